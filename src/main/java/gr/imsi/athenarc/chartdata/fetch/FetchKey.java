package gr.imsi.athenarc.chartdata.fetch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import gr.imsi.athenarc.chartdata.domain.AxisMode;

import java.util.Collection;
import java.util.Objects;

/**
 * Identity of a shared fetch: axis mode, period, the requested parameters in sorted
 * order and the Y-parameter signature. Parameter order does not matter; signature
 * order does.
 */
public final class FetchKey {

    private final AxisMode axisMode;
    private final String periodId;
    private final ImmutableList<String> parameters;
    private final String signature;

    public FetchKey(AxisMode axisMode, String periodId, Collection<String> parameters, String signature) {
        this.axisMode = axisMode;
        this.periodId = Preconditions.checkNotNull(periodId, "periodId");
        this.parameters = ImmutableList.sortedCopyOf(Ordering.natural(), parameters);
        this.signature = signature != null ? signature : "";
    }

    public AxisMode getAxisMode() {
        return axisMode;
    }

    public String getPeriodId() {
        return periodId;
    }

    public ImmutableList<String> getParameters() {
        return parameters;
    }

    public String getSignature() {
        return signature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchKey)) return false;
        FetchKey that = (FetchKey) o;
        return axisMode == that.axisMode
                && periodId.equals(that.periodId)
                && parameters.equals(that.parameters)
                && signature.equals(that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axisMode, periodId, parameters, signature);
    }

    @Override
    public String toString() {
        return (axisMode != null ? axisMode : "default") + ":" + periodId + ":"
                + String.join(",", parameters) + ":" + signature;
    }
}
