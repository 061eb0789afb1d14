package gr.imsi.athenarc.chartdata.chart;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.chartdata.domain.AxisMode;
import gr.imsi.athenarc.chartdata.domain.Period;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The part of a chart's configuration that decides which data it shows: the selected
 * periods, the axis mode, the X parameter and the Y parameters.
 */
public final class ChartConfig {

    private final ImmutableList<Period> periods;
    private final AxisMode axisMode;
    private final String xParameter;
    private final ImmutableList<YParameter> yParameters;

    private ChartConfig(Builder builder) {
        this.periods = ImmutableList.copyOf(builder.periods);
        this.axisMode = builder.axisMode;
        this.xParameter = builder.xParameter;
        this.yParameters = ImmutableList.copyOf(builder.yParameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImmutableList<Period> getPeriods() {
        return periods;
    }

    public AxisMode getAxisMode() {
        return axisMode;
    }

    public String getXParameter() {
        return xParameter;
    }

    public ImmutableList<YParameter> getYParameters() {
        return yParameters;
    }

    public Builder toBuilder() {
        return new Builder()
                .withPeriods(periods)
                .withAxisMode(axisMode)
                .withXParameter(xParameter)
                .withYParameters(yParameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartConfig)) return false;
        ChartConfig that = (ChartConfig) o;
        return periods.equals(that.periods)
                && axisMode == that.axisMode
                && Objects.equals(xParameter, that.xParameter)
                && yParameters.equals(that.yParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(periods, axisMode, xParameter, yParameters);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("periods", periods)
                .add("axisMode", axisMode)
                .add("xParameter", xParameter)
                .add("yParameters", yParameters)
                .toString();
    }

    /**
     * Fluent builder; the axis mode defaults to {@link AxisMode#DATETIME}.
     */
    public static class Builder {
        private final List<Period> periods = new ArrayList<>();
        private AxisMode axisMode = AxisMode.DATETIME;
        private String xParameter;
        private final List<YParameter> yParameters = new ArrayList<>();

        public Builder withPeriod(Period period) {
            this.periods.add(period);
            return this;
        }

        public Builder withPeriods(List<Period> periods) {
            this.periods.clear();
            this.periods.addAll(periods);
            return this;
        }

        public Builder withAxisMode(AxisMode axisMode) {
            this.axisMode = axisMode;
            return this;
        }

        public Builder withXParameter(String xParameter) {
            this.xParameter = xParameter;
            return this;
        }

        public Builder withYParameter(YParameter yParameter) {
            this.yParameters.add(yParameter);
            return this;
        }

        public Builder withYParameters(List<YParameter> yParameters) {
            this.yParameters.clear();
            this.yParameters.addAll(yParameters);
            return this;
        }

        public Builder withYParameters(YParameter... yParameters) {
            return withYParameters(Arrays.asList(yParameters));
        }

        public ChartConfig build() {
            if (axisMode == null) {
                throw new IllegalStateException("Cannot build ChartConfig: missing axis mode");
            }
            return new ChartConfig(this);
        }
    }
}
