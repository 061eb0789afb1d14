package gr.imsi.athenarc.chartdata.chart;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.chartdata.domain.AxisMode;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a chart needs to fetch for one cycle.
 * <p>
 * {@link #getParameters()} is the de-duplicated column list sent to the data provider:
 * the X column (unless the axis is calendar time) followed by every non-blank Y column.
 * {@link #getSignature()} records the Y-parameter configuration in order, type
 * included, so that reordering or retyping Y parameters yields a different fetch key
 * even when the column list stays the same.
 */
public final class FetchPlan {

    private final AxisMode axisMode;
    private final String xColumn;
    private final ImmutableList<YParameter> yParameters;
    private final ImmutableList<String> parameters;
    private final String signature;

    private FetchPlan(AxisMode axisMode, String xColumn, ImmutableList<YParameter> yParameters,
                      ImmutableList<String> parameters, String signature) {
        this.axisMode = axisMode;
        this.xColumn = xColumn;
        this.yParameters = yParameters;
        this.parameters = parameters;
        this.signature = signature;
    }

    public static FetchPlan of(ChartConfig config) {
        AxisMode axisMode = config.getAxisMode();
        String xColumn = null;
        if (axisMode.requiresXParameter() && config.getXParameter() != null && !config.getXParameter().isBlank()) {
            xColumn = YParameter.cleanParameter(config.getXParameter());
        }

        ImmutableList<YParameter> yParameters = config.getYParameters().stream()
                .filter(y -> !y.isBlank())
                .collect(ImmutableList.toImmutableList());

        Set<String> parameters = new LinkedHashSet<>();
        if (xColumn != null) {
            parameters.add(xColumn);
        }
        for (YParameter y : yParameters) {
            parameters.add(y.getColumn());
        }

        String signature = yParameters.stream()
                .map(y -> y.getType() + ":" + y.getParameter())
                .collect(Collectors.joining(";"));

        return new FetchPlan(axisMode, xColumn, yParameters, ImmutableList.copyOf(parameters), signature);
    }

    public AxisMode getAxisMode() {
        return axisMode;
    }

    /**
     * @return the X column, or {@code null} for calendar time axes and for charts
     * missing their X parameter
     */
    public String getXColumn() {
        return xColumn;
    }

    /**
     * @return the non-blank Y parameters, in configuration order
     */
    public ImmutableList<YParameter> getYParameters() {
        return yParameters;
    }

    public ImmutableList<String> getParameters() {
        return parameters;
    }

    public String getSignature() {
        return signature;
    }

    /**
     * @return whether there is anything to plot: at least one Y parameter, and an X
     * parameter when the axis mode needs one
     */
    public boolean isFetchable() {
        if (yParameters.isEmpty()) {
            return false;
        }
        return !axisMode.requiresXParameter() || xColumn != null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("axisMode", axisMode)
                .add("parameters", parameters)
                .add("signature", signature)
                .toString();
    }
}
