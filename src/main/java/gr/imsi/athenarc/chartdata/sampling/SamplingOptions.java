package gr.imsi.athenarc.chartdata.sampling;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

public final class SamplingOptions {

    private final SamplingMethod method;
    private final int targetPointCount;
    private final String seriesKind;
    private final boolean timeOrdered;

    public SamplingOptions(SamplingMethod method, int targetPointCount, String seriesKind, boolean timeOrdered) {
        Preconditions.checkArgument(targetPointCount > 0, "target point count must be positive: %s", targetPointCount);
        this.method = Preconditions.checkNotNull(method, "method");
        this.targetPointCount = targetPointCount;
        this.seriesKind = seriesKind;
        this.timeOrdered = timeOrdered;
    }

    public static SamplingOptions of(SamplingMethod method, int targetPointCount) {
        return new SamplingOptions(method, targetPointCount, "line", true);
    }

    public SamplingMethod getMethod() {
        return method;
    }

    public int getTargetPointCount() {
        return targetPointCount;
    }

    /**
     * @return the kind of chart the series is drawn as, e.g. {@code "line"} or {@code "scatter"}
     */
    public String getSeriesKind() {
        return seriesKind;
    }

    public boolean isTimeOrdered() {
        return timeOrdered;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("method", method)
                .add("targetPointCount", targetPointCount)
                .add("seriesKind", seriesKind)
                .add("timeOrdered", timeOrdered)
                .toString();
    }
}
