package gr.imsi.athenarc.chartdata.chart;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Immutable snapshot of what a chart currently shows. A failed cycle keeps the
 * points of the last successful one and only sets {@link #getError()}.
 */
public final class ChartDataState {

    private static final ChartDataState INITIAL = new ChartDataState(ImmutableList.of(), false, null, 0);

    private final ImmutableList<ChartDataPoint> points;
    private final boolean loading;
    private final Throwable error;
    private final long cycleId;

    private ChartDataState(List<ChartDataPoint> points, boolean loading, Throwable error, long cycleId) {
        this.points = ImmutableList.copyOf(points);
        this.loading = loading;
        this.error = error;
        this.cycleId = cycleId;
    }

    public static ChartDataState initial() {
        return INITIAL;
    }

    ChartDataState loading(long cycleId) {
        return new ChartDataState(points, true, null, cycleId);
    }

    ChartDataState succeeded(List<ChartDataPoint> newPoints, long cycleId) {
        return new ChartDataState(newPoints, false, null, cycleId);
    }

    ChartDataState failed(Throwable failure, long cycleId) {
        return new ChartDataState(points, false, failure, cycleId);
    }

    public ImmutableList<ChartDataPoint> getPoints() {
        return points;
    }

    public boolean isLoading() {
        return loading;
    }

    /**
     * @return the failure of the latest cycle, or {@code null} if it succeeded
     */
    public Throwable getError() {
        return error;
    }

    /**
     * @return the id of the cycle that produced this state, 0 before the first cycle
     */
    public long getCycleId() {
        return cycleId;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("points", points.size())
                .add("loading", loading)
                .add("error", error)
                .add("cycleId", cycleId)
                .toString();
    }
}
