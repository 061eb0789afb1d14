package gr.imsi.athenarc.chartdata.chart;

/**
 * Receives every state a {@link ChartDataCoordinator} publishes.
 * Called on the coordinator's thread; implementations should return quickly.
 */
@FunctionalInterface
public interface ChartDataListener {

    void onStateChanged(String chartId, ChartDataState state);
}
