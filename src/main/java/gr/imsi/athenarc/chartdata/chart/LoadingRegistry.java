package gr.imsi.athenarc.chartdata.chart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which charts are loading data or rendering, so that UI collaborators can tell
 * whether any chart is still busy. Shared by every coordinator of an application and
 * handed to them explicitly.
 * <p>
 * Each chart id is registered and unregistered only by the coordinator that owns it.
 * Finished charts are removed, never kept with a "not loading" flag.
 */
public class LoadingRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LoadingRegistry.class);

    private final Set<String> loadingCharts = ConcurrentHashMap.newKeySet();
    private final Set<String> renderingCharts = ConcurrentHashMap.newKeySet();

    public void registerLoading(String chartId) {
        if (loadingCharts.add(chartId)) {
            LOG.debug("Chart {} started loading, {} loading", chartId, loadingCharts.size());
        }
    }

    public void unregisterLoading(String chartId) {
        if (loadingCharts.remove(chartId)) {
            LOG.debug("Chart {} finished loading, {} loading", chartId, loadingCharts.size());
        }
    }

    public void registerRendering(String chartId) {
        renderingCharts.add(chartId);
    }

    public void unregisterRendering(String chartId) {
        renderingCharts.remove(chartId);
    }

    public boolean isLoading(String chartId) {
        return loadingCharts.contains(chartId);
    }

    public boolean isAnyChartLoading() {
        return !loadingCharts.isEmpty();
    }

    public boolean isAnyChartRendering() {
        return !renderingCharts.isEmpty();
    }

    public boolean isAnyChartBusy() {
        return isAnyChartLoading() || isAnyChartRendering();
    }

    public int getLoadingCount() {
        return loadingCharts.size();
    }

    public int getRenderingCount() {
        return renderingCharts.size();
    }

    public Set<String> getLoadingCharts() {
        return ImmutableSet.copyOf(loadingCharts);
    }
}
