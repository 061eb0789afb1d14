package gr.imsi.athenarc.chartdata.chart;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LoadingRegistryTest {

    @Test
    public void testLoadingLifecycle() {
        LoadingRegistry registry = new LoadingRegistry();
        assertFalse(registry.isAnyChartLoading());

        registry.registerLoading("a");
        registry.registerLoading("b");
        registry.registerLoading("a");

        assertEquals(2, registry.getLoadingCount());
        assertTrue(registry.isLoading("a"));
        assertEquals(Set.of("a", "b"), registry.getLoadingCharts());

        registry.unregisterLoading("a");
        registry.unregisterLoading("a");

        assertFalse(registry.isLoading("a"));
        assertEquals(1, registry.getLoadingCount());
        assertTrue(registry.isAnyChartBusy());

        registry.unregisterLoading("b");
        assertFalse(registry.isAnyChartLoading());
        assertFalse(registry.isAnyChartBusy());
    }

    @Test
    public void testRenderingCountsAsBusy() {
        LoadingRegistry registry = new LoadingRegistry();
        registry.registerRendering("a");

        assertTrue(registry.isAnyChartRendering());
        assertTrue(registry.isAnyChartBusy());
        assertFalse(registry.isAnyChartLoading());
        assertEquals(1, registry.getRenderingCount());

        registry.unregisterRendering("a");
        assertFalse(registry.isAnyChartBusy());
    }
}
