package gr.imsi.athenarc.chartdata.chart;

/**
 * Supplies the current sampling settings. Consulted once per coordinator cycle.
 */
@FunctionalInterface
public interface SettingsProvider {

    SamplingSettings getSamplingSettings();

    static SettingsProvider fixed(SamplingSettings settings) {
        return () -> settings;
    }
}
