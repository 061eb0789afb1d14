package gr.imsi.athenarc.chartdata.sampling;

import java.util.List;
import java.util.Map;

/**
 * Reduces each series of a chart to at most a target number of points.
 * <p>
 * Implementations must return, per series, no more points than they were given;
 * must return a series unchanged when it already has at most
 * {@link SamplingOptions#getTargetPointCount()} points; and must treat
 * {@link SamplingMethod#NONE} as the identity.
 */
public interface SamplingEngine {

    /**
     * @param seriesMap points grouped by series key, in the order they should be returned
     * @param options method and target count, applied to every series
     * @return the reduced points, keyed and ordered like {@code seriesMap}
     * @throws SamplingException when a series cannot be sampled
     */
    <P extends SamplePoint> Map<String, List<P>> sample(Map<String, List<P>> seriesMap, SamplingOptions options);
}
