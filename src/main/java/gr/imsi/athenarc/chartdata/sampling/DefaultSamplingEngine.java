package gr.imsi.athenarc.chartdata.sampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sampling engine offering nth-point, Largest-Triangle-Three-Buckets and an adaptive
 * combination of both.
 * <p>
 * Every reduced series keeps its first and last point. LTTB assumes points ordered by
 * X, so series that are not time ordered are reduced with nth-point instead, which
 * only depends on arrival order.
 */
public class DefaultSamplingEngine implements SamplingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultSamplingEngine.class);

    /** Series up to this size go straight to LTTB in adaptive mode. */
    static final int ADAPTIVE_LTTB_LIMIT = 5000;
    /** Series beyond this size get an extra nth-point stage in adaptive mode. */
    static final int ADAPTIVE_MULTI_STAGE_LIMIT = 50000;

    @Override
    public <P extends SamplePoint> Map<String, List<P>> sample(Map<String, List<P>> seriesMap, SamplingOptions options) {
        Map<String, List<P>> sampled = new LinkedHashMap<>();
        for (Map.Entry<String, List<P>> series : seriesMap.entrySet()) {
            List<P> points = series.getValue();
            try {
                sampled.put(series.getKey(), sampleSeries(points, options));
            } catch (RuntimeException e) {
                throw new SamplingException("Failed to sample series " + series.getKey(), e);
            }
            LOG.debug("Sampled series {} from {} to {} points using {}",
                    series.getKey(), points.size(), sampled.get(series.getKey()).size(), options.getMethod());
        }
        return sampled;
    }

    <P extends SamplePoint> List<P> sampleSeries(List<P> points, SamplingOptions options) {
        int target = options.getTargetPointCount();
        if (points.size() <= target || options.getMethod() == SamplingMethod.NONE) {
            return points;
        }
        SamplingMethod method = options.getMethod();
        if (!options.isTimeOrdered() && method != SamplingMethod.NTH_POINT) {
            method = SamplingMethod.NTH_POINT;
        }
        switch (method) {
            case NTH_POINT:
                return nthPoint(points, target);
            case LTTB:
                return lttb(points, target);
            case ADAPTIVE:
                return adaptive(points, target);
            default:
                throw new SamplingException("Unsupported sampling method " + method);
        }
    }

    /**
     * Stratified nth-point: keeps the first and last point and the middle point of
     * each of the {@code target - 2} equal strata in between.
     */
    static <P> List<P> nthPoint(List<P> points, int target) {
        int n = points.size();
        if (n <= target) {
            return points;
        }
        List<P> sampled = new ArrayList<>(target);
        sampled.add(points.get(0));
        if (target == 1) {
            return sampled;
        }
        int strata = target - 2;
        double strataSize = (double) (n - 2) / Math.max(strata, 1);
        for (int i = 0; i < strata; i++) {
            int start = 1 + (int) Math.floor(i * strataSize);
            int end = 1 + (int) Math.floor((i + 1) * strataSize);
            sampled.add(points.get(Math.min((start + end) / 2, n - 2)));
        }
        sampled.add(points.get(n - 1));
        return sampled;
    }

    static <P extends SamplePoint> List<P> lttb(List<P> points, int target) {
        int n = points.size();
        if (n <= target) {
            return points;
        }
        if (target < 3) {
            return nthPoint(points, target);
        }

        List<P> sampled = new ArrayList<>(target);
        sampled.add(points.get(0));

        double bucketSize = (double) (n - 2) / (target - 2);
        int a = 0;
        for (int i = 0; i < target - 2; i++) {
            int bucketStart = (int) Math.floor(i * bucketSize) + 1;
            int bucketEnd = Math.min((int) Math.floor((i + 1) * bucketSize) + 1, n - 1);

            // average of the next bucket, or the last point for the final bucket
            int nextStart = bucketEnd;
            int nextEnd = Math.min((int) Math.floor((i + 2) * bucketSize) + 1, n);
            double avgX = 0;
            double avgY = 0;
            int avgCount = nextEnd - nextStart;
            if (avgCount <= 0) {
                avgX = points.get(n - 1).getX();
                avgY = points.get(n - 1).getY();
            } else {
                for (int j = nextStart; j < nextEnd; j++) {
                    avgX += points.get(j).getX();
                    avgY += points.get(j).getY();
                }
                avgX /= avgCount;
                avgY /= avgCount;
            }

            P pointA = points.get(a);
            double maxArea = -1;
            int maxAreaIndex = bucketStart;
            for (int j = bucketStart; j < bucketEnd; j++) {
                P candidate = points.get(j);
                double area = Math.abs(
                        (pointA.getX() - avgX) * (candidate.getY() - pointA.getY())
                                - (pointA.getX() - candidate.getX()) * (avgY - pointA.getY())) * 0.5;
                if (area > maxArea) {
                    maxArea = area;
                    maxAreaIndex = j;
                }
            }
            sampled.add(points.get(maxAreaIndex));
            a = maxAreaIndex;
        }

        sampled.add(points.get(n - 1));
        return sampled;
    }

    static <P extends SamplePoint> List<P> adaptive(List<P> points, int target) {
        int n = points.size();
        if (n <= ADAPTIVE_LTTB_LIMIT) {
            return lttb(points, target);
        }
        if (n <= ADAPTIVE_MULTI_STAGE_LIMIT) {
            return lttb(nthPoint(points, target * 2), target);
        }
        List<P> firstStage = nthPoint(points, ADAPTIVE_LTTB_LIMIT);
        return lttb(nthPoint(firstStage, target * 2), target);
    }
}
