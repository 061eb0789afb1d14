package gr.imsi.athenarc.chartdata.chart;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.chartdata.sampling.SamplingMethod;

/**
 * User-facing sampling settings, read by a coordinator at the start of each cycle.
 */
public final class SamplingSettings {

    public static final int DEFAULT_TARGET_POINT_COUNT = 500;

    private static final SamplingSettings DEFAULTS =
            new SamplingSettings(true, SamplingMethod.ADAPTIVE, DEFAULT_TARGET_POINT_COUNT);

    private final boolean enabled;
    private final SamplingMethod method;
    private final int targetPointCount;

    public SamplingSettings(boolean enabled, SamplingMethod method, int targetPointCount) {
        Preconditions.checkArgument(targetPointCount > 0, "target point count must be positive: %s", targetPointCount);
        this.enabled = enabled;
        this.method = Preconditions.checkNotNull(method, "method");
        this.targetPointCount = targetPointCount;
    }

    public static SamplingSettings defaults() {
        return DEFAULTS;
    }

    public static SamplingSettings disabled() {
        return new SamplingSettings(false, SamplingMethod.NONE, DEFAULT_TARGET_POINT_COUNT);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SamplingMethod getMethod() {
        return method;
    }

    public int getTargetPointCount() {
        return targetPointCount;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("enabled", enabled)
                .add("method", method)
                .add("targetPointCount", targetPointCount)
                .toString();
    }
}
