package gr.imsi.athenarc.chartdata.sampling;

import java.util.Locale;

public enum SamplingMethod {
    NONE,
    NTH_POINT,
    LTTB,
    ADAPTIVE;

    /**
     * Parses names such as {@code "lttb"}, {@code "nth-point"} or {@code "auto"}.
     * {@code "auto"} is an alias of {@link #ADAPTIVE}.
     */
    public static SamplingMethod fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("AUTO")) {
            return ADAPTIVE;
        }
        return SamplingMethod.valueOf(normalized);
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
