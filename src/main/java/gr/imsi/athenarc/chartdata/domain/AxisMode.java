package gr.imsi.athenarc.chartdata.domain;

import java.util.Locale;

/**
 * How the X axis of a chart is interpreted.
 */
public enum AxisMode {
    /** Calendar time taken from each record's timestamp. */
    DATETIME,
    /** Elapsed time read from a numeric X parameter. */
    TIME,
    /** An arbitrary numeric X parameter. */
    PARAMETER;

    public boolean requiresXParameter() {
        return this != DATETIME;
    }

    public static AxisMode fromString(String value) {
        return AxisMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
