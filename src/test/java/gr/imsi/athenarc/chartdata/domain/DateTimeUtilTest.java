package gr.imsi.athenarc.chartdata.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DateTimeUtilTest {

    private static final long JAN_1_2024 = 1704067200000L;

    @Test
    public void testParsesSupportedFormats() {
        assertEquals(JAN_1_2024, DateTimeUtil.tryParseTimestamp("1704067200000"));
        assertEquals(JAN_1_2024, DateTimeUtil.tryParseTimestamp("2024-01-01T00:00:00Z"));
        assertEquals(JAN_1_2024, DateTimeUtil.tryParseTimestamp("2024-01-01T02:00:00+02:00"));
        assertEquals(JAN_1_2024, DateTimeUtil.tryParseTimestamp("2024-01-01T00:00:00"));
        assertEquals(JAN_1_2024 + 61_000, DateTimeUtil.tryParseTimestamp("2024-01-01 00:01:01"));
        assertEquals(JAN_1_2024, DateTimeUtil.tryParseTimestamp(" 2024-01-01 "));
    }

    @Test
    public void testUnparseableTimestampsYieldNull() {
        assertNull(DateTimeUtil.tryParseTimestamp(null));
        assertNull(DateTimeUtil.tryParseTimestamp(""));
        assertNull(DateTimeUtil.tryParseTimestamp("yesterday"));
        assertNull(DateTimeUtil.tryParseTimestamp("99999999999999999999999"));
    }

    @Test
    public void testDefaultFormatAcceptsMillisAndDateOnly() {
        assertEquals(JAN_1_2024 + 1_250, DateTimeUtil.tryParseTimestamp("2024-01-01 00:00:01.250"));
        assertEquals(JAN_1_2024 + 86_400_000, DateTimeUtil.tryParseTimestamp("2024-01-02"));
    }

    @Test
    public void testAxisModes() {
        assertEquals(AxisMode.TIME, AxisMode.fromString(" time "));
        assertEquals("parameter", AxisMode.PARAMETER.toString());
        assertFalse(AxisMode.DATETIME.requiresXParameter());
        assertTrue(AxisMode.TIME.requiresXParameter());
    }
}
