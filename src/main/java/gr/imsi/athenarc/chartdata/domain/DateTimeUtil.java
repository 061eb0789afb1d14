package gr.imsi.athenarc.chartdata.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;


public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    public final static String DEFAULT_FORMAT = "yyyy-MM-dd[ HH:mm:ss[.SSS]]";
    public final static DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern(DEFAULT_FORMAT);
    private static final Logger LOG = LoggerFactory.getLogger(DateTimeUtil.class);

    private static final List<Function<String, Long>> TIMESTAMP_PARSERS = List.of(
            DateTimeUtil::parseEpochMillis,
            v -> OffsetDateTime.parse(v).toInstant().toEpochMilli(),
            v -> LocalDateTime.parse(v).atZone(UTC).toInstant().toEpochMilli(),
            DateTimeUtil::parseDefaultFormat);

    private static long parseDefaultFormat(String s) {
        try {
            return LocalDateTime.parse(s, DEFAULT_FORMATTER).atZone(UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            // date only
            return LocalDate.parse(s, DEFAULT_FORMATTER).atStartOfDay(UTC).toInstant().toEpochMilli();
        }
    }

    private static long parseEpochMillis(String s) {
        if (!s.chars().allMatch(Character::isDigit)) {
            throw new DateTimeParseException("Not epoch milliseconds", s, 0);
        }
        return Long.parseLong(s);
    }

    /**
     * Parses a raw record timestamp into epoch milliseconds (UTC).
     * Accepts epoch milliseconds, ISO-8601 instants and offset date-times, ISO local
     * date-times and the {@link #DEFAULT_FORMAT}.
     *
     * @return the epoch milliseconds, or {@code null} when the value cannot be parsed
     */
    public static Long tryParseTimestamp(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim();
        DateTimeParseException failure = null;
        for (Function<String, Long> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                failure = e;
            } catch (NumberFormatException e) {
                LOG.trace("Timestamp '{}' is out of range: {}", value, e.getMessage());
                return null;
            }
        }
        LOG.trace("Unparseable timestamp '{}': {}", value, failure.getMessage());
        return null;
    }
}
