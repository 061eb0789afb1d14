package gr.imsi.athenarc.chartdata.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A single raw sample row of a period: its timestamp and one value per requested
 * parameter. Values are strings or numbers and may be missing.
 */
public final class RawRecord {

    private final String timestamp;
    private final Map<String, Object> values;

    public RawRecord(String timestamp, Map<String, Object> values) {
        this.timestamp = timestamp;
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    public String getTimestamp() {
        return timestamp;
    }

    public Object get(String parameter) {
        return values.get(parameter);
    }

    public Map<String, Object> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "RawRecord{" + timestamp + ", " + values + "}";
    }
}
