package gr.imsi.athenarc.chartdata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approximates the in-memory size of arbitrary cached values.
 * <p>
 * Estimation is driven by per-type rules, checked in registration order with the
 * most recently registered rule first. Values no rule claims are serialized with
 * Jackson and charged two bytes per character; values that cannot be serialized
 * are charged {@link #DEFAULT_ESTIMATE}. Estimation never throws.
 */
public class SizeEstimator implements SizeCalculator<Object> {

    private static final Logger LOG = LoggerFactory.getLogger(SizeEstimator.class);

    public static final long DEFAULT_ESTIMATE = 1024;

    private static final long BYTES_PER_CHAR = 2;
    private static final long NUMBER_SIZE = 8;
    private static final long BOOLEAN_SIZE = 4;

    private final Map<Class<?>, SizeCalculator<Object>> rules = new LinkedHashMap<>();
    private final ObjectMapper mapper;

    public SizeEstimator() {
        this(new ObjectMapper());
    }

    public SizeEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
        register(Map.class, map -> {
            long total = 0;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) map).entrySet()) {
                total += sizeOf(entry.getKey()) + sizeOf(entry.getValue());
            }
            return total;
        });
        register(Collection.class, collection -> {
            long total = 0;
            for (Object item : collection) {
                total += sizeOf(item);
            }
            return total;
        });
        register(Boolean.class, b -> BOOLEAN_SIZE);
        register(Number.class, n -> NUMBER_SIZE);
        register(CharSequence.class, s -> s.length() * BYTES_PER_CHAR);
    }

    /**
     * Adds a rule for values of {@code type}. Later rules take precedence over
     * earlier ones, so a rule for a subtype can override a broader default.
     */
    public synchronized <T> SizeEstimator register(Class<T> type, SizeCalculator<? super T> calculator) {
        Map<Class<?>, SizeCalculator<Object>> reordered = new LinkedHashMap<>();
        reordered.put(type, value -> calculator.sizeOf(type.cast(value)));
        rules.remove(type);
        reordered.putAll(rules);
        rules.clear();
        rules.putAll(reordered);
        return this;
    }

    @Override
    public long sizeOf(Object value) {
        if (value == null) {
            return 0;
        }
        SizeCalculator<Object> rule = ruleFor(value.getClass());
        if (rule != null) {
            return rule.sizeOf(value);
        }
        if (value.getClass().isArray()) {
            long total = 0;
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                total += sizeOf(Array.get(value, i));
            }
            return total;
        }
        try {
            return mapper.writeValueAsString(value).length() * BYTES_PER_CHAR;
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.debug("Falling back to default size estimate for {}: {}", value.getClass().getName(), e.getMessage());
            return DEFAULT_ESTIMATE;
        }
    }

    private synchronized SizeCalculator<Object> ruleFor(Class<?> type) {
        for (Map.Entry<Class<?>, SizeCalculator<Object>> rule : rules.entrySet()) {
            if (rule.getKey().isAssignableFrom(type)) {
                return rule.getValue();
            }
        }
        return null;
    }
}
