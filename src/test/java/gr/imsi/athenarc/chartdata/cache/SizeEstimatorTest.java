package gr.imsi.athenarc.chartdata.cache;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SizeEstimatorTest {

    private final SizeEstimator estimator = new SizeEstimator();

    @Test
    public void testPrimitiveValues() {
        assertEquals(10, estimator.sizeOf("hello"));
        assertEquals(8, estimator.sizeOf(42));
        assertEquals(8, estimator.sizeOf(3.5d));
        assertEquals(4, estimator.sizeOf(true));
        assertEquals(0, estimator.sizeOf(null));
    }

    @Test
    public void testCompositeValuesAreSummed() {
        assertEquals(8 + 8 + 2, estimator.sizeOf(List.of(1, 2L, "a")));
        assertEquals(2 + 8, estimator.sizeOf(Map.of("k", 1)));
        assertEquals(16, estimator.sizeOf(new double[] {1, 2}));
    }

    @Test
    public void testBeanIsSerialized() {
        Sample sample = new Sample();
        // {"name":"ab"}
        assertEquals(13 * 2, estimator.sizeOf(sample));
    }

    @Test
    public void testUnserializableValueFallsBackToDefault() {
        assertEquals(SizeEstimator.DEFAULT_ESTIMATE, estimator.sizeOf(new Object()));
    }

    @Test
    public void testRegisteredRuleTakesPrecedence() {
        estimator.register(String.class, s -> 1);
        assertEquals(1, estimator.sizeOf("hello"));
        assertEquals(8, estimator.sizeOf(5));
    }

    @Test
    public void testRuleForSubtypeMayUseSupertypeCalculator() {
        SizeCalculator<Number> flat = n -> 2;
        estimator.register(Integer.class, flat);
        assertEquals(2, estimator.sizeOf(7));
        assertEquals(8, estimator.sizeOf(7L));
    }

    public static class Sample {
        public String getName() {
            return "ab";
        }
    }
}
