package gr.imsi.athenarc.chartdata.sampling;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultSamplingEngineTest {

    private final DefaultSamplingEngine engine = new DefaultSamplingEngine();

    private static final class Point implements SamplePoint {
        private final double x;
        private final double y;

        Point(double x, double y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public double getX() {
            return x;
        }

        @Override
        public double getY() {
            return y;
        }
    }

    private static List<Point> sine(int n) {
        List<Point> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new Point(i, Math.sin(i / 10.0) * 100));
        }
        return points;
    }

    private static Map<String, List<Point>> single(List<Point> points) {
        Map<String, List<Point>> series = new LinkedHashMap<>();
        series.put("s", points);
        return series;
    }

    @Test
    public void testSeriesWithinTargetIsReturnedUnchanged() {
        List<Point> points = sine(100);
        for (SamplingMethod method : SamplingMethod.values()) {
            Map<String, List<Point>> result = engine.sample(single(points), SamplingOptions.of(method, 100));
            assertSame(points, result.get("s"), method.toString());
        }
    }

    @Test
    public void testNoneIsIdentity() {
        List<Point> points = sine(1000);
        Map<String, List<Point>> result = engine.sample(single(points), SamplingOptions.of(SamplingMethod.NONE, 10));
        assertSame(points, result.get("s"));
    }

    @Test
    public void testReducedSeriesRespectTargetAndKeepEndpoints() {
        List<Point> points = sine(20000);
        for (SamplingMethod method : new SamplingMethod[] {SamplingMethod.NTH_POINT, SamplingMethod.LTTB, SamplingMethod.ADAPTIVE}) {
            List<Point> sampled = engine.sample(single(points), SamplingOptions.of(method, 500)).get("s");
            assertTrue(sampled.size() <= 500, method + " produced " + sampled.size());
            assertSame(points.get(0), sampled.get(0));
            assertSame(points.get(points.size() - 1), sampled.get(sampled.size() - 1));
        }
    }

    @Test
    public void testLttbKeepsXOrder() {
        List<Point> sampled = DefaultSamplingEngine.lttb(sine(3000), 200);
        assertEquals(200, sampled.size());
        for (int i = 1; i < sampled.size(); i++) {
            assertTrue(sampled.get(i).getX() > sampled.get(i - 1).getX());
        }
    }

    @Test
    public void testLttbKeepsSpike() {
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            points.add(new Point(i, i == 517 ? 1000 : 0));
        }
        List<Point> sampled = DefaultSamplingEngine.lttb(points, 50);
        assertTrue(sampled.stream().anyMatch(p -> p.getY() == 1000));
    }

    @Test
    public void testNthPointWithTinyTargets() {
        List<Point> points = sine(50);
        assertEquals(1, DefaultSamplingEngine.nthPoint(points, 1).size());
        List<Point> two = DefaultSamplingEngine.nthPoint(points, 2);
        assertEquals(2, two.size());
        assertSame(points.get(49), two.get(1));
    }

    @Test
    public void testAdaptiveLargeSeries() {
        List<Point> points = sine(DefaultSamplingEngine.ADAPTIVE_MULTI_STAGE_LIMIT + 1000);
        List<Point> sampled = DefaultSamplingEngine.adaptive(points, 300);
        assertTrue(sampled.size() <= 300);
        assertSame(points.get(0), sampled.get(0));
        assertSame(points.get(points.size() - 1), sampled.get(sampled.size() - 1));
    }

    @Test
    public void testUnorderedSeriesFallBackToNthPoint() {
        List<Point> points = sine(1000);
        SamplingOptions scatter = new SamplingOptions(SamplingMethod.LTTB, 100, "scatter", false);
        List<Point> sampled = engine.sample(single(points), scatter).get("s");
        assertEquals(DefaultSamplingEngine.nthPoint(points, 100), sampled);
    }

    @Test
    public void testSeriesOrderIsPreserved() {
        Map<String, List<Point>> series = new LinkedHashMap<>();
        series.put("b", sine(300));
        series.put("a", sine(300));
        Map<String, List<Point>> result = engine.sample(series, SamplingOptions.of(SamplingMethod.LTTB, 50));
        assertEquals(List.of("b", "a"), new ArrayList<>(result.keySet()));
    }

    @Test
    public void testFailureIsWrapped() {
        List<Point> points = new ArrayList<>(sine(100));
        points.set(50, null);
        SamplingException e = assertThrows(SamplingException.class,
                () -> engine.sample(single(points), SamplingOptions.of(SamplingMethod.LTTB, 10)));
        assertTrue(e.getMessage().contains("s"));
    }

    @Test
    public void testMethodNames() {
        assertEquals(SamplingMethod.NTH_POINT, SamplingMethod.fromString("nth-point"));
        assertEquals(SamplingMethod.ADAPTIVE, SamplingMethod.fromString("auto"));
        assertEquals("nth-point", SamplingMethod.NTH_POINT.toString());
    }
}
