package gr.imsi.athenarc.chartdata.chart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.chartdata.domain.AxisMode;
import gr.imsi.athenarc.chartdata.domain.DateTimeUtil;
import gr.imsi.athenarc.chartdata.domain.Period;
import gr.imsi.athenarc.chartdata.domain.RawRecord;
import gr.imsi.athenarc.chartdata.sampling.SamplingEngine;
import gr.imsi.athenarc.chartdata.sampling.SamplingOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw period records into chart points and reduces oversized results.
 * <p>
 * Rows whose X or Y value cannot be coerced (unparseable timestamps, non-numeric
 * strings, missing values, NaN) are skipped silently; they are not errors.
 */
public class ChartDataTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(ChartDataTransformer.class);

    private static final Comparator<ChartDataPoint> BY_X = Comparator.comparingDouble(ChartDataPoint::getX);

    /**
     * Builds the points of every period and concatenates them in period order, so the
     * result does not depend on the order in which the fetches completed.
     *
     * @param periods the selected periods
     * @param recordsPerPeriod the fetched records, index-aligned with {@code periods}
     */
    public List<ChartDataPoint> assemble(List<Period> periods, List<List<RawRecord>> recordsPerPeriod, FetchPlan plan) {
        List<ChartDataPoint> points = new ArrayList<>();
        for (int sourceIndex = 0; sourceIndex < periods.size(); sourceIndex++) {
            points.addAll(transform(periods.get(sourceIndex), sourceIndex, recordsPerPeriod.get(sourceIndex), plan));
        }
        return points;
    }

    public List<ChartDataPoint> transform(Period period, int sourceIndex, List<RawRecord> records, FetchPlan plan) {
        if (records == null || records.isEmpty()) {
            return new ArrayList<>();
        }
        List<YParameter> yParameters = plan.getYParameters();
        int yCount = yParameters.size();
        List<ChartDataPoint> points = new ArrayList<>(records.size() * yCount);
        int skipped = 0;

        for (RawRecord record : records) {
            Double x = xValue(record, plan);
            if (x == null) {
                skipped++;
                continue;
            }
            for (int paramIndex = 0; paramIndex < yCount; paramIndex++) {
                YParameter yParameter = yParameters.get(paramIndex);
                Double y = toNumber(record.get(yParameter.getColumn()));
                if (y == null) {
                    skipped++;
                    continue;
                }
                points.add(new ChartDataPoint(
                        x,
                        y,
                        period.getLabel() + " - " + yParameter.getParameter(),
                        sourceIndex * yCount + paramIndex,
                        period.getId(),
                        period.getLabel(),
                        sourceIndex,
                        paramIndex,
                        record.getTimestamp()));
            }
        }
        if (skipped > 0) {
            LOG.trace("Skipped {} values of period {} that could not be coerced", skipped, period.getId());
        }
        return points;
    }

    /**
     * Samples each series down when the total exceeds the target. The target is split
     * evenly across series. For calendar-time axes each series is sorted by X before
     * sampling and the result is re-sorted by X; other axis modes keep series order.
     *
     * @throws gr.imsi.athenarc.chartdata.sampling.SamplingException if the engine fails
     */
    public List<ChartDataPoint> sample(List<ChartDataPoint> points, AxisMode axisMode, SamplingSettings settings,
                                       SamplingEngine engine) {
        if (!settings.isEnabled() || points.size() <= settings.getTargetPointCount()) {
            return points;
        }

        Map<String, List<ChartDataPoint>> seriesMap = new LinkedHashMap<>();
        for (ChartDataPoint point : points) {
            seriesMap.computeIfAbsent(point.getSeriesKey(), k -> new ArrayList<>()).add(point);
        }

        int perSeriesTarget = Math.max(1, settings.getTargetPointCount() / seriesMap.size());
        boolean timeOrdered = axisMode == AxisMode.DATETIME;
        if (timeOrdered) {
            // endpoint-preserving methods keep the first and last element of each list
            seriesMap.values().forEach(series -> series.sort(BY_X));
        }
        SamplingOptions options = new SamplingOptions(settings.getMethod(), perSeriesTarget,
                timeOrdered ? "line" : "scatter", timeOrdered);

        Map<String, List<ChartDataPoint>> sampled = engine.sample(seriesMap, options);
        List<ChartDataPoint> result = new ArrayList<>();
        for (List<ChartDataPoint> series : sampled.values()) {
            result.addAll(series);
        }
        if (timeOrdered) {
            result.sort(BY_X);
        }
        LOG.debug("Sampled {} points in {} series down to {} ({})",
                points.size(), seriesMap.size(), result.size(), settings.getMethod());
        return result;
    }

    private Double xValue(RawRecord record, FetchPlan plan) {
        if (plan.getAxisMode() == AxisMode.DATETIME) {
            Long timestamp = DateTimeUtil.tryParseTimestamp(record.getTimestamp());
            return timestamp != null ? timestamp.doubleValue() : null;
        }
        return toNumber(record.get(plan.getXColumn()));
    }

    /**
     * Coerces a raw value to a finite number.
     *
     * @return the value, or {@code null} when it is missing or not numeric
     */
    static Double toNumber(Object value) {
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : null;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                double number = Double.parseDouble(text);
                return Double.isFinite(number) ? number : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
