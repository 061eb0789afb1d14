package gr.imsi.athenarc.chartdata.chart;

import gr.imsi.athenarc.chartdata.sampling.SamplePoint;

import java.util.Objects;

/**
 * One renderable point of a chart, produced from a (period, Y parameter, raw record)
 * triple. For calendar-time axes {@code x} holds epoch milliseconds (UTC).
 */
public final class ChartDataPoint implements SamplePoint {

    private final double x;
    private final double y;
    private final String seriesKey;
    private final int seriesIndex;
    private final String sourceId;
    private final String sourceLabel;
    private final int sourceIndex;
    private final int paramIndex;
    private final String timestamp;

    public ChartDataPoint(double x, double y, String seriesKey, int seriesIndex, String sourceId,
                          String sourceLabel, int sourceIndex, int paramIndex, String timestamp) {
        this.x = x;
        this.y = y;
        this.seriesKey = seriesKey;
        this.seriesIndex = seriesIndex;
        this.sourceId = sourceId;
        this.sourceLabel = sourceLabel;
        this.sourceIndex = sourceIndex;
        this.paramIndex = paramIndex;
        this.timestamp = timestamp;
    }

    @Override
    public double getX() {
        return x;
    }

    @Override
    public double getY() {
        return y;
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    /**
     * @return {@code sourceIndex * yParameterCount + paramIndex}, stable for a given
     * period position and Y parameter position
     */
    public int getSeriesIndex() {
        return seriesIndex;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    public int getParamIndex() {
        return paramIndex;
    }

    /**
     * @return the raw timestamp of the record the point came from
     */
    public String getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartDataPoint)) return false;
        ChartDataPoint that = (ChartDataPoint) o;
        return Double.compare(that.x, x) == 0
                && Double.compare(that.y, y) == 0
                && seriesIndex == that.seriesIndex
                && sourceIndex == that.sourceIndex
                && paramIndex == that.paramIndex
                && Objects.equals(seriesKey, that.seriesKey)
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(sourceLabel, that.sourceLabel)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, seriesKey, seriesIndex, sourceId, sourceLabel, sourceIndex, paramIndex, timestamp);
    }

    @Override
    public String toString() {
        return "ChartDataPoint{" + seriesKey + " @ " + x + " = " + y + "}";
    }
}
