package gr.imsi.athenarc.chartdata.sampling;

/**
 * A point that can be downsampled: a numeric X (epoch milliseconds for calendar
 * time) and a Y value.
 */
public interface SamplePoint {

    double getX();

    double getY();
}
