package gr.imsi.athenarc.chartdata.sampling;

/**
 * Raised when a sampling engine cannot reduce a series. Fatal for the chart cycle
 * that triggered it.
 */
public class SamplingException extends RuntimeException {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
