package gr.imsi.athenarc.chartdata.fetch;

/**
 * A period data provider rejected or failed a fetch.
 */
public class PeriodFetchException extends RuntimeException {

    private final String periodId;

    public PeriodFetchException(String periodId, Throwable cause) {
        super("Failed to fetch data for period " + periodId + ": " + cause.getMessage(), cause);
        this.periodId = periodId;
    }

    public String getPeriodId() {
        return periodId;
    }
}
