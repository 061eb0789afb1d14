package gr.imsi.athenarc.chartdata.fetch;

import gr.imsi.athenarc.chartdata.domain.RawRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of raw records for a single period.
 */
public interface PeriodDataProvider {

    /**
     * Loads the records of {@code periodId}, each carrying its timestamp and the
     * requested parameters. Failures are reported through the returned future.
     */
    CompletableFuture<List<RawRecord>> fetch(String periodId, List<String> parameterNames);
}
