package gr.imsi.athenarc.chartdata;

import com.google.common.base.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ticker advanced by hand, for tests of time-to-live behaviour.
 */
public class ManualTicker extends Ticker {

    private final AtomicLong nanos = new AtomicLong(TimeUnit.HOURS.toNanos(1));

    @Override
    public long read() {
        return nanos.get();
    }

    public ManualTicker advanceMillis(long millis) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        return this;
    }
}
