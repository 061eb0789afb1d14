package gr.imsi.athenarc.chartdata.cache;

/**
 * Computes the approximate memory footprint, in bytes, of a cached value.
 */
@FunctionalInterface
public interface SizeCalculator<V> {

    long sizeOf(V value);
}
