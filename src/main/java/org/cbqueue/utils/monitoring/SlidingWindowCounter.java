package org.cbqueue.utils.monitoring;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe counter that sums recorded values into one-second buckets and reports the
 * rate over a sliding window.
 * <p>
 * Recording is O(1); rate and sum queries are O(windowSeconds). Old buckets are dropped once
 * more than {@code windowSeconds + 5} exist, so memory stays bounded.
 * <pre>
 * SlidingWindowCounter pushed = new SlidingWindowCounter(5);
 * pushed.recordSum(batch.size());
 * double perSecond = pushed.getRate();
 * </pre>
 */
public class SlidingWindowCounter {

    private final ConcurrentHashMap<Long, AtomicLong> buckets = new ConcurrentHashMap<>();
    private final int windowSeconds;
    private final int maxBuckets;

    /**
     * Creates a new SlidingWindowCounter with the specified window size.
     *
     * @param windowSeconds The size of the sliding window in seconds
     * @throws IllegalArgumentException if windowSeconds <= 0
     */
    public SlidingWindowCounter(int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
        this.maxBuckets = windowSeconds + 5;
    }

    /**
     * Adds {@code value} to the current second's bucket.
     *
     * @param value The value to add, e.g. the size of a batch
     */
    public void recordSum(long value) {
        recordSum(value, Instant.now().getEpochSecond());
    }

    /**
     * Adds {@code value} to the bucket of the given second.
     *
     * @param value         The value to add
     * @param epochSecond   The second the value belongs to
     */
    void recordSum(long value, long epochSecond) {
        buckets.computeIfAbsent(epochSecond, k -> new AtomicLong()).addAndGet(value);
        cleanupIfNeeded(epochSecond);
    }

    /**
     * @return The average sum per second over the sliding window ending now
     */
    public double getRate() {
        return getRate(Instant.now().getEpochSecond());
    }

    /**
     * @param nowSeconds The end of the window in epoch seconds
     * @return The average sum per second over the window ending at {@code nowSeconds}
     */
    public double getRate(long nowSeconds) {
        return (double) getWindowSum(nowSeconds) / windowSeconds;
    }

    /**
     * @return The total of all values recorded in the sliding window ending now
     */
    public long getWindowSum() {
        return getWindowSum(Instant.now().getEpochSecond());
    }

    /**
     * @param nowSeconds The end of the window in epoch seconds
     * @return The total of all values recorded in the window ending at {@code nowSeconds}
     */
    public long getWindowSum(long nowSeconds) {
        long total = 0;
        for (int i = 0; i < windowSeconds; i++) {
            AtomicLong bucket = buckets.get(nowSeconds - i);
            if (bucket != null) {
                total += bucket.get();
            }
        }
        return total;
    }

    /**
     * @return The number of buckets currently held, for tests
     */
    public int getBucketCount() {
        return buckets.size();
    }

    private void cleanupIfNeeded(long currentSecond) {
        if (buckets.size() > maxBuckets) {
            long cutoffSecond = currentSecond - windowSeconds - 1;
            buckets.keySet().removeIf(second -> second < cutoffSecond);
        }
    }
}
