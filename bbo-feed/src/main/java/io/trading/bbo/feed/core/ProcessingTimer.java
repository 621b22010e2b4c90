package io.trading.bbo.feed.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency statistics per processing stage ("decode", "dispatch").
 * Uses System.nanoTime() and lock-free counters.
 */
public class ProcessingTimer {

    public static final String STAGE_DECODE = "decode";
    public static final String STAGE_DISPATCH = "dispatch";

    private static final long NANO_TO_MICRO = 1_000L;

    private final ConcurrentHashMap<String, TimerStats> statsMap = new ConcurrentHashMap<>();

    /**
     * Starts a timing operation.
     */
    public TimingContext start() {
        return new TimingContext(System.nanoTime());
    }

    /**
     * Records a duration for the given stage.
     */
    public void record(String stage, long nanoDuration) {
        statsMap.computeIfAbsent(stage, k -> new TimerStats()).record(nanoDuration);
    }

    /**
     * Gets statistics for a stage, or null if nothing was recorded yet.
     */
    public TimerStats getStats(String stage) {
        return statsMap.get(stage);
    }

    public Map<String, TimerStats> getAllStats() {
        return statsMap;
    }

    public void clear() {
        statsMap.clear();
    }

    /**
     * Timing context returned by start().
     */
    public static class TimingContext {
        private final long startTime;

        TimingContext(long startTime) {
            this.startTime = startTime;
        }

        /**
         * Returns the elapsed time in nanoseconds.
         */
        public long stop() {
            return System.nanoTime() - startTime;
        }
    }

    /**
     * Statistics for one stage.
     */
    public static class TimerStats {
        private final AtomicLong count = new AtomicLong(0);
        private final AtomicLong totalNanos = new AtomicLong(0);
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(long nanos) {
            count.incrementAndGet();
            totalNanos.addAndGet(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public long getCount() {
            return count.get();
        }

        public double getAvgMicros() {
            long c = count.get();
            return c > 0 ? (double) totalNanos.get() / c / NANO_TO_MICRO : 0.0;
        }

        public long getMinNanos() {
            long m = minNanos.get();
            return m == Long.MAX_VALUE ? 0 : m;
        }

        public long getMaxNanos() {
            return maxNanos.get();
        }

        @Override
        public String toString() {
            return String.format("count=%d avg=%.2fus min=%dns max=%dns",
                getCount(), getAvgMicros(), getMinNanos(), getMaxNanos());
        }
    }
}
