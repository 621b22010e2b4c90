package io.trading.bbo.feed.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingTimerTest {

    private final ProcessingTimer timer = new ProcessingTimer();

    @Test
    void testRecordStats() {
        timer.record(ProcessingTimer.STAGE_DECODE, 2_000);
        timer.record(ProcessingTimer.STAGE_DECODE, 4_000);

        ProcessingTimer.TimerStats stats = timer.getStats(ProcessingTimer.STAGE_DECODE);
        assertEquals(2, stats.getCount());
        assertEquals(3.0, stats.getAvgMicros(), 0.0001);
        assertEquals(2_000, stats.getMinNanos());
        assertEquals(4_000, stats.getMaxNanos());
        assertNull(timer.getStats(ProcessingTimer.STAGE_DISPATCH));
    }

    @Test
    void testTimingContext() {
        ProcessingTimer.TimingContext context = timer.start();

        assertTrue(context.stop() >= 0);
    }

    @Test
    void testClear() {
        timer.record(ProcessingTimer.STAGE_DISPATCH, 10);
        timer.clear();

        assertTrue(timer.getAllStats().isEmpty());
    }

    @Test
    void testEmptyStats() {
        ProcessingTimer.TimerStats stats = new ProcessingTimer.TimerStats();

        assertEquals(0.0, stats.getAvgMicros());
        assertEquals(0, stats.getMinNanos());
    }
}
