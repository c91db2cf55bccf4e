package com.chatcast.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe latency tracking using HdrHistogram.
 * Record nanos from any thread; report percentiles periodically.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.histogram = new Histogram(10_000_000_000L, 3);
    }

    public synchronized void record(long latencyNanos) {
        histogram.recordValue(Math.min(Math.max(latencyNanos, 0), histogram.getHighestTrackableValue()));
        count.increment();
    }

    public long count() {
        return count.sum();
    }

    public String name() {
        return name;
    }

    public synchronized void logAndReset() {
        long total = count.sumThenReset();
        if (total == 0) return;
        log.info("[metrics] {} count={} p50={}µs p99={}µs max={}µs",
                name, total,
                String.format("%.1f", histogram.getValueAtPercentile(50) / 1_000.0),
                String.format("%.1f", histogram.getValueAtPercentile(99) / 1_000.0),
                String.format("%.1f", histogram.getMaxValue() / 1_000.0));
        histogram.reset();
    }
}
