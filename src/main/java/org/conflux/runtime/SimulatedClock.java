package org.conflux.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} that only moves when told to. Used to drive the engine tick by tick.
 * <p>
 * Thread Safety: advancing and reading may happen from different threads.
 */
public final class SimulatedClock extends Clock {

    private volatile long millis;
    private final ZoneId zone;

    public SimulatedClock(long startMillis) {
        this(startMillis, ZoneOffset.UTC);
    }

    private SimulatedClock(long startMillis, ZoneId zone) {
        this.millis = startMillis;
        this.zone = zone;
    }

    public synchronized void advance(Duration duration) {
        advanceMillis(duration.toMillis());
    }

    public synchronized void advanceMillis(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Simulated time cannot move backwards: " + delta);
        }
        millis += delta;
    }

    @Override
    public long millis() {
        return millis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new SimulatedClock(millis, zone);
    }
}
