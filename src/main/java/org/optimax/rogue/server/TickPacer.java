package org.optimax.rogue.server;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum wall-clock interval between ticks.
 */
public final class TickPacer {

    private final long intervalMillis;
    private final LongSupplier clock;
    private long lastTickMillis;

    public TickPacer(Duration interval) {
        this(interval, System::currentTimeMillis);
    }

    /**
     * @param interval minimum time between two ticks; zero disables pacing
     * @param clock    source of the current time in milliseconds
     */
    public TickPacer(Duration interval, LongSupplier clock) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must not be negative: " + interval);
        }
        this.intervalMillis = interval.toMillis();
        this.clock = clock;
        this.lastTickMillis = clock.getAsLong();
    }

    /**
     * @return true if at least one interval passed since the last {@link #markTick()}
     */
    public boolean isDue() {
        return clock.getAsLong() - lastTickMillis >= intervalMillis;
    }

    public void markTick() {
        lastTickMillis = clock.getAsLong();
    }
}
