// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.ratelimit;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Leaky bucket for a single peer. Units poured in leak out at a constant rate, the bucket holds at most
 * {@code capacity} units. The level is brought up to date lazily on every access.
 */
final class LeakyBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final long capacity;
    private final double leakPerSecond;
    private final LongSupplier nanoClock;

    // guarded by this
    private double level;
    private long lastLeakNanos;
    private long costServed;

    LeakyBucket(final long capacity, final double leakPerSecond, final LongSupplier nanoClock) {
        this.capacity = capacity;
        this.leakPerSecond = leakPerSecond;
        this.nanoClock = nanoClock;
        this.lastLeakNanos = nanoClock.getAsLong();
    }

    /**
     * Pour units into the bucket. Anything over capacity spills and is not counted.
     *
     * @param units the units to add, ignored if not positive
     */
    synchronized void add(final long units) {
        if (units <= 0) {
            return;
        }
        leak();
        level = Math.min(capacity, level + units);
    }

    /**
     * Record response cost served to the peer. It does not change the level.
     *
     * @param cost the cost in bytes, ignored if not positive
     */
    synchronized void charge(final long cost) {
        if (cost > 0) {
            costServed += cost;
        }
    }

    /**
     * @return the total cost charged to this bucket
     */
    synchronized long costServed() {
        return costServed;
    }

    /**
     * @return whole units that can still be added before the bucket is full
     */
    synchronized long remaining() {
        leak();
        return capacity - (long) Math.ceil(level);
    }

    /**
     * @return the time until the bucket has leaked empty
     */
    synchronized Duration timeUntilEmpty() {
        leak();
        if (level <= 0.0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil(level / leakPerSecond * NANOS_PER_SECOND));
    }

    /**
     * @return true if nothing is left in the bucket
     */
    synchronized boolean isEmpty() {
        leak();
        return level <= 0.0;
    }

    private void leak() {
        final long now = nanoClock.getAsLong();
        final long deltaNanos = now - lastLeakNanos;
        if (deltaNanos <= 0L) {
            return;
        }
        level = Math.max(0.0, level - (deltaNanos / NANOS_PER_SECOND) * leakPerSecond);
        lastLeakNanos = now;
    }
}
