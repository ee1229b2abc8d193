// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import org.hiero.history.node.spi.ratelimit.QuotaTracker;

/**
 * The buckets of every peer for one protocol topic. A peer's bucket is created on first use and dropped by
 * {@link #pruneIdle()} once it has drained, so a peer that is gone costs nothing.
 */
public final class LeakyBucketCollector implements QuotaTracker {
    private final long capacity;
    private final double leakPerSecond;
    private final LongSupplier nanoClock;
    private final Map<String, LeakyBucket> buckets = new ConcurrentHashMap<>();

    /**
     * @param leakPerSecond units drained from each bucket per second
     * @param capacity the most units a bucket holds, the burst a peer may spend at once
     * @param nanoClock source of monotonic time in nanoseconds
     */
    LeakyBucketCollector(final double leakPerSecond, final long capacity, @NonNull final LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (leakPerSecond <= 0.0) {
            throw new IllegalArgumentException("leakPerSecond must be > 0");
        }
        this.capacity = capacity;
        this.leakPerSecond = leakPerSecond;
        this.nanoClock = nanoClock;
    }

    /**
     * Charge a peer.
     *
     * @param peerKey the peer
     * @param units the units to charge
     */
    void add(@NonNull final String peerKey, final long units) {
        add(peerKey, units, 0L);
    }

    /**
     * Charge a peer quota units and record the response cost served with them.
     *
     * @param peerKey the peer
     * @param units the units to charge
     * @param cost the response cost in bytes
     */
    void add(@NonNull final String peerKey, final long units, final long cost) {
        // atomic with pruneIdle dropping the same bucket
        buckets.compute(peerKey, (key, bucket) -> {
            final LeakyBucket target = bucket == null ? new LeakyBucket(capacity, leakPerSecond, nanoClock) : bucket;
            target.add(units);
            target.charge(cost);
            return target;
        });
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public long remaining(@NonNull final String peerKey) {
        final LeakyBucket bucket = buckets.get(peerKey);
        return bucket == null ? capacity : bucket.remaining();
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Duration timeUntilEmpty(@NonNull final String peerKey) {
        final LeakyBucket bucket = buckets.get(peerKey);
        return bucket == null ? Duration.ZERO : bucket.timeUntilEmpty();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public long costServed(@NonNull final String peerKey) {
        final LeakyBucket bucket = buckets.get(peerKey);
        return bucket == null ? 0L : bucket.costServed();
    }

    /**
     * @return the burst capacity of each bucket
     */
    public long capacity() {
        return capacity;
    }

    /**
     * Drop the buckets that have drained completely.
     *
     * @return the number of buckets dropped
     */
    int pruneIdle() {
        final AtomicInteger dropped = new AtomicInteger();
        for (final String peerKey : buckets.keySet()) {
            buckets.computeIfPresent(peerKey, (key, bucket) -> {
                if (bucket.isEmpty()) {
                    dropped.incrementAndGet();
                    return null;
                }
                return bucket;
            });
        }
        return dropped.get();
    }

    /**
     * @return the number of peers currently tracked
     */
    int trackedPeers() {
        return buckets.size();
    }
}
