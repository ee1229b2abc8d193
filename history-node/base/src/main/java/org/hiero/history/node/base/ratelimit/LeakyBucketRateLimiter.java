// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.ratelimit;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.ratelimit.QuotaTracker;
import org.hiero.history.node.spi.ratelimit.RateLimitExceededException;
import org.hiero.history.node.spi.ratelimit.RateLimiter;
import org.hiero.history.node.spi.ratelimit.ResponseCost;
import org.hiero.history.node.spi.ratelimit.UnknownTopicException;
import org.hiero.history.node.spi.stream.ResponseCode;
import org.hiero.history.node.spi.stream.ResponseStream;

/**
 * {@link RateLimiter} keeping one leaky bucket per peer for every registered protocol topic.
 * <p>
 * Semantics:
 * <ul>
 *     <li>a peer's budget on a topic is the burst capacity minus what is still in its bucket</li>
 *     <li>{@link #validateRequest} only reads the budget, {@link #add} pours the real cost in afterwards</li>
 *     <li>buckets leak at the topic's units per second rate</li>
 *     <li>sidecars are charged one unit each, their {@link ResponseCost} is kept per peer alongside the bucket</li>
 * </ul>
 */
public final class LeakyBucketRateLimiter implements RateLimiter {
    /** The logger for this class. */
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final Map<String, LeakyBucketCollector> collectors = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public LeakyBucketRateLimiter() {
        this(System::nanoTime);
    }

    // Visible for testing.
    LeakyBucketRateLimiter(@NonNull final LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Register the quota for a protocol topic, replacing any earlier registration and its peer state.
     *
     * @param topic the protocol identifier
     * @param unitsPerSecond the sustained rate a peer may spend
     * @param burst the most a peer may spend at once
     */
    public void registerTopic(@NonNull final String topic, final double unitsPerSecond, final long burst) {
        collectors.put(topic, new LeakyBucketCollector(unitsPerSecond, burst, nanoClock));
        LOGGER.log(DEBUG, "Registered rate limit for topic {0}: {1} per second, burst {2}", topic, unitsPerSecond, burst);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void validateRequest(@NonNull final ResponseStream stream, final long units)
            throws RateLimitExceededException, UnknownTopicException {
        final String topic = stream.protocol();
        final String peer = stream.remotePeer();
        final LeakyBucketCollector collector = collector(topic);
        final long remaining = collector.remaining(peer);
        if (units > remaining) {
            LOGGER.log(DEBUG, "Peer {0} is rate limited on {1}, requested {2} with {3} remaining",
                    peer, topic, units, remaining);
            writeRateLimitedResponse(stream);
            throw new RateLimitExceededException(peer, topic, units, remaining);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void add(@NonNull final ResponseStream stream, final long units) throws UnknownTopicException {
        collector(stream.protocol()).add(stream.remotePeer(), units);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void addBlobsSidecars(@NonNull final ResponseStream stream, @NonNull final List<BlobsSidecar> sent)
            throws UnknownTopicException {
        final LeakyBucketCollector collector = collector(stream.protocol());
        if (sent.isEmpty()) {
            return;
        }
        long cost = 0;
        for (final BlobsSidecar sidecar : sent) {
            cost += ResponseCost.ofBlobsSidecar(sidecar);
        }
        collector.add(stream.remotePeer(), sent.size(), cost);
        LOGGER.log(TRACE, "Charged peer {0} {1} sidecars costing {2} bytes", stream.remotePeer(), sent.size(), cost);
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public QuotaTracker topicCollector(@NonNull final String topic) throws UnknownTopicException {
        return collector(topic);
    }

    /**
     * Drop the buckets of every peer that has fully drained on every topic.
     *
     * @return the number of buckets dropped
     */
    public int pruneIdleBuckets() {
        int dropped = 0;
        for (final LeakyBucketCollector collector : collectors.values()) {
            dropped += collector.pruneIdle();
        }
        LOGGER.log(TRACE, "Pruned {0} idle rate limit buckets", dropped);
        return dropped;
    }

    private LeakyBucketCollector collector(final String topic) throws UnknownTopicException {
        final LeakyBucketCollector collector = collectors.get(topic);
        if (collector == null) {
            throw new UnknownTopicException(topic);
        }
        return collector;
    }

    private void writeRateLimitedResponse(final ResponseStream stream) {
        try {
            stream.writeErrorResponse(ResponseCode.INVALID_REQUEST, ResponseCode.RATE_LIMITED_MESSAGE);
        } catch (IOException e) {
            LOGGER.log(DEBUG, "Could not write rate limited response to peer " + stream.remotePeer(), e);
        }
    }
}
