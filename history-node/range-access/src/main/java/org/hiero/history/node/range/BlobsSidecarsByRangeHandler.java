// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.range;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.hiero.history.node.spi.context.ContextDoneException;
import org.hiero.history.node.spi.context.StreamContext;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.RangeRequest;
import org.hiero.history.node.spi.ratelimit.QuotaTracker;
import org.hiero.history.node.spi.ratelimit.RateLimiter;
import org.hiero.history.node.spi.ratelimit.RateLimiterException;
import org.hiero.history.node.spi.store.BlobStore;
import org.hiero.history.node.spi.store.StorageException;
import org.hiero.history.node.spi.stream.ChunkEncoder;
import org.hiero.history.node.spi.stream.ResponseCode;
import org.hiero.history.node.spi.stream.ResponseStream;

/**
 * Serves blobs sidecars for a range of slots to a peer, one chunk per sidecar, in slot order.
 * <p>
 * Each request is checked against the peer's rate limit budget before every slot, and the sidecars of every slot that
 * produced chunks are charged afterward. Once the peer's remaining budget drops below the burst allowance serving pauses until the
 * budget has drained back, or the response deadline is reached. A response covers at most
 * {@link RangeAccessConfig#maxRequestBlobsSidecars()} non-empty slots.
 * <p>
 * A response that is served to the end closes the stream. Any failure resets it, so the peer can tell a truncated
 * response from a complete one.
 */
public final class BlobsSidecarsByRangeHandler {
    /** The protocol id range requests for blobs sidecars are served on */
    public static final String PROTOCOL_ID = "/eth2/beacon_chain/req/blobs_sidecars_by_range/1/ssz_snappy";

    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final RangeAccessConfig config;
    private final BlobStore blobStore;
    private final RateLimiter rateLimiter;
    private final ChunkEncoder<BlobsSidecar> encoder;
    private final Clock clock;
    private final long burst;

    /**
     * @param config range serving configuration
     * @param blobStore the store sidecars are read from
     * @param rateLimiter the limiter the {@link #PROTOCOL_ID} topic is registered with
     * @param encoder encodes one sidecar into one chunk
     * @param clock clock the stream deadlines are computed from
     */
    public BlobsSidecarsByRangeHandler(
            @NonNull final RangeAccessConfig config,
            @NonNull final BlobStore blobStore,
            @NonNull final RateLimiter rateLimiter,
            @NonNull final ChunkEncoder<BlobsSidecar> encoder,
            @NonNull final Clock clock) {
        this.config = Objects.requireNonNull(config);
        this.blobStore = Objects.requireNonNull(blobStore);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
        this.encoder = Objects.requireNonNull(encoder);
        this.clock = Objects.requireNonNull(clock);
        this.burst = (long) config.blockBatchLimitBurstFactor() * config.blockBatchLimit();
    }

    /**
     * Serve one range request on the given stream. The stream is closed on success and reset on failure.
     *
     * @param parent the context of the request, serving stops when it is done
     * @param request the requested range
     * @param stream the response stream to the peer
     * @return how many slots and chunks were served
     * @throws StorageException if sidecars could not be read, the peer has been sent a server error
     * @throws IOException if writing to the stream failed
     * @throws RateLimiterException if the peer is over its rate limit, the peer has been sent the rejection
     * @throws ContextDoneException if the request was cancelled or its deadline passed
     */
    @NonNull
    public RangeServeResult handle(
            @NonNull final StreamContext parent, @NonNull final RangeRequest request, @NonNull final ResponseStream stream)
            throws StorageException, IOException, RateLimiterException, ContextDoneException {
        try (StreamContext context = parent.withTimeout(Duration.ofMillis(config.responseTimeout()))) {
            final RangeServeResult result;
            try {
                result = serve(context, request, stream);
                stream.close();
            } catch (StorageException
                    | IOException
                    | RateLimiterException
                    | ContextDoneException
                    | RuntimeException e) {
                reset(stream, e);
                throw e;
            }
            LOGGER.log(
                    DEBUG,
                    "Served {0} sidecars from {1} slots of range [{2}, {3}) to peer {4}",
                    result.itemsServed(),
                    result.slotsServed(),
                    request.startSlot(),
                    request.endSlot(),
                    stream.remotePeer());
            return result;
        }
    }

    private RangeServeResult serve(
            final StreamContext context, final RangeRequest request, final ResponseStream stream)
            throws StorageException, IOException, RateLimiterException, ContextDoneException {
        stream.setReadDeadline(clock.instant().plusMillis(config.readTimeout()));
        stream.setWriteDeadline(clock.instant().plusMillis(config.writeTimeout()));
        final long endSlot = request.endSlot();
        long slotsServed = 0;
        long itemsServed = 0;
        for (long slot = request.startSlot(); slot < endSlot && slotsServed < config.maxRequestBlobsSidecars(); slot++) {
            context.checkActive();
            rateLimiter.validateRequest(stream, config.blockBatchLimit());
            final List<BlobsSidecar> sent = writeSlot(slot, stream);
            if (sent.isEmpty()) {
                continue;
            }
            slotsServed++;
            itemsServed += sent.size();
            rateLimiter.addBlobsSidecars(stream, sent);
            if (slot + 1 >= endSlot || slotsServed >= config.maxRequestBlobsSidecars()) {
                break;
            }
            throttle(context, stream);
        }
        return new RangeServeResult(slotsServed, itemsServed);
    }

    /**
     * Write every sidecar stored for a slot, skipping the zero root sentinels.
     *
     * @return the sidecars written, one chunk each
     */
    private List<BlobsSidecar> writeSlot(final long slot, final ResponseStream stream)
            throws StorageException, IOException {
        final List<BlobsSidecar> sidecars;
        try {
            sidecars = blobStore.blobsSidecarsBySlot(slot);
        } catch (StorageException e) {
            writeServerError(stream);
            LOGGER.log(WARNING, "Could not read blobs sidecars for slot %d to serve peer %s"
                    .formatted(slot, stream.remotePeer()), e);
            throw e;
        }
        final List<BlobsSidecar> sent = new ArrayList<>(sidecars.size());
        for (final BlobsSidecar sidecar : sidecars) {
            if (sidecar.beaconBlockRoot().isZero()) {
                continue;
            }
            stream.setWriteDeadline(clock.instant().plusMillis(config.writeTimeout()));
            try {
                stream.writeChunk(encoder.encode(sidecar));
            } catch (IOException e) {
                LOGGER.log(DEBUG, "Could not send a chunked response to peer " + stream.remotePeer(), e);
                writeServerError(stream);
                LOGGER.log(WARNING, "Failed to send blobs sidecars for slot %d to peer %s"
                        .formatted(slot, stream.remotePeer()), e);
                throw e;
            }
            sent.add(sidecar);
            LOGGER.log(TRACE, "Sent sidecar for slot {0} to peer {1}", slot, stream.remotePeer());
        }
        return sent;
    }

    /**
     * Pause while the peer's remaining budget is below the burst allowance.
     */
    private void throttle(final StreamContext context, final ResponseStream stream)
            throws RateLimiterException, ContextDoneException {
        final QuotaTracker tracker = rateLimiter.topicCollector(stream.protocol());
        final String key = stream.remotePeer();
        if (tracker.remaining(key) >= burst) {
            return;
        }
        final Duration wait = tracker.timeUntilEmpty(key);
        LOGGER.log(TRACE, "Throttling peer {0} for {1}", key, wait);
        try {
            if (context.awaitDone(wait)) {
                context.checkActive();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            context.checkActive();
        }
    }

    private void writeServerError(final ResponseStream stream) {
        try {
            stream.writeErrorResponse(ResponseCode.SERVER_ERROR, ResponseCode.GENERIC_ERROR_MESSAGE);
        } catch (IOException e) {
            LOGGER.log(DEBUG, "Could not write server error response to peer " + stream.remotePeer(), e);
        }
    }

    private void reset(final ResponseStream stream, final Exception cause) {
        LOGGER.log(DEBUG, "Resetting stream to peer " + stream.remotePeer(), cause);
        try {
            stream.reset();
        } catch (IOException e) {
            cause.addSuppressed(e);
            LOGGER.log(DEBUG, "Could not reset stream to peer " + stream.remotePeer(), e);
        }
    }
}
