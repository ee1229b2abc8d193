// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.stream.ResponseStream;

/**
 * Per peer, per protocol topic rate limiting of inbound requests. Quotas are checked coarsely before work is done and
 * charged with the real cost afterwards, once it is known. Implementations must be safe to call from many stream
 * handlers at once.
 */
public interface RateLimiter {

    /**
     * Check the stream's peer can spend {@code units} on the stream's protocol. On rejection the limiter has already
     * written a rate limited response to the stream.
     *
     * @param stream the stream being served
     * @param units the units the next piece of work may cost
     * @throws RateLimitExceededException if the peer has less budget left than requested
     * @throws UnknownTopicException if the stream's protocol has no quota registered
     */
    void validateRequest(@NonNull ResponseStream stream, long units) throws RateLimiterException;

    /**
     * Charge the stream's peer for work already done.
     *
     * @param stream the stream being served
     * @param units the actual cost
     * @throws UnknownTopicException if the stream's protocol has no quota registered
     */
    void add(@NonNull ResponseStream stream, long units) throws UnknownTopicException;

    /**
     * Charge the stream's peer for sidecars already sent. Every sidecar is one unit of quota, and its
     * {@link ResponseCost#ofBlobsSidecar(BlobsSidecar) cost} is added to the bytes the peer has been served.
     *
     * @param stream the stream being served
     * @param sent the sidecars written to the stream, nothing is charged if empty
     * @throws UnknownTopicException if the stream's protocol has no quota registered
     */
    void addBlobsSidecars(@NonNull ResponseStream stream, @NonNull List<BlobsSidecar> sent)
            throws UnknownTopicException;

    /**
     * @param topic the protocol identifier
     * @return the per peer quota for the topic
     * @throws UnknownTopicException if the topic has no quota registered
     */
    @NonNull
    QuotaTracker topicCollector(@NonNull String topic) throws UnknownTopicException;
}
