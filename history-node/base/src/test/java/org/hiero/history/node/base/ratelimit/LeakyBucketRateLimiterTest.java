// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.history.node.spi.history.Blob;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.ratelimit.QuotaTracker;
import org.hiero.history.node.spi.ratelimit.RateLimitExceededException;
import org.hiero.history.node.spi.ratelimit.UnknownTopicException;
import org.hiero.history.node.spi.stream.ResponseCode;
import org.hiero.history.node.spi.stream.ResponseStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Unit tests for {@link LeakyBucketRateLimiter}, driven by a hand-advanced clock.
 */
@Timeout(value = 5, unit = TimeUnit.SECONDS)
class LeakyBucketRateLimiterTest {
    private static final String TOPIC = "/test/topic/1";
    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    private final AtomicLong nanos = new AtomicLong(1_000L);
    private LeakyBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new LeakyBucketRateLimiter(nanos::get);
        limiter.registerTopic(TOPIC, 10, 20);
    }

    private static ResponseStream stream(final String peer, final String topic) {
        final ResponseStream stream = mock(ResponseStream.class);
        when(stream.remotePeer()).thenReturn(peer);
        when(stream.protocol()).thenReturn(topic);
        return stream;
    }

    @Test
    @DisplayName("A new peer has the full burst available")
    void newPeerHasFullBudget() throws Exception {
        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(20, tracker.remaining("fresh"));
        assertEquals(Duration.ZERO, tracker.timeUntilEmpty("fresh"));
    }

    @Test
    @DisplayName("Charges reduce the budget and leak back over time")
    void chargesLeakBack() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        limiter.add(stream, 15);
        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(5, tracker.remaining("a"));
        assertEquals(Duration.ofMillis(1_500), tracker.timeUntilEmpty("a"));

        nanos.addAndGet(SECOND);
        assertEquals(15, tracker.remaining("a"));
        assertEquals(Duration.ofMillis(500), tracker.timeUntilEmpty("a"));

        nanos.addAndGet(SECOND);
        assertEquals(20, tracker.remaining("a"));
        assertEquals(Duration.ZERO, tracker.timeUntilEmpty("a"));
    }

    @Test
    @DisplayName("The bucket level never exceeds the burst")
    void levelCappedAtBurst() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        limiter.add(stream, 500);
        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(0, tracker.remaining("a"));
        assertEquals(Duration.ofSeconds(2), tracker.timeUntilEmpty("a"));
    }

    @Test
    @DisplayName("Peers are charged independently")
    void peersAreIndependent() throws Exception {
        limiter.add(stream("a", TOPIC), 20);
        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(0, tracker.remaining("a"));
        assertEquals(20, tracker.remaining("b"));
    }

    @Test
    @DisplayName("A request within the budget is accepted without writing anything")
    void requestWithinBudgetAccepted() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        limiter.add(stream, 10);
        assertDoesNotThrow(() -> limiter.validateRequest(stream, 10));
        verify(stream, never()).writeErrorResponse(any(), anyString());
    }

    @Test
    @DisplayName("A request over the budget is rejected with a rate limited response")
    void requestOverBudgetRejected() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        limiter.add(stream, 11);
        final RateLimitExceededException thrown =
                assertThrows(RateLimitExceededException.class, () -> limiter.validateRequest(stream, 10));
        assertEquals("a", thrown.peer());
        assertEquals(TOPIC, thrown.topic());
        verify(stream).writeErrorResponse(ResponseCode.INVALID_REQUEST, ResponseCode.RATE_LIMITED_MESSAGE);
    }

    @Test
    @DisplayName("A failed rejection write still rejects the request")
    void rejectionWriteFailureStillRejects() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        doThrow(new IOException("broken pipe")).when(stream).writeErrorResponse(any(), anyString());
        limiter.add(stream, 20);
        assertThrows(RateLimitExceededException.class, () -> limiter.validateRequest(stream, 1));
    }

    @Test
    @DisplayName("Sent sidecars are charged one unit each and their response cost is recorded")
    void sidecarsChargedByCount() throws Exception {
        final ResponseStream stream = stream("a", TOPIC);
        final BlobsSidecar small = new BlobsSidecar(Root.ZERO, 1, List.of(Blob.copyOf(new byte[100])), Bytes.EMPTY);
        final BlobsSidecar large = new BlobsSidecar(
                Root.ZERO, 1, List.of(Blob.copyOf(new byte[1_000]), Blob.copyOf(new byte[24])), Bytes.EMPTY);

        limiter.addBlobsSidecars(stream, List.of(small, large));

        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(18, tracker.remaining("a"));
        assertEquals((40 + 100) + (40 + 1_024), tracker.costServed("a"));
        assertEquals(0, tracker.costServed("b"));

        limiter.addBlobsSidecars(stream, List.of(small));
        assertEquals(17, tracker.remaining("a"));
        assertEquals((40 + 100) * 2 + (40 + 1_024), tracker.costServed("a"));
    }

    @Test
    @DisplayName("Charging no sidecars leaves the peer untracked")
    void noSidecarsNoCharge() throws Exception {
        limiter.addBlobsSidecars(stream("a", TOPIC), List.of());
        final LeakyBucketCollector collector = (LeakyBucketCollector) limiter.topicCollector(TOPIC);
        assertEquals(0, collector.trackedPeers());
        assertEquals(0, collector.costServed("a"));
    }

    @Test
    @DisplayName("Pruning a drained peer forgets its served cost")
    void pruneForgetsCost() throws Exception {
        final BlobsSidecar sidecar = new BlobsSidecar(Root.ZERO, 1, List.of(), Bytes.EMPTY);
        limiter.addBlobsSidecars(stream("a", TOPIC), List.of(sidecar));
        final QuotaTracker tracker = limiter.topicCollector(TOPIC);
        assertEquals(40, tracker.costServed("a"));

        nanos.addAndGet(SECOND);
        assertEquals(1, limiter.pruneIdleBuckets());
        assertEquals(0, tracker.costServed("a"));
    }

    @Test
    @DisplayName("An unregistered topic is reported")
    void unknownTopic() {
        final ResponseStream stream = stream("a", "/unknown");
        assertThrows(UnknownTopicException.class, () -> limiter.validateRequest(stream, 1));
        assertThrows(UnknownTopicException.class, () -> limiter.add(stream, 1));
        assertThrows(UnknownTopicException.class, () -> limiter.addBlobsSidecars(stream, List.of()));
        assertThrows(UnknownTopicException.class, () -> limiter.topicCollector("/unknown"));
    }

    @Test
    @DisplayName("Drained buckets are pruned and busy ones kept")
    void pruneDrainedBuckets() throws Exception {
        limiter.add(stream("idle", TOPIC), 5);
        nanos.addAndGet(SECOND);
        limiter.add(stream("busy", TOPIC), 20);
        final LeakyBucketCollector collector = (LeakyBucketCollector) limiter.topicCollector(TOPIC);
        assertEquals(2, collector.trackedPeers());

        assertEquals(1, limiter.pruneIdleBuckets());
        assertEquals(1, collector.trackedPeers());
        assertThat(collector.remaining("busy")).isZero();
    }

    @Test
    @DisplayName("Invalid bucket parameters are rejected")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> limiter.registerTopic("x", 0, 10));
        assertThrows(IllegalArgumentException.class, () -> limiter.registerTopic("x", 1, 0));
    }
}
