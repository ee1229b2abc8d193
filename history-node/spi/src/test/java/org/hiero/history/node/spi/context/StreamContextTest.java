// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.hiero.history.node.spi.context.ContextDoneException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Unit tests for {@link StreamContext}.
 */
@Timeout(value = 5, unit = TimeUnit.SECONDS)
class StreamContextTest {

    @Test
    @DisplayName("A background context stays active until cancelled")
    void backgroundUntilCancelled() throws Exception {
        final StreamContext context = StreamContext.background();
        assertFalse(context.isDone());
        assertNull(context.error());
        context.checkActive();
        assertFalse(context.awaitDone(Duration.ofMillis(10)));

        context.cancel();
        assertTrue(context.isDone());
        assertEquals(Reason.CANCELLED, context.error().reason());
        assertEquals(Reason.CANCELLED, assertThrows(ContextDoneException.class, context::checkActive).reason());
    }

    @Test
    @DisplayName("A timed context reports a deadline exceeded error")
    void deadlineExceeded() throws Exception {
        final StreamContext context = StreamContext.background().withTimeout(Duration.ofMillis(20));
        assertTrue(context.awaitDone(Duration.ofSeconds(2)));
        assertEquals(Reason.DEADLINE_EXCEEDED, context.error().reason());
        assertEquals("context deadline exceeded", context.error().getMessage());
    }

    @Test
    @DisplayName("A zero timeout is done immediately")
    void zeroTimeout() {
        final StreamContext context = StreamContext.background().withTimeout(Duration.ZERO);
        assertTrue(context.isDone());
        assertEquals(Reason.DEADLINE_EXCEEDED, context.error().reason());
    }

    @Test
    @DisplayName("Cancelling a parent cancels its children and the first error sticks")
    void parentCancelPropagates() {
        final StreamContext parent = StreamContext.background();
        final StreamContext child = parent.withTimeout(Duration.ofMinutes(1));
        final StreamContext grandChild = child.withTimeout(Duration.ofMinutes(1));

        parent.cancel();

        assertTrue(child.isDone());
        assertTrue(grandChild.isDone());
        assertSame(parent.error(), grandChild.error());
    }

    @Test
    @DisplayName("Closing a child leaves its parent active")
    void closeChildOnly() {
        final StreamContext parent = StreamContext.background();
        final StreamContext child = parent.withTimeout(Duration.ofMinutes(1));
        child.close();
        assertTrue(child.isDone());
        assertFalse(parent.isDone());
    }

    @Test
    @DisplayName("A child never outlives its parent's deadline")
    void childDeadlineCapped() throws Exception {
        final StreamContext parent = StreamContext.background().withTimeout(Duration.ofMillis(20));
        final StreamContext child = parent.withTimeout(Duration.ofHours(1));
        assertTrue(child.awaitDone(Duration.ofSeconds(2)));
        assertEquals(Reason.DEADLINE_EXCEEDED, child.error().reason());
    }

    @Test
    @DisplayName("A child of a done context starts done")
    void childOfDoneContext() {
        final StreamContext parent = StreamContext.background();
        parent.cancel();
        assertTrue(parent.withTimeout(Duration.ofMinutes(1)).isDone());
    }

    @Test
    @DisplayName("A waiting thread is released by a cancel from another thread")
    void cancelReleasesWaiter() throws Exception {
        final StreamContext context = StreamContext.background();
        final CountDownLatch started = new CountDownLatch(1);
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<Boolean> waited = executor.submit(() -> {
                started.countDown();
                return context.awaitDone(Duration.ofMinutes(1));
            });
            assertTrue(started.await(2, TimeUnit.SECONDS));
            context.cancel();
            assertTrue(waited.get(2, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
