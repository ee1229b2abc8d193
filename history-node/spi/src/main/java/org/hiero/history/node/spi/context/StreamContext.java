// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.context;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.hiero.history.node.spi.context.ContextDoneException.Reason;

/**
 * Cancellation and deadline scope for the work done on behalf of one request. A context is done once it is cancelled,
 * its deadline passes, or its parent is done. Once done its {@link #error()} never changes and every child shares it.
 * <h2>Threading</h2>
 * Any thread may cancel a context or wait on it. Deadlines are measured with {@link System#nanoTime()} and noticed
 * lazily, by {@link #isDone()} or when a wait reaches them.
 */
public final class StreamContext implements AutoCloseable {
    /** Deadline value for a context without one */
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    /** The parent context, null for a background context */
    private final StreamContext parent;
    /** The deadline in {@link System#nanoTime()} terms, {@link #NO_DEADLINE} if none */
    private final long deadlineNanos;
    /** Released once the context is done */
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    /** Contexts derived from this one */
    private final List<StreamContext> children = new CopyOnWriteArrayList<>();
    /** The error, set exactly once when the context becomes done */
    private volatile ContextDoneException error;

    private StreamContext(@Nullable final StreamContext parent, final long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * @return a new root context with no deadline, done only when cancelled
     */
    @NonNull
    public static StreamContext background() {
        return new StreamContext(null, NO_DEADLINE);
    }

    /**
     * Derive a child context that is done after {@code timeout} at the latest. The child never outlives this context's
     * own deadline.
     *
     * @param timeout the time the child may run for
     * @return the child context, close it when the work is finished
     */
    @NonNull
    public StreamContext withTimeout(@NonNull final Duration timeout) {
        final long now = System.nanoTime();
        final long timeoutNanos = timeout.toNanos();
        long childDeadline = now + timeoutNanos;
        if (timeoutNanos > 0 && childDeadline - now < 0) {
            // overflow, treat as unbounded
            childDeadline = NO_DEADLINE;
        }
        if (deadlineNanos != NO_DEADLINE && (childDeadline == NO_DEADLINE || deadlineNanos - childDeadline < 0)) {
            childDeadline = deadlineNanos;
        }
        final StreamContext child = new StreamContext(this, childDeadline);
        children.add(child);
        final ContextDoneException parentError = error;
        if (parentError != null) {
            child.finish(parentError);
        }
        return child;
    }

    /**
     * Cancel this context and all contexts derived from it. Does nothing if already done.
     */
    public void cancel() {
        finish(new ContextDoneException(Reason.CANCELLED));
    }

    /**
     * @return true if the context is cancelled, past its deadline or its parent is done
     */
    public boolean isDone() {
        if (error != null) {
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            finish(new ContextDoneException(Reason.DEADLINE_EXCEEDED));
            return true;
        }
        return false;
    }

    /**
     * @return the error of a done context, null while it is still active
     */
    @Nullable
    public ContextDoneException error() {
        return isDone() ? error : null;
    }

    /**
     * @throws ContextDoneException with this context's error if it is done
     */
    public void checkActive() throws ContextDoneException {
        if (isDone()) {
            throw error;
        }
    }

    /**
     * Wait for at most {@code wait}, returning early if the context becomes done.
     *
     * @param wait the longest time to wait
     * @return true if the context is done, false if the full wait elapsed with the context still active
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitDone(@NonNull final Duration wait) throws InterruptedException {
        if (isDone()) {
            return true;
        }
        final long waitNanos = Math.max(0, wait.toNanos());
        if (deadlineNanos != NO_DEADLINE) {
            final long untilDeadline = deadlineNanos - System.nanoTime();
            if (untilDeadline <= waitNanos) {
                if (!doneLatch.await(Math.max(0, untilDeadline), TimeUnit.NANOSECONDS)) {
                    finish(new ContextDoneException(Reason.DEADLINE_EXCEEDED));
                }
                return true;
            }
        }
        return doneLatch.await(waitNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Release this context, cancelling it if still active and detaching it from its parent.
     */
    @Override
    public void close() {
        cancel();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    private void finish(@NonNull final ContextDoneException doneError) {
        synchronized (this) {
            if (error != null) {
                return;
            }
            error = doneError;
        }
        doneLatch.countDown();
        for (final StreamContext child : children) {
            child.finish(doneError);
        }
    }
}
