// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * The known boundaries of the history missing after a checkpoint sync. Slots up to and including {@code lowSlot} and
 * from {@code highSlot} upwards are held locally, the open interval between them is the gap. The origin is the
 * checkpoint the node was started from and is fixed once the status is first created.
 * <p>
 * The status is always persisted and replaced as a whole, never field by field.
 *
 * @param lowSlot the highest slot of contiguous history counted from genesis
 * @param lowRoot the block root at {@code lowSlot}
 * @param highSlot the lowest slot of contiguous history counted back from the head
 * @param highRoot the block root at {@code highSlot}
 * @param originSlot the slot of the checkpoint sync origin block
 * @param originRoot the root of the checkpoint sync origin block
 */
public record GapStatus(
        long lowSlot,
        @NonNull Root lowRoot,
        long highSlot,
        @NonNull Root highRoot,
        long originSlot,
        @NonNull Root originRoot) {

    /** The status before anything has been loaded, all slots zero and all roots the zero root */
    public static final GapStatus EMPTY = new GapStatus(0, Root.ZERO, 0, Root.ZERO, 0, Root.ZERO);

    /**
     * Validates slots and roots.
     *
     * @throws IllegalArgumentException if a slot is negative or {@code lowSlot > highSlot}
     */
    public GapStatus {
        Objects.requireNonNull(lowRoot, "lowRoot");
        Objects.requireNonNull(highRoot, "highRoot");
        Objects.requireNonNull(originRoot, "originRoot");
        if (lowSlot < 0 || highSlot < 0 || originSlot < 0) {
            throw new IllegalArgumentException("GapStatus slots must not be negative: low=%d high=%d origin=%d"
                    .formatted(lowSlot, highSlot, originSlot));
        }
        if (lowSlot > highSlot) {
            throw new IllegalArgumentException(
                    "GapStatus lowSlot: %d must not be greater than highSlot: %d".formatted(lowSlot, highSlot));
        }
    }

    /**
     * Create a copy with a new lower boundary.
     *
     * @param slot the new low slot
     * @param root the block root at the new low slot
     * @return the new status
     */
    @NonNull
    public GapStatus withLow(final long slot, @NonNull final Root root) {
        return new GapStatus(slot, root, highSlot, highRoot, originSlot, originRoot);
    }

    /**
     * Create a copy with a new upper boundary.
     *
     * @param slot the new high slot
     * @param root the block root at the new high slot
     * @return the new status
     */
    @NonNull
    public GapStatus withHigh(final long slot, @NonNull final Root root) {
        return new GapStatus(lowSlot, lowRoot, slot, root, originSlot, originRoot);
    }

    /**
     * @return true if no slot lies strictly between the two boundaries
     */
    public boolean gapClosed() {
        return highSlot - lowSlot <= 1;
    }
}
