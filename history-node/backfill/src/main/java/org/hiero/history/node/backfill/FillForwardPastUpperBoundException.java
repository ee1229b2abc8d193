// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.backfill;

/**
 * Thrown when the low boundary is asked to move above the high boundary.
 */
public final class FillForwardPastUpperBoundException extends BackfillBoundaryException {
    public FillForwardPastUpperBoundException(final long requestedLowSlot, final long highSlot) {
        super(
                "cannot move low slot to %d, it is above the high slot %d".formatted(requestedLowSlot, highSlot),
                requestedLowSlot,
                highSlot);
    }
}
