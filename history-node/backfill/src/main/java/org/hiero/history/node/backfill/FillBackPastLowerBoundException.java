// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.backfill;

/**
 * Thrown when the high boundary is asked to move below the low boundary.
 */
public final class FillBackPastLowerBoundException extends BackfillBoundaryException {
    public FillBackPastLowerBoundException(final long requestedHighSlot, final long lowSlot) {
        super(
                "cannot move high slot to %d, it is below the low slot %d".formatted(requestedHighSlot, lowSlot),
                requestedHighSlot,
                lowSlot);
    }
}
