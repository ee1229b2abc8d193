// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.backfill;

/**
 * Thrown when a boundary update would move one edge of the backfill gap past the other.
 */
public abstract class BackfillBoundaryException extends Exception {
    private final long requestedSlot;
    private final long boundSlot;

    protected BackfillBoundaryException(final String message, final long requestedSlot, final long boundSlot) {
        super(message);
        this.requestedSlot = requestedSlot;
        this.boundSlot = boundSlot;
    }

    /**
     * @return the slot the caller asked to move the boundary to
     */
    public long requestedSlot() {
        return requestedSlot;
    }

    /**
     * @return the opposite boundary the requested slot crossed
     */
    public long boundSlot() {
        return boundSlot;
    }
}
