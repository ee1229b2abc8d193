// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

/**
 * A peer request for everything stored in the slots {@code [startSlot, startSlot + count)}. Values come straight from
 * the network so only their sign is checked here.
 *
 * @param startSlot the first slot requested
 * @param count the number of slots requested
 */
public record RangeRequest(long startSlot, long count) {

    public RangeRequest {
        if (startSlot < 0) {
            throw new IllegalArgumentException("RangeRequest startSlot: %d must not be negative".formatted(startSlot));
        }
        if (count < 0) {
            throw new IllegalArgumentException("RangeRequest count: %d must not be negative".formatted(count));
        }
    }

    /**
     * @return the first slot after the requested range, saturating at {@link Long#MAX_VALUE}
     */
    public long endSlot() {
        final long end = startSlot + count;
        return end < startSlot ? Long.MAX_VALUE : end;
    }
}
