// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link GapStatus}.
 */
class GapStatusTest {
    private static final Root LOW = Root.fromHex("01".repeat(Root.LENGTH));
    private static final Root HIGH = Root.fromHex("02".repeat(Root.LENGTH));

    @ParameterizedTest
    @CsvSource({"5,4,4", "-1,4,4", "0,-1,0", "0,4,-1"})
    void invalidSlotsRejected(final long low, final long high, final long origin) {
        assertThrows(IllegalArgumentException.class, () -> new GapStatus(low, LOW, high, HIGH, origin, HIGH));
    }

    @Test
    void nullRootsRejected() {
        assertThrows(NullPointerException.class, () -> new GapStatus(0, null, 1, HIGH, 1, HIGH));
    }

    @Test
    void withBoundariesKeepsOrigin() {
        final GapStatus status = new GapStatus(0, LOW, 100, HIGH, 100, HIGH);
        final GapStatus moved = status.withLow(30, HIGH).withHigh(60, LOW);
        assertEquals(new GapStatus(30, HIGH, 60, LOW, 100, HIGH), moved);
        assertThrows(IllegalArgumentException.class, () -> status.withLow(101, LOW));
    }

    @Test
    void gapClosedOnceBoundariesAreAdjacent() {
        assertFalse(new GapStatus(0, LOW, 2, HIGH, 2, HIGH).gapClosed());
        assertTrue(new GapStatus(1, LOW, 2, HIGH, 2, HIGH).gapClosed());
        assertTrue(GapStatus.EMPTY.gapClosed());
    }
}
