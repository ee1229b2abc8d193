// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.range;

/**
 * Outcome of a range request that was served to the end.
 *
 * @param slotsServed the number of slots that had at least one item written
 * @param itemsServed the number of chunks written
 */
public record RangeServeResult(long slotsServed, long itemsServed) {}
