// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The parts of a stored block this subsystem reads.
 *
 * @param slot the slot the block was proposed in
 * @param root the block root
 * @param parentRoot the root of the parent block
 */
public record SignedBlock(long slot, @NonNull Root root, @NonNull Root parentRoot) {}
