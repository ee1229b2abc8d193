// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.history.node.spi.history.Blob;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.Root;

/**
 * Cost estimates of response items, in bytes, for quota bookkeeping.
 */
public final class ResponseCost {
    /** Fixed cost of the block root and slot carried by every sidecar */
    public static final int SIDECAR_OVERHEAD_COST = Root.LENGTH + Long.BYTES;

    private ResponseCost() {}

    /**
     * @param sidecar the sidecar to cost
     * @return the fixed overhead plus the length of every blob
     */
    public static long ofBlobsSidecar(@NonNull final BlobsSidecar sidecar) {
        long cost = SIDECAR_OVERHEAD_COST;
        for (final Blob blob : sidecar.blobs()) {
            cost += blob.data().length();
        }
        return cost;
    }
}
