// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;

/**
 * The blobs belonging to one block, as stored locally and served to peers one chunk per sidecar.
 *
 * @param beaconBlockRoot the root of the block the blobs belong to, {@link Root#ZERO} for a placeholder entry
 * @param beaconBlockSlot the slot of that block
 * @param blobs the blobs in order
 * @param aggregatedProof the aggregated proof over all blobs, passed through untouched
 */
public record BlobsSidecar(
        @NonNull Root beaconBlockRoot,
        long beaconBlockSlot,
        @NonNull List<Blob> blobs,
        @NonNull Bytes aggregatedProof) {

    public BlobsSidecar {
        Objects.requireNonNull(beaconBlockRoot, "beaconBlockRoot");
        Objects.requireNonNull(aggregatedProof, "aggregatedProof");
        blobs = List.copyOf(blobs);
    }

    @Override
    public String toString() {
        return "BlobsSidecar[root=" + beaconBlockRoot + ", slot=" + beaconBlockSlot + ", blobs=" + blobs.size() + "]";
    }
}
