// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.stream;

import com.hedera.pbj.runtime.io.buffer.BufferedData;
import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.ByteOrder;
import org.hiero.history.node.spi.history.Blob;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.stream.ChunkEncoder;

/**
 * Encodes a sidecar as a flat little endian record:
 * <pre>
 *   root (32) | slot (8) | blob count (4) | { blob length (4) | blob data }* | proof length (4) | proof
 * </pre>
 */
public final class BlobsSidecarEncoder implements ChunkEncoder<BlobsSidecar> {

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Bytes encode(@NonNull final BlobsSidecar sidecar) {
        long size = Root.LENGTH + Long.BYTES + Integer.BYTES + Integer.BYTES + sidecar.aggregatedProof().length();
        for (final Blob blob : sidecar.blobs()) {
            size += Integer.BYTES + blob.data().length();
        }
        final byte[] encoded = new byte[Math.toIntExact(size)];
        final BufferedData out = BufferedData.wrap(encoded);
        out.writeBytes(sidecar.beaconBlockRoot().bytes());
        out.writeLong(sidecar.beaconBlockSlot(), ByteOrder.LITTLE_ENDIAN);
        out.writeInt(sidecar.blobs().size(), ByteOrder.LITTLE_ENDIAN);
        for (final Blob blob : sidecar.blobs()) {
            out.writeInt(Math.toIntExact(blob.data().length()), ByteOrder.LITTLE_ENDIAN);
            out.writeBytes(blob.data());
        }
        out.writeInt(Math.toIntExact(sidecar.aggregatedProof().length()), ByteOrder.LITTLE_ENDIAN);
        out.writeBytes(sidecar.aggregatedProof());
        return Bytes.wrap(encoded);
    }
}
