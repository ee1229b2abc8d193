// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link BlobsSidecar} and {@link Blob}.
 */
class BlobsSidecarTest {

    @Test
    void blobCopyIsNotChangedByItsSource() {
        final byte[] source = {1, 2, 3};
        final Blob blob = Blob.copyOf(source);
        final int hash = blob.hashCode();
        source[0] = 9;
        assertEquals(Bytes.wrap(new byte[] {1, 2, 3}), blob.data());
        assertEquals(hash, blob.hashCode());
    }

    @Test
    void sidecarsCompareByContent() {
        final BlobsSidecar first =
                new BlobsSidecar(Root.ZERO, 4, List.of(Blob.copyOf(new byte[] {1})), Bytes.wrap(new byte[] {7}));
        final BlobsSidecar same =
                new BlobsSidecar(Root.ZERO, 4, List.of(Blob.copyOf(new byte[] {1})), Bytes.wrap(new byte[] {7}));
        final BlobsSidecar otherProof =
                new BlobsSidecar(Root.ZERO, 4, List.of(Blob.copyOf(new byte[] {1})), Bytes.wrap(new byte[] {8}));
        assertEquals(first, same);
        assertEquals(first.hashCode(), same.hashCode());
        assertNotEquals(first, otherProof);
    }

    @Test
    void blobListIsFixedAtConstruction() {
        final List<Blob> blobs = new ArrayList<>(List.of(Blob.copyOf(new byte[] {1})));
        final BlobsSidecar sidecar = new BlobsSidecar(Root.ZERO, 1, blobs, Bytes.EMPTY);
        blobs.clear();
        assertEquals(1, sidecar.blobs().size());
        assertThrows(UnsupportedOperationException.class, () -> sidecar.blobs().clear());
    }

    @Test
    void missingFieldsRejected() {
        assertThrows(NullPointerException.class, () -> new BlobsSidecar(null, 1, List.of(), Bytes.EMPTY));
        assertThrows(NullPointerException.class, () -> new BlobsSidecar(Root.ZERO, 1, List.of(), null));
        assertThrows(NullPointerException.class, () -> new Blob(null));
    }
}
