// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.hiero.history.node.spi.history.BlobsSidecar;

/**
 * Read access to stored blob sidecars, used when serving range requests.
 */
public interface BlobStore {

    /**
     * Get every sidecar stored for a slot, in storage order.
     *
     * @param slot the slot to read
     * @return the sidecars, empty if there are none
     * @throws StorageException on read failure
     */
    @NonNull
    List<BlobsSidecar> blobsSidecarsBySlot(long slot) throws StorageException;
}
