// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.history.node.spi.history.GapStatus;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.history.SignedBlock;

/**
 * The storage operations the backfill status tracker needs.
 */
public interface BackfillDatabase {

    /**
     * Persist the backfill status, replacing any previous value.
     *
     * @param status the status to save
     * @throws StorageException if the status could not be written
     */
    void saveBackfillStatus(@NonNull GapStatus status) throws StorageException;

    /**
     * @return the persisted backfill status
     * @throws RecordNotFoundException of kind {@code BACKFILL_STATUS} if none has been saved
     * @throws StorageException on any other read failure
     */
    @NonNull
    GapStatus backfillStatus() throws StorageException;

    /**
     * @return the root of the block the node was checkpoint synced from
     * @throws RecordNotFoundException of kind {@code ORIGIN_CHECKPOINT_ROOT} if the node was synced from genesis
     * @throws StorageException on any other read failure
     */
    @NonNull
    Root originCheckpointBlockRoot() throws StorageException;

    /**
     * Look up a block by its root.
     *
     * @param root the block root
     * @return the block, or null if storage holds nothing for the root
     * @throws StorageException on read failure
     */
    @Nullable
    SignedBlock block(@NonNull Root root) throws StorageException;

    /**
     * @return the root of the genesis block
     * @throws RecordNotFoundException of kind {@code GENESIS_BLOCK_ROOT} if it is not known
     * @throws StorageException on any other read failure
     */
    @NonNull
    Root genesisBlockRoot() throws StorageException;
}
