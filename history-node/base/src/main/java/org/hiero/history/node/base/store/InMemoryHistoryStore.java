// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.GapStatus;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.history.SignedBlock;
import org.hiero.history.node.spi.store.BackfillDatabase;
import org.hiero.history.node.spi.store.BlobStore;
import org.hiero.history.node.spi.store.RecordNotFoundException;
import org.hiero.history.node.spi.store.RecordNotFoundException.MissingRecord;

/**
 * Thread safe store holding everything in memory. Backs a node that has no durable storage configured, and tests.
 * Counts backfill status saves so callers can check writes that should not have happened did not.
 */
public final class InMemoryHistoryStore implements BackfillDatabase, BlobStore {
    private final AtomicReference<GapStatus> backfillStatus = new AtomicReference<>();
    private final AtomicReference<Root> originCheckpointBlockRoot = new AtomicReference<>();
    private final AtomicReference<Root> genesisBlockRoot = new AtomicReference<>();
    private final Map<Root, SignedBlock> blocksByRoot = new ConcurrentHashMap<>();
    private final Map<Long, List<BlobsSidecar>> sidecarsBySlot = new ConcurrentSkipListMap<>();
    private final AtomicInteger backfillStatusSaves = new AtomicInteger();

    // ==== BackfillDatabase Methods ===================================================================================

    /**
     * {@inheritDoc}
     */
    @Override
    public void saveBackfillStatus(@NonNull final GapStatus status) {
        backfillStatus.set(Objects.requireNonNull(status));
        backfillStatusSaves.incrementAndGet();
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public GapStatus backfillStatus() throws RecordNotFoundException {
        return required(backfillStatus.get(), MissingRecord.BACKFILL_STATUS);
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Root originCheckpointBlockRoot() throws RecordNotFoundException {
        return required(originCheckpointBlockRoot.get(), MissingRecord.ORIGIN_CHECKPOINT_ROOT);
    }

    /**
     * {@inheritDoc}
     */
    @Nullable
    @Override
    public SignedBlock block(@NonNull final Root root) {
        return blocksByRoot.get(root);
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Root genesisBlockRoot() throws RecordNotFoundException {
        return required(genesisBlockRoot.get(), MissingRecord.GENESIS_BLOCK_ROOT);
    }

    // ==== BlobStore Methods ==========================================================================================

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public List<BlobsSidecar> blobsSidecarsBySlot(final long slot) {
        final List<BlobsSidecar> sidecars = sidecarsBySlot.get(slot);
        return sidecars == null ? List.of() : List.copyOf(sidecars);
    }

    // ==== Write Methods ==============================================================================================

    /**
     * Store a block, keyed by its root.
     *
     * @param block the block
     */
    public void putBlock(@NonNull final SignedBlock block) {
        blocksByRoot.put(block.root(), block);
    }

    /**
     * Record that the node was checkpoint synced from the block with the given root.
     *
     * @param root the origin block root
     */
    public void setOriginCheckpointBlockRoot(@NonNull final Root root) {
        originCheckpointBlockRoot.set(Objects.requireNonNull(root));
    }

    /**
     * @param root the genesis block root
     */
    public void setGenesisBlockRoot(@NonNull final Root root) {
        genesisBlockRoot.set(Objects.requireNonNull(root));
    }

    /**
     * Append a sidecar to the ones stored for its slot.
     *
     * @param sidecar the sidecar
     */
    public void addBlobsSidecar(@NonNull final BlobsSidecar sidecar) {
        sidecarsBySlot
                .computeIfAbsent(sidecar.beaconBlockSlot(), slot -> new CopyOnWriteArrayList<>())
                .add(sidecar);
    }

    /**
     * @return the number of times a backfill status has been saved
     */
    public int backfillStatusSaves() {
        return backfillStatusSaves.get();
    }

    private static <T> T required(@Nullable final T value, final MissingRecord kind) throws RecordNotFoundException {
        if (value == null) {
            throw new RecordNotFoundException(kind);
        }
        return value;
    }
}
