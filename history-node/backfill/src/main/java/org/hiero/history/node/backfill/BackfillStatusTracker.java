// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.backfill;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.TRACE;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.hiero.history.node.spi.history.GapStatus;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.history.SignedBlock;
import org.hiero.history.node.spi.store.BackfillDatabase;
import org.hiero.history.node.spi.store.RecordNotFoundException;
import org.hiero.history.node.spi.store.RecordNotFoundException.MissingRecord;
import org.hiero.history.node.spi.store.StorageException;

/**
 * Tracks which slots of history are missing after a checkpoint sync. The gap is the open interval between the low
 * boundary, grown forward from genesis, and the high boundary, grown back from the checkpoint origin.
 * <p>
 * There is one tracker per node. The cached status always equals the last status persisted to the
 * {@link BackfillDatabase}: every update is written to storage first and only then made visible to readers.
 * <h2>Threading</h2>
 * Reads share a read lock. Reload and the fill operations hold the write lock for the whole check, persist and update,
 * so concurrent fills are applied one at a time, each against the latest status.
 */
public final class BackfillStatusTracker {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final BackfillDatabase database;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    /** True when the node synced from genesis and so has no gap. Written only by {@link #reload()} */
    private volatile boolean genesisSync;
    /** Guarded by {@link #lock} */
    private GapStatus status = GapStatus.EMPTY;
    /** Guarded by {@link #lock} */
    private boolean loaded;

    public BackfillStatusTracker(@NonNull final BackfillDatabase database) {
        this.database = Objects.requireNonNull(database);
    }

    /**
     * Load the status from storage. When no status was ever saved the node is either genesis synced, or it was
     * checkpoint synced by a version that did not record a status, in which case one is built from the origin
     * checkpoint block and the genesis root, then persisted.
     *
     * @throws StorageException if storage fails, or the data needed to build a missing status is absent
     */
    public void reload() throws StorageException {
        lock.writeLock().lock();
        try {
            try {
                status = database.backfillStatus();
                loaded = true;
                LOGGER.log(INFO, "Loaded backfill status {0}", status);
                return;
            } catch (final RecordNotFoundException e) {
                if (!e.isMissing(MissingRecord.BACKFILL_STATUS)) {
                    throw e;
                }
            }
            final Root originRoot;
            try {
                originRoot = database.originCheckpointBlockRoot();
            } catch (final RecordNotFoundException e) {
                if (!e.isMissing(MissingRecord.ORIGIN_CHECKPOINT_ROOT)) {
                    throw e;
                }
                genesisSync = true;
                loaded = true;
                LOGGER.log(INFO, "No origin checkpoint block root found, node is synced from genesis");
                return;
            }
            final GapStatus recovered = recoverFromOrigin(originRoot);
            database.saveBackfillStatus(recovered);
            status = recovered;
            loaded = true;
            LOGGER.log(INFO, "Created backfill status {0} for checkpoint synced node", recovered);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Check whether a slot is held locally.
     *
     * @param slot the slot to check
     * @return true if the node is genesis synced or the slot lies outside the gap
     */
    public boolean slotCovered(final long slot) {
        if (genesisSync) {
            return true;
        }
        lock.readLock().lock();
        try {
            return slot <= status.lowSlot() || slot >= status.highSlot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Move the low boundary of the gap to {@code newLowSlot}.
     *
     * @param newLowSlot the new low slot
     * @param root the block root at the new low slot
     * @throws FillForwardPastUpperBoundException if {@code newLowSlot} is above the high slot, the status is unchanged
     * @throws StorageException if the new status could not be persisted, the status is unchanged
     */
    public void fillForward(final long newLowSlot, @NonNull final Root root)
            throws FillForwardPastUpperBoundException, StorageException {
        Objects.requireNonNull(root);
        lock.writeLock().lock();
        try {
            requireLoaded();
            if (newLowSlot > status.highSlot()) {
                throw new FillForwardPastUpperBoundException(newLowSlot, status.highSlot());
            }
            update(status.withLow(newLowSlot, root));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Move the high boundary of the gap to {@code newHighSlot}.
     *
     * @param newHighSlot the new high slot
     * @param root the block root at the new high slot
     * @throws FillBackPastLowerBoundException if {@code newHighSlot} is below the low slot, the status is unchanged
     * @throws StorageException if the new status could not be persisted, the status is unchanged
     */
    public void fillBack(final long newHighSlot, @NonNull final Root root)
            throws FillBackPastLowerBoundException, StorageException {
        Objects.requireNonNull(root);
        lock.writeLock().lock();
        try {
            requireLoaded();
            if (newHighSlot < status.lowSlot()) {
                throw new FillBackPastLowerBoundException(newHighSlot, status.lowSlot());
            }
            update(status.withHigh(newHighSlot, root));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the current status, {@link GapStatus#EMPTY} before a status is loaded
     */
    @NonNull
    public GapStatus status() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if the node synced from genesis and has no history gap
     */
    public boolean isGenesisSync() {
        return genesisSync;
    }

    // must hold the write lock
    private void update(@NonNull final GapStatus updated) throws StorageException {
        if (updated.equals(status)) {
            LOGGER.log(TRACE, "Backfill status unchanged {0}", updated);
            return;
        }
        database.saveBackfillStatus(updated);
        status = updated;
        LOGGER.log(DEBUG, "Backfill status updated to {0}", updated);
    }

    private void requireLoaded() {
        if (!loaded) {
            throw new IllegalStateException("backfill status has not been loaded, call reload() first");
        }
    }

    private GapStatus recoverFromOrigin(@NonNull final Root originRoot) throws StorageException {
        final SignedBlock originBlock;
        try {
            originBlock = database.block(originRoot);
        } catch (final RecordNotFoundException e) {
            if (!e.isMissing(MissingRecord.BLOCK)) {
                throw e;
            }
            throw new StorageException("nil block found for origin checkpoint root=%s".formatted(originRoot), e);
        } catch (final StorageException e) {
            throw new StorageException("error retrieving block for origin checkpoint root=%s".formatted(originRoot), e);
        }
        if (originBlock == null) {
            throw new StorageException("nil block found for origin checkpoint root=%s".formatted(originRoot));
        }
        final Root genesisRoot;
        try {
            genesisRoot = database.genesisBlockRoot();
        } catch (final RecordNotFoundException e) {
            if (!e.isMissing(MissingRecord.GENESIS_BLOCK_ROOT)) {
                throw e;
            }
            throw new StorageException("genesis block root required for checkpoint sync", e);
        }
        final long originSlot = originBlock.slot();
        return new GapStatus(0, genesisRoot, originSlot, originRoot, originSlot, originRoot);
    }
}
