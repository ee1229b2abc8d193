// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import java.util.List;
import org.hiero.history.node.spi.history.BlobsSidecar;
import org.hiero.history.node.spi.history.GapStatus;
import org.hiero.history.node.spi.history.Root;
import org.hiero.history.node.spi.history.SignedBlock;
import org.hiero.history.node.spi.store.RecordNotFoundException;
import org.hiero.history.node.spi.store.RecordNotFoundException.MissingRecord;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link InMemoryHistoryStore}.
 */
class InMemoryHistoryStoreTest {
    private static final Root ROOT = Root.fromHex("11".repeat(Root.LENGTH));

    private final InMemoryHistoryStore store = new InMemoryHistoryStore();

    @Test
    void missingRecordsReportTheirKind() {
        assertTrue(assertThrows(RecordNotFoundException.class, store::backfillStatus)
                .isMissing(MissingRecord.BACKFILL_STATUS));
        assertTrue(assertThrows(RecordNotFoundException.class, store::originCheckpointBlockRoot)
                .isMissing(MissingRecord.ORIGIN_CHECKPOINT_ROOT));
        assertTrue(assertThrows(RecordNotFoundException.class, store::genesisBlockRoot)
                .isMissing(MissingRecord.GENESIS_BLOCK_ROOT));
        assertNull(store.block(ROOT));
    }

    @Test
    void savesAreCounted() throws Exception {
        final GapStatus status = new GapStatus(1, ROOT, 5, ROOT, 5, ROOT);
        store.saveBackfillStatus(status);
        store.saveBackfillStatus(status);
        assertEquals(status, store.backfillStatus());
        assertEquals(2, store.backfillStatusSaves());
    }

    @Test
    void blocksAndRootsAreReturned() throws Exception {
        final SignedBlock block = new SignedBlock(3, ROOT, Root.ZERO);
        store.putBlock(block);
        store.setOriginCheckpointBlockRoot(ROOT);
        store.setGenesisBlockRoot(Root.ZERO);
        assertEquals(block, store.block(ROOT));
        assertEquals(ROOT, store.originCheckpointBlockRoot());
        assertEquals(Root.ZERO, store.genesisBlockRoot());
    }

    @Test
    void sidecarsAreKeptPerSlotInInsertionOrder() {
        final BlobsSidecar first = new BlobsSidecar(ROOT, 4, List.of(), Bytes.wrap(new byte[] {1}));
        final BlobsSidecar second = new BlobsSidecar(ROOT, 4, List.of(), Bytes.wrap(new byte[] {2}));
        store.addBlobsSidecar(first);
        store.addBlobsSidecar(second);
        assertEquals(List.of(first, second), store.blobsSidecarsBySlot(4));
        assertThat(store.blobsSidecarsBySlot(5)).isEmpty();
    }
}
