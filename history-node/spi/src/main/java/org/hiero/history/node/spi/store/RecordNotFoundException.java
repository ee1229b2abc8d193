// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.store;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Thrown by storage when a record that is looked up does not exist. The {@link MissingRecord} kind lets callers tell
 * an expected absence apart from any other failure.
 */
public class RecordNotFoundException extends StorageException {

    /** The kinds of record storage can report as missing */
    public enum MissingRecord {
        BACKFILL_STATUS("backfill status"),
        ORIGIN_CHECKPOINT_ROOT("origin checkpoint block root"),
        GENESIS_BLOCK_ROOT("genesis block root"),
        BLOCK("block");

        private final String description;

        MissingRecord(final String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final MissingRecord missingRecord;

    public RecordNotFoundException(@NonNull final MissingRecord missingRecord) {
        super("no " + missingRecord.description() + " found in storage");
        this.missingRecord = Objects.requireNonNull(missingRecord);
    }

    /**
     * @return the kind of record that was not found
     */
    @NonNull
    public MissingRecord missingRecord() {
        return missingRecord;
    }

    /**
     * @param kind the kind to compare against
     * @return true if this exception reports a missing record of the given kind
     */
    public boolean isMissing(@NonNull final MissingRecord kind) {
        return missingRecord == kind;
    }
}
