// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A single blob carried by a sidecar.
 *
 * @param data the blob content
 */
public record Blob(@NonNull Bytes data) {

    public Blob {
        Objects.requireNonNull(data, "data");
    }

    /**
     * @param data blob content, copied
     * @return a blob holding its own copy of the content
     */
    @NonNull
    public static Blob copyOf(@NonNull final byte[] data) {
        return new Blob(Bytes.wrap(data.clone()));
    }

    @Override
    public String toString() {
        return "Blob[" + data.length() + " bytes]";
    }
}
