// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.stream;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Encodes a response item into the payload of one chunk.
 *
 * @param <T> the item type
 */
@FunctionalInterface
public interface ChunkEncoder<T> {
    @NonNull
    Bytes encode(@NonNull T item);
}
