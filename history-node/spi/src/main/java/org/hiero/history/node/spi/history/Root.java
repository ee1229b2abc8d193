// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.history;

import com.hedera.pbj.runtime.io.buffer.Bytes;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A 32 byte block root. Roots are compared by content. {@link #ZERO} is the all zero sentinel used by stored items to
 * say they are not associated with any block.
 *
 * @param bytes the root bytes, exactly {@link #LENGTH} long
 */
public record Root(@NonNull Bytes bytes) {
    /** The length of a root in bytes */
    public static final int LENGTH = 32;
    /** The all zero root */
    public static final Root ZERO = new Root(Bytes.wrap(new byte[LENGTH]));

    public Root {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length() != LENGTH) {
            throw new IllegalArgumentException(
                    "Root must be %d bytes but was %d bytes".formatted(LENGTH, bytes.length()));
        }
    }

    /**
     * Create a root from a copy of the given bytes.
     *
     * @param bytes the root bytes, must be exactly {@link #LENGTH} long
     * @return the root
     * @throws IllegalArgumentException if the length is wrong
     */
    @NonNull
    public static Root wrap(@NonNull final byte[] bytes) {
        return new Root(Bytes.wrap(bytes.clone()));
    }

    /**
     * Parse a root from 64 hex characters, with or without a leading {@code 0x}.
     *
     * @param hex the hex string
     * @return the root
     */
    @NonNull
    public static Root fromHex(@NonNull final String hex) {
        final String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        return new Root(Bytes.wrap(HexFormat.of().parseHex(digits)));
    }

    /**
     * @return a copy of the root bytes
     */
    @NonNull
    public byte[] toByteArray() {
        return bytes.toByteArray();
    }

    /**
     * @return true if this is the all zero sentinel root
     */
    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public String toString() {
        return "0x" + bytes.toHex();
    }
}
