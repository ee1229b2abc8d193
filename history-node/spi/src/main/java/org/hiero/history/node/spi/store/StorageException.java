// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.store;

/**
 * Thrown when the node's storage cannot complete a read or write.
 */
public class StorageException extends Exception {
    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
