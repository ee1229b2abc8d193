// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.context;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The error of a {@link StreamContext} that is done, either cancelled or past its deadline.
 */
public class ContextDoneException extends Exception {

    /** Why a context finished */
    public enum Reason {
        CANCELLED("context cancelled"),
        DEADLINE_EXCEEDED("context deadline exceeded");

        private final String message;

        Reason(final String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public ContextDoneException(@NonNull final Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    @NonNull
    public Reason reason() {
        return reason;
    }
}
