// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * Per peer quota for one protocol topic.
 */
public interface QuotaTracker {

    /**
     * @param peerKey the peer identifier
     * @return the units the peer can still spend right now
     */
    long remaining(@NonNull String peerKey);

    /**
     * @param peerKey the peer identifier
     * @return how long until the peer's full budget is available again, zero if it already is
     */
    @NonNull
    Duration timeUntilEmpty(@NonNull String peerKey);

    /**
     * @param peerKey the peer identifier
     * @return the response cost in bytes charged to the peer since it was last idle long enough to be forgotten
     */
    long costServed(@NonNull String peerKey);
}
