// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a peer asks for more than its remaining budget on a topic.
 */
public class RateLimitExceededException extends RateLimiterException {
    private final String peer;
    private final String topic;

    public RateLimitExceededException(@NonNull final String peer, @NonNull final String topic, final long requested,
            final long remaining) {
        super("rate limited: peer=%s topic=%s requested=%d remaining=%d"
                .formatted(peer, topic, requested, remaining));
        this.peer = peer;
        this.topic = topic;
    }

    @NonNull
    public String peer() {
        return peer;
    }

    @NonNull
    public String topic() {
        return topic;
    }
}
