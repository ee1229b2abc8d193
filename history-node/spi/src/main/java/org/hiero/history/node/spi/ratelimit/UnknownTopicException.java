// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a rate limiter has no quota registered for a protocol topic.
 */
public class UnknownTopicException extends RateLimiterException {
    public UnknownTopicException(@NonNull final String topic) {
        super("no rate limit collector registered for topic " + topic);
    }
}
