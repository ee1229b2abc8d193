// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.spi.ratelimit;

/**
 * Base of the failures raised by a {@link RateLimiter}.
 */
public class RateLimiterException extends Exception {
    public RateLimiterException(final String message) {
        super(message);
    }
}
