// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base.ratelimit;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Min;
import org.hiero.history.node.base.Loggable;

/**
 * Configuration for the peer rate limiter.
 *
 * @param pruneInterval interval in milliseconds between sweeps that drop the buckets of peers that have fully drained
 */
@ConfigData("rateLimiter")
public record RateLimiterConfig(@Loggable @ConfigProperty(defaultValue = "60000") @Min(1000) int pruneInterval) {}
