// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.range;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;
import org.hiero.history.node.base.Loggable;

/**
 * Configuration for serving historical range requests.
 *
 * @param maxRequestBlobsSidecars the most non-empty slots served for a single request
 * @param blockBatchLimit the units a peer must have left before a request is accepted, also the per second refill of
 *                        its budget
 * @param blockBatchLimitBurstFactor multiple of {@code blockBatchLimit} a peer may burst to, serving pauses while the
 *                                   peer has less than this left
 * @param responseTimeout time in milliseconds a whole response may take
 * @param readTimeout read deadline in milliseconds set on the stream when serving starts
 * @param writeTimeout write deadline in milliseconds for each chunk written
 */
@ConfigData("range")
public record RangeAccessConfig(
        @Loggable @ConfigProperty(defaultValue = "128") @Min(1) int maxRequestBlobsSidecars,
        @Loggable @ConfigProperty(defaultValue = "64") @Min(1) int blockBatchLimit,
        @Loggable @ConfigProperty(defaultValue = "2") @Min(1) @Max(100) int blockBatchLimitBurstFactor,
        @Loggable @ConfigProperty(defaultValue = "10000") @Min(1) int responseTimeout,
        @Loggable @ConfigProperty(defaultValue = "5000") @Min(1) int readTimeout,
        @Loggable @ConfigProperty(defaultValue = "10000") @Min(1) int writeTimeout) {}
