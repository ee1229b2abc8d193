// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.range;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.swirlds.config.api.Configuration;
import com.swirlds.config.api.ConfigurationBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RangeAccessConfig}.
 */
class RangeAccessConfigTest {

    @Test
    @DisplayName("Test default configuration values")
    void testDefaultConfiguration() {
        final Configuration config = ConfigurationBuilder.create()
                .withConfigDataType(RangeAccessConfig.class)
                .build();

        final RangeAccessConfig rangeConfig = config.getConfigData(RangeAccessConfig.class);

        assertNotNull(rangeConfig);
        assertEquals(128, rangeConfig.maxRequestBlobsSidecars());
        assertEquals(64, rangeConfig.blockBatchLimit());
        assertEquals(2, rangeConfig.blockBatchLimitBurstFactor());
        assertEquals(10_000, rangeConfig.responseTimeout());
        assertEquals(5_000, rangeConfig.readTimeout());
        assertEquals(10_000, rangeConfig.writeTimeout());
    }
}
