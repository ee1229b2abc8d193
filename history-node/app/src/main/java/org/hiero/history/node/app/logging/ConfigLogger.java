// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.app.logging;

import static java.lang.System.Logger.Level.INFO;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hiero.history.node.base.Loggable;

/**
 * Use this class to log configuration data.
 */
public final class ConfigLogger {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ConfigLogger.class.getName());
    /** banner separator line */
    private static final String BANNER_LINE = "=".repeat(120);
    /** replaces the value of a property not marked {@link Loggable} */
    static final String MASK = "*****";

    private ConfigLogger() {}

    /**
     * Log the configuration data.
     *
     * @param configuration the configuration to log
     * @param configTypes the config data types registered with the configuration
     */
    public static void log(
            @NonNull final Configuration configuration, @NonNull final List<Class<? extends Record>> configTypes) {
        if (LOGGER.isLoggable(INFO)) {
            LOGGER.log(INFO, BANNER_LINE);
            LOGGER.log(INFO, "Configuration data types:");
            for (final Class<? extends Record> type : configTypes) {
                LOGGER.log(INFO, "    " + type.getName());
            }
            LOGGER.log(INFO, BANNER_LINE);
            LOGGER.log(INFO, "Combined Configuration:");
            for (final Map.Entry<String, String> config : collectConfig(configuration, configTypes).entrySet()) {
                LOGGER.log(INFO, "    " + config.getKey() + " = " + config.getValue());
            }
            LOGGER.log(INFO, BANNER_LINE);
        }
    }

    /**
     * Collect every property of the given config data types. Values of properties not annotated {@link Loggable} are
     * masked, unless blank, so an admin can still see that a sensitive value was not injected.
     *
     * @param configuration the configuration to read values from
     * @param configTypes the config data types to collect
     * @return sorted map of properties and values, with sensitive values masked
     */
    @NonNull
    static Map<String, String> collectConfig(
            @NonNull final Configuration configuration, @NonNull final List<Class<? extends Record>> configTypes) {
        final Map<String, String> config = new TreeMap<>();
        for (final Class<? extends Record> configType : configTypes) {
            final ConfigData configDataAnnotation = configType.getDeclaredAnnotation(ConfigData.class);
            if (configDataAnnotation == null) {
                continue;
            }
            final Record configRecord = configuration.getConfigData(configType);
            for (final RecordComponent component : configType.getRecordComponents()) {
                if (!component.isAnnotationPresent(ConfigProperty.class)) {
                    continue;
                }
                final String propertyName = configDataAnnotation.value() + "." + component.getName();
                try {
                    final String value = String.valueOf(component.getAccessor().invoke(configRecord));
                    if (component.getAnnotation(Loggable.class) == null) {
                        config.put(propertyName, value.isEmpty() ? "" : MASK);
                    } else {
                        config.put(propertyName, value);
                    }
                } catch (IllegalAccessException | InvocationTargetException e) {
                    throw new IllegalStateException("Could not read config property " + propertyName, e);
                }
            }
        }
        return config;
    }
}
