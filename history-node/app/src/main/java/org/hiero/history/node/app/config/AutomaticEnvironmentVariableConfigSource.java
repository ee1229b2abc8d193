// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.app.config;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.source.ConfigSource;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Config source that maps environment variables onto the properties of the given config data types. The variable
 * name is derived from the property name, so "range.blockBatchLimit" is read from "RANGE_BLOCK_BATCH_LIMIT".
 */
public final class AutomaticEnvironmentVariableConfigSource implements ConfigSource {
    /** Ordinal for system environment, wins over property files */
    private static final int SYSTEM_ENVIRONMENT_ORDINAL = 300;
    /** map from property name to environment variable name */
    private final Map<String, String> propertyNameToEnvMap;
    /** properties that have a variable set in the environment */
    private final Set<String> propertiesSetInEnvironment;
    /** looks up an environment variable, replaced in tests */
    private final Function<String, String> envVarGetter;

    /**
     * @param configTypes the configuration types to collect property names from
     * @param envVarGetter looks up the value of an environment variable, null if unset
     */
    public AutomaticEnvironmentVariableConfigSource(
            @NonNull final List<Class<? extends Record>> configTypes,
            @NonNull final Function<String, String> envVarGetter) {
        this.envVarGetter = Objects.requireNonNull(envVarGetter);
        propertyNameToEnvMap = collectEnvToPropertyNameMappings(configTypes).entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getValue, Map.Entry::getKey));
        propertiesSetInEnvironment = propertyNameToEnvMap.entrySet().stream()
                .filter(entry -> envVarGetter.apply(entry.getValue()) != null)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Set<String> getPropertyNames() {
        return propertiesSetInEnvironment;
    }

    /**
     * {@inheritDoc}
     */
    @Nullable
    @Override
    public String getValue(@NonNull final String propertyName) throws NoSuchElementException {
        final String envName = propertyNameToEnvMap.get(propertyName);
        if (envName == null) {
            throw new NoSuchElementException("Property " + propertyName + " is not defined");
        }
        return envVarGetter.apply(envName);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean isListProperty(@NonNull final String propertyName) throws NoSuchElementException {
        return false;
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public List<String> getListValue(@NonNull final String propertyName) throws NoSuchElementException {
        return Collections.emptyList();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int getOrdinal() {
        return SYSTEM_ENVIRONMENT_ORDINAL;
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Collect the properties of every config data type and map each to its environment variable name.
     *
     * @param configTypes the configuration types to collect property names from
     * @return sorted map from environment variable name to property name
     */
    @NonNull
    static Map<String, String> collectEnvToPropertyNameMappings(
            @NonNull final List<Class<? extends Record>> configTypes) {
        final Map<String, String> envMappings = new TreeMap<>();
        for (final Class<? extends Record> configType : configTypes) {
            final ConfigData configDataAnnotation = configType.getDeclaredAnnotation(ConfigData.class);
            if (configDataAnnotation == null) {
                continue;
            }
            for (final RecordComponent component : configType.getRecordComponents()) {
                if (component.isAnnotationPresent(ConfigProperty.class)) {
                    final String fieldName = component.getName();
                    envMappings.put(
                            getEnvName(configDataAnnotation.value(), fieldName),
                            configDataAnnotation.value() + "." + fieldName);
                }
            }
        }
        return envMappings;
    }

    /**
     * Convert a property name into an environment variable name: '.' becomes '_', each upper case letter is prefixed
     * with '_', and the result is upper cased.
     *
     * @param configDataName the name of the configuration data type
     * @param propertyName the name of the property
     * @return the environment variable name
     */
    static String getEnvName(@NonNull final String configDataName, @NonNull final String propertyName) {
        return configDataName.replaceAll("([A-Z])", "_$1").replace('.', '_').toUpperCase() + "_"
                + propertyName.replaceAll("([A-Z])", "_$1").toUpperCase();
    }
}
