/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tabletrebalancer.config;

import org.tabletrebalancer.annotation.PublicEvolving;
import org.tabletrebalancer.exception.IllegalConfigurationException;
import org.tabletrebalancer.utils.TimeUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values are either kept as the
 * typed value they were set with, or as strings (e.g. when loaded from a properties map) which are
 * converted on access according to the type of the requested {@link ConfigOption}.
 */
@PublicEvolving
public class Configuration {

    private static final String LIST_SEPARATOR = ",";

    /** Stores the concrete key/value pairs of this configuration object. */
    private final HashMap<String, Object> confData;

    /** Creates a new empty configuration. */
    public Configuration() {
        this.confData = new HashMap<>();
    }

    /** Creates a new configuration with the copy of the given configuration. */
    public Configuration(Configuration other) {
        this.confData = new HashMap<>(other.confData);
    }

    /** Creates a new configuration that is initialized with the options of the given map. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        map.forEach(configuration::setString);
        return configuration;
    }

    public void setString(String key, String value) {
        confData.put(checkNotNull(key), checkNotNull(value));
    }

    /**
     * Stores the given value for the given option.
     *
     * @param option the option to set
     * @param value the value to store
     * @return this configuration, for chaining
     */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        confData.put(option.key(), checkNotNull(value));
        return this;
    }

    /**
     * Returns the value of the given option, or its default value if the option is not set.
     *
     * @throws IllegalConfigurationException if the stored value cannot be converted to the type of
     *     the option
     */
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value of the given option if it was explicitly set. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        Object rawValue = confData.get(option.key());
        if (rawValue == null) {
            return Optional.empty();
        }
        try {
            @SuppressWarnings("unchecked")
            T value =
                    option.isList()
                            ? (T) convertToList(rawValue, option.getClazz())
                            : (T) convertValue(rawValue, option.getClazz());
            return Optional.of(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalConfigurationException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue, option.key()),
                    e);
        }
    }

    public boolean contains(ConfigOption<?> option) {
        return confData.containsKey(option.key());
    }

    /** Converts the configuration into a map of string keys and string values. */
    public Map<String, String> toMap() {
        Map<String, String> result = new HashMap<>(confData.size());
        confData.forEach((key, value) -> result.put(key, convertToString(value)));
        return result;
    }

    // --------------------------------------------------------------------------------------------
    //  Type conversion
    // --------------------------------------------------------------------------------------------

    private static Object convertValue(Object rawValue, Class<?> clazz) {
        if (clazz.isInstance(rawValue)) {
            return rawValue;
        }
        String text = rawValue.toString().trim();
        if (clazz == Integer.class) {
            return Integer.parseInt(text);
        } else if (clazz == Long.class) {
            return Long.parseLong(text);
        } else if (clazz == Boolean.class) {
            if (text.equalsIgnoreCase("true")) {
                return true;
            } else if (text.equalsIgnoreCase("false")) {
                return false;
            }
            throw new IllegalArgumentException(
                    String.format("Unrecognized option for boolean: %s.", text));
        } else if (clazz == String.class) {
            return text;
        } else if (clazz == Duration.class) {
            return TimeUtils.parseDuration(text);
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }

    private static List<?> convertToList(Object rawValue, Class<?> clazz) {
        if (rawValue instanceof List) {
            List<?> values = (List<?>) rawValue;
            List<Object> converted = new ArrayList<>(values.size());
            for (Object value : values) {
                converted.add(convertValue(value, clazz));
            }
            return Collections.unmodifiableList(converted);
        }
        String text = rawValue.toString().trim();
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(
                Arrays.stream(text.split(LIST_SEPARATOR))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(s -> convertValue(s, clazz))
                        .collect(Collectors.toList()));
    }

    private static String convertToString(Object value) {
        if (value instanceof Duration) {
            return TimeUtils.formatWithHighestUnit((Duration) value);
        } else if (value instanceof List) {
            return ((List<?>) value)
                    .stream()
                    .map(Configuration::convertToString)
                    .collect(Collectors.joining(LIST_SEPARATOR));
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return "Configuration" + toMap();
    }
}
