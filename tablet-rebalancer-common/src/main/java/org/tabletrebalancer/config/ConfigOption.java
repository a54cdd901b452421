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

import javax.annotation.Nullable;

import java.util.Objects;

import static org.tabletrebalancer.utils.Preconditions.checkNotNull;

/**
 * A {@code ConfigOption} describes a configuration parameter. It encapsulates the configuration
 * key, the value type, and an optional default value.
 *
 * <p>{@code ConfigOptions} are built via the {@link ConfigOptions} class. Once created, a config
 * option is immutable.
 *
 * @param <T> The type of value associated with the configuration option.
 */
@PublicEvolving
public class ConfigOption<T> {

    static final String EMPTY_DESCRIPTION = "";

    private final String key;
    private final @Nullable T defaultValue;
    private final String description;

    /** Type of the value. For a list option this is the type of the elements. */
    private final Class<?> clazz;

    private final boolean isList;

    ConfigOption(
            String key,
            Class<?> clazz,
            String description,
            @Nullable T defaultValue,
            boolean isList) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
        this.isList = isList;
    }

    /**
     * Creates a new config option, using this option's key and default value, and adding the given
     * description. The given description is used when generation the configuration documentation.
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue, isList);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public @Nullable T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    Class<?> getClazz() {
        return clazz;
    }

    boolean isList() {
        return isList;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConfigOption<?> that = (ConfigOption<?>) o;
        return key.equals(that.key)
                && Objects.equals(defaultValue, that.defaultValue)
                && clazz.equals(that.clazz)
                && isList == that.isList;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, defaultValue, clazz, isList);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
