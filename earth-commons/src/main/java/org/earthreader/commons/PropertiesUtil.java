/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.earthreader.commons;

import java.util.Collection;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Conversions for loosely typed configuration values, as found in
 * {@code Map<String, ?>} based configuration. Arrays and collections are
 * reduced to their first element.
 */
public final class PropertiesUtil {

    private PropertiesUtil() {}

    /**
     * Returns the boolean value of the parameter, or {@code defaultValue} if it
     * is {@code null}. Non-boolean values are converted with
     * {@link Boolean#parseBoolean(String)} on their string value.
     */
    public static boolean toBoolean(@Nullable Object propValue, boolean defaultValue) {
        propValue = toObject(propValue);
        if (propValue instanceof Boolean) {
            return (Boolean) propValue;
        } else if (propValue != null) {
            return Boolean.parseBoolean(String.valueOf(propValue));
        }
        return defaultValue;
    }

    /**
     * Returns the parameter as a string, or {@code defaultValue} if it is
     * {@code null}.
     */
    public static String toString(@Nullable Object propValue, @Nullable String defaultValue) {
        propValue = toObject(propValue);
        return (propValue != null) ? propValue.toString() : defaultValue;
    }

    /**
     * Returns the parameter as an integer, or {@code defaultValue} if it is
     * {@code null} or its string value is not an integer.
     */
    public static int toInteger(@Nullable Object propValue, int defaultValue) {
        propValue = toObject(propValue);
        if (propValue instanceof Integer) {
            return (Integer) propValue;
        } else if (propValue instanceof Number) {
            return ((Number) propValue).intValue();
        } else if (propValue != null) {
            try {
                return Integer.parseInt(String.valueOf(propValue).trim());
            } catch (NumberFormatException nfe) {
                // fall through to default value
            }
        }
        return defaultValue;
    }

    /**
     * Looks up {@code name} in {@code config} and converts it with
     * {@link #toString(Object, String)}; fails if there is no usable value.
     */
    @NotNull
    public static String requireString(@NotNull Map<String, ?> config, @NotNull String name) {
        String value = toString(config.get(name), null);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing required configuration property: " + name);
        }
        return value;
    }

    /**
     * Returns the parameter as a single value: the first element of a
     * non-empty array or collection, {@code null} for an empty one, and the
     * parameter itself otherwise.
     */
    @Nullable
    public static Object toObject(@Nullable Object propValue) {
        if (propValue == null) {
            return null;
        } else if (propValue.getClass().isArray() && !propValue.getClass().getComponentType().isPrimitive()) {
            Object[] prop = (Object[]) propValue;
            return prop.length > 0 ? prop[0] : null;
        } else if (propValue instanceof Collection<?>) {
            Collection<?> prop = (Collection<?>) propValue;
            return prop.isEmpty() ? null : prop.iterator().next();
        }
        return propValue;
    }
}
