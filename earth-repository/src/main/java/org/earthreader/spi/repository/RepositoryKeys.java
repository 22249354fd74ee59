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
package org.earthreader.spi.repository;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Validation and helpers for repository keys.
 * <p>
 * A key is an ordered list of non-empty string segments, comparable to the
 * components of a path. Every {@link Repository} implementation runs
 * {@link #checkKey(Iterable)} or {@link #checkEntryKey(Iterable, String)} before
 * anything else.
 */
public final class RepositoryKeys {

    private static final Joiner SLASH = Joiner.on('/');

    private RepositoryKeys() {
    }

    /**
     * Validates a key that may be empty, as accepted by
     * {@link Repository#exists} and {@link Repository#list}.
     *
     * @param key the key to check
     * @return an immutable copy of the key
     * @throws InvalidKeyTypeException if the key is not a {@link List} of
     *             non-empty strings
     */
    @NotNull
    public static ImmutableList<String> checkKey(@Nullable Iterable<String> key) {
        if (key == null) {
            throw new InvalidKeyTypeException("Key must not be null");
        }
        if (!(key instanceof List)) {
            throw new InvalidKeyTypeException(
                    "Key must be an ordered sequence (a List), not " + key.getClass().getName());
        }
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (Object segment : (List<?>) key) {
            if (!(segment instanceof String)) {
                throw new InvalidKeyTypeException("Key segments must be strings, got " + segment);
            }
            if (((String) segment).isEmpty()) {
                throw new InvalidKeyTypeException("Key segments must not be empty: " + key);
            }
            builder.add((String) segment);
        }
        return builder.build();
    }

    /**
     * Validates a key that must address a concrete entry.
     *
     * @param key the key to check
     * @param operation name of the calling operation, for the error message
     * @return an immutable, non-empty copy of the key
     * @throws InvalidKeyTypeException if the key is not a {@link List} of
     *             non-empty strings
     * @throws EmptyKeyException if the key has no segments
     */
    @NotNull
    public static ImmutableList<String> checkEntryKey(@Nullable Iterable<String> key, @NotNull String operation)
            throws EmptyKeyException {
        ImmutableList<String> checked = checkKey(key);
        if (checked.isEmpty()) {
            throw new EmptyKeyException(operation);
        }
        return checked;
    }

    /**
     * Whether {@code prefix} is a proper prefix of {@code key}.
     */
    public static boolean isStrictPrefix(@NotNull List<String> prefix, @NotNull List<String> key) {
        return prefix.size() < key.size() && key.subList(0, prefix.size()).equals(prefix);
    }

    /**
     * Formats a key for messages, e.g. {@code [dir/key]}.
     */
    @NotNull
    public static String toString(@NotNull List<String> key) {
        return "[" + SLASH.join(key) + "]";
    }
}
