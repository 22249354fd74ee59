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

import com.google.common.collect.ImmutableList;

/**
 * Thrown by {@link Repository#write} when the key cannot hold an entry: one
 * of its prefixes is already a plain entry, or the key itself is a
 * directory-like node.
 */
public class KeyConflictException extends RepositoryKeyException {

    private static final long serialVersionUID = 1L;

    private final ImmutableList<String> conflictingKey;

    public KeyConflictException(@NotNull List<String> key, @NotNull List<String> conflictingKey) {
        super(key, "Cannot write " + RepositoryKeys.toString(key) + ": "
                + RepositoryKeys.toString(conflictingKey)
                + (conflictingKey.equals(key) ? " is a directory" : " is not a directory"));
        this.conflictingKey = ImmutableList.copyOf(conflictingKey);
    }

    /**
     * @return the key (the written key or one of its prefixes) whose existing
     *         node is in the way
     */
    @NotNull
    public List<String> getConflictingKey() {
        return conflictingKey;
    }
}
