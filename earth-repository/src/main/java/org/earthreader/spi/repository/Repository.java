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

import java.io.IOException;
import java.util.Set;

import org.earthreader.commons.io.CloseableIterator;
import org.jetbrains.annotations.NotNull;

/**
 * A key-addressed store of opaque byte content.
 * <p>
 * Keys are ordered lists of string segments (see {@link RepositoryKeys}).
 * A key either holds an entry, is a directory-like node that other keys live
 * under, or holds nothing. Implementations validate the key before doing
 * anything else: a key that is not a {@link java.util.List} of non-empty
 * strings fails with {@link InvalidKeyTypeException}.
 */
public interface Repository {

    /**
     * Read the entry stored at the given key, chunk by chunk. The content is
     * not loaded into memory as a whole.
     * <p>
     * Callers that stop before the last chunk must close the returned
     * iterator.
     *
     * @param key the key of the entry
     * @return the content as a lazy sequence of chunks
     * @throws EmptyKeyException if the key is empty
     * @throws KeyNotFoundException if there is no entry at the key, or the key
     *             is a directory-like node
     */
    @NotNull
    CloseableIterator<byte[]> read(@NotNull Iterable<String> key) throws IOException;

    /**
     * Create or replace the entry at the given key. The chunks are consumed
     * in order; missing directory-like nodes above the key are created.
     *
     * @param key the key of the entry
     * @param chunks the new content
     * @throws EmptyKeyException if the key is empty
     * @throws KeyConflictException if a prefix of the key is a plain entry, or
     *             the key itself is a directory-like node
     */
    void write(@NotNull Iterable<String> key, @NotNull Iterable<byte[]> chunks) throws IOException;

    /**
     * Whether an entry or a directory-like node exists at the given key.
     * Always {@code false} for the empty key.
     *
     * @param key the key to check
     */
    boolean exists(@NotNull Iterable<String> key) throws IOException;

    /**
     * The names of the immediate children of the directory-like node at the
     * given key. The empty key lists the top level, which is empty for an
     * empty repository.
     *
     * @param key the key of the node
     * @return the child segment names, in no particular order
     * @throws NotADirectoryKeyException if the key is a plain entry
     * @throws KeyNotFoundException if nothing exists at the key
     */
    @NotNull
    Set<String> list(@NotNull Iterable<String> key) throws IOException;

    /**
     * A locator string for this repository, of the form
     * {@code <scheme>://<location>}.
     *
     * @param scheme the scheme to use
     * @throws UnsupportedOperationException if this repository cannot be
     *             expressed as a locator
     */
    @NotNull
    default String toUrl(@NotNull String scheme) {
        throw new UnsupportedOperationException(getClass().getName() + " cannot be expressed as a URL");
    }
}
