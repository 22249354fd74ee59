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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collections;

import org.earthreader.commons.io.CloseableIterator;
import org.jetbrains.annotations.NotNull;

/**
 * Convenience methods for small entries that fit in memory.
 */
public final class Repositories {

    private Repositories() {
    }

    /**
     * Read the entry at the given key into a byte array.
     */
    @NotNull
    public static byte[] readFully(@NotNull Repository repository, @NotNull Iterable<String> key)
            throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CloseableIterator<byte[]> chunks = repository.read(key)) {
            while (chunks.hasNext()) {
                out.writeBytes(chunks.next());
            }
        }
        return out.toByteArray();
    }

    /**
     * Write the given content as a single chunk.
     */
    public static void write(@NotNull Repository repository, @NotNull Iterable<String> key, @NotNull byte[] data)
            throws IOException {
        repository.write(key, Collections.singletonList(data));
    }
}
