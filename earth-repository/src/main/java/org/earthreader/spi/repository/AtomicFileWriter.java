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

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a file so that readers see either the old or the new content,
 * never a mix of both.
 * <p>
 * The content is streamed into a temporary file next to the target, which is
 * then renamed over the target in a single step. When anything fails before
 * that rename, including the chunk source throwing, the temporary file is
 * removed and the target keeps its previous content.
 * <p>
 * A writer remembers the temporary files of the writes it has in progress, see
 * {@link #isInFlight(Path)}. Temporary names are not reserved: a file that
 * merely looks like one is an ordinary file.
 */
public class AtomicFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileWriter.class);

    private static final String TEMP_PREFIX = ".~";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final int MAX_NAME_ATTEMPTS = 10;

    private final Set<Path> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Write the chunks to the target. The target's directory must exist.
     *
     * @param target the file to create or replace
     * @param chunks the new content
     */
    public void write(@NotNull Path target, @NotNull Iterable<byte[]> chunks) throws IOException {
        Path temp = null;
        OutputStream out = null;
        for (int attempt = 1; out == null; attempt++) {
            temp = temporaryFileFor(target);
            inFlight.add(temp);
            try {
                out = Files.newOutputStream(temp, CREATE_NEW, WRITE);
            } catch (FileAlreadyExistsException e) {
                inFlight.remove(temp);
                if (attempt == MAX_NAME_ATTEMPTS) {
                    throw e;
                }
            } catch (IOException e) {
                inFlight.remove(temp);
                throw e;
            }
        }
        boolean published = false;
        try {
            try (OutputStream stream = out) {
                for (byte[] chunk : chunks) {
                    stream.write(chunk);
                }
            }
            publish(temp, target);
            published = true;
            LOG.debug("Published {} to {}", temp.getFileName(), target);
        } finally {
            if (!published) {
                discard(temp);
            }
            inFlight.remove(temp);
        }
    }

    /**
     * Move the completely written temporary file onto the target in one
     * atomic step.
     */
    protected void publish(@NotNull Path temp, @NotNull Path target) throws IOException {
        Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
    }

    /**
     * Whether the path is the temporary file of a write of this writer that
     * has not yet been published or discarded.
     */
    public boolean isInFlight(@NotNull Path path) {
        return inFlight.contains(path);
    }

    private static Path temporaryFileFor(Path target) {
        String random = Long.toHexString(ThreadLocalRandom.current().nextLong());
        return target.resolveSibling(TEMP_PREFIX + target.getFileName() + "." + random + TEMP_SUFFIX);
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
