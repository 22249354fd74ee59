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
package org.earthreader.commons.io;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;

import org.earthreader.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.AbstractIterator;
import com.google.common.io.ByteStreams;

/**
 * Reads a file as a sequence of fixed-size byte chunks. Every chunk but the
 * last one is exactly {@code chunkSize} bytes long.
 * <p>
 * The iterator owns its stream. The stream is released exactly once: when a
 * read returns no more bytes, when reading fails, or when {@link #close()} is
 * called by a caller that stops early. A file given by name is opened lazily
 * on the first call to {@link #hasNext()}, so an iterator that is never
 * consumed holds no handle.
 * <p>
 * Instances are not restartable; create a new one to read the file again.
 */
public class FileByteIterator extends AbstractIterator<byte[]> implements CloseableIterator<byte[]> {

    private static final Logger LOG = LoggerFactory.getLogger(FileByteIterator.class);

    /**
     * Chunk size used when none is given, {@code earth.repository.chunkSize}
     * (default 4096).
     */
    public static final int DEFAULT_CHUNK_SIZE = SystemPropertySupplier
            .create("earth.repository.chunkSize", 4096)
            .loggingTo(LOG)
            .validateWith(size -> size > 0)
            .get();

    private final File file;
    private final int chunkSize;

    private InputStream in;
    private boolean closed;

    public FileByteIterator(@NotNull File file) {
        this(file, DEFAULT_CHUNK_SIZE);
    }

    public FileByteIterator(@NotNull File file, int chunkSize) {
        checkArgument(chunkSize > 0, "chunk size must be positive: %s", chunkSize);
        this.file = checkNotNull(file);
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Whether the underlying stream has been released.
     */
    public boolean isClosed() {
        return closed;
    }

    @Override
    protected byte[] computeNext() {
        if (closed) {
            return endOfData();
        }
        try {
            if (in == null) {
                in = openStream();
            }
            byte[] chunk = new byte[chunkSize];
            int length = ByteStreams.read(in, chunk, 0, chunkSize);
            if (length == 0) {
                try {
                    close();
                } catch (IOException e) {
                    LOG.warn("Error closing {}", file.getPath(), e);
                }
                return endOfData();
            }
            return length == chunkSize ? chunk : Arrays.copyOf(chunk, length);
        } catch (IOException e) {
            try {
                close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new UncheckedIOException("Failed to read " + file.getPath(), e);
        }
    }

    /**
     * Opens the file. Called once, on first access.
     */
    @NotNull
    protected InputStream openStream() throws IOException {
        return new FileInputStream(file);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (in != null) {
            in.close();
        }
    }

    @Override
    public String toString() {
        return "FileByteIterator[" + file.getPath() + ", chunkSize=" + chunkSize + "]";
    }
}
