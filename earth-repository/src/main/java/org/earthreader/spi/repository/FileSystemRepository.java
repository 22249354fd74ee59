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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.earthreader.spi.repository.RepositoryKeys.checkEntryKey;
import static org.earthreader.spi.repository.RepositoryKeys.checkKey;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.earthreader.commons.PropertiesUtil;
import org.earthreader.commons.io.CloseableIterator;
import org.earthreader.commons.io.FileByteIterator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * A repository that stores each entry as a file below a root directory. The
 * segments of a key are resolved one after another against the root with
 * {@link Path#resolve(String)}, so directory-like nodes are plain directories.
 * Segments are not sanitized: one containing a separator, such as
 * {@code "a/b"}, addresses the same file as the two segments {@code "a"} and
 * {@code "b"}, and conflicts are reported against the directories it passes
 * through.
 * <p>
 * In atomic mode every write goes through an {@link AtomicFileWriter}, so a
 * concurrent reader of the same key sees either the previous or the new
 * content in full. Without it, a reader may observe a partially written file.
 */
public class FileSystemRepository implements Repository {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemRepository.class);

    /** Configuration key of the root directory (required). */
    public static final String PROP_PATH = "path";

    /** Configuration key: create a missing root directory (default {@code true}). */
    public static final String PROP_MKDIR = "mkdir";

    /** Configuration key: use atomic writes (default {@code false}). */
    public static final String PROP_ATOMIC = "atomic";

    /** Configuration key of the read chunk size. */
    public static final String PROP_CHUNK_SIZE = "chunkSize";

    private final String path;
    private final Path root;
    private final boolean atomic;
    private final int chunkSize;
    private final AtomicFileWriter atomicWriter;

    public FileSystemRepository(@NotNull String path) throws IOException {
        this(path, true, false);
    }

    /**
     * @param path the root directory
     * @param mkdir whether to create the root directory if it is missing
     * @param atomic whether writes replace entries atomically
     * @throws NoSuchFileException if the root is missing and {@code mkdir}
     *             is {@code false}
     * @throws NotDirectoryException if the root is not a directory
     */
    public FileSystemRepository(@NotNull String path, boolean mkdir, boolean atomic) throws IOException {
        this(path, mkdir, atomic, FileByteIterator.DEFAULT_CHUNK_SIZE);
    }

    public FileSystemRepository(@NotNull String path, boolean mkdir, boolean atomic, int chunkSize)
            throws IOException {
        this(path, mkdir, atomic, chunkSize, new AtomicFileWriter());
    }

    FileSystemRepository(@NotNull String path, boolean mkdir, boolean atomic, int chunkSize,
            @NotNull AtomicFileWriter atomicWriter) throws IOException {
        checkArgument(!checkNotNull(path).isEmpty(), "Repository path must not be empty");
        checkArgument(chunkSize > 0, "chunk size must be positive: %s", chunkSize);
        this.path = path;
        this.root = Paths.get(path);
        this.atomic = atomic;
        this.chunkSize = chunkSize;
        this.atomicWriter = checkNotNull(atomicWriter);

        if (!Files.exists(root)) {
            if (!mkdir) {
                throw new NoSuchFileException(path, null, "Repository root does not exist");
            }
            FileUtils.forceMkdir(root.toFile());
            LOG.info("Created repository root {}", root);
        } else if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(path);
        }
    }

    /**
     * Create a repository from map based configuration, using the
     * {@code PROP_*} keys of this class.
     */
    public static FileSystemRepository fromConfig(@NotNull Map<String, ?> config) throws IOException {
        String path = PropertiesUtil.requireString(config, PROP_PATH);
        boolean mkdir = PropertiesUtil.toBoolean(config.get(PROP_MKDIR), true);
        boolean atomic = PropertiesUtil.toBoolean(config.get(PROP_ATOMIC), false);
        int chunkSize = PropertiesUtil.toInteger(config.get(PROP_CHUNK_SIZE), FileByteIterator.DEFAULT_CHUNK_SIZE);
        return new FileSystemRepository(path, mkdir, atomic, chunkSize);
    }

    /**
     * Create a repository rooted at the path of the given URL, for example
     * {@code file:///var/lib/earthreader}.
     */
    public static FileSystemRepository fromUrl(@NotNull URI url) throws IOException {
        String urlPath = url.getPath();
        checkArgument(urlPath != null && !urlPath.isEmpty(), "URL has no path: %s", url);
        return new FileSystemRepository(urlPath);
    }

    @NotNull
    @Override
    public String toUrl(@NotNull String scheme) {
        return checkNotNull(scheme) + "://" + path;
    }

    /**
     * @return the root directory, as it was given
     */
    @NotNull
    public String getPath() {
        return path;
    }

    public boolean isAtomic() {
        return atomic;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    @NotNull
    @Override
    public CloseableIterator<byte[]> read(@NotNull Iterable<String> key) throws IOException {
        List<String> checked = checkEntryKey(key, "read");
        Path file = resolve(checked);
        if (!Files.exists(file)) {
            throw new KeyNotFoundException(checked, "No entry at " + RepositoryKeys.toString(checked));
        }
        if (Files.isDirectory(file)) {
            throw new KeyNotFoundException(checked, RepositoryKeys.toString(checked) + " is a directory");
        }
        return new FileByteIterator(file.toFile(), chunkSize);
    }

    @Override
    public void write(@NotNull Iterable<String> key, @NotNull Iterable<byte[]> chunks) throws IOException {
        List<String> checked = checkEntryKey(key, "write");
        checkNotNull(chunks);
        Path file = resolve(checked);
        Path parent = file.getParent();
        for (Path ancestor : ancestorsBelowRoot(parent)) {
            if (Files.exists(ancestor) && !Files.isDirectory(ancestor)) {
                throw new KeyConflictException(checked, keyOf(ancestor));
            }
        }
        if (Files.isDirectory(file)) {
            throw new KeyConflictException(checked, checked);
        }
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (atomic) {
            atomicWriter.write(file, chunks);
        } else {
            try (OutputStream out = Files.newOutputStream(file)) {
                for (byte[] chunk : chunks) {
                    out.write(chunk);
                }
            }
        }
    }

    @Override
    public boolean exists(@NotNull Iterable<String> key) {
        List<String> checked = checkKey(key);
        return !checked.isEmpty() && Files.exists(resolve(checked));
    }

    @NotNull
    @Override
    public Set<String> list(@NotNull Iterable<String> key) throws IOException {
        List<String> checked = checkKey(key);
        Path dir = resolve(checked);
        if (!Files.isDirectory(dir)) {
            if (Files.exists(dir)) {
                throw new NotADirectoryKeyException(checked);
            }
            throw new KeyNotFoundException(checked, "No directory at " + RepositoryKeys.toString(checked));
        }
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (!atomicWriter.isInFlight(entry)) {
                    names.add(entry.getFileName().toString());
                }
            }
        }
        return names.build();
    }

    private Path resolve(List<String> key) {
        Path resolved = root;
        for (String segment : key) {
            resolved = resolved.resolve(segment);
        }
        return resolved;
    }

    /**
     * The directories between the root (exclusive) and the given directory
     * (inclusive), outermost first. Empty if the directory is not below the
     * root.
     */
    private List<Path> ancestorsBelowRoot(Path dir) {
        List<Path> ancestors = new ArrayList<Path>();
        for (Path p = dir; p != null && p.startsWith(root) && !p.equals(root); p = p.getParent()) {
            ancestors.add(p);
        }
        return Lists.reverse(ancestors);
    }

    private List<String> keyOf(Path path) {
        ImmutableList.Builder<String> key = ImmutableList.builder();
        for (Path name : root.relativize(path)) {
            key.add(name.toString());
        }
        return key.build();
    }

    @Override
    public String toString() {
        return "FileSystemRepository[" + path + (atomic ? ", atomic" : "") + "]";
    }
}
