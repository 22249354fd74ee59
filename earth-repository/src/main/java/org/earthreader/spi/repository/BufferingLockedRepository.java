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

import static com.google.common.base.Preconditions.checkNotNull;
import static org.earthreader.spi.repository.RepositoryKeys.checkEntryKey;
import static org.earthreader.spi.repository.RepositoryKeys.checkKey;
import static org.earthreader.spi.repository.RepositoryKeys.isStrictPrefix;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.earthreader.commons.io.CloseableIterator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

/**
 * Buffers writes in memory in front of another repository, keeping the last
 * content written to each key until {@link #flush()} writes it through.
 * <p>
 * Reads, existence checks and listings see buffered entries as if they had
 * already been written. All access to the buffer is serialized by the lock
 * given at construction; the lock is never held while the wrapped repository
 * performs I/O. Conflicting writes (writing below a plain entry, or onto a
 * directory-like node) are rejected at write time, against both the buffer and
 * the wrapped repository.
 * <p>
 * The buffer is unbounded: it holds one value per key written since the last
 * flush.
 */
public class BufferingLockedRepository implements Repository {

    private static final Logger LOG = LoggerFactory.getLogger(BufferingLockedRepository.class);

    private final Repository repository;

    private final Lock lock;

    /**
     * Serializes flushes so that entries reach the wrapped repository in the
     * order they were snapshotted.
     */
    private final Lock flushLock = new ReentrantLock();

    // guarded by lock
    private final Map<List<String>, byte[]> buffer = new LinkedHashMap<List<String>, byte[]>();

    // guarded by lock; incremented whenever a flush persists an entry
    private long persistCount;

    public BufferingLockedRepository(@NotNull Repository repository) {
        this(repository, new ReentrantLock());
    }

    /**
     * @param repository the repository that buffered entries are flushed to
     * @param lock the lock guarding the buffer; may be shared with other
     *            components that need to exclude buffer access
     */
    public BufferingLockedRepository(@NotNull Repository repository, @NotNull Lock lock) {
        this.repository = checkNotNull(repository);
        this.lock = checkNotNull(lock);
    }

    @NotNull
    @Override
    public CloseableIterator<byte[]> read(@NotNull Iterable<String> key) throws IOException {
        List<String> checked = checkEntryKey(key, "read");
        byte[] data;
        boolean directory;
        lock.lock();
        try {
            data = buffer.get(checked);
            directory = data == null && hasBufferedChildren(checked);
        } finally {
            lock.unlock();
        }
        if (data != null) {
            return CloseableIterator.singleton(data.clone());
        }
        if (directory) {
            throw new KeyNotFoundException(checked, RepositoryKeys.toString(checked) + " is a directory");
        }
        return repository.read(checked);
    }

    @Override
    public void write(@NotNull Iterable<String> key, @NotNull Iterable<byte[]> chunks) throws IOException {
        List<String> checked = checkEntryKey(key, "write");
        byte[] data = toByteArray(checkNotNull(chunks));
        while (true) {
            long seen;
            lock.lock();
            try {
                checkBufferedConflicts(checked);
                seen = persistCount;
            } finally {
                lock.unlock();
            }
            checkPersistedConflicts(checked);
            lock.lock();
            try {
                // retry if a flush moved entries from the buffer meanwhile
                if (persistCount == seen) {
                    checkBufferedConflicts(checked);
                    buffer.put(checked, data);
                    return;
                }
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public boolean exists(@NotNull Iterable<String> key) throws IOException {
        List<String> checked = checkKey(key);
        if (checked.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            if (buffer.containsKey(checked) || hasBufferedChildren(checked)) {
                return true;
            }
        } finally {
            lock.unlock();
        }
        return repository.exists(checked);
    }

    @NotNull
    @Override
    public Set<String> list(@NotNull Iterable<String> key) throws IOException {
        List<String> checked = checkKey(key);
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        boolean buffered = false;
        lock.lock();
        try {
            if (buffer.containsKey(checked)) {
                throw new NotADirectoryKeyException(checked);
            }
            for (List<String> bufferedKey : buffer.keySet()) {
                if (isStrictPrefix(checked, bufferedKey)) {
                    names.add(bufferedKey.get(checked.size()));
                    buffered = true;
                }
            }
        } finally {
            lock.unlock();
        }
        try {
            names.addAll(repository.list(checked));
        } catch (KeyNotFoundException e) {
            // a directory that so far exists only in the buffer
            if (e instanceof NotADirectoryKeyException || !buffered) {
                throw e;
            }
        }
        return names.build();
    }

    @NotNull
    @Override
    public String toUrl(@NotNull String scheme) {
        return repository.toUrl(scheme);
    }

    /**
     * Write all buffered entries through to the wrapped repository.
     * <p>
     * An entry stays visible in the buffer until it has been written, and is
     * only dropped from the buffer if it was not overwritten meanwhile. If a
     * write fails, the entries not yet written remain buffered and the error
     * is thrown.
     *
     * @return the number of entries written
     */
    public int flush() throws IOException {
        flushLock.lock();
        try {
            Map<List<String>, byte[]> pending;
            lock.lock();
            try {
                pending = new LinkedHashMap<List<String>, byte[]>(buffer);
            } finally {
                lock.unlock();
            }
            int count = 0;
            for (Map.Entry<List<String>, byte[]> e : pending.entrySet()) {
                repository.write(e.getKey(), Collections.singletonList(e.getValue()));
                lock.lock();
                try {
                    persistCount++;
                    buffer.remove(e.getKey(), e.getValue());
                } finally {
                    lock.unlock();
                }
                count++;
            }
            LOG.debug("Flushed {} buffered entries to {}", count, repository);
            return count;
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Whether there are buffered entries not yet flushed.
     */
    public boolean hasPendingWrites() {
        lock.lock();
        try {
            return !buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    // must hold lock
    private void checkBufferedConflicts(List<String> key) throws KeyConflictException {
        for (List<String> buffered : buffer.keySet()) {
            if (isStrictPrefix(buffered, key)) {
                throw new KeyConflictException(key, buffered);
            }
            if (isStrictPrefix(key, buffered)) {
                throw new KeyConflictException(key, key);
            }
        }
    }

    // must hold lock
    private boolean hasBufferedChildren(List<String> key) {
        for (List<String> buffered : buffer.keySet()) {
            if (isStrictPrefix(key, buffered)) {
                return true;
            }
        }
        return false;
    }

    private void checkPersistedConflicts(List<String> key) throws IOException {
        for (int i = 1; i < key.size(); i++) {
            List<String> prefix = key.subList(0, i);
            if (repository.exists(prefix) && !isPersistedDirectory(prefix)) {
                throw new KeyConflictException(key, prefix);
            }
        }
        if (repository.exists(key) && isPersistedDirectory(key)) {
            throw new KeyConflictException(key, key);
        }
    }

    private boolean isPersistedDirectory(List<String> key) throws IOException {
        try {
            repository.list(key);
            return true;
        } catch (KeyNotFoundException e) {
            return false;
        }
    }

    private static byte[] toByteArray(Iterable<byte[]> chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            out.writeBytes(chunk);
        }
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return "BufferingLockedRepository[" + repository + "]";
    }
}
