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

import java.io.Closeable;
import java.util.Iterator;

import org.jetbrains.annotations.NotNull;

import com.google.common.collect.Iterators;

/**
 * An {@link Iterator} that holds a resource. Callers that stop iterating before
 * the end must {@link #close()} it; implementations release the resource on
 * exhaustion as well. Closing more than once has no effect.
 *
 * @param <T> the type of elements in the iterator
 */
public interface CloseableIterator<T> extends Iterator<T>, Closeable {

    /**
     * Returns an iterator over a single element which holds no resource.
     */
    static <T> CloseableIterator<T> singleton(@NotNull T element) {
        return wrap(Iterators.singletonIterator(element));
    }

    /**
     * Adapts a plain iterator; {@link #close()} does nothing.
     */
    static <T> CloseableIterator<T> wrap(@NotNull Iterator<T> iterator) {
        return new CloseableIterator<T>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public T next() {
                return iterator.next();
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }
}
