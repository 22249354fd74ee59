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

/**
 * Thrown when nothing suitable exists at a key: there is no entry to read, or
 * no directory-like node to list.
 */
public class KeyNotFoundException extends RepositoryKeyException {

    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(@NotNull List<String> key, String message) {
        super(key, message);
    }

    public KeyNotFoundException(@NotNull List<String> key, String message, Throwable cause) {
        super(key, message, cause);
    }
}
