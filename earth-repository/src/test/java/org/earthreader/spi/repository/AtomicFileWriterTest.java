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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AtomicFileWriterTest {

    @Rule
    public final TemporaryFolder temporaryFolder = new TemporaryFolder(new File("target"));

    @Test
    public void writesNewFile() throws Exception {
        Path target = temporaryFolder.getRoot().toPath().resolve("feed.xml");
        new AtomicFileWriter().write(target, Arrays.asList("<feed>".getBytes(UTF_8), "</feed>".getBytes(UTF_8)));
        assertEquals("<feed></feed>", new String(Files.readAllBytes(target), UTF_8));
        assertEquals(1, temporaryFolder.getRoot().list().length);
    }

    @Test
    public void tempFileLivesNextToTarget() throws Exception {
        File dir = temporaryFolder.newFolder("dir");
        Path target = dir.toPath().resolve("feed.xml");
        FileUtils.writeStringToFile(target.toFile(), "old", UTF_8);
        List<Path> published = new ArrayList<Path>();
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void publish(Path temp, Path target) throws IOException {
                published.add(temp);
                assertTrue(isInFlight(temp));
                assertEquals("old", new String(Files.readAllBytes(target), UTF_8));
                assertEquals("new", new String(Files.readAllBytes(temp), UTF_8));
                super.publish(temp, target);
            }
        };
        writer.write(target, Arrays.asList("new".getBytes(UTF_8)));
        assertEquals(1, published.size());
        Path temp = published.get(0);
        assertEquals(dir.toPath(), temp.getParent());
        assertTrue(temp.getFileName().toString().startsWith(".~feed.xml."));
        assertFalse(writer.isInFlight(temp));
        assertFalse(Files.exists(temp));
        assertEquals("new", new String(Files.readAllBytes(target), UTF_8));
    }

    @Test
    public void missingDirectoryFails() {
        Path target = temporaryFolder.getRoot().toPath().resolve("missing").resolve("feed.xml");
        try {
            new AtomicFileWriter().write(target, Arrays.asList("x".getBytes(UTF_8)));
            fail();
        } catch (IOException e) {
            // expected
        }
        assertFalse(Files.exists(target.getParent()));
    }

    @Test
    public void failedWriteIsNoLongerInFlight() throws Exception {
        Path target = temporaryFolder.getRoot().toPath().resolve("feed.xml");
        List<Path> temps = new ArrayList<Path>();
        AtomicFileWriter writer = new AtomicFileWriter() {
            @Override
            protected void publish(Path temp, Path target) throws IOException {
                temps.add(temp);
                throw new IOException("rename failed");
            }
        };
        try {
            writer.write(target, Arrays.asList("x".getBytes(UTF_8)));
            fail();
        } catch (IOException e) {
            assertEquals("rename failed", e.getMessage());
        }
        assertEquals(1, temps.size());
        assertFalse(writer.isInFlight(temps.get(0)));
        assertFalse(Files.exists(temps.get(0)));
        assertFalse(Files.exists(target));
    }

    @Test
    public void namesLikeTemporaryFilesAreOrdinary() throws Exception {
        File file = temporaryFolder.newFile(".~feed.xml.1f2e.tmp");
        assertFalse(new AtomicFileWriter().isInFlight(file.toPath()));
    }
}
