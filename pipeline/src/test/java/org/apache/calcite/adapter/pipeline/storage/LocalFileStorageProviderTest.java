/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.pipeline.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LocalFileStorageProvider}.
 */
@Tag("unit")
public class LocalFileStorageProviderTest {

  @TempDir
  Path tempDir;

  private final StorageProvider storage = new LocalFileStorageProvider();

  @Test void testWriteAtomicAndReadBack() throws Exception {
    String file = storage.resolvePath(tempDir.toString(), "a/b/data.json");
    byte[] content = "{\"x\":1}".getBytes(StandardCharsets.UTF_8);

    storage.writeAtomic(file, content);

    assertArrayEquals(content, storage.readAll(file));
    assertEquals("local", storage.getStorageType());
    List<StorageProvider.FileEntry> siblings =
        storage.listFiles(tempDir.resolve("a/b").toString(), false);
    assertEquals(1, siblings.size());
    assertEquals("data.json", siblings.get(0).getName());
  }

  @Test void testMoveAtomicReplacesDestination() throws Exception {
    Path source = tempDir.resolve("tmp/part.parquet");
    Files.createDirectories(source.getParent());
    Files.write(source, "new".getBytes(StandardCharsets.UTF_8));
    Path destination = tempDir.resolve("final/x=1/part.parquet");
    Files.createDirectories(destination.getParent());
    Files.write(destination, "old".getBytes(StandardCharsets.UTF_8));

    storage.moveAtomic(source.toString(), destination.toString());

    assertFalse(Files.exists(source));
    assertEquals("new", new String(Files.readAllBytes(destination), StandardCharsets.UTF_8));
  }

  @Test void testDeleteDirectoryTree() throws Exception {
    Path dir = tempDir.resolve("_temporary/run1/x=1");
    Files.createDirectories(dir);
    Files.write(dir.resolve("f"), new byte[] {1});

    assertTrue(storage.delete(tempDir.resolve("_temporary").toString()));
    assertFalse(storage.exists(tempDir.resolve("_temporary").toString()));
    assertFalse(storage.delete(tempDir.resolve("_temporary").toString()));
  }

  @Test void testListFilesRecursive() throws Exception {
    Files.createDirectories(tempDir.resolve("x=1"));
    Files.write(tempDir.resolve("x=1/part.parquet"), new byte[] {1, 2});

    List<StorageProvider.FileEntry> flat = storage.listFiles(tempDir.toString(), false);
    List<StorageProvider.FileEntry> deep = storage.listFiles(tempDir.toString(), true);

    assertEquals(1, flat.size());
    assertTrue(flat.get(0).isDirectory());
    assertEquals(2, deep.size());
    assertEquals(2, deep.get(1).getSize());
    assertTrue(storage.listFiles(tempDir.resolve("missing").toString(), true).isEmpty());
  }
}
