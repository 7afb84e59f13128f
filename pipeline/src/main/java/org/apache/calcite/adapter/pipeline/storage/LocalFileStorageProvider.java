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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link StorageProvider} over the local file system.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    Path dir = Paths.get(path);
    List<FileEntry> entries = new ArrayList<>();
    if (!Files.isDirectory(dir)) {
      return entries;
    }
    List<Path> paths;
    try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
      paths = stream.filter(p -> !p.equals(dir))
          .sorted()
          .collect(Collectors.toList());
    }
    for (Path p : paths) {
      BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
      entries.add(
          new FileEntry(p.toString(), p.getFileName().toString(), attrs.isDirectory(),
              attrs.size(), attrs.lastModifiedTime().toMillis()));
    }
    return entries;
  }

  @Override public boolean exists(String path) {
    return Files.exists(Paths.get(path));
  }

  @Override public void createDirectories(String path) throws IOException {
    Files.createDirectories(Paths.get(path));
  }

  @Override public boolean delete(String path) throws IOException {
    Path target = Paths.get(path);
    if (!Files.exists(target)) {
      return false;
    }
    if (!Files.isDirectory(target)) {
      Files.delete(target);
      return true;
    }
    Files.walkFileTree(target, new SimpleFileVisitor<Path>() {
      @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override public FileVisitResult postVisitDirectory(Path dir, IOException exc)
          throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
    LOGGER.debug("Deleted directory {}", target);
    return true;
  }

  @Override public void moveAtomic(String source, String destination) throws IOException {
    Path from = Paths.get(source);
    Path to = Paths.get(destination);
    Path parent = to.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try {
      // Atomic rename (on most filesystems)
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      throw new IOException("Cannot promote " + source + " to " + destination
          + " atomically: " + e.getMessage(), e);
    }
    LOGGER.debug("Promoted {} to {}", from, to);
  }

  @Override public void writeAtomic(String path, byte[] content) throws IOException {
    Path target = Paths.get(path);
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path temp = parent.resolve("." + target.getFileName() + ".tmp." + UUID.randomUUID());
    try {
      Files.write(temp, content);
      moveAtomic(temp.toString(), target.toString());
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override public byte[] readAll(String path) throws IOException {
    return Files.readAllBytes(Paths.get(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    return Paths.get(basePath).resolve(relativePath).toString();
  }
}
