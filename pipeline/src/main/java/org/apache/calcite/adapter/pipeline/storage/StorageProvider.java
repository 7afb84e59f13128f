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

import java.io.IOException;
import java.util.List;

/**
 * Storage provider interface for abstracting access to the sink.
 *
 * <p>Paths are strings so that implementations are free to address local
 * directories or object-store prefixes. The materializer only needs the
 * operations below; everything it writes is first written under a staging
 * path and then promoted with {@link #moveAtomic}.
 */
public interface StorageProvider {

  /**
   * Lists files in a directory.
   *
   * @param path The directory path
   * @param recursive Whether to include subdirectories
   * @return File entries, sorted by path; empty if the directory does not exist
   * @throws IOException If an I/O error occurs
   */
  List<FileEntry> listFiles(String path, boolean recursive) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Creates directories for the given path, including parents.
   *
   * @throws IOException If an I/O error occurs
   */
  void createDirectories(String path) throws IOException;

  /**
   * Deletes a file, or a directory and everything under it.
   *
   * @return true if something was deleted, false if the path didn't exist
   * @throws IOException If an I/O error occurs
   */
  boolean delete(String path) throws IOException;

  /**
   * Moves a file to its final path in one step, replacing any file already
   * there. Readers see either the old file or the new one, never a partial
   * file.
   *
   * @throws IOException If the move fails or cannot be made atomic
   */
  void moveAtomic(String source, String destination) throws IOException;

  /**
   * Writes a small file in one step (write to a sibling, then move).
   *
   * @throws IOException If an I/O error occurs
   */
  void writeAtomic(String path, byte[] content) throws IOException;

  /**
   * Reads a whole file.
   *
   * @throws IOException If an I/O error occurs
   */
  byte[] readAll(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a base path.
   *
   * @param basePath The base path
   * @param relativePath The relative path
   * @return The resolved path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * File entry in a listing.
   */
  class FileEntry {
    private final String path;
    private final String name;
    private final boolean isDirectory;
    private final long size;
    private final long lastModified;

    public FileEntry(String path, String name, boolean isDirectory,
                     long size, long lastModified) {
      this.path = path;
      this.name = name;
      this.isDirectory = isDirectory;
      this.size = size;
      this.lastModified = lastModified;
    }

    public String getPath() {
      return path;
    }

    public String getName() {
      return name;
    }

    public boolean isDirectory() {
      return isDirectory;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    @Override public String toString() {
      return path;
    }
  }
}
