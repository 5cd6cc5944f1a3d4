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
package org.brewlake.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Storage provider interface for abstracting file access behind the pipeline layers.
 *
 * <p>All paths are plain strings so that layer locations can be carried in
 * configuration unchanged. Writes that must appear atomically to readers
 * go through {@link #move(String, String)} from a staging location.
 */
public interface StorageProvider {

  /**
   * Lists files in a directory.
   *
   * @param path The directory path
   * @param recursive Whether to include subdirectories
   * @return List of file entries, empty if the directory does not exist
   * @throws IOException If an I/O error occurs
   */
  List<FileEntry> listFiles(String path, boolean recursive) throws IOException;

  /**
   * Opens an input stream for reading file content.
   *
   * @param path The file path
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Checks if a path is a directory.
   *
   * @param path The path to check
   * @return true if the path is a directory
   * @throws IOException If an I/O error occurs
   */
  boolean isDirectory(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a base path.
   * An absolute relative path is returned unchanged.
   *
   * @param basePath The base path
   * @param relativePath The relative path
   * @return The resolved path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * Writes content to a file.
   * Creates the file and its parent directories if needed, overwrites if it exists.
   *
   * @param path The file path
   * @param content The content to write
   * @throws IOException If an I/O error occurs
   */
  void writeFile(String path, byte[] content) throws IOException;

  /**
   * Creates directories for the given path, including parents.
   *
   * @param path The directory path to create
   * @throws IOException If an I/O error occurs
   */
  void createDirectories(String path) throws IOException;

  /**
   * Deletes a file, or a directory together with everything below it.
   *
   * @param path The path to delete
   * @return true if something was deleted, false if the path didn't exist
   * @throws IOException If an I/O error occurs
   */
  boolean delete(String path) throws IOException;

  /**
   * Moves a file or directory, replacing the target if it exists.
   *
   * @param source The existing path
   * @param target The destination path
   * @throws IOException If an I/O error occurs
   */
  void move(String source, String target) throws IOException;

  /**
   * File entry returned by {@link #listFiles}.
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
      return "FileEntry{" + path + (isDirectory ? "/" : "") + ", size=" + size + "}";
    }
  }
}
