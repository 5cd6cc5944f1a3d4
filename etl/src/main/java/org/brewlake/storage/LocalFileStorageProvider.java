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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Storage provider backed by the local (or a mounted) filesystem.
 */
public class LocalFileStorageProvider implements StorageProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  @Override public List<FileEntry> listFiles(String path, boolean recursive) throws IOException {
    Path dir = Paths.get(path);
    if (!Files.isDirectory(dir)) {
      return Collections.emptyList();
    }

    List<FileEntry> entries = new ArrayList<FileEntry>();
    if (recursive) {
      Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
        @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          entries.add(toEntry(file, attrs));
          return FileVisitResult.CONTINUE;
        }

        @Override public FileVisitResult preVisitDirectory(Path subDir,
            BasicFileAttributes attrs) {
          if (!subDir.equals(dir)) {
            entries.add(toEntry(subDir, attrs));
          }
          return FileVisitResult.CONTINUE;
        }
      });
    } else {
      try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
        for (Path child : stream) {
          entries.add(
              toEntry(child, Files.readAttributes(child, BasicFileAttributes.class)));
        }
      }
    }

    entries.sort(Comparator.comparing(FileEntry::getPath));
    return entries;
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    return Files.newInputStream(Paths.get(path));
  }

  @Override public boolean exists(String path) {
    return Files.exists(Paths.get(path));
  }

  @Override public boolean isDirectory(String path) {
    return Files.isDirectory(Paths.get(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    if (relativePath == null || relativePath.isEmpty()) {
      return basePath;
    }
    Path relative = Paths.get(relativePath);
    if (relative.isAbsolute() || basePath == null || basePath.isEmpty()) {
      return relative.toString();
    }
    return Paths.get(basePath).resolve(relative).normalize().toString();
  }

  @Override public void writeFile(String path, byte[] content) throws IOException {
    Path file = Paths.get(path);
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(file, content);
  }

  @Override public void createDirectories(String path) throws IOException {
    Files.createDirectories(Paths.get(path));
  }

  @Override public boolean delete(String path) throws IOException {
    Path target = Paths.get(path);
    if (!Files.exists(target)) {
      return false;
    }

    if (Files.isDirectory(target)) {
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
    } else {
      Files.delete(target);
    }
    LOGGER.debug("Deleted {}", path);
    return true;
  }

  @Override public void move(String source, String target) throws IOException {
    Path from = Paths.get(source);
    Path to = Paths.get(target);
    Path parent = to.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    // Directories cannot be replaced by Files.move, so clear the target first
    if (Files.isDirectory(to)) {
      delete(target);
    }

    try {
      Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.debug("Atomic move not supported for {} -> {}, falling back to plain move",
          source, target);
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static FileEntry toEntry(Path path, BasicFileAttributes attrs) {
    Path fileName = path.getFileName();
    return new FileEntry(path.toString(),
        fileName != null ? fileName.toString() : path.toString(),
        attrs.isDirectory(),
        attrs.size(),
        attrs.lastModifiedTime().toMillis());
  }
}
