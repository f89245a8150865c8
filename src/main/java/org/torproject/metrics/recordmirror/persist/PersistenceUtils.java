/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * File system helpers shared by the persistent backends. All writes go to a
 * temporary sibling first and are then moved into place, so that readers
 * only ever see complete files.
 */
public class PersistenceUtils {

  private static final Logger log = LoggerFactory.getLogger(
      PersistenceUtils.class);

  public static final String TEMPFIX = ".tmp";

  private PersistenceUtils() {
  }

  /** Returns the temporary sibling used while writing the given path. */
  public static Path tempPath(Path outputPath) {
    return outputPath.resolveSibling(outputPath.getFileName() + TEMPFIX);
  }

  /** Writes data to the given path via a temporary file. */
  public static void storeAtomically(byte[] data, Path outputPath)
      throws IOException {
    Files.createDirectories(outputPath.getParent());
    Path tmpPath = tempPath(outputPath);
    Files.write(tmpPath, data);
    moveIntoPlace(tmpPath, outputPath);
  }

  /**
   * Streams the given input to the given path via a temporary file and
   * returns the number of bytes written.
   */
  public static long storeAtomically(InputStream in, Path outputPath)
      throws IOException {
    Files.createDirectories(outputPath.getParent());
    Path tmpPath = tempPath(outputPath);
    long written;
    try {
      written = Files.copy(in, tmpPath, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      Files.deleteIfExists(tmpPath);
      throw e;
    }
    moveIntoPlace(tmpPath, outputPath);
    return written;
  }

  private static void moveIntoPlace(Path tmpPath, Path outputPath)
      throws IOException {
    try {
      Files.move(tmpPath, outputPath, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException amnse) {
      log.debug("Atomic move not supported for {}, replacing instead.",
          outputPath);
      Files.move(tmpPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Deletes temporary files left behind by interrupted writes. */
  public static void cleanDirectory(Path pathToClean) throws IOException {
    if (!Files.isDirectory(pathToClean)) {
      return;
    }
    SimpleFileVisitor<Path> sfv = new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        if (file.getFileName().toString().endsWith(TEMPFIX)) {
          log.debug("Removing incomplete file {}.", file);
          Files.deleteIfExists(file);
        }
        return FileVisitResult.CONTINUE;
      }
    };
    Files.walkFileTree(pathToClean, sfv);
  }

  /** Deletes the given directory together with everything below it. */
  public static void deleteRecursively(Path directory) throws IOException {
    if (!Files.exists(directory)) {
      return;
    }
    Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc)
          throws IOException {
        if (null != exc) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }
}
