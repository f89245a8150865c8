/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lock coordinator based on lock files in a directory shared by all
 * processes that need to be coordinated.
 *
 * <p>A lock file contains the holder's token on the first line and the
 * expiry time in milliseconds since the epoch on the second line. It is
 * published by creating a hard link to a completely written temporary file,
 * which fails if the lock file exists already.</p>
 */
public class FileLockCoordinator implements LockCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(
      FileLockCoordinator.class);

  private static final String LOCK_SUFFIX = ".lock";

  private final Path lockDirectory;

  private final Clock clock;

  public FileLockCoordinator(Path lockDirectory) {
    this(lockDirectory, Clock.systemUTC());
  }

  /** Creates a coordinator reading expiry times from the given clock. */
  public FileLockCoordinator(Path lockDirectory, Clock clock) {
    this.lockDirectory = lockDirectory;
    this.clock = clock;
  }

  private Path lockPath(String name) {
    return this.lockDirectory.resolve("lock-" + name + LOCK_SUFFIX);
  }

  @Override
  public Optional<String> acquire(String name, Duration ttl)
      throws LockException {
    Path lockPath = this.lockPath(name);
    String token = UUID.randomUUID().toString();
    try {
      Files.createDirectories(this.lockDirectory);
      if (this.tryCreate(lockPath, token, ttl)) {
        logger.debug("Acquired lock {}.", name);
        return Optional.of(token);
      }
      Optional<String[]> held = readLock(lockPath);
      if (held.isPresent() && !this.isExpired(held.get())) {
        logger.debug("Lock {} is busy.", name);
        return Optional.empty();
      }
      if (held.isPresent() && !this.breakExpired(lockPath, held.get()[0])) {
        return Optional.empty();
      }
      if (this.tryCreate(lockPath, token, ttl)) {
        logger.info("Acquired lock {} after previous holder's lock expired.",
            name);
        return Optional.of(token);
      }
      return Optional.empty();
    } catch (IOException e) {
      throw new LockException("Cannot acquire lock " + name + " in "
          + this.lockDirectory + ".", e);
    }
  }

  private boolean tryCreate(Path lockPath, String token, Duration ttl)
      throws IOException {
    long expiryMillis = this.clock.millis() + ttl.toMillis();
    Path tmpPath = lockPath.resolveSibling(lockPath.getFileName() + "."
        + token);
    Files.write(tmpPath, (token + "\n" + expiryMillis + "\n")
        .getBytes(StandardCharsets.UTF_8));
    try {
      Files.createLink(lockPath, tmpPath);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    } finally {
      Files.deleteIfExists(tmpPath);
    }
  }

  /**
   * Moves an expired lock file out of the way, unless another process
   * replaced it in the meantime.
   */
  private boolean breakExpired(Path lockPath, String expiredToken)
      throws IOException {
    return removeIfHeldBy(lockPath, expiredToken) != Removal.REPLACED;
  }

  private enum Removal {
    ABSENT, REMOVED, REPLACED
  }

  /**
   * Atomically moves the lock file to a private name and only discards it if
   * it carries the given token, otherwise links it back into place.
   */
  private static Removal removeIfHeldBy(Path lockPath, String token)
      throws IOException {
    Path movedPath = lockPath.resolveSibling(lockPath.getFileName()
        + ".stale-" + UUID.randomUUID());
    try {
      Files.move(lockPath, movedPath, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException e) {
      return Removal.ABSENT;
    }
    try {
      Optional<String[]> moved = readLock(movedPath);
      if (moved.isPresent() && !token.equals(moved.get()[0])) {
        try {
          Files.createLink(lockPath, movedPath);
        } catch (FileAlreadyExistsException faee) {
          logger.debug("Lock file {} was recreated concurrently.", lockPath);
        }
        return Removal.REPLACED;
      }
      return Removal.REMOVED;
    } finally {
      Files.deleteIfExists(movedPath);
    }
  }

  private boolean isExpired(String[] held) {
    try {
      return Long.parseLong(held[1]) <= this.clock.millis();
    } catch (NumberFormatException e) {
      logger.warn("Treating lock with unreadable expiry '{}' as expired.",
          held[1]);
      return true;
    }
  }

  private static Optional<String[]> readLock(Path lockPath)
      throws IOException {
    try {
      List<String> lines = Files.readAllLines(lockPath,
          StandardCharsets.UTF_8);
      return Optional.of(new String[] {
          lines.isEmpty() ? "" : lines.get(0),
          lines.size() < 2 ? "" : lines.get(1) });
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
  }

  @Override
  public void release(String name, String token) throws LockException {
    Path lockPath = this.lockPath(name);
    try {
      if (removeIfHeldBy(lockPath, token) == Removal.REMOVED) {
        logger.debug("Released lock {}.", name);
      } else {
        logger.debug("Not releasing lock {} held by somebody else.", name);
      }
    } catch (IOException e) {
      throw new LockException("Cannot release lock " + name + " in "
          + this.lockDirectory + ".", e);
    }
  }
}
