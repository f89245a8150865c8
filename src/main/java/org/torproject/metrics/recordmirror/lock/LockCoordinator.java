/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Named mutual-exclusion locks with a time-to-live. A lock that is not
 * released expires after its TTL, and expiry is never extended while the
 * lock is held.
 */
public interface LockCoordinator {

  /**
   * Tries to acquire the named lock.
   *
   * @param name Lock name.
   * @param ttl Time after which the lock expires if not released.
   * @return Token identifying the holder, or empty if the lock is held.
   * @throws LockException Thrown if the lock backend cannot be used.
   */
  Optional<String> acquire(String name, Duration ttl) throws LockException;

  /**
   * Releases the named lock if it is still held with the given token, and
   * does nothing otherwise.
   */
  void release(String name, String token) throws LockException;
}
