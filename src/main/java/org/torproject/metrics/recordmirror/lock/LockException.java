/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.lock;

/**
 * The lock backend failed. This is different from a lock being busy, which
 * is reported as an empty result of {@link LockCoordinator#acquire}.
 */
public class LockException extends Exception {

  private static final long serialVersionUID = 2761204388717553044L;

  public LockException(String message) {
    super(message);
  }

  public LockException(String message, Throwable cause) {
    super(message, cause);
  }
}
