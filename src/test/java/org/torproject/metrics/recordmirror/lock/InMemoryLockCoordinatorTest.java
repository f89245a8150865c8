/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.lock;

public class InMemoryLockCoordinatorTest extends LockCoordinatorContract {

  @Override
  protected LockCoordinator newCoordinator() {
    return new InMemoryLockCoordinator(clock);
  }
}
