/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Lock coordinator for locks held within a single process. */
public class InMemoryLockCoordinator implements LockCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(
      InMemoryLockCoordinator.class);

  private static final class Held {

    private final String token;

    private final Instant expiry;

    private Held(String token, Instant expiry) {
      this.token = token;
      this.expiry = expiry;
    }
  }

  private final ConcurrentMap<String, Held> locks = new ConcurrentHashMap<>();

  private final Clock clock;

  public InMemoryLockCoordinator() {
    this(Clock.systemUTC());
  }

  /** Creates a coordinator reading expiry times from the given clock. */
  public InMemoryLockCoordinator(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> acquire(String name, Duration ttl) {
    String token = UUID.randomUUID().toString();
    Instant now = this.clock.instant();
    Held held = this.locks.compute("lock:" + name, (key, current) ->
        null == current || !current.expiry.isAfter(now)
            ? new Held(token, now.plus(ttl)) : current);
    if (!token.equals(held.token)) {
      logger.debug("Lock {} is busy until {}.", name, held.expiry);
      return Optional.empty();
    }
    logger.debug("Acquired lock {} until {}.", name, held.expiry);
    return Optional.of(token);
  }

  @Override
  public void release(String name, String token) {
    boolean released = this.locks.computeIfPresent("lock:" + name,
        (key, current) -> current.token.equals(token) ? null : current)
        == null;
    logger.debug("Release of lock {} {}.", name,
        released ? "succeeded" : "ignored");
  }
}
