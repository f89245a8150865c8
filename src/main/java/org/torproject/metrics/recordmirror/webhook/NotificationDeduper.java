/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers notification keys for a limited time, so that notifications
 * delivered more than once are processed only once.
 *
 * <p>Expired keys are removed lazily while recording new keys.</p>
 */
public class NotificationDeduper {

  private static final int SCAN_LIMIT = 64;

  private final Map<String, Long> seen = new ConcurrentHashMap<>();

  private final long ttlMillis;

  private final Clock clock;

  public NotificationDeduper(Duration ttl) {
    this(ttl, Clock.systemUTC());
  }

  /** Creates a deduper reading the current time from the given clock. */
  public NotificationDeduper(Duration ttl, Clock clock) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
    }
    this.ttlMillis = ttl.toMillis();
    this.clock = clock;
  }

  /**
   * Records the given key.
   *
   * @return {@code true} if the key was not seen within the TTL.
   */
  public boolean firstTime(String key) {
    Objects.requireNonNull(key, "key");
    long now = this.clock.millis();
    boolean[] first = new boolean[1];
    this.seen.compute(key, (k, expiry) -> {
      if (null != expiry && expiry >= now) {
        return expiry;
      }
      first[0] = true;
      return now + this.ttlMillis;
    });
    if (first[0]) {
      this.cleanup(now);
    }
    return first[0];
  }

  private void cleanup(long now) {
    int scanned = 0;
    for (Iterator<Map.Entry<String, Long>> it = this.seen.entrySet()
        .iterator(); it.hasNext() && scanned < SCAN_LIMIT; scanned++) {
      if (it.next().getValue() < now) {
        it.remove();
      }
    }
  }

  /** Number of keys currently remembered. */
  int size() {
    return this.seen.size();
  }
}
