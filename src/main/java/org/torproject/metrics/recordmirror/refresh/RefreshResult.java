/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

/**
 * Result of a full refresh attempt, which is either skipped because another
 * refresh holds the lock or completed with stats.
 */
public final class RefreshResult {

  private static final RefreshResult SKIPPED = new RefreshResult(null);

  private final RefreshStats stats;

  private RefreshResult(RefreshStats stats) {
    this.stats = stats;
  }

  public static RefreshResult skipped() {
    return SKIPPED;
  }

  public static RefreshResult completed(RefreshStats stats) {
    return new RefreshResult(stats);
  }

  public boolean isSkipped() {
    return null == stats;
  }

  /** Returns the stats, or {@code null} if the refresh was skipped. */
  public RefreshStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return isSkipped() ? "skipped" : "completed: " + stats;
  }
}
