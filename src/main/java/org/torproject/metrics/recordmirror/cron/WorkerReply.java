/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.refresh.ReconcileStats;
import org.torproject.metrics.recordmirror.refresh.RefreshResult;
import org.torproject.metrics.recordmirror.store.StoreStats;

/** Reply of the {@link RefreshWorker} to a {@link WorkerMessage}. */
public final class WorkerReply {

  /** Reply kinds. */
  public enum Kind {
    /** A full refresh completed or was skipped because of the lock. */
    REFRESHED,
    RECONCILED,
    STATS,
    STOPPED,
    /** The worker was stopped and did not accept the message. */
    REJECTED,
    /** Processing the message failed with an infrastructure fault. */
    FAILED
  }

  private final Kind kind;

  private final RefreshResult refreshResult;

  private final ReconcileStats reconcileStats;

  private final StoreStats storeStats;

  private final String error;

  private WorkerReply(Kind kind, RefreshResult refreshResult,
      ReconcileStats reconcileStats, StoreStats storeStats, String error) {
    this.kind = kind;
    this.refreshResult = refreshResult;
    this.reconcileStats = reconcileStats;
    this.storeStats = storeStats;
    this.error = error;
  }

  static WorkerReply refreshed(RefreshResult result) {
    return new WorkerReply(Kind.REFRESHED, result, null, null, null);
  }

  static WorkerReply reconciled(ReconcileStats stats) {
    return new WorkerReply(Kind.RECONCILED, null, stats, null, null);
  }

  static WorkerReply stats(StoreStats stats) {
    return new WorkerReply(Kind.STATS, null, null, stats, null);
  }

  static WorkerReply stopped() {
    return new WorkerReply(Kind.STOPPED, null, null, null, null);
  }

  static WorkerReply rejected(WorkerMessage message) {
    return new WorkerReply(Kind.REJECTED, null, null, null,
        "Worker is stopped, rejecting " + message + ".");
  }

  static WorkerReply failed(Throwable cause) {
    return new WorkerReply(Kind.FAILED, null, null, null,
        cause.getClass().getSimpleName() + ": " + cause.getMessage());
  }

  public Kind getKind() {
    return kind;
  }

  public RefreshResult getRefreshResult() {
    return refreshResult;
  }

  public ReconcileStats getReconcileStats() {
    return reconcileStats;
  }

  public StoreStats getStoreStats() {
    return storeStats;
  }

  /** Returns the reason of a rejected or failed message. */
  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    switch (kind) {
      case REFRESHED:
        return kind + " " + refreshResult;
      case RECONCILED:
        return kind + " " + reconcileStats;
      case STATS:
        return kind + " " + storeStats;
      case REJECTED:
      case FAILED:
        return kind + " " + error;
      default:
        return kind.toString();
    }
  }
}
