/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.refresh.TableDiff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message understood by the {@link RefreshWorker}. Instances can only be
 * created by the factory methods of this class.
 */
public final class WorkerMessage {

  /** Message kinds. */
  public enum Kind {
    REFRESH_START,
    REFRESH_STOP,
    STATS_GET,
    RECONCILE
  }

  private static final WorkerMessage REFRESH_START =
      new WorkerMessage(Kind.REFRESH_START, Collections.emptyMap());

  private static final WorkerMessage REFRESH_STOP =
      new WorkerMessage(Kind.REFRESH_STOP, Collections.emptyMap());

  private static final WorkerMessage STATS_GET =
      new WorkerMessage(Kind.STATS_GET, Collections.emptyMap());

  private final Kind kind;

  private final Map<String, TableDiff> diffs;

  private WorkerMessage(Kind kind, Map<String, TableDiff> diffs) {
    this.kind = kind;
    this.diffs = diffs;
  }

  /** Requests a full refresh. */
  public static WorkerMessage refreshStart() {
    return REFRESH_START;
  }

  /** Stops accepting refresh and reconcile requests. */
  public static WorkerMessage refreshStop() {
    return REFRESH_STOP;
  }

  /** Requests counts of the active slot. */
  public static WorkerMessage statsGet() {
    return STATS_GET;
  }

  /** Requests applying the given diffs, keyed by external table id. */
  public static WorkerMessage reconcile(Map<String, TableDiff> diffs) {
    return new WorkerMessage(Kind.RECONCILE,
        Collections.unmodifiableMap(new LinkedHashMap<>(diffs)));
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the diffs of a reconcile message, or an empty map. */
  public Map<String, TableDiff> getDiffs() {
    return diffs;
  }

  @Override
  public String toString() {
    return Kind.RECONCILE == kind ? kind + diffs.keySet().toString()
        : kind.toString();
  }
}
