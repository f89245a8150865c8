/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import org.torproject.metrics.recordmirror.store.SlotId;

/** Counts of a completed full refresh. */
public final class RefreshStats {

  private final int tables;

  private final int records;

  private final int attachmentsDownloaded;

  private final int attachmentsReused;

  private final int errors;

  private final long durationMillis;

  private final SlotId activeSlot;

  /** Creates refresh counts. */
  public RefreshStats(int tables, int records, int attachmentsDownloaded,
      int attachmentsReused, int errors, long durationMillis,
      SlotId activeSlot) {
    this.tables = tables;
    this.records = records;
    this.attachmentsDownloaded = attachmentsDownloaded;
    this.attachmentsReused = attachmentsReused;
    this.errors = errors;
    this.durationMillis = durationMillis;
    this.activeSlot = activeSlot;
  }

  /** Tables whose records were fetched. */
  public int getTables() {
    return tables;
  }

  public int getRecords() {
    return records;
  }

  public int getAttachmentsDownloaded() {
    return attachmentsDownloaded;
  }

  public int getAttachmentsReused() {
    return attachmentsReused;
  }

  /** Records, tables, and attachments that failed. */
  public int getErrors() {
    return errors;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  /** Slot that became active at the end of the refresh. */
  public SlotId getActiveSlot() {
    return activeSlot;
  }

  @Override
  public String toString() {
    return tables + " tables, " + records + " records, "
        + attachmentsDownloaded + " attachments downloaded, "
        + attachmentsReused + " reused, " + errors + " errors in "
        + durationMillis + " ms, active slot " + activeSlot;
  }
}
