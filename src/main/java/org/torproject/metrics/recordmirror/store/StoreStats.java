/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Counts describing the contents of one slot. */
@JsonPropertyOrder({ "slot", "tables", "records", "attachments",
    "pending_attachments" })
public final class StoreStats {

  @JsonProperty("slot")
  private final SlotId slot;

  @JsonProperty("tables")
  private final int tables;

  @JsonProperty("records")
  private final long records;

  @JsonProperty("attachments")
  private final long attachments;

  @JsonProperty("pending_attachments")
  private final long pendingAttachments;

  /** Creates a snapshot of slot counts. */
  public StoreStats(SlotId slot, int tables, long records, long attachments,
      long pendingAttachments) {
    this.slot = slot;
    this.tables = tables;
    this.records = records;
    this.attachments = attachments;
    this.pendingAttachments = pendingAttachments;
  }

  public SlotId getSlot() {
    return slot;
  }

  public int getTables() {
    return tables;
  }

  public long getRecords() {
    return records;
  }

  public long getAttachments() {
    return attachments;
  }

  public long getPendingAttachments() {
    return pendingAttachments;
  }

  @Override
  public String toString() {
    return "slot " + slot + ": " + tables + " tables, " + records
        + " records, " + attachments + " attachments ("
        + pendingAttachments + " pending)";
  }
}
