/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

/** Counts of one incremental reconciliation. */
public final class ReconcileStats {

  private final int tables;

  private final int recordsCreated;

  private final int recordsUpdated;

  private final int recordsDeleted;

  private final int tablesSkipped;

  private final int errors;

  private final long durationMillis;

  /** Creates reconciliation counts. */
  public ReconcileStats(int tables, int recordsCreated, int recordsUpdated,
      int recordsDeleted, int tablesSkipped, int errors,
      long durationMillis) {
    this.tables = tables;
    this.recordsCreated = recordsCreated;
    this.recordsUpdated = recordsUpdated;
    this.recordsDeleted = recordsDeleted;
    this.tablesSkipped = tablesSkipped;
    this.errors = errors;
    this.durationMillis = durationMillis;
  }

  /** Tables whose diff was applied. */
  public int getTables() {
    return tables;
  }

  public int getRecordsCreated() {
    return recordsCreated;
  }

  public int getRecordsUpdated() {
    return recordsUpdated;
  }

  public int getRecordsDeleted() {
    return recordsDeleted;
  }

  /** Tables without a known mapping. */
  public int getTablesSkipped() {
    return tablesSkipped;
  }

  public int getErrors() {
    return errors;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  @Override
  public String toString() {
    return tables + " tables: " + recordsCreated + " created, "
        + recordsUpdated + " updated, " + recordsDeleted + " deleted, "
        + tablesSkipped + " tables skipped, " + errors + " errors in "
        + durationMillis + " ms";
  }
}
