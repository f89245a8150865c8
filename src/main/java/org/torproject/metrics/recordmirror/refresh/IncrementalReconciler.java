/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import org.torproject.metrics.recordmirror.source.SourceClient;
import org.torproject.metrics.recordmirror.source.SourceException;
import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.StoreUnavailableException;
import org.torproject.metrics.recordmirror.store.TableInfo;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies sparse per-table diffs to the active slot without a flip.
 *
 * <p>Created and changed records are fetched from the source and upserted,
 * then destroyed records are deleted. Tables without a stored mapping are
 * skipped. This never takes the refresh lock, so it may run while a full
 * refresh rebuilds the inactive slot.</p>
 */
public class IncrementalReconciler {

  private static final Logger logger = LoggerFactory.getLogger(
      IncrementalReconciler.class);

  private final RecordStore store;

  private final SourceClient source;

  private final VersionManager versions;

  private final BatchWriter writer;

  /** Creates a reconciler writing in batches of the given size. */
  public IncrementalReconciler(RecordStore store, SourceClient source,
      VersionManager versions, int batchSize) {
    this.store = store;
    this.source = source;
    this.versions = versions;
    this.writer = new BatchWriter(store, batchSize);
  }

  /**
   * Applies the given diffs, keyed by external table identifier.
   *
   * @throws StoreUnavailableException if the store cannot be reached.
   */
  public ReconcileStats reconcile(Map<String, TableDiff> diffs)
      throws StoreException {
    long started = System.currentTimeMillis();
    SlotId active = this.versions.getActive();
    int tables = 0;
    int created = 0;
    int updated = 0;
    int deleted = 0;
    int skipped = 0;
    int errors = 0;
    for (Map.Entry<String, TableDiff> entry : diffs.entrySet()) {
      Optional<TableInfo> mapping = this.store.findTableMapping(
          entry.getKey());
      if (!mapping.isPresent()) {
        logger.warn("Unknown table {}, skipping its changes.",
            entry.getKey());
        skipped++;
        continue;
      }
      TableInfo table = mapping.get();
      String tableName = table.getNormalizedName();
      TableDiff diff = entry.getValue();
      logger.info("Applying changes to table {}: {}.", table.getDisplayName(),
          diff);
      boolean fetchFailed = false;
      Set<String> upsertIds = diff.getUpsertIds();
      if (!upsertIds.isEmpty()) {
        List<CachedRecord> fetched = Collections.emptyList();
        try {
          fetched = this.source.fetchRecords(table, upsertIds);
        } catch (SourceException e) {
          logger.warn("Cannot fetch changed records of table {}: {}",
              table.getDisplayName(), e.getMessage());
          errors++;
          fetchFailed = true;
        }
        BatchWriter.Result result = this.writer.write(active, tableName,
            fetched);
        errors += result.getErrors();
        for (String id : result.getWritten()) {
          if (diff.getCreatedIds().contains(id)) {
            created++;
          } else if (diff.getChangedIds().contains(id)) {
            updated++;
          }
        }
      }
      for (String id : diff.getDestroyedIds()) {
        try {
          this.store.deleteRecord(active, tableName, id);
          deleted++;
        } catch (StoreUnavailableException e) {
          throw e;
        } catch (StoreException e) {
          logger.warn("Cannot delete record {} of table {}: {}", id,
              table.getDisplayName(), e.getMessage());
          errors++;
        }
      }
      if (!fetchFailed) {
        tables++;
      }
    }
    ReconcileStats stats = new ReconcileStats(tables, created, updated,
        deleted, skipped, errors, System.currentTimeMillis() - started);
    logger.info("Incremental reconciliation of slot {} completed: {}.",
        active, stats);
    return stats;
  }
}
