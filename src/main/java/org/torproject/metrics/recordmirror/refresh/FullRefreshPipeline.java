/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import org.torproject.metrics.recordmirror.attachments.AttachmentPipeline;
import org.torproject.metrics.recordmirror.attachments.DownloadStats;
import org.torproject.metrics.recordmirror.lock.LockCoordinator;
import org.torproject.metrics.recordmirror.lock.LockException;
import org.torproject.metrics.recordmirror.source.SourceClient;
import org.torproject.metrics.recordmirror.source.SourceException;
import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.TableInfo;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the inactive slot from the source and publishes it by flipping
 * the active pointer.
 *
 * <p>Only one full refresh runs at a time, which is ensured by the
 * {@code refresh} lock. Faults of single tables, records, or attachments
 * are counted and logged, while faults of the store, the lock, or the flip
 * abort the refresh. The lock is released in any case.</p>
 */
public class FullRefreshPipeline {

  private static final Logger logger = LoggerFactory.getLogger(
      FullRefreshPipeline.class);

  public static final String LOCK_NAME = "refresh";

  public static final int DEFAULT_BATCH_SIZE = 50;

  private final RecordStore store;

  private final SourceClient source;

  private final VersionManager versions;

  private final LockCoordinator locks;

  private final AttachmentPipeline attachments;

  private final SchemaSync schemaSync;

  private final BatchWriter writer;

  private final Duration lockTtl;

  private volatile RefreshState state = RefreshState.IDLE;

  /**
   * Creates a pipeline.
   *
   * @param attachments Attachment pipeline, or {@code null} if attachments
   *     are not downloaded.
   */
  public FullRefreshPipeline(RecordStore store, SourceClient source,
      VersionManager versions, LockCoordinator locks,
      AttachmentPipeline attachments, int batchSize, Duration lockTtl) {
    this.store = store;
    this.source = source;
    this.versions = versions;
    this.locks = locks;
    this.attachments = attachments;
    this.schemaSync = new SchemaSync(source, store);
    this.writer = new BatchWriter(store, batchSize);
    this.lockTtl = lockTtl;
  }

  /** Returns the phase of the current or last refresh. */
  public RefreshState getState() {
    return state;
  }

  /**
   * Runs a full refresh unless another one holds the lock.
   *
   * @throws StoreException if the store is unavailable or the flip fails.
   * @throws LockException if the lock backend fails.
   */
  public RefreshResult run() throws StoreException, LockException {
    this.state = RefreshState.LOCKING;
    Optional<String> token = this.locks.acquire(LOCK_NAME, this.lockTtl);
    if (!token.isPresent()) {
      logger.info("Another full refresh is running. Skipping.");
      this.state = RefreshState.IDLE;
      return RefreshResult.skipped();
    }
    try {
      RefreshStats stats = this.refresh();
      this.state = RefreshState.DONE;
      logger.info("Full refresh completed: {}.", stats);
      return RefreshResult.completed(stats);
    } catch (StoreException | RuntimeException e) {
      this.state = RefreshState.ERROR;
      logger.error("Full refresh failed: {}", e.getMessage(), e);
      throw e;
    } finally {
      try {
        this.locks.release(LOCK_NAME, token.get());
      } catch (LockException e) {
        logger.error("Cannot release lock {}; it expires after {}.",
            LOCK_NAME, this.lockTtl, e);
      }
    }
  }

  private RefreshStats refresh() throws StoreException {
    long started = System.currentTimeMillis();
    List<TableInfo> tables = this.schemaSync.syncOrStored();
    this.state = RefreshState.CLEANING;
    SlotId inactive = this.versions.getInactive();
    logger.info("Starting full refresh of {} table(s) into slot {}.",
        tables.size(), inactive);
    this.versions.clearInactive();
    int tablesProcessed = 0;
    int records = 0;
    int errors = 0;
    for (TableInfo table : tables) {
      this.state = RefreshState.FETCHING;
      List<CachedRecord> fetched;
      try {
        fetched = this.source.fetchAllRecords(table);
      } catch (SourceException e) {
        logger.warn("Cannot fetch records of table {}, skipping it: {}",
            table.getDisplayName(), e.getMessage());
        errors++;
        continue;
      }
      this.state = RefreshState.WRITING;
      BatchWriter.Result result = this.writer.write(inactive,
          table.getNormalizedName(), fetched);
      tablesProcessed++;
      records += result.getWritten().size();
      errors += result.getErrors();
      logger.info("Wrote {} of {} record(s) of table {}.",
          result.getWritten().size(), fetched.size(), table.getDisplayName());
      Thread.yield();
    }
    int downloaded = 0;
    int reused = 0;
    if (null != this.attachments) {
      this.state = RefreshState.ATTACHMENT_SYNC;
      DownloadStats downloadStats = this.attachments.downloadPending(inactive);
      downloaded = downloadStats.getDownloaded();
      reused = downloadStats.getReused();
      errors += downloadStats.getErrors();
    }
    this.state = RefreshState.FLIPPING;
    SlotId active = this.versions.flip();
    return new RefreshStats(tablesProcessed, records, downloaded, reused,
        errors, System.currentTimeMillis() - started, active);
  }
}
