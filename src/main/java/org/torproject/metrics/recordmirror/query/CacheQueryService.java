/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.query;

import org.torproject.metrics.recordmirror.cron.RefreshWorker;
import org.torproject.metrics.recordmirror.cron.WorkerMessage;
import org.torproject.metrics.recordmirror.cron.WorkerReply;
import org.torproject.metrics.recordmirror.store.Attachment;
import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.StoreStats;
import org.torproject.metrics.recordmirror.store.TableInfo;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Read access to the cache. All reads go to the active slot and never wait
 * for a running refresh.
 */
public class CacheQueryService {

  private static final Logger logger = LoggerFactory.getLogger(
      CacheQueryService.class);

  private final RecordStore store;

  private final VersionManager versions;

  private final RefreshWorker worker;

  public CacheQueryService(RecordStore store, VersionManager versions,
      RefreshWorker worker) {
    this.store = store;
    this.versions = versions;
    this.worker = worker;
  }

  /** Returns the normalized names of all tables with cached records. */
  public List<String> listTables() throws StoreException {
    return this.store.listTables(this.versions.getActive());
  }

  /** Returns the mapping of source tables to cached table names. */
  public List<TableInfo> listTableMappings() throws StoreException {
    return this.store.listTableMappings();
  }

  /**
   * Returns all records of a table, which may be given by its normalized or
   * its display name.
   */
  public List<CachedRecord> listRecords(String table) throws StoreException {
    return this.store.listRecords(this.versions.getActive(),
        TableInfo.normalize(table));
  }

  public Optional<CachedRecord> getRecord(String table, String id)
      throws StoreException {
    return this.store.getRecord(this.versions.getActive(),
        TableInfo.normalize(table), id);
  }

  public StoreStats stats() throws StoreException {
    return this.store.stats(this.versions.getActive());
  }

  /** Requests a full refresh, which runs asynchronously. */
  public Future<WorkerReply> triggerRefresh() {
    logger.info("Full refresh requested.");
    return this.worker.tell(WorkerMessage.refreshStart());
  }

  /**
   * Returns the attachment with the given identifier if it was downloaded
   * and its local file still exists.
   */
  public Optional<Attachment> getAttachment(String id) throws StoreException {
    Optional<Attachment> attachment = this.store.getAttachment(
        this.versions.getActive(), id);
    if (!attachment.isPresent() || !attachment.get().isDownloaded()) {
      return Optional.empty();
    }
    Path localPath = attachment.get().getLocalPath();
    if (null == localPath || !Files.isRegularFile(localPath)) {
      logger.warn("Local file {} of attachment {} is missing.", localPath, id);
      return Optional.empty();
    }
    return attachment;
  }
}
