/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import org.torproject.metrics.recordmirror.source.SourceClient;
import org.torproject.metrics.recordmirror.source.SourceException;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.TableInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps the stored table mapping in line with the tables of the source,
 * which also picks up renamed tables and forgets removed ones.
 */
public class SchemaSync {

  private static final Logger logger = LoggerFactory.getLogger(
      SchemaSync.class);

  private final SourceClient source;

  private final RecordStore store;

  public SchemaSync(SourceClient source, RecordStore store) {
    this.source = source;
    this.store = store;
  }

  /**
   * Fetches the source's tables and replaces the stored mapping with them.
   *
   * @return The tables as currently known to the source.
   */
  public List<TableInfo> sync() throws SourceException, StoreException {
    List<TableInfo> tables = this.source.fetchTables();
    this.store.replaceTableMappings(tables);
    logger.info("Synchronized mapping of {} table(s).", tables.size());
    return tables;
  }

  /**
   * Tries to synchronize the mapping and falls back to the stored mapping
   * if the source cannot be reached.
   */
  public List<TableInfo> syncOrStored() throws StoreException {
    try {
      this.sync();
    } catch (SourceException e) {
      logger.warn("Cannot fetch tables from source, using stored mapping: {}",
          e.getMessage());
    }
    return this.store.listTableMappings();
  }
}
