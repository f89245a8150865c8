/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.source;

import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.TableInfo;

import java.util.Collection;
import java.util.List;

/** Read access to the remote system of record. */
public interface SourceClient {

  /** Lists all tables of the source together with their names. */
  List<TableInfo> fetchTables() throws SourceException;

  /** Fetches all records of a table, following pagination. */
  List<CachedRecord> fetchAllRecords(TableInfo table) throws SourceException;

  /**
   * Fetches the records with the given identifiers. Identifiers that do not
   * exist in the source are silently missing from the result.
   */
  List<CachedRecord> fetchRecords(TableInfo table, Collection<String> ids)
      throws SourceException;
}
