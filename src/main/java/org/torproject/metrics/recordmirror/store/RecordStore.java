/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Slot-partitioned storage of records, their attachments, and the table
 * mapping.
 *
 * <p>Records and attachments always live in exactly one slot, whereas the
 * table mapping is shared by both slots. Writes in a slot are visible to
 * subsequent reads of the same slot.</p>
 */
public interface RecordStore {

  /** Returns the record with the given identifier, if present. */
  Optional<CachedRecord> getRecord(SlotId slot, String table, String id)
      throws StoreException;

  /** Returns all records of a table, ordered by identifier. */
  List<CachedRecord> listRecords(SlotId slot, String table)
      throws StoreException;

  /**
   * Writes a single record, replacing an existing record with the same
   * identifier and its attachments.
   */
  void setRecord(SlotId slot, String table, String id,
      Map<String, Object> fields) throws StoreException;

  /**
   * Writes a batch of records. All records are validated before the first
   * write, so that a single malformed record fails the whole batch without
   * side effects.
   */
  void setRecordsBatch(SlotId slot, String table,
      Collection<CachedRecord> records) throws StoreException;

  /**
   * Deletes a record and its attachments.
   *
   * @return {@code true} if a record was deleted.
   */
  boolean deleteRecord(SlotId slot, String table, String id)
      throws StoreException;

  /** Returns the normalized names of all tables with records. */
  List<String> listTables(SlotId slot) throws StoreException;

  /** Returns counts for the given slot. */
  StoreStats stats(SlotId slot) throws StoreException;

  /** Deletes all records and attachments of a slot. */
  void clearSlot(SlotId slot) throws StoreException;

  /** Returns attachments not yet downloaded, ordered by table and record. */
  List<Attachment> getPendingAttachments(SlotId slot) throws StoreException;

  /** Returns the attachment with the given identifier, if present. */
  Optional<Attachment> getAttachment(SlotId slot, String id)
      throws StoreException;

  /**
   * Marks an attachment as downloaded to the given local path.
   *
   * @throws StoreException if there is no such attachment.
   */
  void markAttachmentDownloaded(SlotId slot, String id, Path localPath,
      long size) throws StoreException;

  /** Inserts or replaces table mappings, keyed by external identifier. */
  void putTableMappings(Collection<TableInfo> tables) throws StoreException;

  /**
   * Replaces the whole table mapping with the given tables, dropping
   * mappings of tables that are not among them.
   */
  void replaceTableMappings(Collection<TableInfo> tables)
      throws StoreException;

  /** Resolves an external table identifier. */
  Optional<TableInfo> findTableMapping(String externalId)
      throws StoreException;

  /** Returns all known table mappings ordered by display name. */
  List<TableInfo> listTableMappings() throws StoreException;
}
