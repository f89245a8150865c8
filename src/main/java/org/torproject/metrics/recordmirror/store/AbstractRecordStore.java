/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation and attachment bookkeeping shared by all record store
 * backends. Subclasses only provide the storage primitives.
 */
public abstract class AbstractRecordStore implements RecordStore {

  private static final Logger logger = LoggerFactory.getLogger(
      AbstractRecordStore.class);

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

  @Override
  public void setRecord(SlotId slot, String table, String id,
      Map<String, Object> fields) throws StoreException {
    this.setRecordsBatch(slot, table,
        Collections.singletonList(new CachedRecord(id, fields)));
  }

  @Override
  public void setRecordsBatch(SlotId slot, String table,
      Collection<CachedRecord> records) throws StoreException {
    checkTableName(table);
    for (CachedRecord record : records) {
      checkRecord(table, record);
    }
    for (CachedRecord record : records) {
      List<Attachment> attachments = new ArrayList<>();
      for (Attachment attachment
          : AttachmentExtractor.extract(table, record)) {
        attachments.add(this.carryOverDownload(slot, attachment));
      }
      this.writeRecord(slot, table, record, attachments);
    }
    logger.debug("Wrote {} record(s) to table {} in slot {}.", records.size(),
        table, slot);
  }

  /**
   * Keeps the download state of an attachment that is rewritten with an
   * unchanged URL and whose local file is still complete.
   */
  private Attachment carryOverDownload(SlotId slot, Attachment attachment)
      throws StoreException {
    Optional<Attachment> previous = this.getAttachment(slot,
        attachment.getId());
    if (!previous.isPresent() || !previous.get().isDownloaded()
        || !attachment.getOriginalUrl().equals(
            previous.get().getOriginalUrl())) {
      return attachment;
    }
    Path localPath = previous.get().getLocalPath();
    try {
      if (Files.isRegularFile(localPath)
          && Files.size(localPath) == attachment.getExpectedSize()) {
        return attachment.withDownload(localPath,
            attachment.getExpectedSize());
      }
    } catch (IOException e) {
      logger.debug("Cannot inspect {}, downloading again.", localPath, e);
    }
    return attachment;
  }

  /**
   * Stores the record and replaces all attachments previously stored for
   * it with the given ones.
   */
  protected abstract void writeRecord(SlotId slot, String table,
      CachedRecord record, List<Attachment> attachments)
      throws StoreException;

  /** Rejects table names that cannot serve as storage keys. */
  protected static void checkTableName(String table) throws StoreException {
    if (null == table || !TABLE_NAME.matcher(table).matches()) {
      throw new StoreException("Invalid table name '" + table + "'.");
    }
  }

  /** Rejects records that cannot be stored. */
  protected static void checkRecord(String table, CachedRecord record)
      throws StoreException {
    if (null == record) {
      throw new StoreException("Null record for table " + table + ".");
    }
    if (null == record.getId() || record.getId().trim().isEmpty()) {
      throw new StoreException("Record without id for table " + table + ".");
    }
    if (null == record.getFields()) {
      throw new StoreException("Record " + record.getId() + " in table "
          + table + " has no fields.");
    }
    for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
      if (null == field.getKey() || !isStorable(field.getValue())) {
        throw new StoreException("Record " + record.getId() + " in table "
            + table + " has an unsupported value in field "
            + field.getKey() + ".");
      }
    }
  }

  /** Only JSON-like values are storable. */
  private static boolean isStorable(Object value) {
    if (null == value || value instanceof String || value instanceof Number
        || value instanceof Boolean) {
      return true;
    }
    if (value instanceof List) {
      for (Object item : (List<?>) value) {
        if (!isStorable(item)) {
          return false;
        }
      }
      return true;
    }
    if (value instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        if (!(entry.getKey() instanceof String)
            || !isStorable(entry.getValue())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }
}
