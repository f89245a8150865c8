/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Record store keeping both slots in concurrent maps. Contents are lost when
 * the process terminates.
 */
public class InMemoryRecordStore extends AbstractRecordStore {

  private static final class Slot {

    private final ConcurrentMap<String, ConcurrentMap<String, CachedRecord>>
        tables = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, Attachment> attachments =
        new ConcurrentHashMap<>();

    /* Attachment ids by "table/recordId", guarded by the slot monitor. */
    private final Map<String, Set<String>> attachmentsByRecord =
        new HashMap<>();
  }

  private final Map<SlotId, Slot> slots = new EnumMap<>(SlotId.class);

  private final ConcurrentMap<String, TableInfo> mappings =
      new ConcurrentHashMap<>();

  /** Creates an empty store. */
  public InMemoryRecordStore() {
    for (SlotId slotId : SlotId.values()) {
      this.slots.put(slotId, new Slot());
    }
  }

  @Override
  public Optional<CachedRecord> getRecord(SlotId slot, String table,
      String id) {
    Map<String, CachedRecord> records = this.slots.get(slot).tables.get(table);
    return null == records ? Optional.empty()
        : Optional.ofNullable(records.get(id));
  }

  @Override
  public List<CachedRecord> listRecords(SlotId slot, String table) {
    List<CachedRecord> result = new ArrayList<>();
    Map<String, CachedRecord> records = this.slots.get(slot).tables.get(table);
    if (null != records) {
      result.addAll(records.values());
      result.sort(Comparator.comparing(CachedRecord::getId));
    }
    return result;
  }

  @Override
  protected void writeRecord(SlotId slot, String table, CachedRecord record,
      List<Attachment> attachments) {
    Slot data = this.slots.get(slot);
    synchronized (data) {
      data.tables.computeIfAbsent(table, t -> new ConcurrentHashMap<>())
          .put(record.getId(), record);
      removeAttachments(data, table, record.getId());
      Set<String> ids = new HashSet<>();
      for (Attachment attachment : attachments) {
        data.attachments.put(attachment.getId(), attachment);
        ids.add(attachment.getId());
      }
      if (!ids.isEmpty()) {
        data.attachmentsByRecord.put(recordKey(table, record.getId()), ids);
      }
    }
  }

  @Override
  public boolean deleteRecord(SlotId slot, String table, String id) {
    Slot data = this.slots.get(slot);
    synchronized (data) {
      Map<String, CachedRecord> records = data.tables.get(table);
      if (null == records || null == records.remove(id)) {
        return false;
      }
      if (records.isEmpty()) {
        data.tables.remove(table);
      }
      removeAttachments(data, table, id);
      return true;
    }
  }

  private static void removeAttachments(Slot data, String table,
      String recordId) {
    Set<String> ids = data.attachmentsByRecord.remove(
        recordKey(table, recordId));
    if (null != ids) {
      data.attachments.keySet().removeAll(ids);
    }
  }

  private static String recordKey(String table, String recordId) {
    return table + "/" + recordId;
  }

  @Override
  public List<String> listTables(SlotId slot) {
    List<String> tables = new ArrayList<>(this.slots.get(slot).tables.keySet());
    tables.sort(Comparator.naturalOrder());
    return tables;
  }

  @Override
  public StoreStats stats(SlotId slot) {
    Slot data = this.slots.get(slot);
    long records = 0L;
    for (Map<String, CachedRecord> table : data.tables.values()) {
      records += table.size();
    }
    long pending = data.attachments.values().stream()
        .filter(a -> !a.isDownloaded()).count();
    return new StoreStats(slot, data.tables.size(), records,
        data.attachments.size(), pending);
  }

  @Override
  public void clearSlot(SlotId slot) {
    Slot data = this.slots.get(slot);
    synchronized (data) {
      data.tables.clear();
      data.attachments.clear();
      data.attachmentsByRecord.clear();
    }
  }

  @Override
  public List<Attachment> getPendingAttachments(SlotId slot) {
    List<Attachment> pending = new ArrayList<>();
    for (Attachment attachment : this.slots.get(slot).attachments.values()) {
      if (!attachment.isDownloaded()) {
        pending.add(attachment);
      }
    }
    pending.sort(Comparator.comparing(Attachment::getTableName)
        .thenComparing(Attachment::getRecordId)
        .thenComparing(Attachment::getId));
    return pending;
  }

  @Override
  public Optional<Attachment> getAttachment(SlotId slot, String id) {
    return Optional.ofNullable(this.slots.get(slot).attachments.get(id));
  }

  @Override
  public void markAttachmentDownloaded(SlotId slot, String id,
      Path localPath, long size) throws StoreException {
    Attachment updated = this.slots.get(slot).attachments.computeIfPresent(id,
        (key, attachment) -> attachment.withDownload(localPath, size));
    if (null == updated) {
      throw new StoreException("No attachment " + id + " in slot " + slot
          + ".");
    }
  }

  @Override
  public void putTableMappings(Collection<TableInfo> tables) {
    for (TableInfo table : tables) {
      this.mappings.put(table.getExternalId(), table);
    }
  }

  @Override
  public void replaceTableMappings(Collection<TableInfo> tables) {
    synchronized (this.mappings) {
      Set<String> keep = new HashSet<>();
      for (TableInfo table : tables) {
        keep.add(table.getExternalId());
        this.mappings.put(table.getExternalId(), table);
      }
      this.mappings.keySet().retainAll(keep);
    }
  }

  @Override
  public Optional<TableInfo> findTableMapping(String externalId) {
    return Optional.ofNullable(this.mappings.get(externalId));
  }

  @Override
  public List<TableInfo> listTableMappings() {
    List<TableInfo> tables = new ArrayList<>(this.mappings.values());
    tables.sort(Comparator.comparing(TableInfo::getDisplayName));
    return tables;
  }
}
