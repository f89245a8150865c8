/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import org.torproject.metrics.recordmirror.persist.PersistenceUtils;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Record store keeping one JSON document per record, attachment, and table
 * mapping below a root directory:
 *
 * <pre>
 * root/mappings/{externalId}.json
 * root/slot-a/records/{table}/{recordId}.json
 * root/slot-a/attachments/{attachmentId}.json
 * root/slot-b/...
 * </pre>
 *
 * <p>Every document is written to a temporary file first and then moved into
 * place, so that concurrent readers never see partial documents. Writers
 * within this process are serialized per slot.</p>
 */
public class FileRecordStore extends AbstractRecordStore {

  private static final Logger logger = LoggerFactory.getLogger(
      FileRecordStore.class);

  private static final String JSON_SUFFIX = ".json";

  private static final String RECORDS = "records";

  private static final String ATTACHMENTS = "attachments";

  private static final String MAPPINGS = "mappings";

  private static ObjectMapper objectMapper = new ObjectMapper()
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  private final Path root;

  private final Map<SlotId, Object> slotLocks = new EnumMap<>(SlotId.class);

  private final Object mappingsLock = new Object();

  /**
   * Opens the store at the given root directory, creating it if needed and
   * removing leftovers of interrupted writes.
   *
   * @throws StoreUnavailableException if the root cannot be prepared.
   */
  public FileRecordStore(Path root) throws StoreUnavailableException {
    this.root = root;
    for (SlotId slot : SlotId.values()) {
      this.slotLocks.put(slot, new Object());
    }
    try {
      Files.createDirectories(root);
      PersistenceUtils.cleanDirectory(root);
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot open record store at "
          + root + ".", e);
    }
    logger.info("Opened file record store at {}.", root);
  }

  private void checkAvailable() throws StoreUnavailableException {
    if (!Files.isDirectory(this.root) || !Files.isWritable(this.root)) {
      throw new StoreUnavailableException("Record store at " + this.root
          + " is not accessible.");
    }
  }

  private static String fileName(String key) {
    return URLEncoder.encode(key, StandardCharsets.UTF_8) + JSON_SUFFIX;
  }

  private static String keyOf(Path file) {
    String name = file.getFileName().toString();
    return URLDecoder.decode(name.substring(0,
        name.length() - JSON_SUFFIX.length()), StandardCharsets.UTF_8);
  }

  private Path slotPath(SlotId slot) {
    return this.root.resolve(slot.marker());
  }

  private Path tablePath(SlotId slot, String table) {
    return this.slotPath(slot).resolve(RECORDS).resolve(table);
  }

  private Path recordPath(SlotId slot, String table, String id) {
    return this.tablePath(slot, table).resolve(fileName(id));
  }

  private Path attachmentsPath(SlotId slot) {
    return this.slotPath(slot).resolve(ATTACHMENTS);
  }

  private Path attachmentPath(SlotId slot, String id) {
    return this.attachmentsPath(slot).resolve(fileName(id));
  }

  private Path mappingsPath() {
    return this.root.resolve(MAPPINGS);
  }

  private static <T> Optional<T> read(Path path, Class<T> clazz)
      throws StoreException {
    try {
      return Optional.of(objectMapper.readValue(Files.readAllBytes(path),
          clazz));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StoreException("Cannot read " + path + ".", e);
    }
  }

  private static void write(Path path, Object value) throws StoreException {
    try {
      PersistenceUtils.storeAtomically(objectMapper.writeValueAsBytes(value),
          path);
    } catch (IOException e) {
      throw new StoreException("Cannot write " + path + ".", e);
    }
  }

  private static void delete(Path path) throws StoreException {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new StoreException("Cannot delete " + path + ".", e);
    }
  }

  /** Lists JSON documents in a directory, ignoring temporary files. */
  private static List<Path> listDocuments(Path directory)
      throws StoreException {
    if (!Files.isDirectory(directory)) {
      return new ArrayList<>();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(f -> f.getFileName().toString()
          .endsWith(JSON_SUFFIX)).sorted().collect(Collectors.toList());
    } catch (NoSuchFileException e) {
      return new ArrayList<>();
    } catch (IOException e) {
      throw new StoreException("Cannot list " + directory + ".", e);
    }
  }

  @Override
  public Optional<CachedRecord> getRecord(SlotId slot, String table,
      String id) throws StoreException {
    this.checkAvailable();
    checkTableName(table);
    return read(this.recordPath(slot, table, id), CachedRecord.class);
  }

  @Override
  public List<CachedRecord> listRecords(SlotId slot, String table)
      throws StoreException {
    this.checkAvailable();
    checkTableName(table);
    List<CachedRecord> records = new ArrayList<>();
    for (Path file : listDocuments(this.tablePath(slot, table))) {
      read(file, CachedRecord.class).ifPresent(records::add);
    }
    records.sort(Comparator.comparing(CachedRecord::getId));
    return records;
  }

  @Override
  protected void writeRecord(SlotId slot, String table, CachedRecord record,
      List<Attachment> attachments) throws StoreException {
    this.checkAvailable();
    Path recordPath = this.recordPath(slot, table, record.getId());
    synchronized (this.slotLocks.get(slot)) {
      Optional<CachedRecord> previous = read(recordPath, CachedRecord.class);
      write(recordPath, record);
      Set<String> keep = new HashSet<>();
      for (Attachment attachment : attachments) {
        write(this.attachmentPath(slot, attachment.getId()), attachment);
        keep.add(attachment.getId());
      }
      if (previous.isPresent()) {
        for (Attachment old
            : AttachmentExtractor.extract(table, previous.get())) {
          if (!keep.contains(old.getId())) {
            delete(this.attachmentPath(slot, old.getId()));
          }
        }
      }
    }
  }

  @Override
  public boolean deleteRecord(SlotId slot, String table, String id)
      throws StoreException {
    this.checkAvailable();
    checkTableName(table);
    Path recordPath = this.recordPath(slot, table, id);
    synchronized (this.slotLocks.get(slot)) {
      Optional<CachedRecord> previous = read(recordPath, CachedRecord.class);
      if (!previous.isPresent()) {
        return false;
      }
      for (Attachment old : AttachmentExtractor.extract(table,
          previous.get())) {
        delete(this.attachmentPath(slot, old.getId()));
      }
      delete(recordPath);
      return true;
    }
  }

  @Override
  public List<String> listTables(SlotId slot) throws StoreException {
    this.checkAvailable();
    Path recordsPath = this.slotPath(slot).resolve(RECORDS);
    List<String> tables = new ArrayList<>();
    if (!Files.isDirectory(recordsPath)) {
      return tables;
    }
    try (Stream<Path> directories = Files.list(recordsPath)) {
      for (Path directory : directories.filter(Files::isDirectory)
          .sorted().collect(Collectors.toList())) {
        if (!listDocuments(directory).isEmpty()) {
          tables.add(directory.getFileName().toString());
        }
      }
    } catch (IOException e) {
      throw new StoreException("Cannot list tables in " + recordsPath + ".",
          e);
    }
    return tables;
  }

  @Override
  public StoreStats stats(SlotId slot) throws StoreException {
    List<String> tables = this.listTables(slot);
    long records = 0L;
    for (String table : tables) {
      records += listDocuments(this.tablePath(slot, table)).size();
    }
    long attachments = 0L;
    long pending = 0L;
    for (Path file : listDocuments(this.attachmentsPath(slot))) {
      Optional<Attachment> attachment = read(file, Attachment.class);
      if (attachment.isPresent()) {
        attachments++;
        if (!attachment.get().isDownloaded()) {
          pending++;
        }
      }
    }
    return new StoreStats(slot, tables.size(), records, attachments, pending);
  }

  @Override
  public void clearSlot(SlotId slot) throws StoreException {
    this.checkAvailable();
    synchronized (this.slotLocks.get(slot)) {
      try {
        PersistenceUtils.deleteRecursively(this.slotPath(slot));
      } catch (IOException e) {
        throw new StoreException("Cannot clear slot " + slot + ".", e);
      }
    }
    logger.debug("Cleared slot {} in {}.", slot, this.root);
  }

  @Override
  public List<Attachment> getPendingAttachments(SlotId slot)
      throws StoreException {
    this.checkAvailable();
    List<Attachment> pending = new ArrayList<>();
    for (Path file : listDocuments(this.attachmentsPath(slot))) {
      Optional<Attachment> attachment = read(file, Attachment.class);
      if (attachment.isPresent() && !attachment.get().isDownloaded()) {
        pending.add(attachment.get());
      }
    }
    pending.sort(Comparator.comparing(Attachment::getTableName)
        .thenComparing(Attachment::getRecordId)
        .thenComparing(Attachment::getId));
    return pending;
  }

  @Override
  public Optional<Attachment> getAttachment(SlotId slot, String id)
      throws StoreException {
    this.checkAvailable();
    return read(this.attachmentPath(slot, id), Attachment.class);
  }

  @Override
  public void markAttachmentDownloaded(SlotId slot, String id,
      Path localPath, long size) throws StoreException {
    this.checkAvailable();
    Path path = this.attachmentPath(slot, id);
    synchronized (this.slotLocks.get(slot)) {
      Optional<Attachment> attachment = read(path, Attachment.class);
      if (!attachment.isPresent()) {
        throw new StoreException("No attachment " + id + " in slot " + slot
            + ".");
      }
      write(path, attachment.get().withDownload(localPath, size));
    }
  }

  @Override
  public void putTableMappings(Collection<TableInfo> tables)
      throws StoreException {
    this.checkAvailable();
    synchronized (this.mappingsLock) {
      for (TableInfo table : tables) {
        write(this.mappingsPath().resolve(fileName(table.getExternalId())),
            table);
      }
    }
  }

  @Override
  public void replaceTableMappings(Collection<TableInfo> tables)
      throws StoreException {
    this.checkAvailable();
    synchronized (this.mappingsLock) {
      Set<String> keep = new HashSet<>();
      for (TableInfo table : tables) {
        keep.add(fileName(table.getExternalId()));
        write(this.mappingsPath().resolve(fileName(table.getExternalId())),
            table);
      }
      for (Path file : listDocuments(this.mappingsPath())) {
        if (!keep.contains(file.getFileName().toString())) {
          logger.info("Dropping mapping of removed table {}.", keyOf(file));
          delete(file);
        }
      }
    }
  }

  @Override
  public Optional<TableInfo> findTableMapping(String externalId)
      throws StoreException {
    this.checkAvailable();
    return read(this.mappingsPath().resolve(fileName(externalId)),
        TableInfo.class);
  }

  @Override
  public List<TableInfo> listTableMappings() throws StoreException {
    this.checkAvailable();
    List<TableInfo> tables = new ArrayList<>();
    for (Path file : listDocuments(this.mappingsPath())) {
      Optional<TableInfo> table = read(file, TableInfo.class);
      if (table.isPresent() && table.get().getExternalId().equals(
          keyOf(file))) {
        tables.add(table.get());
      } else {
        logger.warn("Ignoring inconsistent table mapping in {}.", file);
      }
    }
    tables.sort(Comparator.comparing(TableInfo::getDisplayName));
    return tables;
  }
}
