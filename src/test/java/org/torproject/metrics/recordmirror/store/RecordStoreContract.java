/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Behavior shared by all {@link RecordStore} backends; subclasses provide
 * the store under test.
 */
public abstract class RecordStoreContract {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  protected abstract RecordStore newStore() throws Exception;

  static Map<String, Object> fields(Object... keysAndValues) {
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      fields.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return fields;
  }

  static Map<String, Object> file(String url, String filename, long size) {
    Map<String, Object> file = new LinkedHashMap<>();
    file.put("url", url);
    file.put("filename", filename);
    file.put("size", size);
    return file;
  }

  @Test()
  public void testSetAndGetRecord() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("name", "Alice"));
    Optional<CachedRecord> record = store.getRecord(SlotId.A, "people",
        "rec1");
    assertTrue(record.isPresent());
    assertEquals("Alice", record.get().getFields().get("name"));
    assertFalse(store.getRecord(SlotId.B, "people", "rec1").isPresent());
    assertFalse(store.getRecord(SlotId.A, "people", "rec2").isPresent());
  }

  @Test()
  public void testUpsertReplacesFields() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("name", "Alice",
        "city", "Oslo"));
    store.setRecord(SlotId.A, "people", "rec1", fields("name", "Bob"));
    Map<String, Object> stored = store.getRecord(SlotId.A, "people", "rec1")
        .get().getFields();
    assertEquals(Collections.singletonMap("name", "Bob"), stored);
  }

  @Test()
  public void testListRecordsSorted() throws Exception {
    RecordStore store = newStore();
    store.setRecordsBatch(SlotId.A, "people", Arrays.asList(
        new CachedRecord("rec3", fields("n", "c")),
        new CachedRecord("rec1", fields("n", "a")),
        new CachedRecord("rec2", fields("n", "b"))));
    List<String> ids = new ArrayList<>();
    for (CachedRecord record : store.listRecords(SlotId.A, "people")) {
      ids.add(record.getId());
    }
    assertEquals(Arrays.asList("rec1", "rec2", "rec3"), ids);
    assertTrue(store.listRecords(SlotId.A, "unknown").isEmpty());
  }

  @Test()
  public void testInvalidRecordFailsWholeBatch() throws Exception {
    RecordStore store = newStore();
    Map<String, Object> broken = new HashMap<>();
    broken.put("when", new Object());
    try {
      store.setRecordsBatch(SlotId.A, "people", Arrays.asList(
          new CachedRecord("rec1", fields("n", "a")),
          new CachedRecord("rec2", broken)));
      fail("Should have rejected the batch.");
    } catch (StoreException e) {
      assertTrue(store.listRecords(SlotId.A, "people").isEmpty());
    }
  }

  @Test(expected = StoreException.class)
  public void testRecordWithoutId() throws Exception {
    newStore().setRecordsBatch(SlotId.A, "people", Collections.singletonList(
        new CachedRecord(" ", fields("n", "a"))));
  }

  @Test(expected = StoreException.class)
  public void testRecordWithoutFields() throws Exception {
    newStore().setRecordsBatch(SlotId.A, "people", Collections.singletonList(
        new CachedRecord("rec1", null)));
  }

  @Test(expected = StoreException.class)
  public void testInvalidTableName() throws Exception {
    newStore().setRecord(SlotId.A, "../people", "rec1", fields("n", "a"));
  }

  @Test()
  public void testDeleteRecord() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("n", "a"));
    assertTrue(store.deleteRecord(SlotId.A, "people", "rec1"));
    assertFalse(store.deleteRecord(SlotId.A, "people", "rec1"));
    assertFalse(store.getRecord(SlotId.A, "people", "rec1").isPresent());
    assertTrue(store.listTables(SlotId.A).isEmpty());
  }

  @Test()
  public void testListTablesAndStats() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("n", "a"));
    store.setRecord(SlotId.A, "people", "rec2", fields("files",
        Collections.singletonList(file("https://x/a.pdf", "a.pdf", 10L))));
    store.setRecord(SlotId.A, "places", "rec3", fields("n", "c"));
    assertEquals(Arrays.asList("people", "places"),
        store.listTables(SlotId.A));
    StoreStats stats = store.stats(SlotId.A);
    assertEquals(SlotId.A, stats.getSlot());
    assertEquals(2, stats.getTables());
    assertEquals(3L, stats.getRecords());
    assertEquals(1L, stats.getAttachments());
    assertEquals(1L, stats.getPendingAttachments());
    assertEquals(0, store.stats(SlotId.B).getTables());
  }

  @Test()
  public void testClearSlotLeavesOtherSlot() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("n", "a"));
    store.setRecord(SlotId.B, "people", "rec1", fields("n", "b"));
    store.clearSlot(SlotId.B);
    assertTrue(store.listTables(SlotId.B).isEmpty());
    assertEquals("a", store.getRecord(SlotId.A, "people", "rec1").get()
        .getFields().get("n"));
  }

  @Test()
  public void testAttachmentsFollowRecord() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("files", Arrays.asList(
        file("https://x/a.pdf", "a.pdf", 10L),
        file("https://x/b.pdf", "b.pdf", 20L))));
    List<Attachment> pending = store.getPendingAttachments(SlotId.A);
    assertEquals(2, pending.size());
    assertEquals("rec1_files_0", pending.get(0).getId());
    assertEquals("people", pending.get(0).getTableName());
    assertEquals(10L, pending.get(0).getExpectedSize());
    store.setRecord(SlotId.A, "people", "rec1", fields("files",
        Collections.singletonList(file("https://x/c.pdf", "c.pdf", 30L))));
    pending = store.getPendingAttachments(SlotId.A);
    assertEquals(1, pending.size());
    assertEquals("https://x/c.pdf", pending.get(0).getOriginalUrl());
    assertFalse(store.getAttachment(SlotId.A, "rec1_files_1").isPresent());
    store.deleteRecord(SlotId.A, "people", "rec1");
    assertTrue(store.getPendingAttachments(SlotId.A).isEmpty());
  }

  @Test()
  public void testMarkAttachmentDownloaded() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("files",
        Collections.singletonList(file("https://x/a.pdf", "a.pdf", 3L))));
    Path local = tmpf.newFile("a.pdf").toPath();
    Files.write(local, new byte[] { 1, 2, 3 });
    store.markAttachmentDownloaded(SlotId.A, "rec1_files_0", local, 3L);
    Attachment attachment = store.getAttachment(SlotId.A, "rec1_files_0")
        .get();
    assertTrue(attachment.isDownloaded());
    assertEquals(local, attachment.getLocalPath());
    assertTrue(store.getPendingAttachments(SlotId.A).isEmpty());
    store.setRecord(SlotId.A, "people", "rec1", fields("note", "x", "files",
        Collections.singletonList(file("https://x/a.pdf", "a.pdf", 3L))));
    assertTrue(store.getAttachment(SlotId.A, "rec1_files_0").get()
        .isDownloaded());
    store.setRecord(SlotId.A, "people", "rec1", fields("files",
        Collections.singletonList(file("https://x/new.pdf", "a.pdf", 3L))));
    assertFalse(store.getAttachment(SlotId.A, "rec1_files_0").get()
        .isDownloaded());
  }

  @Test(expected = StoreException.class)
  public void testMarkUnknownAttachment() throws Exception {
    newStore().markAttachmentDownloaded(SlotId.A, "nope",
        tmpf.getRoot().toPath(), 1L);
  }

  @Test()
  public void testTableMappings() throws Exception {
    RecordStore store = newStore();
    store.putTableMappings(Arrays.asList(TableInfo.of("tblB", "Zoo Animals"),
        TableInfo.of("tblA", "Accounts")));
    store.putTableMappings(Collections.singletonList(
        TableInfo.of("tblA", "All Accounts")));
    Optional<TableInfo> mapping = store.findTableMapping("tblB");
    assertTrue(mapping.isPresent());
    assertEquals("zooanimals", mapping.get().getNormalizedName());
    assertFalse(store.findTableMapping("tblC").isPresent());
    List<TableInfo> mappings = store.listTableMappings();
    assertEquals(2, mappings.size());
    assertEquals("All Accounts", mappings.get(0).getDisplayName());
    assertEquals("allaccounts", mappings.get(0).getNormalizedName());
  }

  @Test()
  public void testReplaceTableMappingsDropsRemovedTables() throws Exception {
    RecordStore store = newStore();
    store.putTableMappings(Arrays.asList(TableInfo.of("tblA", "Accounts"),
        TableInfo.of("tblB", "Zoo Animals")));
    store.replaceTableMappings(Arrays.asList(TableInfo.of("tblB", "Zoo"),
        TableInfo.of("tblC", "Clients")));
    assertFalse(store.findTableMapping("tblA").isPresent());
    assertEquals("zoo", store.findTableMapping("tblB").get()
        .getNormalizedName());
    assertEquals(Arrays.asList(TableInfo.of("tblC", "Clients"),
        TableInfo.of("tblB", "Zoo")), store.listTableMappings());
    store.replaceTableMappings(Collections.<TableInfo>emptyList());
    assertTrue(store.listTableMappings().isEmpty());
  }

  @Test()
  public void testRewriteKeepsOtherRecordsAttachments() throws Exception {
    RecordStore store = newStore();
    store.setRecord(SlotId.A, "people", "rec1", fields("files",
        Arrays.asList(file("https://f/1", "a.txt", 1L),
            file("https://f/2", "b.txt", 2L))));
    store.setRecord(SlotId.A, "people", "rec2", fields("files",
        Collections.singletonList(file("https://f/3", "c.txt", 3L))));
    store.setRecord(SlotId.A, "people", "rec1", fields("name", "Alice"));
    assertFalse(store.getAttachment(SlotId.A, "rec1_files_0").isPresent());
    assertFalse(store.getAttachment(SlotId.A, "rec1_files_1").isPresent());
    assertTrue(store.getAttachment(SlotId.A, "rec2_files_0").isPresent());
    store.setRecord(SlotId.A, "people", "rec1", fields("files",
        Collections.singletonList(file("https://f/4", "d.txt", 4L))));
    assertEquals(2L, store.stats(SlotId.A).getAttachments());
    assertTrue(store.deleteRecord(SlotId.A, "people", "rec2"));
    assertFalse(store.getAttachment(SlotId.A, "rec2_files_0").isPresent());
    assertEquals("https://f/4", store.getAttachment(SlotId.A,
        "rec1_files_0").get().getOriginalUrl());
    store.clearSlot(SlotId.A);
    store.setRecord(SlotId.A, "people", "rec1", fields("name", "Bob"));
    assertEquals(0L, store.stats(SlotId.A).getAttachments());
  }
}
