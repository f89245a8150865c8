/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import org.torproject.metrics.recordmirror.cron.RefreshWorker;
import org.torproject.metrics.recordmirror.cron.WorkerMessage;
import org.torproject.metrics.recordmirror.cron.WorkerReply;
import org.torproject.metrics.recordmirror.refresh.FullRefreshPipeline;
import org.torproject.metrics.recordmirror.refresh.IncrementalReconciler;
import org.torproject.metrics.recordmirror.refresh.RefreshResult;
import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.InMemoryRecordStore;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.TableInfo;
import org.torproject.metrics.recordmirror.version.InMemoryActivePointer;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class CacheQueryServiceTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private RecordStore store;

  private VersionManager versions;

  private FullRefreshPipeline pipeline;

  private RefreshWorker worker;

  private CacheQueryService service;

  @Before
  public void setUp() {
    this.store = new InMemoryRecordStore();
    this.versions = new VersionManager(new InMemoryActivePointer(),
        this.store);
    this.pipeline = mock(FullRefreshPipeline.class);
    this.worker = new RefreshWorker(this.pipeline,
        mock(IncrementalReconciler.class), this.store, this.versions);
    this.service = new CacheQueryService(this.store, this.versions,
        this.worker);
  }

  @After
  public void tearDown() {
    this.worker.tell(WorkerMessage.refreshStop());
  }

  @Test()
  public void testReadsActiveSlotOnly() throws Exception {
    store.setRecord(SlotId.A, "people", "rec1",
        Collections.<String, Object>singletonMap("name", "Alice"));
    store.setRecord(SlotId.B, "people", "rec1",
        Collections.<String, Object>singletonMap("name", "Alicia"));
    store.setRecord(SlotId.B, "places", "rec2",
        Collections.<String, Object>singletonMap("name", "Oslo"));
    assertEquals(Collections.singletonList("people"), service.listTables());
    Optional<CachedRecord> record = service.getRecord("People", "rec1");
    assertEquals("Alice", record.get().getFields().get("name"));
    versions.flip();
    assertEquals(2, service.listTables().size());
    assertEquals("Alicia", service.getRecord("people", "rec1").get()
        .getFields().get("name"));
    assertEquals(1, service.listRecords("Places").size());
    assertFalse(service.getRecord("people", "rec9").isPresent());
    assertEquals(SlotId.B, service.stats().getSlot());
    assertEquals(2L, service.stats().getRecords());
  }

  @Test()
  public void testTableMappings() throws Exception {
    store.putTableMappings(Collections.singletonList(
        TableInfo.of("tbl1", "People")));
    assertEquals("people", service.listTableMappings().get(0)
        .getNormalizedName());
  }

  @Test()
  public void testOnlyDownloadedAttachmentsAreServed() throws Exception {
    Map<String, Object> file = new LinkedHashMap<>();
    file.put("url", "https://files/a");
    file.put("filename", "a.txt");
    file.put("size", 1L);
    store.setRecord(SlotId.A, "docs", "rec1", Collections
        .<String, Object>singletonMap("files",
            Collections.singletonList(file)));
    assertFalse(service.getAttachment("rec1_files_0").isPresent());
    Path local = tmpf.newFile("a.txt").toPath();
    Files.write(local, new byte[] { 'a' });
    store.markAttachmentDownloaded(SlotId.A, "rec1_files_0", local, 1L);
    assertTrue(service.getAttachment("rec1_files_0").isPresent());
    Files.delete(local);
    assertFalse(service.getAttachment("rec1_files_0").isPresent());
    assertFalse(service.getAttachment("unknown").isPresent());
  }

  @Test()
  public void testTriggerRefresh() throws Exception {
    given(pipeline.run()).willReturn(RefreshResult.skipped());
    assertEquals(WorkerReply.Kind.REFRESHED,
        service.triggerRefresh().get().getKind());
  }
}
