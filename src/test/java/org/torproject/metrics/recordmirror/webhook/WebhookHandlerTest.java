/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;

import org.torproject.metrics.recordmirror.cron.RefreshWorker;
import org.torproject.metrics.recordmirror.cron.WorkerMessage;
import org.torproject.metrics.recordmirror.refresh.FullRefreshPipeline;
import org.torproject.metrics.recordmirror.refresh.IncrementalReconciler;
import org.torproject.metrics.recordmirror.refresh.ReconcileStats;
import org.torproject.metrics.recordmirror.refresh.RefreshResult;
import org.torproject.metrics.recordmirror.refresh.TableDiff;
import org.torproject.metrics.recordmirror.store.InMemoryRecordStore;
import org.torproject.metrics.recordmirror.version.InMemoryActivePointer;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

public class WebhookHandlerTest {

  private static final String CHANGES = "{\"webhook\":{\"id\":\"ach1\"},"
      + "\"timestamp\":\"2026-01-01T00:00:00.000Z\",\"payloads\":["
      + "{\"changedTablesById\":{\"tbl1\":{"
      + "\"createdRecordsById\":{\"rec1\":null},"
      + "\"destroyedRecordIds\":[\"rec2\"]}}}]}";

  private FullRefreshPipeline pipeline;

  private IncrementalReconciler reconciler;

  private RefreshWorker worker;

  private WebhookSignature signature;

  private WebhookHandler handler;

  @Before
  public void setUp() throws Exception {
    this.pipeline = mock(FullRefreshPipeline.class);
    this.reconciler = mock(IncrementalReconciler.class);
    given(this.pipeline.run()).willReturn(RefreshResult.skipped());
    given(this.reconciler.reconcile(anyMap())).willReturn(
        new ReconcileStats(1, 1, 0, 1, 0, 0, 1L));
    InMemoryRecordStore store = new InMemoryRecordStore();
    this.worker = new RefreshWorker(this.pipeline, this.reconciler, store,
        new VersionManager(new InMemoryActivePointer(), store));
    this.signature = new WebhookSignature(WebhookSignatureTest.SECRET);
    this.handler = newHandler("ach1");
  }

  private WebhookHandler newHandler(String webhookId) {
    return new WebhookHandler(new WebhookConfig(webhookId,
        WebhookSignatureTest.SECRET, null),
        new NotificationDeduper(Duration.ofMinutes(10L)), this.worker);
  }

  @After
  public void tearDown() {
    this.worker.tell(WorkerMessage.refreshStop());
  }

  private WebhookOutcome handle(WebhookHandler handler, String json) {
    byte[] body = json.getBytes(StandardCharsets.UTF_8);
    return handler.handle(body, this.signature.sign(body));
  }

  @Test()
  @SuppressWarnings("unchecked")
  public void testChangesAreReconciled() throws Exception {
    assertEquals(WebhookOutcome.INCREMENTAL, handle(handler, CHANGES));
    ArgumentCaptor<Map<String, TableDiff>> diffs = ArgumentCaptor.forClass(
        Map.class);
    then(reconciler).should(timeout(5000L)).reconcile(diffs.capture());
    TableDiff diff = diffs.getValue().get("tbl1");
    assertEquals(1, diff.getCreatedIds().size());
    assertEquals(1, diff.getDestroyedIds().size());
    then(pipeline).should(never()).run();
  }

  @Test()
  public void testInvalidSignatureIsRejected() throws Exception {
    byte[] body = CHANGES.getBytes(StandardCharsets.UTF_8);
    assertEquals(WebhookOutcome.REJECTED, handler.handle(body,
        "hmac-sha256=0000"));
    assertEquals(WebhookOutcome.REJECTED, handler.handle(body, null));
    then(reconciler).should(never()).reconcile(anyMap());
  }

  @Test()
  public void testMalformedBodyIsRejected() {
    assertEquals(WebhookOutcome.REJECTED, handle(handler, "{\"payloads\":"));
  }

  @Test()
  public void testOtherWebhookIsRejected() {
    assertEquals(WebhookOutcome.REJECTED,
        handle(newHandler("ach9"), CHANGES));
    assertEquals(WebhookOutcome.INCREMENTAL,
        handle(newHandler(null), CHANGES));
  }

  @Test()
  public void testDuplicateIsIgnored() throws Exception {
    assertEquals(WebhookOutcome.INCREMENTAL, handle(handler, CHANGES));
    assertEquals(WebhookOutcome.DUPLICATE, handle(handler, CHANGES));
    then(reconciler).should(timeout(5000L).times(1)).reconcile(anyMap());
  }

  @Test()
  public void testNoChangesTriggerFullRefresh() throws Exception {
    assertEquals(WebhookOutcome.FULL, handle(handler,
        "{\"webhook\":{\"id\":\"ach1\"},\"timestamp\":\"t2\","
        + "\"payloads\":[{\"changedTablesById\":{\"tbl1\":{}}}]}"));
    then(pipeline).should(timeout(5000L)).run();
    then(reconciler).should(never()).reconcile(anyMap());
  }

  @Test()
  public void testStoppedWorkerRejects() {
    worker.tell(WorkerMessage.refreshStop());
    assertEquals(WebhookOutcome.REJECTED, handle(handler, CHANGES));
  }
}
