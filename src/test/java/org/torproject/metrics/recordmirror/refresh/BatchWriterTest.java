/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;

import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.InMemoryRecordStore;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class BatchWriterTest {

  @Test()
  public void testCleanBatchesAreWrittenAtOnce() throws Exception {
    RecordStore store = spy(new InMemoryRecordStore());
    List<CachedRecord> records = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      records.add(FullRefreshPipelineTest.record("rec" + i, "n" + i));
    }
    BatchWriter.Result result = new BatchWriter(store, 3).write(SlotId.A,
        "people", records);
    assertEquals(7, result.getWritten().size());
    assertEquals(0, result.getErrors());
    then(store).should(times(3)).setRecordsBatch(eq(SlotId.A),
        anyString(), any(Collection.class));
  }

  @Test()
  public void testFailedBatchFallsBackToSingleRecords() throws Exception {
    RecordStore store = new InMemoryRecordStore();
    Map<String, Object> broken = new HashMap<>();
    broken.put("value", new StringBuilder("not json"));
    List<CachedRecord> records = new ArrayList<>();
    records.add(FullRefreshPipelineTest.record("rec1", "a"));
    records.add(new CachedRecord("rec2", broken));
    records.add(FullRefreshPipelineTest.record("rec3", "c"));
    records.add(FullRefreshPipelineTest.record("rec4", "d"));
    BatchWriter.Result result = new BatchWriter(store, 2).write(SlotId.A,
        "people", records);
    assertEquals(3, result.getWritten().size());
    assertFalse(result.getWritten().contains("rec2"));
    assertEquals(1, result.getErrors());
    assertTrue(store.getRecord(SlotId.A, "people", "rec1").isPresent());
    assertTrue(store.getRecord(SlotId.A, "people", "rec4").isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidBatchSize() {
    new BatchWriter(new InMemoryRecordStore(), 0);
  }
}
