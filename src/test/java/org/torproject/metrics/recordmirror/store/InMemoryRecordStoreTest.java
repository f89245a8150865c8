/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class InMemoryRecordStoreTest extends RecordStoreContract {

  @Override
  protected RecordStore newStore() {
    return new InMemoryRecordStore();
  }

  @Test()
  public void testConcurrentWritesToBothSlots() throws Exception {
    RecordStore store = newStore();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    List<Callable<Void>> writes = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      String id = "rec" + i;
      SlotId slot = i % 2 == 0 ? SlotId.A : SlotId.B;
      writes.add(() -> {
        store.setRecordsBatch(slot, "people", Collections.singletonList(
            new CachedRecord(id, fields("n", id))));
        return null;
      });
    }
    for (Future<Void> future : executor.invokeAll(writes)) {
      future.get();
    }
    executor.shutdown();
    assertEquals(100L, store.stats(SlotId.A).getRecords());
    assertEquals(100L, store.stats(SlotId.B).getRecords());
  }
}
