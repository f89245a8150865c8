/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.recordmirror.source.FakeSourceClient;
import org.torproject.metrics.recordmirror.source.SourceException;
import org.torproject.metrics.recordmirror.store.InMemoryRecordStore;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.TableInfo;

import org.junit.Test;

import java.util.Collections;

public class SchemaSyncTest {

  @Test()
  public void testSyncStoresMapping() throws Exception {
    RecordStore store = new InMemoryRecordStore();
    FakeSourceClient source = new FakeSourceClient()
        .table(TableInfo.of("tblPeople", "People"));
    assertEquals(1, new SchemaSync(source, store).sync().size());
    assertEquals("people", store.findTableMapping("tblPeople").get()
        .getNormalizedName());
  }

  @Test(expected = SourceException.class)
  public void testSyncFailure() throws Exception {
    FakeSourceClient source = new FakeSourceClient();
    source.failTables();
    new SchemaSync(source, new InMemoryRecordStore()).sync();
  }

  @Test()
  public void testFallbackToStoredMapping() throws Exception {
    RecordStore store = new InMemoryRecordStore();
    store.putTableMappings(Collections.singletonList(
        TableInfo.of("tblOld", "Old Table")));
    FakeSourceClient source = new FakeSourceClient();
    source.failTables();
    assertEquals(Collections.singletonList(TableInfo.of("tblOld",
        "Old Table")), new SchemaSync(source, store).syncOrStored());
  }

  @Test()
  public void testEmptySource() throws Exception {
    assertTrue(new SchemaSync(new FakeSourceClient(),
        new InMemoryRecordStore()).syncOrStored().isEmpty());
  }
}
