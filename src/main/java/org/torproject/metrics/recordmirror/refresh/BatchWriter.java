/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

import org.torproject.metrics.recordmirror.store.CachedRecord;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes records in batches and falls back to writing the records of a
 * failed batch one by one, so that a malformed record only costs itself.
 */
class BatchWriter {

  private static final Logger logger = LoggerFactory.getLogger(
      BatchWriter.class);

  /** Identifiers written and number of records that could not be written. */
  static final class Result {

    private final Set<String> written;

    private final int errors;

    private Result(Set<String> written, int errors) {
      this.written = Collections.unmodifiableSet(written);
      this.errors = errors;
    }

    Set<String> getWritten() {
      return written;
    }

    int getErrors() {
      return errors;
    }
  }

  private final RecordStore store;

  private final int batchSize;

  BatchWriter(RecordStore store, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive, but "
          + "is " + batchSize + ".");
    }
    this.store = store;
    this.batchSize = batchSize;
  }

  /**
   * Writes the given records.
   *
   * @throws StoreUnavailableException if the store cannot be reached.
   */
  Result write(SlotId slot, String table, List<CachedRecord> records)
      throws StoreUnavailableException {
    Set<String> written = new HashSet<>();
    int errors = 0;
    for (int start = 0; start < records.size(); start += this.batchSize) {
      List<CachedRecord> batch = new ArrayList<>(records.subList(start,
          Math.min(start + this.batchSize, records.size())));
      try {
        this.store.setRecordsBatch(slot, table, batch);
        for (CachedRecord record : batch) {
          written.add(record.getId());
        }
        logger.debug("Wrote batch of {} record(s) to {}.", batch.size(),
            table);
        continue;
      } catch (StoreUnavailableException e) {
        throw e;
      } catch (StoreException e) {
        logger.warn("Batch write to {} failed, writing {} record(s) one by "
            + "one: {}", table, batch.size(), e.getMessage());
      }
      for (CachedRecord record : batch) {
        try {
          this.store.setRecordsBatch(slot, table,
              Collections.singletonList(record));
          written.add(record.getId());
        } catch (StoreUnavailableException e) {
          throw e;
        } catch (StoreException e) {
          logger.warn("Cannot write record {} to {}: {}", record.getId(),
              table, e.getMessage());
          errors++;
        }
      }
    }
    return new Result(written, errors);
  }
}
