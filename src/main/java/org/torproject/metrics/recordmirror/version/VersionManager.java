/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.version;

import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Owner of the active pointer. Readers always use the active slot, while a
 * full refresh rebuilds the inactive slot and publishes it by flipping the
 * pointer.
 */
public class VersionManager {

  private static final Logger logger = LoggerFactory.getLogger(
      VersionManager.class);

  private final ActivePointer pointer;

  private final RecordStore store;

  public VersionManager(ActivePointer pointer, RecordStore store) {
    this.pointer = pointer;
    this.store = store;
  }

  /**
   * Returns the slot that currently answers reads.
   *
   * @throws StoreUnavailableException if the pointer cannot be read.
   */
  public SlotId getActive() throws StoreUnavailableException {
    try {
      return this.pointer.read();
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot read active pointer.", e);
    }
  }

  public SlotId getInactive() throws StoreUnavailableException {
    return this.getActive().other();
  }

  /** Deletes all records and attachments of the inactive slot. */
  public void clearInactive() throws StoreException {
    SlotId inactive = this.getInactive();
    this.store.clearSlot(inactive);
    logger.info("Cleared inactive slot {}.", inactive);
  }

  /**
   * Makes the inactive slot the active one.
   *
   * @return The new active slot.
   * @throws StoreUnavailableException if the pointer could not be written,
   *     in which case the active slot is unchanged.
   */
  public synchronized SlotId flip() throws StoreUnavailableException {
    SlotId previous = this.getActive();
    SlotId next = previous.other();
    try {
      this.pointer.write(next);
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot flip active slot from "
          + previous + " to " + next + ".", e);
    }
    logger.info("Flipped active slot from {} to {}.", previous, next);
    return next;
  }
}
