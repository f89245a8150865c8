/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.version;

import org.torproject.metrics.recordmirror.store.SlotId;

import java.io.IOException;

/** Durable single-value cell designating the active slot. */
public interface ActivePointer {

  /** Returns the active slot, or {@link SlotId#A} if none was written. */
  SlotId read() throws IOException;

  /** Replaces the active slot in a single indivisible write. */
  void write(SlotId slot) throws IOException;
}
