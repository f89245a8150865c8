/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.version;

import org.torproject.metrics.recordmirror.store.SlotId;

import java.util.concurrent.atomic.AtomicReference;

public class InMemoryActivePointer implements ActivePointer {

  private final AtomicReference<SlotId> active =
      new AtomicReference<>(SlotId.A);

  @Override
  public SlotId read() {
    return this.active.get();
  }

  @Override
  public void write(SlotId slot) {
    this.active.set(slot);
  }
}
