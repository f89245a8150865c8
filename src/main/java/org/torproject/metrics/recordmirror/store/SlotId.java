/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import java.util.Locale;

/**
 * The two physical storage slots. Exactly one of them answers reads at any
 * time, while the other one is left alone, rebuilt, or waiting to be
 * published.
 */
public enum SlotId {

  A,
  B;

  /** Returns the complement of this slot. */
  public SlotId other() {
    return this == A ? B : A;
  }

  /** Directory or key fragment used by persistent backends. */
  public String marker() {
    return "slot-" + this.name().toLowerCase(Locale.US);
  }

  /**
   * Parses a slot identifier as written by {@link #name()}, ignoring
   * surrounding whitespace and case.
   *
   * @throws IllegalArgumentException if the value names no slot.
   */
  public static SlotId parse(String value) {
    if (null == value) {
      throw new IllegalArgumentException("No slot identifier given.");
    }
    return SlotId.valueOf(value.trim().toUpperCase());
  }
}
