/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.conf;

/** Backends available for records, the active pointer, and locks. */
public enum StoreType {
  Memory,
  File
}
