/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.refresh;

/** Phases of a full refresh. */
public enum RefreshState {
  IDLE,
  LOCKING,
  CLEANING,
  FETCHING,
  WRITING,
  ATTACHMENT_SYNC,
  FLIPPING,
  DONE,
  ERROR
}
