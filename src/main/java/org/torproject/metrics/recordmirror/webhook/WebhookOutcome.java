/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

/** How a webhook notification was handled. */
public enum WebhookOutcome {

  /** Bad signature, unknown webhook, malformed body, or stopped worker. */
  REJECTED,

  /** Already handled within the deduplication window. */
  DUPLICATE,

  /** Record changes were handed over for incremental reconciliation. */
  INCREMENTAL,

  /** No record changes were given, so a full refresh was requested. */
  FULL
}
