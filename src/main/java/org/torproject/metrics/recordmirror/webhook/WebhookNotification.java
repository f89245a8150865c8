/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import org.torproject.metrics.recordmirror.refresh.TableDiff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Parsed webhook notification. */
public final class WebhookNotification {

  private final String webhookId;

  private final String timestamp;

  private final Map<String, TableDiff> changedTables;

  /** Creates a notification, copying the given diffs. */
  public WebhookNotification(String webhookId, String timestamp,
      Map<String, TableDiff> changedTables) {
    this.webhookId = webhookId;
    this.timestamp = timestamp;
    this.changedTables = Collections.unmodifiableMap(
        new LinkedHashMap<>(changedTables));
  }

  /** Returns the sending webhook's identifier, or {@code null}. */
  public String getWebhookId() {
    return webhookId;
  }

  /** Returns the notification timestamp as sent, or {@code null}. */
  public String getTimestamp() {
    return timestamp;
  }

  /** Returns diffs keyed by external table identifier. */
  public Map<String, TableDiff> getChangedTables() {
    return changedTables;
  }

  /**
   * Returns the key identifying this notification for deduplication, or
   * {@code null} if it carries no webhook identifier.
   */
  public String dedupKey() {
    if (null == webhookId) {
      return null;
    }
    return null == timestamp ? webhookId : webhookId + "@" + timestamp;
  }
}
