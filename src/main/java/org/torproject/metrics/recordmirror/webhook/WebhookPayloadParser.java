/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import org.torproject.metrics.recordmirror.refresh.TableDiff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses webhook notification bodies. Changes are either contained in a
 * {@code payloads} array, whose elements are merged in order, or given
 * directly in a top-level {@code changedTablesById} object:
 *
 * <pre>
 * {"webhookId": "ach1", "timestamp": "...",
 *  "payloads": [{"changedTablesById": {"tbl1": {
 *    "createdRecordsById": {"rec1": null},
 *    "changedRecordsById": {"rec3": null},
 *    "destroyedRecordIds": ["rec2"]}}}]}
 * </pre>
 */
public class WebhookPayloadParser {

  private static ObjectMapper objectMapper = new ObjectMapper();

  /**
   * Parses the given body.
   *
   * @throws IOException if the body is not a JSON object.
   */
  public WebhookNotification parse(byte[] body) throws IOException {
    JsonNode root = objectMapper.readTree(body);
    if (null == root || !root.isObject()) {
      throw new IOException("Webhook notification is not a JSON object.");
    }
    String webhookId = root.hasNonNull("webhookId")
        ? root.get("webhookId").asText()
        : root.path("webhook").path("id").asText(null);
    String timestamp = root.path("timestamp").asText(null);
    Map<String, TableDiff> diffs = new LinkedHashMap<>();
    if (root.path("payloads").isArray()) {
      for (JsonNode payload : root.get("payloads")) {
        mergeTables(diffs, payload.path("changedTablesById"));
      }
    }
    if (diffs.isEmpty()) {
      mergeTables(diffs, root.path("changedTablesById"));
    }
    return new WebhookNotification(webhookId, timestamp, diffs);
  }

  private static void mergeTables(Map<String, TableDiff> diffs,
      JsonNode changedTables) {
    Iterator<Map.Entry<String, JsonNode>> tables = changedTables.fields();
    while (tables.hasNext()) {
      Map.Entry<String, JsonNode> table = tables.next();
      TableDiff diff = new TableDiff(
          fieldNames(table.getValue().path("createdRecordsById")),
          fieldNames(table.getValue().path("changedRecordsById")),
          textValues(table.getValue().path("destroyedRecordIds")));
      diffs.merge(table.getKey(), diff, TableDiff::merge);
    }
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }

  private static List<String> textValues(JsonNode node) {
    List<String> values = new ArrayList<>();
    for (JsonNode value : node) {
      if (value.isTextual()) {
        values.add(value.asText());
      }
    }
    return values;
  }
}
