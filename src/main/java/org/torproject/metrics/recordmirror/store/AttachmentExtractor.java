/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives attachment rows from record fields. A field contributes one
 * attachment per list element that is an object with a {@code url}, a
 * {@code filename}, and a positive {@code size}.
 */
public final class AttachmentExtractor {

  private AttachmentExtractor() {
  }

  /** Returns all attachments referenced by the given record. */
  public static List<Attachment> extract(String tableName,
      CachedRecord record) {
    List<Attachment> attachments = new ArrayList<>();
    for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
      if (!(field.getValue() instanceof List)) {
        continue;
      }
      List<?> items = (List<?>) field.getValue();
      for (int index = 0; index < items.size(); index++) {
        Object item = items.get(index);
        if (!(item instanceof Map)) {
          continue;
        }
        Map<?, ?> object = (Map<?, ?>) item;
        Object url = object.get("url");
        Object filename = object.get("filename");
        long size = sizeOf(object.get("size"));
        if (url instanceof String && filename instanceof String && size > 0) {
          attachments.add(Attachment.pending(tableName, record.getId(),
              field.getKey(), index, (String) url, (String) filename, size));
        }
      }
    }
    return attachments;
  }

  private static long sizeOf(Object size) {
    if (size instanceof Number) {
      return ((Number) size).longValue();
    }
    return -1L;
  }
}
