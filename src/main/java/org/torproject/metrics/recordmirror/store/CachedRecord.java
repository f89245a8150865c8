/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record as delivered by the source: a stable identifier and a mapping from
 * field names to scalar, list, or attachment values.
 *
 * <p>Instances are not validated on construction; stores reject malformed
 * records when they are written.</p>
 */
@JsonPropertyOrder({ "id", "fields" })
public final class CachedRecord {

  @JsonProperty("id")
  private final String id;

  @JsonProperty("fields")
  private final Map<String, Object> fields;

  /** Creates a record, copying the given fields if there are any. */
  @JsonCreator
  public CachedRecord(@JsonProperty("id") String id,
      @JsonProperty("fields") Map<String, Object> fields) {
    this.id = id;
    this.fields = null == fields ? null
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String getId() {
    return id;
  }

  /** Returns the unmodifiable fields, or {@code null} if none were given. */
  public Map<String, Object> getFields() {
    return fields;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CachedRecord)) {
      return false;
    }
    CachedRecord that = (CachedRecord) other;
    return Objects.equals(this.id, that.id)
        && Objects.equals(this.fields, that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, fields);
  }

  @Override
  public String toString() {
    return "CachedRecord[" + id + ", " + fields + "]";
  }
}
