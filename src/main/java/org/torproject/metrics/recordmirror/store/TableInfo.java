/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;
import java.util.Objects;

/**
 * Table of the remote source together with the names used to address it,
 * i.e., the external identifier assigned by the source, the name displayed
 * by the source, and the normalized name used as storage key.
 */
@JsonPropertyOrder({ "external_id", "display_name", "normalized_name" })
public final class TableInfo {

  @JsonProperty("external_id")
  private final String externalId;

  @JsonProperty("display_name")
  private final String displayName;

  @JsonProperty("normalized_name")
  private final String normalizedName;

  /** Creates a table description with explicitly given names. */
  @JsonCreator
  public TableInfo(@JsonProperty("external_id") String externalId,
      @JsonProperty("display_name") String displayName,
      @JsonProperty("normalized_name") String normalizedName) {
    this.externalId = Objects.requireNonNull(externalId, "externalId");
    this.displayName = Objects.requireNonNull(displayName, "displayName");
    this.normalizedName = Objects.requireNonNull(normalizedName,
        "normalizedName");
  }

  /** Creates a table description deriving the normalized name. */
  public static TableInfo of(String externalId, String displayName) {
    return new TableInfo(externalId, displayName, normalize(displayName));
  }

  /**
   * Lower-cases the given name and drops everything that is not a letter
   * from a to z or a digit, e.g., {@code "Hello World! 123"} becomes
   * {@code "helloworld123"}.
   */
  public static String normalize(String name) {
    return name.toLowerCase(Locale.US).replaceAll("[^a-z0-9]", "");
  }

  public String getExternalId() {
    return externalId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getNormalizedName() {
    return normalizedName;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TableInfo)) {
      return false;
    }
    TableInfo that = (TableInfo) other;
    return this.externalId.equals(that.externalId)
        && this.displayName.equals(that.displayName)
        && this.normalizedName.equals(that.normalizedName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(externalId, displayName, normalizedName);
  }

  @Override
  public String toString() {
    return externalId + " (" + displayName + " -> " + normalizedName + ")";
  }
}
