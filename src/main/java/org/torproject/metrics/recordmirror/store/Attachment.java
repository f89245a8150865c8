/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Binary object referenced from a record field, along with its download
 * state.
 */
@JsonPropertyOrder({ "id", "table_name", "record_id", "field_name",
    "original_url", "filename", "size", "local_path", "downloaded" })
public final class Attachment {

  @JsonProperty("id")
  private final String id;

  @JsonProperty("table_name")
  private final String tableName;

  @JsonProperty("record_id")
  private final String recordId;

  @JsonProperty("field_name")
  private final String fieldName;

  @JsonProperty("original_url")
  private final String originalUrl;

  @JsonProperty("filename")
  private final String filename;

  @JsonProperty("size")
  private final long expectedSize;

  @JsonProperty("local_path")
  private final String localPath;

  @JsonProperty("downloaded")
  private final boolean downloaded;

  /** Creates an attachment; used by the JSON mapper and by stores. */
  @JsonCreator
  public Attachment(@JsonProperty("id") String id,
      @JsonProperty("table_name") String tableName,
      @JsonProperty("record_id") String recordId,
      @JsonProperty("field_name") String fieldName,
      @JsonProperty("original_url") String originalUrl,
      @JsonProperty("filename") String filename,
      @JsonProperty("size") long expectedSize,
      @JsonProperty("local_path") String localPath,
      @JsonProperty("downloaded") boolean downloaded) {
    this.id = id;
    this.tableName = tableName;
    this.recordId = recordId;
    this.fieldName = fieldName;
    this.originalUrl = originalUrl;
    this.filename = filename;
    this.expectedSize = expectedSize;
    this.localPath = localPath;
    this.downloaded = downloaded;
  }

  /** Creates an attachment that has not been downloaded yet. */
  public static Attachment pending(String tableName, String recordId,
      String fieldName, int index, String originalUrl, String filename,
      long expectedSize) {
    return new Attachment(attachmentId(recordId, fieldName, index), tableName,
        recordId, fieldName, originalUrl, filename, expectedSize, null,
        false);
  }

  /** Returns the deterministic attachment identifier. */
  public static String attachmentId(String recordId, String fieldName,
      int index) {
    return recordId + "_" + fieldName + "_" + index;
  }

  /** Returns a copy marked as downloaded to the given path. */
  public Attachment withDownload(Path path, long size) {
    return new Attachment(this.id, this.tableName, this.recordId,
        this.fieldName, this.originalUrl, this.filename, size,
        path.toString(), true);
  }

  public String getId() {
    return id;
  }

  public String getTableName() {
    return tableName;
  }

  public String getRecordId() {
    return recordId;
  }

  public String getFieldName() {
    return fieldName;
  }

  public String getOriginalUrl() {
    return originalUrl;
  }

  public String getFilename() {
    return filename;
  }

  public long getExpectedSize() {
    return expectedSize;
  }

  /** Local path, or {@code null} as long as nothing was downloaded. */
  public Path getLocalPath() {
    return null == localPath ? null : Paths.get(localPath);
  }

  public boolean isDownloaded() {
    return downloaded;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Attachment)) {
      return false;
    }
    Attachment that = (Attachment) other;
    return this.expectedSize == that.expectedSize
        && this.downloaded == that.downloaded
        && Objects.equals(this.id, that.id)
        && Objects.equals(this.tableName, that.tableName)
        && Objects.equals(this.recordId, that.recordId)
        && Objects.equals(this.fieldName, that.fieldName)
        && Objects.equals(this.originalUrl, that.originalUrl)
        && Objects.equals(this.filename, that.filename)
        && Objects.equals(this.localPath, that.localPath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, tableName, recordId, fieldName, originalUrl,
        filename, expectedSize, localPath, downloaded);
  }

  @Override
  public String toString() {
    return "Attachment[" + id + ", " + originalUrl + ", " + expectedSize
        + (downloaded ? ", " + localPath : ", pending") + "]";
  }
}
