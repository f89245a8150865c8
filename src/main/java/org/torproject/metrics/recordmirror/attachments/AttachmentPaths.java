/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.attachments;

import org.torproject.metrics.recordmirror.store.Attachment;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.file.Path;

/**
 * Deterministic local paths for attachments of the form
 * {@code table/record/field/name_hash.ext}, where {@code hash} is derived
 * from the attachment URL.
 */
public final class AttachmentPaths {

  static final int MAX_FILENAME_LENGTH = 100;

  static final int HASH_LENGTH = 8;

  private AttachmentPaths() {
  }

  /** Returns the local path of the given attachment below the root. */
  public static Path localPath(Path root, Attachment attachment) {
    String filename = null == attachment.getFilename()
        || attachment.getFilename().isEmpty()
        ? "attachment_" + attachment.getId() : attachment.getFilename();
    return root.resolve(sanitize(attachment.getTableName()))
        .resolve(sanitize(attachment.getRecordId()))
        .resolve(sanitize(attachment.getFieldName()))
        .resolve(fileName(filename, attachment.getOriginalUrl()));
  }

  /** Replaces every character outside {@code [A-Za-z0-9._-]} by {@code _}. */
  static String sanitize(String segment) {
    String safe = segment.replaceAll("[^a-zA-Z0-9._-]", "_");
    return safe.matches("\\.*") ? safe.replace('.', '_') + "_" : safe;
  }

  /** Returns the sanitized file name with the URL hash before the suffix. */
  static String fileName(String filename, String url) {
    String safe = sanitize(filename);
    if (safe.length() > MAX_FILENAME_LENGTH) {
      safe = safe.substring(0, MAX_FILENAME_LENGTH);
    }
    String hash = DigestUtils.sha256Hex(url).substring(0, HASH_LENGTH);
    int dot = safe.lastIndexOf('.');
    if (dot <= 0) {
      return safe + "_" + hash;
    }
    return safe.substring(0, dot) + "_" + hash + safe.substring(dot);
  }
}
