/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.attachments;

/** Outcome counts of one attachment pipeline run. */
public final class DownloadStats {

  private final int downloaded;

  private final int reused;

  private final int errors;

  public DownloadStats(int downloaded, int reused, int errors) {
    this.downloaded = downloaded;
    this.reused = reused;
    this.errors = errors;
  }

  public static DownloadStats empty() {
    return new DownloadStats(0, 0, 0);
  }

  /** Attachments fetched from the network. */
  public int getDownloaded() {
    return downloaded;
  }

  /** Attachments found complete on disk and marked without a fetch. */
  public int getReused() {
    return reused;
  }

  public int getErrors() {
    return errors;
  }

  @Override
  public String toString() {
    return downloaded + " downloaded, " + reused + " reused, " + errors
        + " errors";
  }
}
