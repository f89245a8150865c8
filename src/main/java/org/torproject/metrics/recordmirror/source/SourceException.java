/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.source;

/** The remote source could not be reached or sent an unusable response. */
public class SourceException extends Exception {

  private static final long serialVersionUID = -1958411032717906126L;

  public SourceException(String message) {
    super(message);
  }

  public SourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
