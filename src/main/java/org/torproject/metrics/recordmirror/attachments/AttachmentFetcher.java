/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.attachments;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;

/** Downloads a single attachment to a local file. */
@FunctionalInterface
public interface AttachmentFetcher {

  /**
   * Downloads the given URL to the given file.
   *
   * @return Number of bytes written, or {@code -1} if the server refused
   *     the request.
   */
  long fetch(URL url, Path target) throws IOException;
}
