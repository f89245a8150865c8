/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.downloader;

import org.torproject.metrics.recordmirror.persist.PersistenceUtils;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

/**
 * Utility class for downloading resources from HTTP servers.
 */
public class Downloader {

  static final int READ_TIMEOUT_MILLIS = 5000;

  static final int CONNECT_TIMEOUT_MILLIS = 10000;

  /**
   * Download the given URL from an HTTP server and return downloaded bytes.
   *
   * @param url URL to download.
   * @return Downloaded bytes, or {@code null} if the resource was not found.
   * @throws IOException Thrown if anything goes wrong while downloading.
   */
  public static byte[] downloadFromHttpServer(URL url) throws IOException {
    return Downloader.downloadFromHttpServer(url, Collections.emptyMap());
  }

  /**
   * Download the given URL from an HTTP server sending the given request
   * headers, and return downloaded bytes.
   *
   * @param url URL to download.
   * @param headers Request headers, e.g., for authorization.
   * @return Downloaded bytes, or {@code null} if the server did not respond
   *     with a 2xx status.
   * @throws IOException Thrown if anything goes wrong while downloading.
   */
  public static byte[] downloadFromHttpServer(URL url,
      Map<String, String> headers) throws IOException {
    HttpURLConnection huc = openGet(url, headers);
    int response = huc.getResponseCode();
    if (!isSuccessful(response)) {
      huc.disconnect();
      return null;
    }
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    try (BufferedInputStream in
        = new BufferedInputStream(huc.getInputStream())) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }

  /**
   * Download the given URL from an HTTP server and stream the response body
   * to the given file, which only appears once the download is complete.
   *
   * @param url URL to download.
   * @param outputPath File to write.
   * @return Number of bytes written, or {@code -1} if the server did not
   *     respond with a 2xx status, in which case nothing is written.
   * @throws IOException Thrown if anything goes wrong while downloading.
   */
  public static long downloadToFile(URL url, Path outputPath)
      throws IOException {
    HttpURLConnection huc = openGet(url, Collections.emptyMap());
    int response = huc.getResponseCode();
    if (!isSuccessful(response)) {
      huc.disconnect();
      return -1L;
    }
    try (InputStream in = new BufferedInputStream(huc.getInputStream())) {
      return PersistenceUtils.storeAtomically(in, outputPath);
    }
  }

  private static boolean isSuccessful(int response) {
    return response / 100 == 2;
  }

  private static HttpURLConnection openGet(URL url,
      Map<String, String> headers) throws IOException {
    HttpURLConnection huc = (HttpURLConnection) url.openConnection();
    huc.setRequestMethod("GET");
    huc.setConnectTimeout(CONNECT_TIMEOUT_MILLIS);
    huc.setReadTimeout(READ_TIMEOUT_MILLIS);
    for (Map.Entry<String, String> header : headers.entrySet()) {
      huc.setRequestProperty(header.getKey(), header.getValue());
    }
    huc.connect();
    return huc;
  }
}
