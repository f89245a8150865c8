/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.downloader;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.URLStreamHandlerFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Test class for {@link Downloader}.
 *
 * <p>This test class is heavily based on the blog post
 * <a href="https://claritysoftware.co.uk/mocking-javas-url-with-mockito/">"How
 * to mock the Java URL class with Mockito"</a> by nathan from March 10,
 * 2017.</p>
 */
public class DownloaderTest {

  /**
   * Custom {@link URLStreamHandler} that allows us to control the
   * {@link URLConnection URLConnections} that are returned by {@link URL URLs}
   * in the code under test.
   */
  private static class HttpUrlStreamHandler extends URLStreamHandler {

    private Map<URL, URLConnection> connections = new HashMap<>();

    @Override
    protected URLConnection openConnection(URL url) {
      return this.connections.get(url);
    }

    private void resetConnections() {
      this.connections = new HashMap<>();
    }

    private void addConnection(URL url, URLConnection urlConnection) {
      this.connections.put(url, urlConnection);
    }
  }

  private static HttpUrlStreamHandler httpUrlStreamHandler;

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  /**
   * Set up our own stream handler for all tests in this class.
   */
  @BeforeClass
  public static void setupUrlStreamHandlerFactory() {
    URLStreamHandlerFactory urlStreamHandlerFactory
        = mock(URLStreamHandlerFactory.class);
    URL.setURLStreamHandlerFactory(urlStreamHandlerFactory);
    httpUrlStreamHandler = new HttpUrlStreamHandler();
    given(urlStreamHandlerFactory.createURLStreamHandler("http"))
        .willReturn(httpUrlStreamHandler);
  }

  /**
   * Clear any connections from previously run tests.
   */
  @Before
  public void reset() {
    httpUrlStreamHandler.resetConnections();
  }

  private HttpURLConnection connection(String url, int status,
      InputStream body) throws IOException {
    HttpURLConnection urlConnection = mock(HttpURLConnection.class);
    httpUrlStreamHandler.addConnection(new URL(url), urlConnection);
    given(urlConnection.getResponseCode()).willReturn(status);
    if (null != body) {
      given(urlConnection.getInputStream()).willReturn(body);
    }
    return urlConnection;
  }

  @Test
  public void testExistingResource() throws Exception {
    byte[] expectedDownloadedBytes = "content".getBytes();
    connection("http://localhost/exists", 200,
        new ByteArrayInputStream(expectedDownloadedBytes));
    byte[] downloadedBytes = Downloader.downloadFromHttpServer(
        new URL("http://localhost/exists"));
    assertArrayEquals(expectedDownloadedBytes, downloadedBytes);
  }

  @Test
  public void testRequestHeaders() throws Exception {
    HttpURLConnection urlConnection = connection("http://localhost/auth",
        200, new ByteArrayInputStream("{}".getBytes()));
    Downloader.downloadFromHttpServer(new URL("http://localhost/auth"),
        Collections.singletonMap("Authorization", "Bearer secret"));
    then(urlConnection).should().setRequestProperty("Authorization",
        "Bearer secret");
    then(urlConnection).should().setReadTimeout(
        Downloader.READ_TIMEOUT_MILLIS);
  }

  @Test
  public void testOtherSuccessStatus() throws Exception {
    byte[] expectedDownloadedBytes = "partial".getBytes();
    connection("http://localhost/partial", 203,
        new ByteArrayInputStream(expectedDownloadedBytes));
    assertArrayEquals(expectedDownloadedBytes,
        Downloader.downloadFromHttpServer(
        new URL("http://localhost/partial")));
  }

  @Test
  public void testRedirectStatusIsNotDownloaded() throws Exception {
    connection("http://localhost/moved", 301, null);
    assertNull(Downloader.downloadFromHttpServer(
        new URL("http://localhost/moved")));
  }

  @Test
  public void testNonExistingResource() throws Exception {
    connection("http://localhost/notfound", 404, null);
    assertNull(Downloader.downloadFromHttpServer(
        new URL("http://localhost/notfound")));
  }

  @Test
  public void testEmptyResource() throws Exception {
    connection("http://localhost/empty", 200,
        new ByteArrayInputStream(new byte[0]));
    byte[] downloadedBytes = Downloader.downloadFromHttpServer(
        new URL("http://localhost/empty"));
    assertEquals(0, downloadedBytes.length);
  }

  @Test(expected = SocketTimeoutException.class)
  public void testTimeout() throws Exception {
    SocketTimeoutException expectedException = new SocketTimeoutException();
    HttpURLConnection urlConnection = connection("http://localhost/timeout",
        200, null);
    given(urlConnection.getInputStream()).willThrow(expectedException);
    Downloader.downloadFromHttpServer(new URL("http://localhost/timeout"));
    fail("Should have thrown a SocketTimeoutException.");
  }

  @Test
  public void testDownloadToFile() throws Exception {
    byte[] content = new byte[3000];
    content[2999] = 7;
    connection("http://localhost/file.pdf", 200,
        new ByteArrayInputStream(content));
    Path target = tmpf.getRoot().toPath().resolve("file.pdf");
    assertEquals(3000L, Downloader.downloadToFile(
        new URL("http://localhost/file.pdf"), target));
    assertArrayEquals(content, Files.readAllBytes(target));
  }

  @Test
  public void testDownloadToFileWithOtherSuccessStatus() throws Exception {
    connection("http://localhost/created.pdf", 201,
        new ByteArrayInputStream(new byte[] { 1, 2, 3 }));
    Path target = tmpf.getRoot().toPath().resolve("created.pdf");
    assertEquals(3L, Downloader.downloadToFile(
        new URL("http://localhost/created.pdf"), target));
    assertEquals(3L, Files.size(target));
  }

  @Test
  public void testDownloadToFileNotFound() throws Exception {
    connection("http://localhost/missing.pdf", 404, null);
    Path target = tmpf.getRoot().toPath().resolve("missing.pdf");
    assertEquals(-1L, Downloader.downloadToFile(
        new URL("http://localhost/missing.pdf"), target));
    assertFalse(Files.exists(target));
  }

  @Test
  public void testInterruptedDownloadLeavesNoFile() throws Exception {
    HttpURLConnection urlConnection = connection("http://localhost/cut.pdf",
        200, null);
    given(urlConnection.getInputStream()).willReturn(new InputStream() {
      private int remaining = 100;

      @Override
      public int read() throws IOException {
        if (remaining-- == 0) {
          throw new IOException("connection reset");
        }
        return 1;
      }
    });
    Path target = tmpf.getRoot().toPath().resolve("cut.pdf");
    try {
      Downloader.downloadToFile(new URL("http://localhost/cut.pdf"), target);
      fail("Should have thrown an IOException.");
    } catch (IOException e) {
      assertFalse(Files.exists(target));
    }
  }
}
