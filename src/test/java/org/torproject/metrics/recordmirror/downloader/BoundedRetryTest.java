/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.downloader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

public class BoundedRetryTest {

  @Test()
  public void testSucceedsAfterFailures() throws Exception {
    AtomicInteger calls = new AtomicInteger(0);
    String result = new BoundedRetry(3, 1L).run("fetch", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new IOException("flaky");
      }
      return "ok";
    });
    assertEquals("ok", result);
    assertEquals(3, calls.get());
  }

  @Test()
  public void testRethrowsLastFailure() {
    AtomicInteger calls = new AtomicInteger(0);
    try {
      new BoundedRetry(2, 1L).run("fetch", () -> {
        throw new IOException("failure " + calls.incrementAndGet());
      });
      fail("Should have thrown an IOException.");
    } catch (IOException e) {
      assertEquals("failure 2", e.getMessage());
    }
    assertEquals(2, calls.get());
  }

  @Test()
  public void testSingleAttempt() {
    AtomicInteger calls = new AtomicInteger(0);
    try {
      new BoundedRetry(1, 0L).run("fetch", () -> {
        calls.incrementAndGet();
        throw new IllegalStateException("no retry");
      });
      fail("Should have thrown an IllegalStateException.");
    } catch (IllegalStateException e) {
      assertEquals(1, calls.get());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoAttempts() {
    new BoundedRetry(0, 1L);
  }
}
