/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.downloader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to a fixed number of attempts, sleeping between
 * attempts with a delay that doubles after every failure.
 */
public class BoundedRetry {

  private static final Logger logger = LoggerFactory.getLogger(
      BoundedRetry.class);

  /** Operation to retry. */
  @FunctionalInterface
  public interface Attempt<T, E extends Exception> {
    T run() throws E;
  }

  private final int maxAttempts;

  private final long initialDelayMillis;

  /**
   * Creates a retry policy.
   *
   * @param maxAttempts Total number of attempts, at least 1.
   * @param initialDelayMillis Delay before the second attempt.
   */
  public BoundedRetry(int maxAttempts, long initialDelayMillis) {
    if (maxAttempts < 1 || initialDelayMillis < 0L) {
      throw new IllegalArgumentException("Invalid retry policy: "
          + maxAttempts + " attempts, " + initialDelayMillis + " ms delay.");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelayMillis = initialDelayMillis;
  }

  /**
   * Runs the given operation until it succeeds or all attempts are used up,
   * in which case the last exception is thrown.
   *
   * @param description Operation description for logging.
   * @param attempt Operation to run.
   */
  public <T, E extends Exception> T run(String description,
      Attempt<T, E> attempt) throws E {
    long delayMillis = this.initialDelayMillis;
    for (int i = 1; ; i++) {
      try {
        return attempt.run();
      } catch (Exception e) {
        if (i >= this.maxAttempts) {
          throw e;
        }
        logger.warn("Attempt {} of {} to {} failed, retrying in {} ms: {}",
            i, this.maxAttempts, description, delayMillis, e.getMessage());
      }
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting to "
            + description + ".", ie);
      }
      delayMillis *= 2L;
    }
  }
}
