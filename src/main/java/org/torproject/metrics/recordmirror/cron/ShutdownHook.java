/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Stops the refresh worker and then the scheduler when the JVM shuts down.
 */
public final class ShutdownHook extends Thread {

  private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

  private final Scheduler scheduler;

  private final RefreshWorker worker;

  private boolean stayAlive = true;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(Scheduler scheduler, RefreshWorker worker) {
    super("RecordMirror-ShutdownThread");
    this.scheduler = scheduler;
    this.worker = worker;
  }

  /**
   * Stay alive until the shutdown thread gets run.
   */
  public void stayAlive() {
    synchronized (this) {
      while (this.stayAlive) {
        try {
          this.wait();
        } catch (InterruptedException e) {
          log.info("Interrupted while staying alive, exiting.");
          Thread.currentThread().interrupt();
          return;
        }
      }
    }
  }

  @Override
  public void run() {
    log.info("Shutdown in progress ... ");
    this.worker.tell(WorkerMessage.refreshStop());
    try {
      if (!this.worker.awaitTermination(
          this.scheduler.getGracePeriodMinutes(), TimeUnit.MINUTES)) {
        log.warn("Refresh work did not complete within the grace period.");
      }
    } catch (InterruptedException ie) {
      log.warn("Interrupted while waiting for refresh work to complete.");
      Thread.currentThread().interrupt();
    }
    this.scheduler.shutdownScheduler();
    synchronized (this) {
      this.stayAlive = false;
      this.notify();
    }
    log.info("Shutdown finished. Exiting.");
  }
}
