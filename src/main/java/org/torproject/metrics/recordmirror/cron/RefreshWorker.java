/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.refresh.FullRefreshPipeline;
import org.torproject.metrics.recordmirror.refresh.IncrementalReconciler;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.version.VersionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single owner of all refresh work. Full refreshes run one after another
 * on their own thread, and so do incremental reconciliations, so that a
 * reconciliation never waits for a long full refresh.
 *
 * <p>After a stop message, refresh and reconcile messages are rejected,
 * while work that was accepted before completes.</p>
 */
public class RefreshWorker {

  private static final Logger logger = LoggerFactory.getLogger(
      RefreshWorker.class);

  private final FullRefreshPipeline pipeline;

  private final IncrementalReconciler reconciler;

  private final RecordStore store;

  private final VersionManager versions;

  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private final ExecutorService refreshExecutor =
      Executors.newSingleThreadExecutor(runner -> newThread(runner,
          "RecordMirror-Refresh-Thread"));

  private final ExecutorService reconcileExecutor =
      Executors.newSingleThreadExecutor(runner -> newThread(runner,
          "RecordMirror-Reconcile-Thread"));

  /** Creates a worker; it accepts messages right away. */
  public RefreshWorker(FullRefreshPipeline pipeline,
      IncrementalReconciler reconciler, RecordStore store,
      VersionManager versions) {
    this.pipeline = pipeline;
    this.reconciler = reconciler;
    this.store = store;
    this.versions = versions;
  }

  private static Thread newThread(Runnable runner, String name) {
    Thread thread = new Thread(runner, name);
    thread.setDaemon(true);
    logger.info("New Thread created: " + name);
    return thread;
  }

  /**
   * Hands the given message to the worker.
   *
   * @return Future completed with the reply once the message is processed.
   */
  public Future<WorkerReply> tell(WorkerMessage message) {
    logger.debug("Received {}.", message);
    switch (message.getKind()) {
      case STATS_GET:
        return CompletableFuture.completedFuture(this.stats());
      case REFRESH_STOP:
        this.stop();
        return CompletableFuture.completedFuture(WorkerReply.stopped());
      case REFRESH_START:
        return this.submit(this.refreshExecutor, message, () -> {
          try {
            return WorkerReply.refreshed(this.pipeline.run());
          } catch (Exception e) {
            return WorkerReply.failed(e);
          }
        });
      case RECONCILE:
        return this.submit(this.reconcileExecutor, message, () -> {
          try {
            return WorkerReply.reconciled(
                this.reconciler.reconcile(message.getDiffs()));
          } catch (Exception e) {
            logger.error("Incremental reconciliation failed: {}",
                e.getMessage(), e);
            return WorkerReply.failed(e);
          }
        });
      default:
        throw new IllegalArgumentException("Unknown message " + message);
    }
  }

  private Future<WorkerReply> submit(ExecutorService executor,
      WorkerMessage message, Callable<WorkerReply> work) {
    if (this.stopped.get()) {
      logger.info("Rejecting {} after stop.", message);
      return CompletableFuture.completedFuture(WorkerReply.rejected(message));
    }
    try {
      return executor.submit(work);
    } catch (RejectedExecutionException e) {
      logger.info("Rejecting {} during stop.", message);
      return CompletableFuture.completedFuture(WorkerReply.rejected(message));
    }
  }

  private WorkerReply stats() {
    try {
      return WorkerReply.stats(this.store.stats(this.versions.getActive()));
    } catch (Exception e) {
      logger.warn("Cannot compute stats: {}", e.getMessage());
      return WorkerReply.failed(e);
    }
  }

  private void stop() {
    if (this.stopped.compareAndSet(false, true)) {
      logger.info("Stopping refresh worker; accepted work completes.");
      this.refreshExecutor.shutdown();
      this.reconcileExecutor.shutdown();
    }
  }

  public boolean isStopped() {
    return stopped.get();
  }

  /**
   * Waits for accepted work to complete after a stop.
   *
   * @return {@code true} if all work completed in time.
   */
  public boolean awaitTermination(long timeout, TimeUnit unit)
      throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    boolean refreshDone = this.refreshExecutor.awaitTermination(timeout,
        unit);
    return refreshDone && this.reconcileExecutor.awaitTermination(
        Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
  }
}
