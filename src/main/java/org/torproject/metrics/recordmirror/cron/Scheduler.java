/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that starts the tasks configured in recordmirror.properties.
 */
public final class Scheduler implements ThreadFactory {

  public static final String ACTIVATED = "Activated";
  public static final String PERIODMIN = "PeriodMinutes";
  public static final String OFFSETMIN = "OffsetMinutes";
  private static final long MILLIS_IN_A_MINUTE = 60_000L;

  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private int currentThreadNo = 0;
  private long gracePeriodMinutes = 10L;

  private final ScheduledExecutorService scheduler =
      Executors.newScheduledThreadPool(2, this);

  /**
   * Schedule all tasks given according to the parameters in the
   * the configuration.
   */
  public void scheduleModuleRuns(Map<Key, ? extends MirrorTask> tasks,
      Configuration conf) {
    try {
      gracePeriodMinutes = conf.getLong(Key.ShutdownGraceWaitMinutes);
    } catch (ConfigurationException ce) {
      logger.warn("Cannot read grace period: {}", ce.getMessage());
      gracePeriodMinutes = 10L;
    }
    List<Callable<Object>> runOnceTasks = new ArrayList<>();
    for (Map.Entry<Key, ? extends MirrorTask> taskEntry : tasks.entrySet()) {
      MirrorTask task = taskEntry.getValue();
      try {
        if (conf.getBool(taskEntry.getKey())) {
          String prefix = taskEntry.getKey().name().replace(ACTIVATED, "");
          if (conf.getBool(Key.RunOnce)) {
            logger.info("Prepare single run for " + task.module() + ".");
            runOnceTasks.add(task);
          } else {
            scheduleExecutions(task,
                conf.getInt(Key.valueOf(prefix + OFFSETMIN)),
                task.periodMinutes(prefix));
          }
        }
      } catch (ConfigurationException | RejectedExecutionException
          | IllegalArgumentException | NullPointerException ex) {
        logger.error("Cannot schedule " + task.module()
            + ". Reason: " + ex.getMessage(), ex);
      }
    }
    try {
      if (conf.getBool(Key.RunOnce)) {
        scheduler.invokeAll(runOnceTasks);
      }
    } catch (ConfigurationException | RejectedExecutionException
        | NullPointerException ex) {
      logger.error("Cannot schedule run-once: " + ex.getMessage(), ex);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      logger.error("Interrupted during run-once: " + ie.getMessage(), ie);
    }
  }

  private void scheduleExecutions(MirrorTask task, int offset, int period) {
    logger.info("Periodic updater started for " + task.module()
        + "; offset=" + offset + ", period=" + period + ".");
    long periodMillis = period * MILLIS_IN_A_MINUTE;
    long initialDelayMillis = computeInitialDelayMillis(
        System.currentTimeMillis(), offset * MILLIS_IN_A_MINUTE, periodMillis);

    /* Run after initialDelay delay and then every period min. */
    logger.info("Periodic updater will first run in {} and then every {} "
        + "minutes.", initialDelayMillis < MILLIS_IN_A_MINUTE
        ? "under 1 minute"
        : (initialDelayMillis / MILLIS_IN_A_MINUTE) + " minute(s)", period);
    this.scheduler.scheduleAtFixedRate(task, initialDelayMillis, periodMillis,
        TimeUnit.MILLISECONDS);
  }

  protected static long computeInitialDelayMillis(long currentMillis,
      long offsetMillis, long periodMillis) {
    return (periodMillis - (currentMillis % periodMillis) + offsetMillis)
        % periodMillis;
  }

  /**
   * Try to shutdown smoothly, i.e., wait for running tasks to terminate.
   */
  public void shutdownScheduler() {
    try {
      logger.info("Waiting at most {} minutes for termination "
          + "of running tasks ... ", gracePeriodMinutes);
      scheduler.shutdown();
      scheduler.awaitTermination(gracePeriodMinutes, TimeUnit.MINUTES);
      logger.info("Shutdown of all scheduled tasks completed successfully.");
    } catch (InterruptedException ie) {
      List<Runnable> notTerminated = scheduler.shutdownNow();
      logger.error("Regular shutdown failed for: " + notTerminated);
      if (!notTerminated.isEmpty()) {
        logger.error("Forced shutdown failed for: " + notTerminated);
      }
    }
  }

  /** Returns the configured grace period for shutting down. */
  public long getGracePeriodMinutes() {
    return gracePeriodMinutes;
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public synchronized Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("RecordMirror-Scheduled-Thread-" + ++currentThreadNo);
    logger.info("New Thread created: " + newThread.getName());
    return newThread;
  }
}
