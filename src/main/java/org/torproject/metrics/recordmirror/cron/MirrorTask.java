/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base class of all periodically executed tasks. A failing execution is
 * logged and never prevents later executions.
 */
public abstract class MirrorTask implements Callable<Object>, Runnable {

  private static final Logger logger = LoggerFactory.getLogger(
      MirrorTask.class);

  protected Configuration config = new Configuration();

  public MirrorTask(Configuration conf) {
    this.config.putAll(conf.getPropertiesCopy());
  }

  /**
   * Log all errors preventing successful completion of the task.
   */
  @Override
  public final void run() {
    try {
      logger.info("Starting {} task of RecordMirror.", module());
      startProcessing();
      logger.info("Terminating {} task of RecordMirror.", module());
    } catch (Throwable th) { // Catching all to keep the schedule alive.
      logger.error("The {} task failed: {}", module(), th.getMessage(), th);
    }
  }

  /** Wrapper for <code>run</code>. */
  @Override
  public final Object call() {
    run();
    return null;
  }

  /**
   * Returns the period in minutes between two executions, read from the
   * property with the given prefix, e.g., {@code RefreshPeriodMinutes}.
   */
  protected int periodMinutes(String prefix) throws ConfigurationException {
    return this.config.getInt(Key.valueOf(prefix + Scheduler.PERIODMIN));
  }

  /**
   * Task specific code goes here.
   */
  protected abstract void startProcessing() throws Exception;

  /**
   * Returns the task name for logging purposes.
   */
  public abstract String module();
}
