/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.cron;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic full refresh. When webhooks keep the cache up to date, the full
 * refresh only runs as a failsafe with its own, usually longer period.
 */
public class FullRefreshTask extends MirrorTask {

  private static final Logger logger = LoggerFactory.getLogger(
      FullRefreshTask.class);

  private final RefreshWorker worker;

  public FullRefreshTask(Configuration conf, RefreshWorker worker) {
    super(conf);
    this.worker = worker;
  }

  @Override
  public String module() {
    return "refresh";
  }

  @Override
  protected int periodMinutes(String prefix) throws ConfigurationException {
    if (this.config.getBool(Key.WebhookActivated)) {
      return this.config.getInt(Key.FailsafePeriodMinutes);
    }
    return super.periodMinutes(prefix);
  }

  @Override
  protected void startProcessing() throws Exception {
    WorkerReply reply = this.worker.tell(WorkerMessage.refreshStart()).get();
    switch (reply.getKind()) {
      case REFRESHED:
        logger.info("Full refresh {}.", reply.getRefreshResult());
        break;
      case REJECTED:
        logger.info("Full refresh not started: {}", reply.getError());
        break;
      default:
        logger.warn("Full refresh did not complete: {}", reply);
        break;
    }
  }
}
