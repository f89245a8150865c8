/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import org.torproject.metrics.recordmirror.cron.RefreshWorker;
import org.torproject.metrics.recordmirror.cron.WorkerMessage;
import org.torproject.metrics.recordmirror.cron.WorkerReply;
import org.torproject.metrics.recordmirror.refresh.TableDiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Accepts webhook notifications from the source and turns them into
 * refresh work. Notifications carrying record changes lead to incremental
 * reconciliation, all others to a full refresh. The refresh work itself
 * runs asynchronously on the worker.
 */
public class WebhookHandler {

  private static final Logger logger = LoggerFactory.getLogger(
      WebhookHandler.class);

  private final WebhookConfig config;

  private final WebhookSignature signature;

  private final WebhookPayloadParser parser;

  private final NotificationDeduper deduper;

  private final RefreshWorker worker;

  /** Creates a handler for notifications of the configured webhook. */
  public WebhookHandler(WebhookConfig config, NotificationDeduper deduper,
      RefreshWorker worker) {
    this.config = config;
    this.signature = new WebhookSignature(config.getSecret());
    this.parser = new WebhookPayloadParser();
    this.deduper = deduper;
    this.worker = worker;
  }

  /**
   * Handles a notification.
   *
   * @param body Raw request body.
   * @param signatureHeader Value of the signature header, or {@code null}.
   */
  public WebhookOutcome handle(byte[] body, String signatureHeader) {
    if (!this.signature.verify(body, signatureHeader)) {
      logger.warn("Rejecting webhook notification with invalid signature.");
      return WebhookOutcome.REJECTED;
    }
    WebhookNotification notification;
    try {
      notification = this.parser.parse(body);
    } catch (IOException e) {
      logger.warn("Rejecting malformed webhook notification: {}",
          e.getMessage());
      return WebhookOutcome.REJECTED;
    }
    if (null != this.config.getId() && null != notification.getWebhookId()
        && !this.config.getId().equals(notification.getWebhookId())) {
      logger.warn("Rejecting notification of unknown webhook {}.",
          notification.getWebhookId());
      return WebhookOutcome.REJECTED;
    }
    String key = notification.dedupKey();
    if (null != key && !this.deduper.firstTime(key)) {
      logger.info("Skipping already processed notification {}.", key);
      return WebhookOutcome.DUPLICATE;
    }
    Map<String, TableDiff> diffs = new LinkedHashMap<>();
    for (Map.Entry<String, TableDiff> entry
        : notification.getChangedTables().entrySet()) {
      if (!entry.getValue().isEmpty()) {
        diffs.put(entry.getKey(), entry.getValue());
      }
    }
    WebhookOutcome outcome;
    Future<WorkerReply> reply;
    if (diffs.isEmpty()) {
      logger.info("Notification carries no record changes, requesting full "
          + "refresh.");
      outcome = WebhookOutcome.FULL;
      reply = this.worker.tell(WorkerMessage.refreshStart());
    } else {
      logger.info("Notification carries changes to {} table(s), requesting "
          + "incremental reconciliation.", diffs.size());
      outcome = WebhookOutcome.INCREMENTAL;
      reply = this.worker.tell(WorkerMessage.reconcile(diffs));
    }
    if (reply.isDone() && isRejected(reply)) {
      return WebhookOutcome.REJECTED;
    }
    return outcome;
  }

  private static boolean isRejected(Future<WorkerReply> reply) {
    try {
      return WorkerReply.Kind.REJECTED == reply.get().getKind();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      logger.warn("Refresh work failed: {}", e.getMessage());
      return false;
    }
  }
}
