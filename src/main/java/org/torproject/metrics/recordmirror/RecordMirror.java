/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror;

import org.torproject.metrics.recordmirror.attachments.AttachmentPipeline;
import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;
import org.torproject.metrics.recordmirror.cron.FullRefreshTask;
import org.torproject.metrics.recordmirror.cron.RefreshWorker;
import org.torproject.metrics.recordmirror.downloader.BoundedRetry;
import org.torproject.metrics.recordmirror.lock.FileLockCoordinator;
import org.torproject.metrics.recordmirror.lock.InMemoryLockCoordinator;
import org.torproject.metrics.recordmirror.lock.LockCoordinator;
import org.torproject.metrics.recordmirror.query.CacheQueryService;
import org.torproject.metrics.recordmirror.refresh.FullRefreshPipeline;
import org.torproject.metrics.recordmirror.refresh.IncrementalReconciler;
import org.torproject.metrics.recordmirror.refresh.SchemaSync;
import org.torproject.metrics.recordmirror.source.HttpSourceClient;
import org.torproject.metrics.recordmirror.source.SourceClient;
import org.torproject.metrics.recordmirror.store.FileRecordStore;
import org.torproject.metrics.recordmirror.store.InMemoryRecordStore;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.version.ActivePointer;
import org.torproject.metrics.recordmirror.version.FileActivePointer;
import org.torproject.metrics.recordmirror.version.InMemoryActivePointer;
import org.torproject.metrics.recordmirror.version.VersionManager;
import org.torproject.metrics.recordmirror.webhook.NotificationDeduper;
import org.torproject.metrics.recordmirror.webhook.WebhookConfig;
import org.torproject.metrics.recordmirror.webhook.WebhookHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * All components of a running instance, constructed once at start-up and
 * passed to their consumers.
 */
public final class RecordMirror {

  private static final Logger logger = LoggerFactory.getLogger(
      RecordMirror.class);

  static final String ACTIVE_POINTER_FILE = "active-slot";

  private final RecordStore store;

  private final VersionManager versions;

  private final SchemaSync schemaSync;

  private final RefreshWorker worker;

  private final FullRefreshTask refreshTask;

  private final CacheQueryService queryService;

  private final WebhookHandler webhookHandler;

  private RecordMirror(RecordStore store, VersionManager versions,
      SchemaSync schemaSync, RefreshWorker worker, FullRefreshTask refreshTask,
      CacheQueryService queryService, WebhookHandler webhookHandler) {
    this.store = store;
    this.versions = versions;
    this.schemaSync = schemaSync;
    this.worker = worker;
    this.refreshTask = refreshTask;
    this.queryService = queryService;
    this.webhookHandler = webhookHandler;
  }

  /** Builds all components reading the remote source over HTTP. */
  public static RecordMirror create(Configuration conf)
      throws ConfigurationException, StoreException {
    SourceClient source = new HttpSourceClient(conf.getUrl(Key.SourceBaseUrl),
        conf.getString(Key.SourceBaseId), conf.getString(Key.SourceToken),
        new BoundedRetry(conf.getInt(Key.SourceMaxAttempts),
            conf.getLong(Key.SourceRetryDelayMillis)));
    return create(conf, source);
  }

  /** Builds all components reading from the given source. */
  public static RecordMirror create(Configuration conf, SourceClient source)
      throws ConfigurationException, StoreException {
    RecordStore store;
    ActivePointer pointer;
    LockCoordinator locks;
    switch (conf.getStoreType(Key.StoreBackend)) {
      case File:
        store = new FileRecordStore(conf.getPath(Key.StorePath));
        pointer = new FileActivePointer(conf.getPath(Key.StorePath)
            .resolve(ACTIVE_POINTER_FILE));
        locks = new FileLockCoordinator(conf.getPath(Key.LockPath));
        break;
      case Memory:
      default:
        store = new InMemoryRecordStore();
        pointer = new InMemoryActivePointer();
        locks = new InMemoryLockCoordinator();
        break;
    }
    VersionManager versions = new VersionManager(pointer, store);
    AttachmentPipeline attachments = conf.getBool(Key.AttachmentsActivated)
        ? new AttachmentPipeline(store, conf.getPath(Key.AttachmentsPath),
            conf.getInt(Key.AttachmentsConcurrency))
        : null;
    int batchSize = conf.getInt(Key.RefreshBatchSize);
    Duration lockTtl = conf.getSeconds(Key.RefreshLockTtlSeconds);
    FullRefreshPipeline pipeline = new FullRefreshPipeline(store, source,
        versions, locks, attachments, batchSize, lockTtl);
    IncrementalReconciler reconciler = new IncrementalReconciler(store,
        source, versions, batchSize);
    RefreshWorker worker = new RefreshWorker(pipeline, reconciler, store,
        versions);
    WebhookHandler webhookHandler = null;
    if (conf.getBool(Key.WebhookActivated)) {
      WebhookConfig webhookConfig = WebhookConfig.from(conf);
      webhookHandler = new WebhookHandler(webhookConfig,
          new NotificationDeduper(Duration.ofMinutes(
              conf.getLong(Key.WebhookDedupMinutes))), worker);
      logger.info("Accepting notifications of {}.", webhookConfig);
    }
    logger.info("Created {} store with active slot {}.",
        conf.getStoreType(Key.StoreBackend), versions.getActive());
    return new RecordMirror(store, versions, new SchemaSync(source, store),
        worker, new FullRefreshTask(conf, worker),
        new CacheQueryService(store, versions, worker), webhookHandler);
  }

  public RecordStore getStore() {
    return store;
  }

  public VersionManager getVersions() {
    return versions;
  }

  public SchemaSync getSchemaSync() {
    return schemaSync;
  }

  public RefreshWorker getWorker() {
    return worker;
  }

  public FullRefreshTask getRefreshTask() {
    return refreshTask;
  }

  public CacheQueryService getQueryService() {
    return queryService;
  }

  /** Returns the webhook handler, or {@code null} if webhooks are off. */
  public WebhookHandler getWebhookHandler() {
    return webhookHandler;
  }
}
