/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.attachments;

import org.torproject.metrics.recordmirror.downloader.Downloader;
import org.torproject.metrics.recordmirror.store.Attachment;
import org.torproject.metrics.recordmirror.store.RecordStore;
import org.torproject.metrics.recordmirror.store.SlotId;
import org.torproject.metrics.recordmirror.store.StoreException;
import org.torproject.metrics.recordmirror.store.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Downloads attachments that are not yet available locally.
 *
 * <p>Pending attachments are processed in waves of at most
 * {@code concurrency} downloads. Each wave completes fully before the next
 * one starts, and a failed download never cancels the other downloads of
 * its wave. Files that already exist with the expected size are reused
 * without fetching them again.</p>
 */
public class AttachmentPipeline {

  private static final Logger logger = LoggerFactory.getLogger(
      AttachmentPipeline.class);

  public static final int DEFAULT_CONCURRENCY = 5;

  private enum Outcome {
    DOWNLOADED, REUSED, FAILED
  }

  private final RecordStore store;

  private final AttachmentFetcher fetcher;

  private final Path root;

  private final int concurrency;

  /** Creates a pipeline downloading with {@link Downloader}. */
  public AttachmentPipeline(RecordStore store, Path root, int concurrency) {
    this(store, Downloader::downloadToFile, root, concurrency);
  }

  /** Creates a pipeline using the given fetcher. */
  public AttachmentPipeline(RecordStore store, AttachmentFetcher fetcher,
      Path root, int concurrency) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be positive, but "
          + "is " + concurrency + ".");
    }
    this.store = store;
    this.fetcher = fetcher;
    this.root = root;
    this.concurrency = concurrency;
  }

  public DownloadStats downloadPending(SlotId slot) throws StoreException {
    return this.downloadPending(slot, this.concurrency);
  }

  /**
   * Downloads all pending attachments of the given slot.
   *
   * @throws StoreUnavailableException if the store cannot be reached; all
   *     other failures are counted as errors.
   */
  public DownloadStats downloadPending(SlotId slot, int concurrency)
      throws StoreException {
    List<Attachment> pending = this.store.getPendingAttachments(slot);
    if (pending.isEmpty()) {
      logger.info("No attachments to download in slot {}.", slot);
      return DownloadStats.empty();
    }
    logger.info("Found {} pending attachment(s) in slot {}.", pending.size(),
        slot);
    int downloaded = 0;
    int reused = 0;
    int errors = 0;
    ExecutorService executor = Executors.newFixedThreadPool(concurrency);
    try {
      for (int start = 0; start < pending.size(); start += concurrency) {
        List<Callable<Outcome>> wave = new ArrayList<>();
        for (Attachment attachment : pending.subList(start,
            Math.min(start + concurrency, pending.size()))) {
          wave.add(() -> this.process(slot, attachment));
        }
        StoreUnavailableException unavailable = null;
        for (Future<Outcome> future : executor.invokeAll(wave)) {
          try {
            switch (future.get()) {
              case DOWNLOADED:
                downloaded++;
                break;
              case REUSED:
                reused++;
                break;
              default:
                errors++;
                break;
            }
          } catch (ExecutionException e) {
            if (e.getCause() instanceof StoreUnavailableException) {
              unavailable = (StoreUnavailableException) e.getCause();
            } else {
              logger.warn("Attachment download failed unexpectedly.",
                  e.getCause());
              errors++;
            }
          }
        }
        if (null != unavailable) {
          throw unavailable;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while downloading attachments.",
          e);
    } finally {
      executor.shutdown();
    }
    DownloadStats stats = new DownloadStats(downloaded, reused, errors);
    logger.info("Attachment download for slot {} completed: {}.", slot,
        stats);
    return stats;
  }

  private Outcome process(SlotId slot, Attachment attachment)
      throws StoreUnavailableException {
    Path localPath = AttachmentPaths.localPath(this.root, attachment);
    try {
      if (Files.exists(localPath)) {
        long existingSize = Files.size(localPath);
        if (existingSize == attachment.getExpectedSize()) {
          logger.debug("Reusing existing file {}.", localPath);
          this.store.markAttachmentDownloaded(slot, attachment.getId(),
              localPath, existingSize);
          return Outcome.REUSED;
        }
        logger.info("File {} has {} bytes instead of {}, downloading again.",
            localPath, existingSize, attachment.getExpectedSize());
        Files.delete(localPath);
      }
      Files.createDirectories(localPath.getParent());
      logger.debug("Downloading {} to {}.", attachment.getOriginalUrl(),
          localPath);
      long written = this.fetcher.fetch(new URL(attachment.getOriginalUrl()),
          localPath);
      if (written < 0L) {
        logger.warn("Server refused download of attachment {} from {}.",
            attachment.getId(), attachment.getOriginalUrl());
        return Outcome.FAILED;
      }
      if (written != attachment.getExpectedSize()) {
        logger.warn("Attachment {} has {} bytes, expected {}.",
            attachment.getId(), written, attachment.getExpectedSize());
      }
      this.store.markAttachmentDownloaded(slot, attachment.getId(), localPath,
          written);
      return Outcome.DOWNLOADED;
    } catch (StoreUnavailableException e) {
      throw e;
    } catch (IOException | StoreException e) {
      logger.warn("Cannot download attachment {} from {}: {}",
          attachment.getId(), attachment.getOriginalUrl(), e.getMessage());
      return Outcome.FAILED;
    }
  }
}
