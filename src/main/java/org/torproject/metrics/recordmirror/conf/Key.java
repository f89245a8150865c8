/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  RunOnce(Boolean.class),
  StoreBackend(StoreType.class),
  StorePath(Path.class),
  LockPath(Path.class),
  SourceBaseUrl(URL.class),
  SourceBaseId(String.class),
  SourceToken(String.class),
  SourceMaxAttempts(Integer.class),
  SourceRetryDelayMillis(Long.class),
  RefreshActivated(Boolean.class),
  RefreshOffsetMinutes(Integer.class),
  RefreshPeriodMinutes(Integer.class),
  FailsafePeriodMinutes(Integer.class),
  RefreshBatchSize(Integer.class),
  RefreshLockTtlSeconds(Long.class),
  AttachmentsActivated(Boolean.class),
  AttachmentsPath(Path.class),
  AttachmentsConcurrency(Integer.class),
  WebhookActivated(Boolean.class),
  WebhookId(String.class),
  WebhookSecret(String.class),
  WebhookNotificationUrl(URL.class),
  WebhookDedupMinutes(Long.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
