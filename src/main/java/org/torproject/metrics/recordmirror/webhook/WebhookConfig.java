/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import org.torproject.metrics.recordmirror.conf.Configuration;
import org.torproject.metrics.recordmirror.conf.ConfigurationException;
import org.torproject.metrics.recordmirror.conf.Key;

import java.net.URL;
import java.util.Objects;

/** Registration data of the webhook notifying us about source changes. */
public final class WebhookConfig {

  private final String id;

  private final String secret;

  private final URL notificationUrl;

  /**
   * Creates a webhook configuration.
   *
   * @param id Webhook identifier, or {@code null} to accept any.
   * @param secret Base64-encoded MAC secret.
   * @param notificationUrl URL the source posts notifications to, or
   *     {@code null} if unknown.
   */
  public WebhookConfig(String id, String secret, URL notificationUrl) {
    this.id = id;
    this.secret = Objects.requireNonNull(secret, "secret");
    this.notificationUrl = notificationUrl;
  }

  /** Reads the webhook configuration from the given configuration. */
  public static WebhookConfig from(Configuration conf)
      throws ConfigurationException {
    String secret = conf.getString(Key.WebhookSecret);
    if (null == secret) {
      throw new ConfigurationException("Webhooks are activated, but "
          + Key.WebhookSecret + " is not set.");
    }
    String url = conf.getProperty(Key.WebhookNotificationUrl.name(), "");
    return new WebhookConfig(conf.getString(Key.WebhookId), secret,
        url.trim().isEmpty() ? null : conf.getUrl(Key.WebhookNotificationUrl));
  }

  public String getId() {
    return id;
  }

  public String getSecret() {
    return secret;
  }

  public URL getNotificationUrl() {
    return notificationUrl;
  }

  @Override
  public String toString() {
    return "webhook " + (null == id ? "(any)" : id) + " at " + notificationUrl;
  }
}
