/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.webhook;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Verifies the signature header sent along with webhook notifications,
 * which has the form {@code hmac-sha256=<hex>}. The MAC is computed over
 * the raw request body using the base64-decoded webhook secret.
 */
public class WebhookSignature {

  public static final String PREFIX = "hmac-sha256=";

  private final byte[] key;

  public WebhookSignature(String secretBase64) {
    this.key = Base64.decodeBase64(secretBase64);
  }

  /** Returns the header value expected for the given body. */
  public String sign(byte[] body) {
    return PREFIX + new HmacUtils(HmacAlgorithms.HMAC_SHA_256, this.key)
        .hmacHex(body);
  }

  /**
   * Checks the given header against the body in constant time.
   *
   * @return {@code false} if the header is missing, malformed, or wrong.
   */
  public boolean verify(byte[] body, String header) {
    if (null == header) {
      return false;
    }
    String normalized = header.trim().toLowerCase(Locale.US);
    if (!normalized.startsWith(PREFIX)) {
      return false;
    }
    byte[] expected = this.sign(body).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = normalized.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, actual);
  }
}
