package com.copytrading.integration.polymarket;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Level-2 API authentication: an HMAC-SHA256 over {@code timestamp + method + path + body}, keyed
 * with the url-safe base64 decoded API secret and encoded as url-safe base64.
 */
public class PolymarketRequestSigner {
  private static final String HMAC_SHA256 = "HmacSHA256";

  private final byte[] secret;
  private final Clock clock;

  public PolymarketRequestSigner(String apiSecret, Clock clock) {
    this.secret = decodeSecret(Objects.requireNonNullElse(apiSecret, ""));
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public SignedHeaders sign(String method, String requestPath, String body) {
    String timestamp = Long.toString(clock.instant().getEpochSecond());
    String message =
        timestamp + method.toUpperCase() + requestPath + Objects.requireNonNullElse(body, "");
    return new SignedHeaders(timestamp, hmac(message));
  }

  private String hmac(String message) {
    try {
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(secret, HMAC_SHA256));
      byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().encodeToString(digest);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign Polymarket request", ex);
    }
  }

  private static byte[] decodeSecret(String apiSecret) {
    if (apiSecret.isBlank()) {
      return new byte[] {0};
    }
    try {
      return Base64.getUrlDecoder().decode(apiSecret);
    } catch (IllegalArgumentException notBase64) {
      return apiSecret.getBytes(StandardCharsets.UTF_8);
    }
  }

  public record SignedHeaders(String timestamp, String signature) {}
}
