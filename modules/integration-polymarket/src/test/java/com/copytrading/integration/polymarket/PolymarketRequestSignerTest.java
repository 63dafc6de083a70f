package com.copytrading.integration.polymarket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class PolymarketRequestSignerTest {
  private static final String SECRET =
      Base64.getUrlEncoder().encodeToString("test-secret".getBytes(StandardCharsets.UTF_8));
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void shouldSignTimestampMethodPathAndBody() throws Exception {
    PolymarketRequestSigner signer = new PolymarketRequestSigner(SECRET, CLOCK);

    PolymarketRequestSigner.SignedHeaders signed =
        signer.sign("post", "/order", "{\"orderID\":\"0x1\"}");

    String timestamp = Long.toString(CLOCK.instant().getEpochSecond());
    assertEquals(timestamp, signed.timestamp());
    assertEquals(expected(timestamp + "POST/order{\"orderID\":\"0x1\"}"), signed.signature());
  }

  @Test
  void shouldTreatMissingBodyAsEmpty() throws Exception {
    PolymarketRequestSigner signer = new PolymarketRequestSigner(SECRET, CLOCK);

    PolymarketRequestSigner.SignedHeaders withoutBody = signer.sign("GET", "/data/order/0x1", null);
    PolymarketRequestSigner.SignedHeaders otherPath = signer.sign("GET", "/data/order/0x2", null);

    assertEquals(
        expected(withoutBody.timestamp() + "GET/data/order/0x1"), withoutBody.signature());
    assertNotEquals(withoutBody.signature(), otherPath.signature());
  }

  private static String expected(String message) throws Exception {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec("test-secret".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
    return Base64.getUrlEncoder()
        .encodeToString(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
  }
}
