package com.copytrading.integration.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

public class RestPolymarketExchangeClient implements ExchangeClient {
  private static final Logger log = LoggerFactory.getLogger(RestPolymarketExchangeClient.class);

  static final String ORDER_PATH = "/order";
  static final String BOOK_PATH = "/book";
  static final String ORDER_STATUS_PATH = "/data/order/";

  static final String HEADER_ADDRESS = "POLY_ADDRESS";
  static final String HEADER_SIGNATURE = "POLY_SIGNATURE";
  static final String HEADER_TIMESTAMP = "POLY_TIMESTAMP";
  static final String HEADER_API_KEY = "POLY_API_KEY";
  static final String HEADER_PASSPHRASE = "POLY_PASSPHRASE";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final PolymarketConnectorProperties properties;
  private final PolymarketRequestSigner requestSigner;
  private final RateLimitRetryExecutor retryExecutor;

  public RestPolymarketExchangeClient(
      RestClient restClient,
      ObjectMapper objectMapper,
      PolymarketConnectorProperties properties,
      PolymarketRequestSigner requestSigner,
      RateLimitRetryExecutor retryExecutor) {
    this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.requestSigner = Objects.requireNonNull(requestSigner, "requestSigner must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
  }

  /**
   * Posts the order exactly once. Transient failures surface as {@link ExchangeException} so the
   * caller's retry schedule is the only one applied to order placement.
   */
  @Override
  public ExchangeOrderAck submitOrder(ExchangeOrderRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    String body = toJson(orderBody(request));
    JsonNode root = parseJson(exchange(HttpMethod.POST, ORDER_PATH, body, true));
    if (root.hasNonNull("success") && !root.get("success").asBoolean()) {
      String errorMessage = root.path("errorMsg").asText("");
      throw new ExchangeException(
          ExchangeErrorCode.fromErrorMessage(errorMessage),
          "Order rejected clientOrderId=" + request.clientOrderId() + " error=" + errorMessage);
    }
    String exchangeOrderId = requiredText(root, "orderID");
    log.info(
        "Exchange accepted order clientOrderId={} exchangeOrderId={} status={}",
        request.clientOrderId(),
        exchangeOrderId,
        root.path("status").asText(null));
    return new ExchangeOrderAck(exchangeOrderId, root.path("status").asText(null), root.toString());
  }

  @Override
  public ExchangeCancelResult cancelOrder(String exchangeOrderId) {
    requireText(exchangeOrderId, "exchangeOrderId");
    ObjectNode payload = objectMapper.createObjectNode().put("orderID", exchangeOrderId);
    String body = toJson(payload);
    return retryExecutor.execute(
        "cancel",
        () -> {
          JsonNode root = parseJson(exchange(HttpMethod.DELETE, ORDER_PATH, body, true));
          for (JsonNode cancelled : root.path("canceled")) {
            if (exchangeOrderId.equals(cancelled.asText())) {
              return new ExchangeCancelResult(exchangeOrderId, true, null);
            }
          }
          String reason = root.path("not_canceled").path(exchangeOrderId).asText(null);
          return new ExchangeCancelResult(exchangeOrderId, false, reason);
        });
  }

  @Override
  public OrderBook fetchOrderBook(String tokenId) {
    requireText(tokenId, "tokenId");
    return retryExecutor.execute(
        "book",
        () -> {
          JsonNode root = parseJson(exchange(HttpMethod.GET, BOOK_PATH + "?token_id=" + tokenId, null, false));
          return new OrderBook(tokenId, levels(root.path("bids")), levels(root.path("asks")));
        });
  }

  @Override
  public ExchangeFillSnapshot pollFill(String exchangeOrderId) {
    requireText(exchangeOrderId, "exchangeOrderId");
    return retryExecutor.execute(
        "poll",
        () -> {
          JsonNode root =
              parseJson(exchange(HttpMethod.GET, ORDER_STATUS_PATH + exchangeOrderId, null, true));
          return new ExchangeFillSnapshot(
              exchangeOrderId,
              requiredText(root, "status"),
              decimal(root, "original_size"),
              decimal(root, "size_matched"),
              decimal(root, "price"),
              root.path("associate_trades").size());
        });
  }

  private ObjectNode orderBody(ExchangeOrderRequest request) {
    ObjectNode order =
        objectMapper
            .createObjectNode()
            .put("tokenID", request.tokenId())
            .put("side", request.side().name())
            .put("size", request.size().toPlainString());
    if (request.price() != null) {
      order.put("price", request.price().toPlainString());
    }
    ObjectNode body = objectMapper.createObjectNode();
    body.set("order", order);
    body.put("owner", properties.getApiKey());
    body.put("orderType", venueOrderType(request));
    body.put("clientOrderId", request.clientOrderId());
    return body;
  }

  private static String venueOrderType(ExchangeOrderRequest request) {
    return switch (request.orderType()) {
      case MARKET, FOK -> "FOK";
      case LIMIT, GTC -> "GTC";
    };
  }

  private String exchange(HttpMethod method, String pathAndQuery, String body, boolean authenticated) {
    RestClient.RequestBodySpec spec = restClient.method(method).uri(pathAndQuery);
    if (authenticated) {
      String path = pathAndQuery.contains("?") ? pathAndQuery.substring(0, pathAndQuery.indexOf('?')) : pathAndQuery;
      PolymarketRequestSigner.SignedHeaders signed = requestSigner.sign(method.name(), path, body);
      spec.header(HEADER_ADDRESS, properties.getAddress())
          .header(HEADER_API_KEY, properties.getApiKey())
          .header(HEADER_PASSPHRASE, properties.getPassphrase())
          .header(HEADER_TIMESTAMP, signed.timestamp())
          .header(HEADER_SIGNATURE, signed.signature());
    }
    if (body != null) {
      spec.contentType(MediaType.APPLICATION_JSON).body(body);
    }
    try {
      String response =
          spec.retrieve()
              .onStatus(HttpStatusCode::isError, (request, result) -> raiseExchangeException(result))
              .body(String.class);
      return response == null ? "{}" : response;
    } catch (ResourceAccessException ex) {
      throw new ExchangeException(
          isTimeout(ex) ? ExchangeErrorCode.TIMEOUT : ExchangeErrorCode.CONNECTION,
          method + " " + pathAndQuery + " failed: " + ex.getMessage(),
          ex);
    }
  }

  private void raiseExchangeException(ClientHttpResponse response) throws IOException {
    String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    String errorMessage = extractErrorMessage(body);
    int status = response.getStatusCode().value();
    throw new ExchangeException(
        ExchangeErrorCode.fromHttpStatus(status, errorMessage),
        errorMessage == null ? "HTTP " + status : errorMessage,
        status,
        response.getHeaders(),
        body,
        null);
  }

  private String extractErrorMessage(String body) {
    try {
      JsonNode root = objectMapper.readTree(body);
      if (root == null) {
        return null;
      }
      if (root.hasNonNull("error")) {
        return root.get("error").asText();
      }
      return root.hasNonNull("errorMsg") ? root.get("errorMsg").asText() : null;
    } catch (IOException unreadable) {
      return body == null || body.isBlank() ? null : body;
    }
  }

  private static boolean isTimeout(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof SocketTimeoutException
          || cause instanceof HttpTimeoutException
          || cause instanceof InterruptedIOException) {
        return true;
      }
    }
    return false;
  }

  private static List<OrderBookLevel> levels(JsonNode side) {
    List<OrderBookLevel> levels = new ArrayList<>();
    for (JsonNode level : side) {
      BigDecimal price = decimal(level, "price");
      BigDecimal size = decimal(level, "size");
      if (price != null && size != null && price.signum() > 0 && size.signum() > 0) {
        levels.add(new OrderBookLevel(price, size));
      }
    }
    return levels;
  }

  private String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode Polymarket request body", ex);
    }
  }

  private JsonNode parseJson(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new ExchangeException(
          ExchangeErrorCode.SERVER_ERROR, "Unreadable Polymarket response", ex);
    }
  }

  private static String requiredText(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || node.asText().isBlank()) {
      throw new ExchangeException(
          ExchangeErrorCode.SERVER_ERROR, "Missing required field in Polymarket response: " + field);
    }
    return node.asText();
  }

  private static BigDecimal decimal(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull() || node.asText().isBlank()) {
      return null;
    }
    return new BigDecimal(node.asText());
  }

  private static void requireText(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
