package com.copytrading.domain.orders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Order(
    UUID orderId,
    String idempotencyKey,
    String tokenId,
    OrderSide side,
    OrderType orderType,
    BigDecimal size,
    BigDecimal price,
    OrderState state,
    BigDecimal filledSize,
    BigDecimal avgFillPrice,
    String exchangeOrderId,
    int retryCount,
    int maxRetries,
    String errorMessage,
    UUID parentOrderId,
    UUID rootOrderId,
    OrderContext context,
    Instant createdAt,
    Instant submittedAt,
    Instant filledAt,
    Instant confirmedAt,
    Instant updatedAt) {
  public static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
  public static final BigDecimal MAX_PRICE = new BigDecimal("0.99");
  public static final int DEFAULT_MAX_RETRIES = 3;

  private static final int PRICE_SCALE = 6;

  public Order {
    Objects.requireNonNull(orderId, "orderId must not be null");
    requireNonBlank(idempotencyKey, "idempotencyKey");
    requireNonBlank(tokenId, "tokenId");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(orderType, "orderType must not be null");
    requirePositive(size, "size");
    validatePriceByType(orderType, price);
    Objects.requireNonNull(state, "state must not be null");
    Objects.requireNonNull(filledSize, "filledSize must not be null");
    if (filledSize.compareTo(BigDecimal.ZERO) < 0 || filledSize.compareTo(size) > 0) {
      throw new OrderDomainException("filledSize must be between 0 and size");
    }
    if (retryCount < 0) {
      throw new OrderDomainException("retryCount must be >= 0");
    }
    if (maxRetries < 0) {
      throw new OrderDomainException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static Order createNew(
      UUID orderId,
      String idempotencyKey,
      String tokenId,
      OrderSide side,
      OrderType orderType,
      BigDecimal size,
      BigDecimal price,
      int maxRetries,
      OrderContext context,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new Order(
        orderId,
        idempotencyKey,
        tokenId,
        side,
        orderType,
        size,
        price,
        OrderState.PENDING,
        BigDecimal.ZERO,
        null,
        null,
        0,
        maxRetries,
        null,
        null,
        null,
        context,
        now,
        null,
        null,
        null,
        now);
  }

  /** Creates the PENDING order that carries the unfilled remainder of this order. */
  public Order createRemainderChild(UUID childOrderId, int childNumber, UUID positionId, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (childNumber < 1) {
      throw new OrderDomainException("childNumber must be >= 1");
    }
    BigDecimal remaining = remainingSize();
    if (remaining.signum() <= 0) {
      throw new OrderDomainException("Order " + orderId + " has no remainder to re-submit");
    }
    UUID root = rootOrderId == null ? orderId : rootOrderId;
    String rootKey = rootIdempotencyKey();
    return new Order(
        childOrderId,
        rootKey + ":child:" + childNumber,
        tokenId,
        side,
        orderType,
        remaining,
        price,
        OrderState.PENDING,
        BigDecimal.ZERO,
        null,
        null,
        0,
        maxRetries,
        null,
        orderId,
        root,
        positionId == null ? context : context.withPositionId(positionId),
        now,
        null,
        null,
        null,
        now);
  }

  public BigDecimal remainingSize() {
    return size.subtract(filledSize);
  }

  public BigDecimal fillRatio() {
    return filledSize.divide(size, PRICE_SCALE, RoundingMode.HALF_UP);
  }

  public BigDecimal notional() {
    return price == null ? null : size.multiply(price);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  public boolean canRetry() {
    return retryCount < maxRetries;
  }

  public String rootIdempotencyKey() {
    int marker = idempotencyKey.indexOf(":child:");
    return marker < 0 ? idempotencyKey : idempotencyKey.substring(0, marker);
  }

  public Order markSubmitted(String nextExchangeOrderId, Instant now) {
    requireNonBlank(nextExchangeOrderId, "exchangeOrderId");
    return next(OrderState.SUBMITTED, now)
        .with(filledSize, avgFillPrice, nextExchangeOrderId, retryCount, errorMessage, now, null, null);
  }

  /** Records one additional fill and moves to PARTIALLY_FILLED or FILLED. */
  public Order applyFill(BigDecimal fillSize, BigDecimal fillPrice, Instant now) {
    requirePositive(fillSize, "fillSize");
    requirePositive(fillPrice, "fillPrice");
    BigDecimal nextFilled = filledSize.add(fillSize);
    if (nextFilled.compareTo(size) > 0) {
      throw new OrderDomainException(
          "Fill of " + fillSize + " exceeds remaining size " + remainingSize() + " of order " + orderId);
    }
    BigDecimal previousNotional =
        avgFillPrice == null ? BigDecimal.ZERO : avgFillPrice.multiply(filledSize);
    BigDecimal nextAvg =
        previousNotional
            .add(fillPrice.multiply(fillSize))
            .divide(nextFilled, PRICE_SCALE, RoundingMode.HALF_UP);
    OrderState target =
        nextFilled.compareTo(size) == 0 ? OrderState.FILLED : OrderState.PARTIALLY_FILLED;
    return next(target, now)
        .with(
            nextFilled,
            nextAvg,
            exchangeOrderId,
            retryCount,
            errorMessage,
            submittedAt,
            target == OrderState.FILLED ? now : filledAt,
            null);
  }

  public Order confirm(Instant now) {
    return next(OrderState.CONFIRMED, now)
        .with(
            filledSize,
            avgFillPrice,
            exchangeOrderId,
            retryCount,
            errorMessage,
            submittedAt,
            filledAt == null ? now : filledAt,
            now);
  }

  public Order cancel(String reason, Instant now) {
    return next(OrderState.CANCELLED, now)
        .with(filledSize, avgFillPrice, exchangeOrderId, retryCount, reason, submittedAt, filledAt, null);
  }

  public Order fail(String reason, Instant now) {
    return next(OrderState.FAILED, now)
        .with(filledSize, avgFillPrice, exchangeOrderId, retryCount, reason, submittedAt, filledAt, null);
  }

  public Order deadLetter(Instant now) {
    return next(OrderState.DEAD_LETTER, now)
        .with(filledSize, avgFillPrice, exchangeOrderId, retryCount, errorMessage, submittedAt, filledAt, null);
  }

  /** Counts a failed submission attempt while the order stays PENDING. */
  public Order recordRetry(String error, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (state != OrderState.PENDING) {
      throw new OrderDomainException("Only PENDING orders can be retried, order " + orderId + " is " + state);
    }
    return with(filledSize, avgFillPrice, exchangeOrderId, retryCount + 1, error, submittedAt, filledAt, null)
        .touch(now);
  }

  private Order next(OrderState toState, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    OrderStateMachine.validateTransition(state, toState);
    return new Order(
        orderId,
        idempotencyKey,
        tokenId,
        side,
        orderType,
        size,
        price,
        toState,
        filledSize,
        avgFillPrice,
        exchangeOrderId,
        retryCount,
        maxRetries,
        errorMessage,
        parentOrderId,
        rootOrderId,
        context,
        createdAt,
        submittedAt,
        filledAt,
        confirmedAt,
        now);
  }

  private Order with(
      BigDecimal nextFilledSize,
      BigDecimal nextAvgFillPrice,
      String nextExchangeOrderId,
      int nextRetryCount,
      String nextErrorMessage,
      Instant nextSubmittedAt,
      Instant nextFilledAt,
      Instant nextConfirmedAt) {
    return new Order(
        orderId,
        idempotencyKey,
        tokenId,
        side,
        orderType,
        size,
        price,
        state,
        nextFilledSize,
        nextAvgFillPrice,
        nextExchangeOrderId,
        nextRetryCount,
        maxRetries,
        nextErrorMessage,
        parentOrderId,
        rootOrderId,
        context,
        createdAt,
        nextSubmittedAt,
        nextFilledAt,
        nextConfirmedAt == null ? confirmedAt : nextConfirmedAt,
        updatedAt);
  }

  private Order touch(Instant now) {
    return new Order(
        orderId,
        idempotencyKey,
        tokenId,
        side,
        orderType,
        size,
        price,
        state,
        filledSize,
        avgFillPrice,
        exchangeOrderId,
        retryCount,
        maxRetries,
        errorMessage,
        parentOrderId,
        rootOrderId,
        context,
        createdAt,
        submittedAt,
        filledAt,
        confirmedAt,
        now);
  }

  private static void validatePriceByType(OrderType type, BigDecimal price) {
    if (!type.requiresPrice()) {
      if (price != null) {
        throw new OrderDomainException("Market order price must be null");
      }
      return;
    }
    requirePositive(price, "price");
    if (price.compareTo(MIN_PRICE) < 0 || price.compareTo(MAX_PRICE) > 0) {
      throw new OrderDomainException("price must be between " + MIN_PRICE + " and " + MAX_PRICE);
    }
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
      throw new OrderDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
