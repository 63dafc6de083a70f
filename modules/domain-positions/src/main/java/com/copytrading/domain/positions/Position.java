package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Position(
    UUID positionId,
    String whaleAddress,
    String tokenId,
    String category,
    PositionSide side,
    BigDecimal entrySize,
    BigDecimal entryPrice,
    BigDecimal entryAmount,
    BigDecimal currentSize,
    BigDecimal currentPrice,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    BigDecimal maxDrawdown,
    BigDecimal maxProfit,
    BigDecimal stopLossPrice,
    BigDecimal takeProfitPrice,
    BigDecimal kellyFraction,
    BigDecimal edge,
    BigDecimal winRate,
    Instant marketEndsAt,
    PositionStatus status,
    Instant openedAt,
    Instant lastUpdatedAt,
    Instant closedAt,
    CloseReason closeReason) {
  public static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
  public static final BigDecimal MAX_PRICE = new BigDecimal("0.99");

  private static final int MONEY_SCALE = 8;
  private static final int PRICE_SCALE = 6;
  private static final BigDecimal HUNDRED = new BigDecimal("100");

  public Position {
    Objects.requireNonNull(positionId, "positionId must not be null");
    requireNonBlank(whaleAddress, "whaleAddress");
    requireNonBlank(tokenId, "tokenId");
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(entrySize, "entrySize");
    requirePrice(entryPrice, "entryPrice");
    Objects.requireNonNull(entryAmount, "entryAmount must not be null");
    Objects.requireNonNull(currentSize, "currentSize must not be null");
    if (currentSize.signum() < 0) {
      throw new PositionDomainException("currentSize must be >= 0");
    }
    requirePrice(currentPrice, "currentPrice");
    Objects.requireNonNull(unrealizedPnl, "unrealizedPnl must not be null");
    Objects.requireNonNull(realizedPnl, "realizedPnl must not be null");
    Objects.requireNonNull(maxDrawdown, "maxDrawdown must not be null");
    Objects.requireNonNull(maxProfit, "maxProfit must not be null");
    if (kellyFraction != null
        && (kellyFraction.signum() <= 0 || kellyFraction.compareTo(BigDecimal.ONE) > 0)) {
      throw new PositionDomainException("kellyFraction must be in (0, 1]");
    }
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(openedAt, "openedAt must not be null");
    Objects.requireNonNull(lastUpdatedAt, "lastUpdatedAt must not be null");
    if (status == PositionStatus.CLOSED || status == PositionStatus.ARCHIVED) {
      Objects.requireNonNull(closedAt, "closedAt must not be null for a closed position");
      if (unrealizedPnl.signum() != 0) {
        throw new PositionDomainException("closed position must not carry unrealized P&L");
      }
    }
  }

  public static Position open(
      UUID positionId,
      String whaleAddress,
      String tokenId,
      String category,
      PositionSide side,
      BigDecimal size,
      BigDecimal price,
      BigDecimal stopLossPrice,
      BigDecimal takeProfitPrice,
      BigDecimal kellyFraction,
      BigDecimal edge,
      BigDecimal winRate,
      Instant marketEndsAt,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    requirePositive(size, "size");
    requirePrice(price, "price");
    return new Position(
        positionId,
        whaleAddress,
        tokenId,
        category,
        side,
        size,
        price,
        money(size.multiply(price)),
        size,
        price,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        stopLossPrice,
        takeProfitPrice,
        kellyFraction,
        edge,
        winRate,
        marketEndsAt,
        PositionStatus.OPEN,
        now,
        now,
        null,
        null);
  }

  public BigDecimal marketValue() {
    return money(currentSize.multiply(currentPrice));
  }

  public BigDecimal totalPnl() {
    return unrealizedPnl.add(realizedPnl);
  }

  public BigDecimal pnlPercentage() {
    if (entryAmount.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return totalPnl().divide(entryAmount, MONEY_SCALE, RoundingMode.HALF_UP).multiply(HUNDRED);
  }

  /** Per-unit P&L of this position at the given token price. */
  public BigDecimal pnlPerUnit(BigDecimal price) {
    BigDecimal move = price.subtract(entryPrice);
    return side == PositionSide.YES ? move : move.negate();
  }

  public boolean isStopLossHit(BigDecimal price) {
    if (stopLossPrice == null) {
      return false;
    }
    return side == PositionSide.YES
        ? price.compareTo(stopLossPrice) <= 0
        : price.compareTo(stopLossPrice) >= 0;
  }

  public boolean isTakeProfitHit(BigDecimal price) {
    if (takeProfitPrice == null) {
      return false;
    }
    return side == PositionSide.YES
        ? price.compareTo(takeProfitPrice) >= 0
        : price.compareTo(takeProfitPrice) <= 0;
  }

  public Position updatePrice(BigDecimal price, Instant now) {
    requireActive("update price");
    requirePrice(price, "price");
    return withMarket(currentSize, price, entrySize, entryPrice, entryAmount, realizedPnl, now);
  }

  /** Adds size at the given price, re-averaging the entry price. */
  public Position increase(BigDecimal size, BigDecimal price, Instant now) {
    requireActive("increase");
    requirePositive(size, "size");
    requirePrice(price, "price");
    BigDecimal nextSize = currentSize.add(size);
    BigDecimal nextEntryPrice =
        entryPrice
            .multiply(currentSize)
            .add(price.multiply(size))
            .divide(nextSize, PRICE_SCALE, RoundingMode.HALF_UP);
    return withMarket(
        nextSize,
        price,
        entrySize.add(size),
        nextEntryPrice,
        money(entryAmount.add(size.multiply(price))),
        realizedPnl,
        now);
  }

  /**
   * Removes size at the given exit price and realizes its P&L. Reducing to zero closes the
   * position with the given reason.
   */
  public Position reduce(BigDecimal size, BigDecimal price, CloseReason reason, Instant now) {
    requireActive("reduce");
    requirePositive(size, "size");
    requirePrice(price, "price");
    if (size.compareTo(currentSize) > 0) {
      throw new PositionDomainException(
          "Cannot reduce position " + positionId + " by " + size + ", current size " + currentSize);
    }
    BigDecimal nextRealized = money(realizedPnl.add(pnlPerUnit(price).multiply(size)));
    BigDecimal nextSize = currentSize.subtract(size);
    Position reduced =
        withMarket(nextSize, price, entrySize, entryPrice, entryAmount, nextRealized, now);
    if (nextSize.signum() == 0) {
      Objects.requireNonNull(reason, "reason must not be null when closing");
      return reduced.withStatus(PositionStatus.CLOSED, now, reason);
    }
    return reduced;
  }

  public Position markClosing(Instant now) {
    if (status != PositionStatus.OPEN) {
      throw new PositionDomainException("Position " + positionId + " is " + status + ", not OPEN");
    }
    return withStatus(PositionStatus.CLOSING, null, null).touch(now);
  }

  /** Returns a CLOSING position whose closing order ended before flattening it to OPEN. */
  public Position reopen(Instant now) {
    if (status != PositionStatus.CLOSING) {
      throw new PositionDomainException("Position " + positionId + " is " + status + ", not CLOSING");
    }
    return withStatus(PositionStatus.OPEN, null, null).touch(now);
  }

  public Position archive(Instant now) {
    if (status != PositionStatus.CLOSED) {
      throw new PositionDomainException("Position " + positionId + " is " + status + ", not CLOSED");
    }
    return withStatus(PositionStatus.ARCHIVED, closedAt, closeReason).touch(now);
  }

  private Position withMarket(
      BigDecimal nextSize,
      BigDecimal nextPrice,
      BigDecimal nextEntrySize,
      BigDecimal nextEntryPrice,
      BigDecimal nextEntryAmount,
      BigDecimal nextRealized,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    BigDecimal perUnit = nextPrice.subtract(nextEntryPrice);
    if (side == PositionSide.NO) {
      perUnit = perUnit.negate();
    }
    BigDecimal nextUnrealized = money(perUnit.multiply(nextSize));
    BigDecimal nextTotal = nextUnrealized.add(nextRealized);
    BigDecimal nextMaxProfit = maxProfit.max(nextTotal);
    BigDecimal nextMaxDrawdown = maxDrawdown.max(nextMaxProfit.subtract(nextTotal));
    return new Position(
        positionId,
        whaleAddress,
        tokenId,
        category,
        side,
        nextEntrySize,
        nextEntryPrice,
        nextEntryAmount,
        nextSize,
        nextPrice,
        nextUnrealized,
        nextRealized,
        nextMaxDrawdown,
        nextMaxProfit,
        stopLossPrice,
        takeProfitPrice,
        kellyFraction,
        edge,
        winRate,
        marketEndsAt,
        status,
        openedAt,
        now,
        closedAt,
        closeReason);
  }

  private Position withStatus(PositionStatus nextStatus, Instant nextClosedAt, CloseReason reason) {
    return new Position(
        positionId,
        whaleAddress,
        tokenId,
        category,
        side,
        entrySize,
        entryPrice,
        entryAmount,
        currentSize,
        currentPrice,
        nextStatus == PositionStatus.CLOSED ? BigDecimal.ZERO : unrealizedPnl,
        realizedPnl,
        maxDrawdown,
        maxProfit,
        stopLossPrice,
        takeProfitPrice,
        kellyFraction,
        edge,
        winRate,
        marketEndsAt,
        nextStatus,
        openedAt,
        lastUpdatedAt,
        nextClosedAt,
        reason);
  }

  private Position touch(Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new Position(
        positionId,
        whaleAddress,
        tokenId,
        category,
        side,
        entrySize,
        entryPrice,
        entryAmount,
        currentSize,
        currentPrice,
        unrealizedPnl,
        realizedPnl,
        maxDrawdown,
        maxProfit,
        stopLossPrice,
        takeProfitPrice,
        kellyFraction,
        edge,
        winRate,
        marketEndsAt,
        status,
        openedAt,
        now,
        closedAt,
        closeReason);
  }

  private void requireActive(String operation) {
    if (!status.isActive()) {
      throw new PositionDomainException(
          "Cannot " + operation + " position " + positionId + " in status " + status);
    }
  }

  private static BigDecimal money(BigDecimal value) {
    return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
  }

  private static void requirePrice(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(MIN_PRICE) < 0 || value.compareTo(MAX_PRICE) > 0) {
      throw new PositionDomainException(
          fieldName + " must be between " + MIN_PRICE + " and " + MAX_PRICE);
    }
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
      throw new PositionDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new PositionDomainException(fieldName + " must not be blank");
    }
  }
}
