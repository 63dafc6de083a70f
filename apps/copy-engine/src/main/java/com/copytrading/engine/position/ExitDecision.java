package com.copytrading.engine.position;

import com.copytrading.domain.positions.Position;
import java.math.BigDecimal;

/** A position that has just been moved to CLOSING and needs a closing order. */
public record ExitDecision(Position position, ExitTrigger trigger, BigDecimal triggerPrice) {}
