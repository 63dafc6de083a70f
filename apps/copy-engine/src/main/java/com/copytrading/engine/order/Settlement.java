package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.positions.Position;

public record Settlement(Order order, Position position) {}
