package com.copytrading.engine.api;

import java.util.List;

public record OrderDetailResponse(OrderResponse order, List<OrderTransitionResponse> transitions) {}
