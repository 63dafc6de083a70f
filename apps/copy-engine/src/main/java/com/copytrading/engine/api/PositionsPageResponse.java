package com.copytrading.engine.api;

import java.util.List;

public record PositionsPageResponse(List<PositionResponse> positions, int page, int size) {}
