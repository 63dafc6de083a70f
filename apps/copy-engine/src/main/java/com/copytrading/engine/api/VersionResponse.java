package com.copytrading.engine.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}
