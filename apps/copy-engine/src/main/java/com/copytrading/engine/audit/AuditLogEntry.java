package com.copytrading.engine.audit;

import java.time.Instant;

public record AuditLogEntry(
    String actor,
    String action,
    String entityType,
    String entityId,
    String beforeJson,
    String afterJson,
    AuditResult result,
    String errorCode,
    String errorMessage,
    String metadataJson,
    Instant createdAt) {}
