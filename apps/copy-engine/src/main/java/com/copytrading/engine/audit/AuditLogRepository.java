package com.copytrading.engine.audit;

import java.util.List;

public interface AuditLogRepository {
  void append(AuditLogEntry entry);

  List<AuditLogEntry> findByEntity(String entityType, String entityId, int limit);
}
