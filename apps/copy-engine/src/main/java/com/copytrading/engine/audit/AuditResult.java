package com.copytrading.engine.audit;

public enum AuditResult {
  SUCCESS,
  REJECTED,
  FAILED
}
