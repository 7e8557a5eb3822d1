package com.fintech.settlement.entity;

public enum AuditSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
