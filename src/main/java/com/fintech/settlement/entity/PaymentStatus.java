package com.fintech.settlement.entity;

/**
 * Status of a member's contribution payment. Only COMPLETED payments are settled.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
