package com.fintech.settlement.entity;

public enum TransferStatus {
    PENDING,
    COMPLETED,
    FAILED
}
