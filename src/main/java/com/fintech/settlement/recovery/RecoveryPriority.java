package com.fintech.settlement.recovery;

public enum RecoveryPriority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    RecoveryPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
