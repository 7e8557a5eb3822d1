package com.fintech.settlement.entity;

public enum RecipientType {
    DELEGATE("Delegate"),
    COORDINATOR("Coordinator");

    private final String label;

    RecipientType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
