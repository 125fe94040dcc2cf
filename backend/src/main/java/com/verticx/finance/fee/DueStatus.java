package com.verticx.finance.fee;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DueStatus {
    PAID("Paid"),
    PARTIALLY_PAID("Partially Paid"),
    DUE("Due");

    private final String label;

    DueStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
