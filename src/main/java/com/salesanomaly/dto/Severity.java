package com.salesanomaly.dto;

public enum Severity {
    UNCLASSIFIED(-1),
    NORMAL(0),
    WATCH(1),
    BAD(2),
    CRITICAL(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= 0 && rank >= other.rank;
    }
}
