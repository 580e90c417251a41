package com.salesanomaly.dto;

public record OperationalFlags(boolean closed, boolean outOfStock, boolean overloaded) {

    public static final OperationalFlags NONE = new OperationalFlags(false, false, false);

    public OperationalFlags or(OperationalFlags other) {
        if (other == null) {
            return this;
        }
        return new OperationalFlags(
            closed || other.closed,
            outOfStock || other.outOfStock,
            overloaded || other.overloaded);
    }
}
