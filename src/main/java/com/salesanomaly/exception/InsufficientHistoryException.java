package com.salesanomaly.exception;

import java.time.LocalDate;

public class InsufficientHistoryException extends SalesAnomalyException {
    public InsufficientHistoryException(LocalDate date, int available, int required) {
        super("INSUFFICIENT_HISTORY",
              "Only " + available + " prior days before " + date + ", at least " + required + " required for lag features.");
    }
}
