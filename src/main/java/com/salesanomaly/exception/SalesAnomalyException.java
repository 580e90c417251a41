package com.salesanomaly.exception;

import lombok.Getter;

@Getter
public abstract class SalesAnomalyException extends RuntimeException {
    private final String errorCode;
    protected SalesAnomalyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected SalesAnomalyException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
