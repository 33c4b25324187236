package com.company.timeseries.exception;

public class BackfillDispatchException extends RuntimeException {
    public BackfillDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
