package com.company.timeseries.exception;

public class InvalidIntervalException extends RuntimeException {
    public InvalidIntervalException() {
        super("You must specify an interval (1d/7d/30d)");
    }
}
