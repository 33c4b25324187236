package com.company.timeseries.exception;

public class UnknownMeasurementException extends RuntimeException {
    public UnknownMeasurementException(String name) {
        super("Unknown measurement: " + name);
    }
}
