package com.company.timeseries.exception;

public class TimeseriesDisabledException extends RuntimeException {
    public TimeseriesDisabledException() {
        super("Timeseries storage is not enabled");
    }
}
