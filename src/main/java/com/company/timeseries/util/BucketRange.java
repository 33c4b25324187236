package com.company.timeseries.util;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class BucketRange {
    private Instant start;
    private Instant end;

    public boolean isEmpty() {
        return start.isAfter(end);
    }
}
