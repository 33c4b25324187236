package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A single entry of a coverage series. Gaps carry null values so that charts can
 * tell "no data" apart from zero coverage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant timestamp;
    private Double avg;
    private Double min;
    private Double max;

    public static MeasurementPoint placeholder(Instant timestamp) {
        return new MeasurementPoint(timestamp, null, null, null);
    }

    public boolean hasData() {
        return avg != null || min != null || max != null;
    }

    public MeasurementPoint withTimestamp(Instant newTimestamp) {
        return new MeasurementPoint(newTimestamp, avg, min, max);
    }
}
