package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of merging summary rows into a coarser grouping. Keys that were
 * collapsed by the grouping are left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedMeasurement {
    private Instant timestampBin;
    private Long ownerId;
    private Long repoId;
    private Long flagId;
    private String branch;
    private Double avg;
    private Double min;
    private Double max;
    private long count;

    public MeasurementPoint toPoint() {
        return new MeasurementPoint(timestampBin, avg, min, max);
    }
}
