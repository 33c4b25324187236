package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One pre-aggregated bucket of measurements, as materialized by the
 * 1/7/30 day continuous aggregates (or computed live from commits).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementSummary {
    private Instant timestampBin;
    private Long ownerId;
    private Long repoId;
    private Long flagId;  // null for repository-wide measurements
    private String branch;
    private String name;
    private double valueAvg;
    private double valueMin;
    private double valueMax;
    private long valueCount;
}
