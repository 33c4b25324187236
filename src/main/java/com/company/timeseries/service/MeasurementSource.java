package com.company.timeseries.service;

import com.company.timeseries.domain.MeasurementQuery;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.enums.Interval;

import java.time.Instant;
import java.util.List;

/**
 * Where bucketed measurements are read from. Both implementations return rows in
 * the summary shape so that merging and gap filling behave the same for either.
 */
public interface MeasurementSource {

    String getName();

    /**
     * Bucket rows with {@code alignedStart <= timestamp_bin <= end}; null bounds are open.
     */
    List<MeasurementSummary> fetch(MeasurementQuery query, Interval interval, Instant alignedStart, Instant end);

    /**
     * Rows of the most recent bucket strictly before {@code alignedStart}.
     */
    List<MeasurementSummary> fetchLatestBefore(MeasurementQuery query, Interval interval, Instant alignedStart);
}
