package com.company.timeseries.service;

import com.company.timeseries.domain.MeasurementQuery;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.repository.MeasurementSummaryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Reads the continuous aggregates. Only used once a dataset is backfilled.
 */
@Component
@RequiredArgsConstructor
public class PrecomputedSource implements MeasurementSource {

    private final MeasurementSummaryRepository summaryRepository;

    @Override
    public String getName() {
        return "precomputed";
    }

    @Override
    public List<MeasurementSummary> fetch(MeasurementQuery query, Interval interval,
                                          Instant alignedStart, Instant end) {
        return summaryRepository.findSummaries(interval, query, alignedStart, end);
    }

    @Override
    public List<MeasurementSummary> fetchLatestBefore(MeasurementQuery query, Interval interval,
                                                      Instant alignedStart) {
        return summaryRepository.findLatestBefore(interval, query, alignedStart);
    }
}
