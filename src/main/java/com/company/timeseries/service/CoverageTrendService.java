package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.domain.MeasurementPoint;
import com.company.timeseries.domain.MeasurementScope;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.dto.response.DatasetStatusResponse;
import com.company.timeseries.repository.DatasetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cached reads behind the REST endpoints. Series with an open end ("until now")
 * are never cached.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CoverageTrendService {

    private final CoverageMeasurementReader reader;
    private final DatasetRepository datasetRepository;
    private final TimeseriesProperties properties;
    private final Clock clock;

    @Cacheable(
            value = "coverageTrend",
            key = "#repoId + '-' + #interval + '-' + #start + '-' + #end + '-' + #branch",
            condition = "#end != null"
    )
    public List<MeasurementPoint> repositoryCoverage(long repoId, Interval interval,
                                                     Instant start, Instant end, String branch) {
        log.debug("Cache miss - reading {} coverage trend for repo {}", interval, repoId);

        MeasurementScope scope = MeasurementScope.builder()
                .name(MeasurementName.COVERAGE)
                .repoId(repoId)
                .branch(branch)
                .build();
        return new ArrayList<>(reader.measurements(scope, interval, start, end));
    }

    @Cacheable(
            value = "coverageTrend",
            key = "#repoId + '-flag-' + #flagId + '-' + #interval + '-' + #start + '-' + #end + '-' + #branch",
            condition = "#end != null"
    )
    public List<MeasurementPoint> flagCoverage(long repoId, long flagId, Interval interval,
                                               Instant start, Instant end, String branch) {
        log.debug("Cache miss - reading {} coverage trend for flag {} of repo {}", interval, flagId, repoId);

        MeasurementScope scope = MeasurementScope.builder()
                .name(MeasurementName.FLAG_COVERAGE)
                .repoId(repoId)
                .flagId(flagId)
                .branch(branch)
                .build();
        return new ArrayList<>(reader.summaryMeasurements(scope, interval, start, end));
    }

    @Cacheable(
            value = "coverageTrend",
            key = "'owner-' + #ownerId + '-' + #repoIds + '-' + #interval + '-' + #start + '-' + #end",
            condition = "#end != null"
    )
    public List<MeasurementPoint> ownerCoverage(long ownerId, List<Long> repoIds, Interval interval,
                                                Instant start, Instant end) {
        log.debug("Cache miss - reading {} coverage trend for owner {}", interval, ownerId);
        return new ArrayList<>(reader.ownerMeasurements(ownerId, repoIds, interval, start, end));
    }

    @Cacheable(value = "datasetStatus", key = "#repoId + '-' + #name")
    public DatasetStatusResponse datasetStatus(long repoId, MeasurementName name) {
        if (!properties.isEnabled()) {
            return new DatasetStatusResponse(name.getValue(), false, false);
        }

        Optional<Dataset> dataset = datasetRepository.findByNameAndRepositoryId(name.getValue(), repoId);
        boolean backfilled = dataset
                .map(d -> d.isBackfilled(clock.instant(), properties.getBackfill().getReadyAfter()))
                .orElse(false);
        return new DatasetStatusResponse(name.getValue(), dataset.isPresent(), backfilled);
    }
}
