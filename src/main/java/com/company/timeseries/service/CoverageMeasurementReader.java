package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.AggregatedMeasurement;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.domain.MeasurementPoint;
import com.company.timeseries.domain.MeasurementQuery;
import com.company.timeseries.domain.MeasurementScope;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.Repo;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.repository.DatasetRepository;
import com.company.timeseries.repository.RepoRepository;
import com.company.timeseries.util.IntervalAlignment;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for coverage series. Picks the summary store when the dataset is
 * backfilled and the commit fallback otherwise, stitches in the latest older
 * bucket and fills gaps.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CoverageMeasurementReader {

    private final RepoRepository repoRepository;
    private final DatasetRepository datasetRepository;
    private final PrecomputedSource precomputedSource;
    private final FallbackSource fallbackSource;
    private final BackfillTrigger backfillTrigger;
    private final SummaryAggregator aggregator;
    private final SparseSeriesFiller filler;
    private final TimeseriesProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Filled series for {@code scope} between {@code start} and {@code end} (both optional).
     * Unknown repositories and measurements read as an empty series.
     */
    public List<MeasurementPoint> measurements(MeasurementScope scope, Interval interval,
                                               Instant start, Instant end) {
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }
        if (scope == null || scope.getName() == null || scope.getRepoId() == null) {
            return new ArrayList<>();
        }

        Optional<Repo> repo = repoRepository.findById(scope.getRepoId());
        if (repo.isEmpty()) {
            log.debug("Repository {} not found, returning no measurements", scope.getRepoId());
            return new ArrayList<>();
        }

        MeasurementQuery query = MeasurementQuery.builder()
                .name(scope.getName())
                .ownerId(repo.get().getOwnerId())
                .repoId(repo.get().getRepoId())
                .flagId(scope.getFlagId())
                .branch(scope.getBranch() != null ? scope.getBranch() : repo.get().getBranch())
                .build();

        return read(selectSource(query), query, interval, start, end);
    }

    /**
     * Filled series for {@code scope} read from the summary store only. No dataset is
     * looked up or created; a scope without materialized summaries reads as empty buckets.
     * The branch is not defaulted, so a null branch merges all branches per bucket.
     */
    public List<MeasurementPoint> summaryMeasurements(MeasurementScope scope, Interval interval,
                                                      Instant start, Instant end) {
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }
        if (scope == null || scope.getName() == null || scope.getRepoId() == null) {
            return new ArrayList<>();
        }
        if (!properties.isEnabled()) {
            log.debug("Timeseries disabled, no summaries for repo {}", scope.getRepoId());
            return new ArrayList<>();
        }

        Optional<Repo> repo = repoRepository.findById(scope.getRepoId());
        if (repo.isEmpty()) {
            log.debug("Repository {} not found, returning no measurements", scope.getRepoId());
            return new ArrayList<>();
        }

        MeasurementQuery query = MeasurementQuery.builder()
                .name(scope.getName())
                .ownerId(repo.get().getOwnerId())
                .repoId(repo.get().getRepoId())
                .flagId(scope.getFlagId())
                .branch(scope.getBranch())
                .build();
        return read(precomputedSource, query, interval, start, end);
    }

    /**
     * Filled coverage series over the repositories of an owner, each on its default
     * branch, merged into one value per bucket. {@code repoIds} narrows the set; null
     * means every repository of the owner. The summary store is used only when every
     * repository has a backfilled dataset.
     */
    public List<MeasurementPoint> ownerMeasurements(long ownerId, List<Long> repoIds, Interval interval,
                                                    Instant start, Instant end) {
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }

        List<Repo> repos = repoRepository.findByOwner(ownerId, repoIds);
        if (repos.isEmpty()) {
            log.debug("Owner {} has no matching repositories, returning no measurements", ownerId);
            return new ArrayList<>();
        }

        MeasurementQuery query = MeasurementQuery.builder()
                .name(MeasurementName.COVERAGE)
                .ownerId(ownerId)
                .repos(repos)
                .build();
        return read(selectOwnerSource(query), query, interval, start, end);
    }

    private List<MeasurementPoint> read(MeasurementSource source, MeasurementQuery query, Interval interval,
                                        Instant start, Instant end) {
        meterRegistry.counter("timeseries.measurements.source",
                "source", source.getName(),
                "interval", interval.name()
        ).increment();

        Instant alignedStart = start != null ? IntervalAlignment.alignedStartDate(interval, start) : null;

        List<MeasurementPoint> points = new ArrayList<>();
        if (alignedStart != null) {
            List<MeasurementSummary> older = source.fetchLatestBefore(query, interval, alignedStart);
            aggregator.aggregate(older, SummaryAggregator.BY_BUCKET).stream()
                    .map(AggregatedMeasurement::toPoint)
                    .forEach(points::add);
        }

        List<MeasurementSummary> rows = source.fetch(query, interval, alignedStart, end);
        aggregator.aggregate(rows, SummaryAggregator.BY_BUCKET).stream()
                .map(AggregatedMeasurement::toPoint)
                .forEach(points::add);

        log.debug("Read {} buckets of {} for owner {} repo {} from {} source",
                points.size(), query.getName(), query.getOwnerId(), query.getRepoId(), source.getName());

        return filler.fill(points, interval, start, end);
    }

    private MeasurementSource selectSource(MeasurementQuery query) {
        if (!properties.isEnabled()) {
            return fallbackSource;
        }

        Optional<Dataset> dataset = datasetRepository.findByNameAndRepositoryId(
                query.getName().getValue(), query.getRepoId());

        if (dataset.isPresent()
                && dataset.get().isBackfilled(clock.instant(), properties.getBackfill().getReadyAfter())) {
            return precomputedSource;
        }
        if (dataset.isEmpty()) {
            requestBackfill(query.getName(), query.getRepoId());
        }
        return fallbackSource;
    }

    private MeasurementSource selectOwnerSource(MeasurementQuery query) {
        if (!properties.isEnabled()) {
            return fallbackSource;
        }

        List<Long> repoIds = query.getRepos().stream()
                .map(Repo::getRepoId)
                .collect(Collectors.toList());
        Map<Long, Dataset> datasets = datasetRepository
                .findByNameAndRepositoryIds(query.getName().getValue(), repoIds).stream()
                .collect(Collectors.toMap(Dataset::getRepositoryId, Function.identity(), (a, b) -> a));

        Instant now = clock.instant();
        boolean allBackfilled = repoIds.stream()
                .allMatch(id -> datasets.containsKey(id)
                        && datasets.get(id).isBackfilled(now, properties.getBackfill().getReadyAfter()));
        if (allBackfilled) {
            return precomputedSource;
        }

        repoIds.stream()
                .filter(id -> !datasets.containsKey(id))
                .forEach(id -> requestBackfill(query.getName(), id));
        return fallbackSource;
    }

    private void requestBackfill(MeasurementName name, long repoId) {
        try {
            backfillTrigger.ensureDataset(name, repoId);
        } catch (RuntimeException e) {
            log.warn("Failed to request backfill of {} for repo {}, serving fallback data",
                    name.getValue(), repoId, e);
            meterRegistry.counter("timeseries.backfill.request_failures",
                    "measurement", name.getValue()
            ).increment();
        }
    }
}
