package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.Repo;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.dto.request.AdminBackfillRequest;
import com.company.timeseries.dto.response.BackfillResponse;
import com.company.timeseries.exception.RepositoryNotFoundException;
import com.company.timeseries.exception.TimeseriesDisabledException;
import com.company.timeseries.repository.MeasurementSummaryRepository;
import com.company.timeseries.repository.RepoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator-initiated backfill of a repository's coverage datasets over a date range.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminBackfillService {

    private static final List<MeasurementName> REPOSITORY_DATASETS =
            List.of(MeasurementName.COVERAGE, MeasurementName.FLAG_COVERAGE);

    private final RepoRepository repoRepository;
    private final BackfillTrigger backfillTrigger;
    private final BackfillTaskDispatcher dispatcher;
    private final MeasurementSummaryRepository summaryRepository;
    private final TimeseriesProperties properties;
    private final Clock clock;

    public BackfillResponse backfill(AdminBackfillRequest request) {
        if (!properties.isEnabled()) {
            throw new TimeseriesDisabledException();
        }

        Repo repo = repoRepository.findById(request.getRepoId())
                .orElseThrow(() -> new RepositoryNotFoundException(request.getRepoId()));

        Instant start = request.getStartDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end = request.getEndDate() != null
                ? request.getEndDate().atStartOfDay(ZoneOffset.UTC).toInstant()
                : clock.instant();

        // the jobs write into existing datasets, so make sure they are there
        REPOSITORY_DATASETS.forEach(name -> backfillTrigger.getOrCreateDataset(name, repo.getRepoId()));

        List<String> datasetNames = REPOSITORY_DATASETS.stream().map(MeasurementName::getValue)
                .collect(Collectors.toList());
        int batches = dispatcher.backfillRepository(repo.getRepoId(), start, end, datasetNames);

        if (request.isRefresh()) {
            log.info("Refreshing measurement summaries from {} to {}", start, end);
            summaryRepository.refresh(start, end);
        }

        log.info("Dispatched {} backfill batches for repo {} ({} to {})", batches, repo.getRepoId(), start, end);

        return BackfillResponse.builder()
                .repoId(repo.getRepoId())
                .startDate(start)
                .endDate(end)
                .batches(batches)
                .datasets(datasetNames)
                .refreshed(request.isRefresh())
                .build();
    }
}
