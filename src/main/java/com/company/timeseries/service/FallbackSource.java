package com.company.timeseries.service;

import com.company.timeseries.domain.MeasurementQuery;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.repository.CommitCoverageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates commit totals on the fly while a dataset has no materialized
 * summaries. Commits only carry repository-wide coverage, so other measurements
 * have no fallback and read as empty.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FallbackSource implements MeasurementSource {

    private final CommitCoverageRepository commitCoverageRepository;

    @Override
    public String getName() {
        return "fallback";
    }

    @Override
    public List<MeasurementSummary> fetch(MeasurementQuery query, Interval interval,
                                          Instant alignedStart, Instant end) {
        if (!supports(query)) {
            log.debug("No commit fallback for measurement {} of repo {}", query.getName(), query.getRepoId());
            return new ArrayList<>();
        }
        if (query.isOwnerWide()) {
            return commitCoverageRepository.findBucketedCoverage(query.getRepos(), interval, alignedStart, end);
        }
        return commitCoverageRepository.findBucketedCoverage(
                query.getRepoId(), query.getBranch(), interval, alignedStart, end);
    }

    @Override
    public List<MeasurementSummary> fetchLatestBefore(MeasurementQuery query, Interval interval,
                                                      Instant alignedStart) {
        if (!supports(query)) {
            return new ArrayList<>();
        }
        List<MeasurementSummary> rows = new ArrayList<>();
        if (query.isOwnerWide()) {
            commitCoverageRepository.findLatestBucketBefore(query.getRepos(), interval, alignedStart)
                    .ifPresent(rows::add);
            return rows;
        }
        commitCoverageRepository.findLatestBefore(query.getRepoId(), query.getBranch(), interval, alignedStart)
                .ifPresent(rows::add);
        return rows;
    }

    private boolean supports(MeasurementQuery query) {
        return query.getName() == MeasurementName.COVERAGE && query.getFlagId() == null;
    }
}
