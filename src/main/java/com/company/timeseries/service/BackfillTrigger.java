package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.CommitSpan;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.domain.DatasetLookup;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.exception.RepositoryNotFoundException;
import com.company.timeseries.exception.TimeseriesDisabledException;
import com.company.timeseries.repository.CommitCoverageRepository;
import com.company.timeseries.repository.DatasetRepository;
import com.company.timeseries.repository.RepoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Creates datasets and requests their backfill. A dataset is backfilled at most once:
 * only the caller that actually inserted the row dispatches the job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillTrigger {

    private final DatasetRepository datasetRepository;
    private final CommitCoverageRepository commitCoverageRepository;
    private final RepoRepository repoRepository;
    private final BackfillTaskDispatcher dispatcher;
    private final TimeseriesProperties properties;
    private final Clock clock;

    public DatasetLookup getOrCreateDataset(MeasurementName name, long repositoryId) {
        boolean created;
        try {
            created = datasetRepository.insertIfAbsent(name.getValue(), repositoryId, clock.instant());
        } catch (DuplicateKeyException e) {
            log.debug("Dataset {} for repo {} created concurrently", name.getValue(), repositoryId);
            created = false;
        }

        Dataset dataset = datasetRepository.findByNameAndRepositoryId(name.getValue(), repositoryId)
                .orElseThrow(() -> new IllegalStateException(
                        "Dataset " + name.getValue() + " missing for repo " + repositoryId + " after insert"));
        return new DatasetLookup(dataset, created);
    }

    /**
     * Get-or-create the dataset and backfill it if this call created it.
     * Dispatch failures propagate.
     */
    public DatasetLookup ensureDataset(MeasurementName name, long repositoryId) {
        DatasetLookup lookup = getOrCreateDataset(name, repositoryId);
        if (lookup.isCreated()) {
            log.info("Created dataset {} for repo {}", name.getValue(), repositoryId);
            triggerBackfill(lookup.getDataset());
        }
        return lookup;
    }

    /**
     * Request a backfill over the whole commit history of the dataset's repository,
     * from the day of the first commit to the day after the last one. No-op without commits.
     */
    public void triggerBackfill(Dataset dataset) {
        Optional<CommitSpan> span = commitCoverageRepository.findCommitSpan(dataset.getRepositoryId());
        if (span.isEmpty()) {
            log.info("Repo {} has no commits, nothing to backfill for dataset {}",
                    dataset.getRepositoryId(), dataset.getName());
            return;
        }

        LocalDate startDate = span.get().getFirstCommitAt().atOffset(ZoneOffset.UTC).toLocalDate();
        LocalDate endDate = span.get().getLastCommitAt().atOffset(ZoneOffset.UTC).toLocalDate().plusDays(1);

        dispatcher.backfillDataset(dataset, startDate, endDate);
    }

    /**
     * Turn on time-series collection for a measurement of a repository.
     */
    public DatasetLookup activate(MeasurementName name, long repositoryId) {
        if (!properties.isEnabled()) {
            throw new TimeseriesDisabledException();
        }
        repoRepository.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        return ensureDataset(name, repositoryId);
    }
}
