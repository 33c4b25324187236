package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.CommitSpan;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.domain.DatasetLookup;
import com.company.timeseries.domain.Repo;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.exception.RepositoryNotFoundException;
import com.company.timeseries.exception.TimeseriesDisabledException;
import com.company.timeseries.repository.CommitCoverageRepository;
import com.company.timeseries.repository.DatasetRepository;
import com.company.timeseries.repository.RepoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackfillTriggerTest {

    private static final long REPO_ID = 42L;
    private static final Instant NOW = Instant.parse("2022-01-10T00:00:00Z");

    @Mock
    private DatasetRepository datasetRepository;

    @Mock
    private CommitCoverageRepository commitCoverageRepository;

    @Mock
    private RepoRepository repoRepository;

    @Mock
    private BackfillTaskDispatcher dispatcher;

    private TimeseriesProperties properties;
    private BackfillTrigger trigger;
    private Dataset dataset;

    @BeforeEach
    void setUp() {
        properties = new TimeseriesProperties();
        trigger = new BackfillTrigger(datasetRepository, commitCoverageRepository, repoRepository,
                dispatcher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        dataset = Dataset.builder().id(7).name("coverage").repositoryId(REPO_ID).createdAt(NOW).build();
    }

    @Test
    @DisplayName("Backfill spans the first commit day to the day after the last commit")
    void ensureDataset_created_triggersBackfill() {
        when(datasetRepository.insertIfAbsent("coverage", REPO_ID, NOW)).thenReturn(true);
        when(datasetRepository.findByNameAndRepositoryId("coverage", REPO_ID)).thenReturn(Optional.of(dataset));
        when(commitCoverageRepository.findCommitSpan(REPO_ID)).thenReturn(Optional.of(new CommitSpan(
                Instant.parse("2000-01-01T00:00:00Z"), Instant.parse("2021-12-31T00:00:00Z"))));

        DatasetLookup lookup = trigger.ensureDataset(MeasurementName.COVERAGE, REPO_ID);

        assertThat(lookup.isCreated()).isTrue();
        assertThat(lookup.getDataset()).isSameAs(dataset);
        verify(dispatcher).backfillDataset(dataset, LocalDate.of(2000, 1, 1), LocalDate.of(2022, 1, 1));
    }

    @Test
    @DisplayName("Only the call that created the dataset triggers a backfill")
    void ensureDataset_twice_triggersOnce() {
        when(datasetRepository.insertIfAbsent("coverage", REPO_ID, NOW)).thenReturn(true, false);
        when(datasetRepository.findByNameAndRepositoryId("coverage", REPO_ID)).thenReturn(Optional.of(dataset));
        when(commitCoverageRepository.findCommitSpan(REPO_ID)).thenReturn(Optional.of(new CommitSpan(
                Instant.parse("2021-06-01T10:00:00Z"), Instant.parse("2021-06-30T23:00:00Z"))));

        DatasetLookup first = trigger.ensureDataset(MeasurementName.COVERAGE, REPO_ID);
        DatasetLookup second = trigger.ensureDataset(MeasurementName.COVERAGE, REPO_ID);

        assertThat(first.isCreated()).isTrue();
        assertThat(second.isCreated()).isFalse();
        verify(dispatcher, times(1)).backfillDataset(any(), any(), any());
    }

    @Test
    @DisplayName("Losing the insert race reads as an existing dataset")
    void getOrCreateDataset_duplicateKey() {
        when(datasetRepository.insertIfAbsent("coverage", REPO_ID, NOW))
                .thenThrow(new DuplicateKeyException("name_repository_id_unique"));
        when(datasetRepository.findByNameAndRepositoryId("coverage", REPO_ID)).thenReturn(Optional.of(dataset));

        DatasetLookup lookup = trigger.ensureDataset(MeasurementName.COVERAGE, REPO_ID);

        assertThat(lookup.isCreated()).isFalse();
        verifyNoInteractions(dispatcher, commitCoverageRepository);
    }

    @Test
    @DisplayName("Repositories without commits have nothing to backfill")
    void triggerBackfill_noCommits() {
        when(commitCoverageRepository.findCommitSpan(REPO_ID)).thenReturn(Optional.empty());

        trigger.triggerBackfill(dataset);

        verify(dispatcher, never()).backfillDataset(any(), any(), any());
    }

    @Test
    @DisplayName("Activation is refused while time-series is disabled")
    void activate_disabled() {
        properties.setEnabled(false);

        assertThatThrownBy(() -> trigger.activate(MeasurementName.COVERAGE, REPO_ID))
                .isInstanceOf(TimeseriesDisabledException.class);
        verifyNoInteractions(datasetRepository, dispatcher);
    }

    @Test
    @DisplayName("Activation of an unknown repository fails")
    void activate_unknownRepo() {
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> trigger.activate(MeasurementName.COVERAGE, REPO_ID))
                .isInstanceOf(RepositoryNotFoundException.class)
                .hasMessageContaining("42");
    }

    @Test
    @DisplayName("Activation of an existing dataset does not backfill again")
    void activate_existingDataset() {
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(Repo.builder().repoId(REPO_ID).build()));
        when(datasetRepository.insertIfAbsent("coverage", REPO_ID, NOW)).thenReturn(false);
        when(datasetRepository.findByNameAndRepositoryId("coverage", REPO_ID)).thenReturn(Optional.of(dataset));

        DatasetLookup lookup = trigger.activate(MeasurementName.COVERAGE, REPO_ID);

        assertThat(lookup.isCreated()).isFalse();
        verifyNoInteractions(dispatcher);
    }
}
