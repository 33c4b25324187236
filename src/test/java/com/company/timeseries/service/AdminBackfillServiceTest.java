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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminBackfillServiceTest {

    private static final long REPO_ID = 42L;
    private static final Instant NOW = Instant.parse("2022-02-01T08:30:00Z");

    @Mock
    private RepoRepository repoRepository;

    @Mock
    private BackfillTrigger backfillTrigger;

    @Mock
    private BackfillTaskDispatcher dispatcher;

    @Mock
    private MeasurementSummaryRepository summaryRepository;

    private TimeseriesProperties properties;
    private AdminBackfillService service;

    @BeforeEach
    void setUp() {
        properties = new TimeseriesProperties();
        service = new AdminBackfillService(repoRepository, backfillTrigger, dispatcher, summaryRepository,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Creates both coverage datasets and dispatches batches up to now")
    void backfill_openEnded() {
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(Repo.builder().repoId(REPO_ID).build()));
        Instant start = Instant.parse("2022-01-01T00:00:00Z");
        List<String> names = List.of("coverage", "flag_coverage");
        when(dispatcher.backfillRepository(REPO_ID, start, NOW, names)).thenReturn(4);

        BackfillResponse response = service.backfill(AdminBackfillRequest.builder()
                .repoId(REPO_ID)
                .startDate(LocalDate.of(2022, 1, 1))
                .build());

        assertThat(response.getBatches()).isEqualTo(4);
        assertThat(response.getEndDate()).isEqualTo(NOW);
        assertThat(response.getDatasets()).containsExactly("coverage", "flag_coverage");
        assertThat(response.isRefreshed()).isFalse();
        verify(backfillTrigger).getOrCreateDataset(MeasurementName.COVERAGE, REPO_ID);
        verify(backfillTrigger).getOrCreateDataset(MeasurementName.FLAG_COVERAGE, REPO_ID);
        verifyNoInteractions(summaryRepository);
    }

    @Test
    @DisplayName("Refreshes the summaries over the same range when asked")
    void backfill_withRefresh() {
        when(repoRepository.findById(REPO_ID)).thenReturn(Optional.of(Repo.builder().repoId(REPO_ID).build()));

        service.backfill(AdminBackfillRequest.builder()
                .repoId(REPO_ID)
                .startDate(LocalDate.of(2021, 1, 1))
                .endDate(LocalDate.of(2021, 3, 1))
                .refresh(true)
                .build());

        verify(summaryRepository).refresh(Instant.parse("2021-01-01T00:00:00Z"), Instant.parse("2021-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Unknown repositories are rejected")
    void backfill_unknownRepo() {
        when(repoRepository.findById(anyLong())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.backfill(AdminBackfillRequest.builder()
                .repoId(REPO_ID).startDate(LocalDate.of(2022, 1, 1)).build()))
                .isInstanceOf(RepositoryNotFoundException.class);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Nothing happens while time-series is disabled")
    void backfill_disabled() {
        properties.setEnabled(false);

        assertThatThrownBy(() -> service.backfill(AdminBackfillRequest.builder()
                .repoId(REPO_ID).startDate(LocalDate.of(2022, 1, 1)).build()))
                .isInstanceOf(TimeseriesDisabledException.class);
        verifyNoInteractions(repoRepository, dispatcher, backfillTrigger);
    }
}
