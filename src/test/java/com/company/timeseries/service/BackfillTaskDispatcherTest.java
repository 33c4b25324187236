package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.exception.BackfillDispatchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackfillTaskDispatcherTest {

    private static final String QUEUE = "timeseries:backfill:queue";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private BackfillTaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new BackfillTaskDispatcher(redisTemplate, objectMapper,
                OpenTelemetry.noop().getTracer("test"), meterRegistry, new TimeseriesProperties());
        when(redisTemplate.opsForList()).thenReturn(listOperations);
    }

    @Test
    @DisplayName("Dataset backfill pushes one job with ISO dates")
    void backfillDataset_enqueuesJob() throws Exception {
        Dataset dataset = Dataset.builder().id(7).name("coverage").repositoryId(42L).build();

        dispatcher.backfillDataset(dataset, LocalDate.of(2000, 1, 1), LocalDate.of(2022, 1, 1));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(listOperations).leftPush(eq(QUEUE), payload.capture());
        JsonNode job = objectMapper.readTree(payload.getValue());
        assertThat(job.get("task").asText()).isEqualTo("app.tasks.timeseries.backfill_dataset");
        assertThat(job.get("dataset_id").asInt()).isEqualTo(7);
        assertThat(job.get("start_date").asText()).isEqualTo("2000-01-01");
        assertThat(job.get("end_date").asText()).isEqualTo("2022-01-01");
        assertThat(job.has("dataset_names")).isFalse();
        assertThat(meterRegistry.counter("timeseries.backfill.dispatched",
                "task", "app.tasks.timeseries.backfill_dataset").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repository backfill is split into 10 day batches, newest first")
    void backfillRepository_batches() throws Exception {
        int jobs = dispatcher.backfillRepository(42L,
                Instant.parse("2022-01-01T00:00:00Z"), Instant.parse("2022-01-25T00:00:00Z"),
                List.of("coverage", "flag_coverage"));

        assertThat(jobs).isEqualTo(3);
        ArgumentCaptor<String> payloads = ArgumentCaptor.forClass(String.class);
        verify(listOperations, times(3)).leftPush(eq(QUEUE), payloads.capture());

        List<String> values = payloads.getAllValues();
        JsonNode newest = objectMapper.readTree(values.get(0));
        JsonNode oldest = objectMapper.readTree(values.get(2));
        assertThat(newest.get("start_date").asText()).isEqualTo("2022-01-15T00:00Z");
        assertThat(newest.get("end_date").asText()).isEqualTo("2022-01-25T00:00Z");
        assertThat(oldest.get("start_date").asText()).isEqualTo("2022-01-01T00:00Z");
        assertThat(oldest.get("end_date").asText()).isEqualTo("2022-01-05T00:00Z");
        assertThat(newest.get("repoid").asLong()).isEqualTo(42L);
        assertThat(newest.get("dataset_names")).hasSize(2);
    }

    @Test
    @DisplayName("Queue failures surface as BackfillDispatchException")
    void backfillDataset_queueDown() {
        Dataset dataset = Dataset.builder().id(7).repositoryId(42L).build();
        when(listOperations.leftPush(eq(QUEUE), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> dispatcher.backfillDataset(dataset, LocalDate.of(2021, 1, 1), LocalDate.of(2021, 2, 1)))
                .isInstanceOf(BackfillDispatchException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
        assertThat(meterRegistry.counter("timeseries.backfill.dispatch_failures",
                "task", "app.tasks.timeseries.backfill_dataset").count()).isEqualTo(1.0);
    }
}
