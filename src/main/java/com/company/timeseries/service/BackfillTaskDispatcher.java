package com.company.timeseries.service;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.domain.BackfillJob;
import com.company.timeseries.domain.Dataset;
import com.company.timeseries.exception.BackfillDispatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Enqueues backfill work for the time-series worker. Jobs are JSON documents pushed
 * onto a Redis list; this class never waits for them to run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BackfillTaskDispatcher {

    static final String DATASET_TASK = "app.tasks.timeseries.backfill_dataset";
    static final String REPO_TASK = "app.tasks.timeseries.backfill";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final TimeseriesProperties properties;

    /**
     * One job covering {@code [startDate, endDate)} for a single dataset.
     */
    @CircuitBreaker(name = "backfillDispatch")
    public void backfillDataset(Dataset dataset, LocalDate startDate, LocalDate endDate) {
        log.info("Triggering dataset backfill: dataset={}, start={}, end={}",
                dataset.getId(), startDate, endDate);

        enqueue(BackfillJob.builder()
                .task(DATASET_TASK)
                .datasetId(dataset.getId())
                .repoId(dataset.getRepositoryId())
                .startDate(startDate.toString())
                .endDate(endDate.toString())
                .build());
    }

    /**
     * Splits {@code [start, end]} into batches of {@code timeseries.backfill.batch-days},
     * newest first, and enqueues one job per batch.
     *
     * @return number of jobs enqueued
     */
    @CircuitBreaker(name = "backfillDispatch")
    public int backfillRepository(long repoId, Instant start, Instant end, List<String> datasetNames) {
        log.info("Triggering timeseries backfill tasks for repo {}: start={}, end={}, datasets={}",
                repoId, start, end, datasetNames);

        Duration batch = Duration.ofDays(properties.getBackfill().getBatchDays());
        List<BackfillJob> jobs = new ArrayList<>();

        Instant batchEnd = end;
        while (batchEnd.isAfter(start)) {
            Instant batchStart = batchEnd.minus(batch);
            if (batchStart.isBefore(start)) {
                batchStart = start;
            }
            jobs.add(BackfillJob.builder()
                    .task(REPO_TASK)
                    .repoId(repoId)
                    .startDate(batchStart.atOffset(ZoneOffset.UTC).toString())
                    .endDate(batchEnd.atOffset(ZoneOffset.UTC).toString())
                    .datasetNames(datasetNames)
                    .build());
            batchEnd = batchStart;
        }

        jobs.forEach(this::enqueue);
        return jobs.size();
    }

    private void enqueue(BackfillJob job) {
        Span span = tracer.spanBuilder("timeseries.backfill.dispatch")
                .setSpanKind(SpanKind.PRODUCER)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("task", job.getTask());
            span.setAttribute("repo.id", job.getRepoId() != null ? job.getRepoId() : 0L);
            span.setAttribute("start_date", job.getStartDate());
            span.setAttribute("end_date", job.getEndDate());

            String payload = objectMapper.writeValueAsString(job);
            redisTemplate.opsForList().leftPush(properties.getBackfill().getQueueKey(), payload);

            meterRegistry.counter("timeseries.backfill.dispatched", "task", job.getTask()).increment();
        } catch (JsonProcessingException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to serialize backfill job");
            throw new BackfillDispatchException("Failed to serialize backfill job", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to enqueue backfill job");
            meterRegistry.counter("timeseries.backfill.dispatch_failures", "task", job.getTask()).increment();
            throw new BackfillDispatchException("Failed to enqueue backfill job", e);
        } finally {
            span.end();
        }
    }
}
