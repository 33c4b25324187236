package com.company.timeseries.scheduled;

import com.company.timeseries.config.TimeseriesProperties;
import com.company.timeseries.repository.MeasurementSummaryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Refreshes the continuous aggregates over a trailing window so late measurements land in
 * the summary tables.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "timeseries.refresh.enabled", havingValue = "true")
public class SummaryRefreshJob {

    private final MeasurementSummaryRepository summaryRepository;
    private final TimeseriesProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(cron = "${timeseries.refresh.cron:0 15 * * * *}")
    public void refreshRecentSummaries() {
        Instant end = clock.instant();
        Instant start = end.minus(properties.getRefresh().getLookback());
        log.info("Refreshing measurement summaries from {} to {}", start, end);

        try {
            summaryRepository.refresh(start, end);
            meterRegistry.counter("timeseries.summaries.refresh.success").increment();
        } catch (Exception e) {
            log.error("Failed to refresh measurement summaries", e);
            meterRegistry.counter("timeseries.summaries.refresh.failures").increment();
        }
    }
}
