package com.company.timeseries.config;

import com.company.timeseries.repository.DatasetRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final DatasetRepository datasetRepository;
    private final TimeseriesProperties properties;
    private final Clock clock;

    /**
     * Datasets created within the readiness window, still served from commits.
     */
    @Bean
    public MeterBinder pendingDatasetMetrics() {
        return registry -> {
            Gauge.builder("timeseries.datasets.pending", datasetRepository, repo -> {
                        try {
                            return repo.countCreatedAfter(
                                    clock.instant().minus(properties.getBackfill().getReadyAfter()));
                        } catch (Exception e) {
                            log.warn("Failed to count pending datasets", e);
                            return 0;
                        }
                    })
                    .description("Datasets whose backfill is not assumed complete yet")
                    .register(registry);

            log.info("Timeseries metrics registered");
        };
    }
}
