package com.company.timeseries.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetTest {

    private static final Duration READY_AFTER = Duration.ofHours(1);

    @Test
    @DisplayName("A dataset is backfilled once the readiness window has passed")
    void isBackfilled_afterWindow() {
        Dataset dataset = Dataset.builder().createdAt(Instant.parse("2022-01-01T00:00:00Z")).build();

        assertThat(dataset.isBackfilled(Instant.parse("2022-01-01T00:30:00Z"), READY_AFTER)).isFalse();
        assertThat(dataset.isBackfilled(Instant.parse("2022-01-01T01:00:00Z"), READY_AFTER)).isFalse();
        assertThat(dataset.isBackfilled(Instant.parse("2022-01-01T01:00:01Z"), READY_AFTER)).isTrue();
    }

    @Test
    @DisplayName("Without a creation time a dataset is never backfilled")
    void isBackfilled_noCreatedAt() {
        assertThat(new Dataset().isBackfilled(Instant.now(), READY_AFTER)).isFalse();
    }
}
