package com.company.timeseries.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryDatesTest {

    @Test
    @DisplayName("Plain dates are midnight UTC")
    void parse_plainDate() {
        assertThat(QueryDates.parse("2021-12-31")).isEqualTo(Instant.parse("2021-12-31T00:00:00Z"));
    }

    @Test
    @DisplayName("Zone-less date-times are read as UTC, offsets are honored")
    void parse_dateTimes() {
        assertThat(QueryDates.parse("2022-01-01T01:00:00")).isEqualTo(Instant.parse("2022-01-01T01:00:00Z"));
        assertThat(QueryDates.parse("2022-01-01T01:00:00Z")).isEqualTo(Instant.parse("2022-01-01T01:00:00Z"));
        assertThat(QueryDates.parse("2022-01-01T03:00:00+02:00")).isEqualTo(Instant.parse("2022-01-01T01:00:00Z"));
    }

    @Test
    @DisplayName("Missing values parse to null")
    void parse_blank() {
        assertThat(QueryDates.parse(null)).isNull();
        assertThat(QueryDates.parse("  ")).isNull();
    }

    @Test
    @DisplayName("Garbage is an IllegalArgumentException")
    void parse_invalid() {
        assertThatThrownBy(() -> QueryDates.parse("yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yesterday");
    }
}
