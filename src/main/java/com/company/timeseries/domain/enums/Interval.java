package com.company.timeseries.domain.enums;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Bucket widths supported by the measurement summaries. Each interval is backed by
 * its own continuous aggregate table.
 */
public enum Interval {
    INTERVAL_1_DAY(1, "1d", "timeseries_measurement_summary_1day"),
    INTERVAL_7_DAY(7, "7d", "timeseries_measurement_summary_7day"),
    INTERVAL_30_DAY(30, "30d", "timeseries_measurement_summary_30day");

    private final int days;
    private final String alias;
    private final String summaryTable;

    Interval(int days, String alias, String summaryTable) {
        this.days = days;
        this.alias = alias;
        this.summaryTable = summaryTable;
    }

    public int getDays() {
        return days;
    }

    public String getAlias() {
        return alias;
    }

    public String getSummaryTable() {
        return summaryTable;
    }

    public Duration getDuration() {
        return Duration.ofDays(days);
    }

    /**
     * Resolve the short REST form ("1d", "7d", "30d").
     */
    public static Optional<Interval> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(interval -> interval.alias.equalsIgnoreCase(alias.trim()))
                .findFirst();
    }
}
