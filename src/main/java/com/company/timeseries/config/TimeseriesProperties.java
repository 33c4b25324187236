package com.company.timeseries.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code timeseries.*} settings.
 */
@Data
@ConfigurationProperties(prefix = "timeseries")
public class TimeseriesProperties {

    /**
     * When false every read is answered from commits and no dataset is created.
     */
    private boolean enabled = true;

    private Backfill backfill = new Backfill();

    private Refresh refresh = new Refresh();

    @Data
    public static class Backfill {
        // time after creation at which a dataset's aggregates are assumed materialized
        private Duration readyAfter = Duration.ofHours(1);
        private String queueKey = "timeseries:backfill:queue";
        private int batchDays = 10;
    }

    @Data
    public static class Refresh {
        private boolean enabled = false;
        private String cron = "0 15 * * * *";
        private Duration lookback = Duration.ofDays(2);
    }
}
