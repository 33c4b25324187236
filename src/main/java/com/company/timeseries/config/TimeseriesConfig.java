package com.company.timeseries.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TimeseriesProperties.class)
public class TimeseriesConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
