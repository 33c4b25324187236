package com.company.timeseries.controller;

import com.company.timeseries.domain.MeasurementPoint;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.dto.response.CoverageTrendResponse;
import com.company.timeseries.exception.InvalidIntervalException;
import com.company.timeseries.service.CoverageTrendService;
import com.company.timeseries.util.QueryDates;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/repos/{repoId}")
@Tag(name = "Coverage", description = "Coverage trends aggregated by interval")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class CoverageController {

    private final CoverageTrendService trendService;
    private final MeterRegistry meterRegistry;

    /**
     * Paginated coverage measurements of a repository aggregated by {@code interval},
     * optionally narrowed to a branch and a date range.
     */
    @GetMapping("/coverage")
    @Operation(summary = "Coverage trend", description = "Gap-filled coverage series, one entry per interval")
    public ResponseEntity<CoverageTrendResponse> coverageTrend(
            @PathVariable long repoId,
            @Parameter(description = "1d, 7d or 30d") @RequestParam(required = false) String interval,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String branch,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "page_size", defaultValue = "20") @Min(1) @Max(100) int pageSize) {

        Interval resolved = resolveInterval(interval);
        meterRegistry.counter("api.coverage.trend.requests", "interval", resolved.getAlias()).increment();

        List<MeasurementPoint> series = trendService.repositoryCoverage(
                repoId, resolved, QueryDates.parse(startDate), QueryDates.parse(endDate), branch);

        return ResponseEntity.ok(CoverageTrendResponse.of(series, page, pageSize));
    }

    @GetMapping("/flags/{flagId}/coverage")
    @Operation(summary = "Flag coverage trend", description = "Gap-filled coverage series of a single flag")
    public ResponseEntity<CoverageTrendResponse> flagCoverageTrend(
            @PathVariable long repoId,
            @PathVariable long flagId,
            @RequestParam(required = false) String interval,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) String branch,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "page_size", defaultValue = "20") @Min(1) @Max(100) int pageSize) {

        Interval resolved = resolveInterval(interval);
        meterRegistry.counter("api.coverage.flag_trend.requests", "interval", resolved.getAlias()).increment();

        List<MeasurementPoint> series = trendService.flagCoverage(
                repoId, flagId, resolved, QueryDates.parse(startDate), QueryDates.parse(endDate), branch);

        return ResponseEntity.ok(CoverageTrendResponse.of(series, page, pageSize));
    }

    private Interval resolveInterval(String interval) {
        return Interval.fromAlias(interval).orElseThrow(InvalidIntervalException::new);
    }
}
