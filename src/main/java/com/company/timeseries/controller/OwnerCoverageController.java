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

import java.util.List;

@RestController
@RequestMapping("/api/v1/owners/{ownerId}")
@Tag(name = "Coverage", description = "Coverage trends aggregated by interval")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class OwnerCoverageController {

    private final CoverageTrendService trendService;
    private final MeterRegistry meterRegistry;

    /**
     * Coverage of all repositories of an owner merged per bucket, each repository
     * on its default branch. {@code repos} narrows the set to the given ids.
     */
    @GetMapping("/coverage")
    @Operation(summary = "Owner coverage trend",
            description = "Gap-filled coverage series merged over the owner's repositories")
    public ResponseEntity<CoverageTrendResponse> ownerCoverageTrend(
            @PathVariable long ownerId,
            @Parameter(description = "1d, 7d or 30d") @RequestParam(required = false) String interval,
            @Parameter(description = "Repository ids, all repositories when absent")
            @RequestParam(name = "repos", required = false) List<Long> repoIds,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "page_size", defaultValue = "20") @Min(1) @Max(100) int pageSize) {

        Interval resolved = Interval.fromAlias(interval).orElseThrow(InvalidIntervalException::new);
        meterRegistry.counter("api.coverage.owner_trend.requests", "interval", resolved.getAlias()).increment();

        List<MeasurementPoint> series = trendService.ownerCoverage(
                ownerId, repoIds, resolved, QueryDates.parse(startDate), QueryDates.parse(endDate));

        return ResponseEntity.ok(CoverageTrendResponse.of(series, page, pageSize));
    }
}
