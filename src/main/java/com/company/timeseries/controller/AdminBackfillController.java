package com.company.timeseries.controller;

import com.company.timeseries.dto.request.AdminBackfillRequest;
import com.company.timeseries.dto.response.BackfillResponse;
import com.company.timeseries.service.AdminBackfillService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/timeseries")
@Tag(name = "Timeseries Admin", description = "Operator tools for time-series data")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class AdminBackfillController {

    private final AdminBackfillService backfillService;

    @PostMapping("/backfill")
    @Operation(summary = "Backfill a repository", description = "Dispatches backfill batches and optionally refreshes summaries")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BackfillResponse> backfill(@Valid @RequestBody AdminBackfillRequest request) {
        log.info("Admin backfill requested for repo {} from {} to {}",
                request.getRepoId(), request.getStartDate(), request.getEndDate());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(backfillService.backfill(request));
    }
}
