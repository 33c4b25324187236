package com.company.timeseries.controller;

import com.company.timeseries.domain.Dataset;
import com.company.timeseries.domain.DatasetLookup;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.dto.response.DatasetActivationResponse;
import com.company.timeseries.dto.response.DatasetStatusResponse;
import com.company.timeseries.exception.UnknownMeasurementException;
import com.company.timeseries.service.BackfillTrigger;
import com.company.timeseries.service.CoverageTrendService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/repos/{repoId}/measurements/{name}")
@Tag(name = "Measurements", description = "Time-series dataset activation and status")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class DatasetController {

    private final CoverageTrendService trendService;
    private final BackfillTrigger backfillTrigger;

    @GetMapping("/status")
    @Operation(summary = "Whether a measurement is collected and backfilled for a repository")
    public ResponseEntity<DatasetStatusResponse> status(@PathVariable long repoId, @PathVariable String name) {
        return ResponseEntity.ok(trendService.datasetStatus(repoId, resolve(name)));
    }

    @PostMapping("/activate")
    @Operation(summary = "Activate a measurement", description = "Creates the dataset and backfills it on first activation")
    @PreAuthorize("hasAnyRole('REPO_ADMIN', 'ADMIN')")
    public ResponseEntity<DatasetActivationResponse> activate(@PathVariable long repoId, @PathVariable String name) {
        MeasurementName measurement = resolve(name);
        log.info("Activate {} measurements for repo {}", measurement.getValue(), repoId);

        DatasetLookup lookup = backfillTrigger.activate(measurement, repoId);
        Dataset dataset = lookup.getDataset();

        DatasetActivationResponse response = DatasetActivationResponse.builder()
                .datasetId(dataset.getId())
                .name(dataset.getName())
                .repositoryId(dataset.getRepositoryId())
                .created(lookup.isCreated())
                .createdAt(dataset.getCreatedAt())
                .build();

        return ResponseEntity.status(lookup.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    private MeasurementName resolve(String name) {
        return MeasurementName.fromValue(name).orElseThrow(() -> new UnknownMeasurementException(name));
    }
}
