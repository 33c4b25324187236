package com.company.timeseries.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminBackfillRequest {
    @NotNull(message = "Repository ID is required")
    private Long repoId;

    @NotNull(message = "Start date is required (YYYY-MM-DD)")
    private LocalDate startDate;

    // defaults to now
    private LocalDate endDate;

    // also refresh the continuous aggregates over the range
    private boolean refresh;
}
