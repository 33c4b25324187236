package com.company.timeseries.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResponse {
    private Long repoId;
    private Instant startDate;
    private Instant endDate;
    private int batches;
    private List<String> datasets;
    private boolean refreshed;
}
