package com.company.timeseries.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetActivationResponse {
    private Integer datasetId;
    private String name;
    private Long repositoryId;
    private boolean created;
    private Instant createdAt;
}
