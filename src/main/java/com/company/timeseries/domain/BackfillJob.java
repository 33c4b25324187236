package com.company.timeseries.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload pushed onto the backfill task queue for the worker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackfillJob {
    private String task;

    @JsonProperty("dataset_id")
    private Integer datasetId;

    @JsonProperty("repoid")
    private Long repoId;

    @JsonProperty("start_date")
    private String startDate;

    @JsonProperty("end_date")
    private String endDate;

    @JsonProperty("dataset_names")
    private List<String> datasetNames;
}
