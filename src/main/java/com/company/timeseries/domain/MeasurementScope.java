package com.company.timeseries.domain;

import com.company.timeseries.domain.enums.MeasurementName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a caller asks for: a measurement on a repository, optionally narrowed to a
 * flag and a branch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementScope {
    private MeasurementName name;
    private Long repoId;
    private Long flagId;
    private String branch;
}
