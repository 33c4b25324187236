package com.company.timeseries.domain;

import com.company.timeseries.domain.enums.MeasurementName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fully resolved filter for a measurement series: owner and branch are filled
 * in from the repository when the caller leaves them out.
 *
 * <p>An owner-wide query sets {@code repos} instead of {@code repoId}; each listed
 * repository is then read on its own default branch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementQuery {
    private MeasurementName name;
    private Long ownerId;
    private Long repoId;
    private Long flagId;
    private String branch;
    private List<Repo> repos;

    public boolean isOwnerWide() {
        return repos != null;
    }
}
