package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a row of the {@code repos} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Repo {
    private Long repoId;
    private Long ownerId;
    private String name;
    private String branch;  // default branch
}
