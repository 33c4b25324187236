package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Tracks whether time-series data has been enabled for a measurement on a repository.
 * One row per (name, repository_id), enforced by a unique constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dataset {
    private Integer id;
    private String name;
    private Long repositoryId;

    // set by the worker once it finishes; not reliable enough to read yet
    private Boolean backfilled;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * The continuous aggregates are considered materialized once {@code readyAfter}
     * has elapsed since the dataset was created.
     */
    public boolean isBackfilled(Instant now, Duration readyAfter) {
        if (createdAt == null) {
            return false;
        }
        return now.isAfter(createdAt.plus(readyAfter));
    }
}
