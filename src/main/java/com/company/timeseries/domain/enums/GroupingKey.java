package com.company.timeseries.domain.enums;

/**
 * Columns a set of summary rows can be grouped by. Keys left out of a grouping
 * are collapsed by the aggregation.
 */
public enum GroupingKey {
    TIMESTAMP_BIN,
    OWNER,
    REPO,
    FLAG,
    BRANCH
}
