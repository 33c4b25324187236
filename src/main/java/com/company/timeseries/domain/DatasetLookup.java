package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a get-or-create on {@link Dataset}; {@code created} is true only for the
 * caller whose insert won the unique constraint.
 */
@Data
@AllArgsConstructor
public class DatasetLookup {
    private Dataset dataset;
    private boolean created;
}
