package com.company.timeseries.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class CommitSpan {
    private Instant firstCommitAt;
    private Instant lastCommitAt;
}
