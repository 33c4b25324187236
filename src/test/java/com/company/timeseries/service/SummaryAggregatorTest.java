package com.company.timeseries.service;

import com.company.timeseries.domain.AggregatedMeasurement;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.enums.GroupingKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SummaryAggregatorTest {

    private static final Instant DAY_1 = Instant.parse("2022-01-01T00:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2022-01-02T00:00:00Z");

    private final SummaryAggregator aggregator = new SummaryAggregator();

    @Test
    @DisplayName("Averages are weighted by count")
    void aggregate_weightedAverage() {
        List<MeasurementSummary> rows = List.of(
                row(DAY_1, "main", 10.0, 10.0, 10.0, 1),
                row(DAY_1, "develop", 20.0, 18.0, 25.0, 9));

        List<AggregatedMeasurement> result = aggregator.aggregate(rows, SummaryAggregator.BY_BUCKET);

        assertThat(result).hasSize(1);
        AggregatedMeasurement merged = result.get(0);
        assertThat(merged.getTimestampBin()).isEqualTo(DAY_1);
        assertThat(merged.getAvg()).isEqualTo(19.0);
        assertThat(merged.getMin()).isEqualTo(10.0);
        assertThat(merged.getMax()).isEqualTo(25.0);
        assertThat(merged.getCount()).isEqualTo(10);
        assertThat(merged.getBranch()).isNull();
    }

    @Test
    @DisplayName("Rows of different buckets stay apart, ordered by bucket")
    void aggregate_groupsByBucket() {
        List<MeasurementSummary> rows = List.of(
                row(DAY_2, "main", 80.0, 80.0, 80.0, 1),
                row(DAY_1, "main", 80.0, 80.0, 80.0, 1),
                row(DAY_1, "main", 85.0, 85.0, 85.0, 1));

        List<AggregatedMeasurement> result = aggregator.aggregate(rows, SummaryAggregator.BY_BUCKET);

        assertThat(result).extracting(AggregatedMeasurement::getTimestampBin).containsExactly(DAY_1, DAY_2);
        assertThat(result.get(0).getAvg()).isEqualTo(82.5);
        assertThat(result.get(0).getCount()).isEqualTo(2);
        assertThat(result.get(1).getAvg()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("Grouping by branch keeps one row per branch and bucket")
    void aggregate_groupsByBranch() {
        List<MeasurementSummary> rows = List.of(
                row(DAY_1, "main", 70.0, 70.0, 70.0, 2),
                row(DAY_1, "develop", 60.0, 60.0, 60.0, 1),
                row(DAY_1, "main", 76.0, 76.0, 76.0, 1));

        List<AggregatedMeasurement> result =
                aggregator.aggregate(rows, EnumSet.of(GroupingKey.TIMESTAMP_BIN, GroupingKey.BRANCH));

        assertThat(result).hasSize(2);
        AggregatedMeasurement main = result.stream().filter(r -> "main".equals(r.getBranch())).findFirst().orElseThrow();
        assertThat(main.getAvg()).isEqualTo(72.0);
        assertThat(main.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Long series of small buckets do not drift")
    void aggregate_highPrecision() {
        List<MeasurementSummary> rows = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            rows.add(row(DAY_1, "main", 0.1, 0.1, 0.1, 1));
        }

        List<AggregatedMeasurement> result = aggregator.aggregate(rows, SummaryAggregator.BY_BUCKET);

        assertThat(result.get(0).getAvg()).isCloseTo(0.1, within(1e-15));
        assertThat(result.get(0).getCount()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("An empty grouping merges everything into one row")
    void aggregate_emptyGrouping() {
        List<MeasurementSummary> rows = List.of(
                row(DAY_1, "main", 50.0, 40.0, 60.0, 1),
                row(DAY_2, "main", 70.0, 65.0, 90.0, 3));

        List<AggregatedMeasurement> result = aggregator.aggregate(rows, EnumSet.noneOf(GroupingKey.class));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getTimestampBin()).isNull();
        assertThat(result.get(0).getAvg()).isEqualTo(65.0);
        assertThat(result.get(0).getMin()).isEqualTo(40.0);
        assertThat(result.get(0).getMax()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("No rows, no output")
    void aggregate_empty() {
        assertThat(aggregator.aggregate(List.of(), SummaryAggregator.BY_BUCKET)).isEmpty();
    }

    private static MeasurementSummary row(Instant bin, String branch, double avg, double min, double max, long count) {
        return MeasurementSummary.builder()
                .timestampBin(bin)
                .ownerId(1L)
                .repoId(2L)
                .branch(branch)
                .name("coverage")
                .valueAvg(avg)
                .valueMin(min)
                .valueMax(max)
                .valueCount(count)
                .build();
    }
}
