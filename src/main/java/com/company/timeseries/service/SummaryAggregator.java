package com.company.timeseries.service;

import com.company.timeseries.domain.AggregatedMeasurement;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.enums.GroupingKey;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Second-level aggregation over pre-aggregated summary rows.
 *
 * <p>Averages are merged weighted by {@code value_count}: the mean of
 * {@code {avg 10, count 1}} and {@code {avg 20, count 9}} is 19, not 15. The weighted
 * sum is accumulated in {@link BigDecimal} so that long series of small buckets
 * do not drift.
 */
@Component
public class SummaryAggregator {

    public static final Set<GroupingKey> BY_BUCKET = EnumSet.of(GroupingKey.TIMESTAMP_BIN);

    private static final MathContext PRECISION = new MathContext(100);

    private static final Comparator<AggregatedMeasurement> BY_TIMESTAMP = Comparator.comparing(
            AggregatedMeasurement::getTimestampBin, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * One row per distinct value of {@code grouping}, ordered by bucket timestamp.
     */
    public List<AggregatedMeasurement> aggregate(Collection<MeasurementSummary> rows, Set<GroupingKey> grouping) {
        if (rows == null || rows.isEmpty()) {
            return new ArrayList<>();
        }
        Set<GroupingKey> keys = grouping.isEmpty() ? EnumSet.noneOf(GroupingKey.class) : EnumSet.copyOf(grouping);

        Map<List<Object>, Accumulator> groups = new LinkedHashMap<>();
        for (MeasurementSummary row : rows) {
            groups.computeIfAbsent(groupKey(row, keys), k -> new Accumulator(row, keys)).add(row);
        }

        List<AggregatedMeasurement> result = new ArrayList<>(groups.size());
        for (Accumulator accumulator : groups.values()) {
            result.add(accumulator.toMeasurement());
        }
        result.sort(BY_TIMESTAMP);
        return result;
    }

    private static List<Object> groupKey(MeasurementSummary row, Set<GroupingKey> keys) {
        Object[] values = new Object[GroupingKey.values().length];
        for (GroupingKey key : keys) {
            values[key.ordinal()] = keyValue(row, key);
        }
        return Arrays.asList(values);
    }

    private static Object keyValue(MeasurementSummary row, GroupingKey key) {
        switch (key) {
            case TIMESTAMP_BIN:
                return row.getTimestampBin();
            case OWNER:
                return row.getOwnerId();
            case REPO:
                return row.getRepoId();
            case FLAG:
                return row.getFlagId();
            case BRANCH:
                return row.getBranch();
            default:
                throw new IllegalArgumentException("Unknown grouping key: " + key);
        }
    }

    private static final class Accumulator {
        private final AggregatedMeasurement.AggregatedMeasurementBuilder keys;
        private BigDecimal weightedSum = BigDecimal.ZERO;
        private long count;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        private Accumulator(MeasurementSummary first, Set<GroupingKey> grouping) {
            this.keys = AggregatedMeasurement.builder()
                    .timestampBin(grouping.contains(GroupingKey.TIMESTAMP_BIN) ? first.getTimestampBin() : null)
                    .ownerId(grouping.contains(GroupingKey.OWNER) ? first.getOwnerId() : null)
                    .repoId(grouping.contains(GroupingKey.REPO) ? first.getRepoId() : null)
                    .flagId(grouping.contains(GroupingKey.FLAG) ? first.getFlagId() : null)
                    .branch(grouping.contains(GroupingKey.BRANCH) ? first.getBranch() : null);
        }

        private void add(MeasurementSummary row) {
            weightedSum = weightedSum.add(
                    BigDecimal.valueOf(row.getValueAvg()).multiply(BigDecimal.valueOf(row.getValueCount())),
                    PRECISION);
            count += row.getValueCount();
            min = Math.min(min, row.getValueMin());
            max = Math.max(max, row.getValueMax());
        }

        private AggregatedMeasurement toMeasurement() {
            Double avg = count > 0
                    ? weightedSum.divide(BigDecimal.valueOf(count), PRECISION).doubleValue()
                    : null;
            return keys
                    .avg(avg)
                    .min(min)
                    .max(max)
                    .count(count)
                    .build();
        }
    }
}
