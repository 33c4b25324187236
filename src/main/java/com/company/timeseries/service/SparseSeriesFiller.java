package com.company.timeseries.service;

import com.company.timeseries.domain.MeasurementPoint;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.util.BucketRange;
import com.company.timeseries.util.IntervalAlignment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Turns a sparse, bucket-keyed series into one entry per bucket of the requested
 * range. Missing buckets become null placeholders, except an empty first bucket,
 * which takes the values of the latest measurement before the range.
 */
@Component
@RequiredArgsConstructor
public class SparseSeriesFiller {

    private final Clock clock;

    public List<MeasurementPoint> fill(List<MeasurementPoint> measurements, Interval interval,
                                       Instant start, Instant end) {
        if (measurements == null || measurements.isEmpty()) {
            return new ArrayList<>();
        }

        NavigableMap<Instant, MeasurementPoint> byBucket = new TreeMap<>();
        for (MeasurementPoint measurement : measurements) {
            byBucket.put(measurement.getTimestamp(), measurement);
        }

        Instant first = start != null
                ? IntervalAlignment.alignedStartDate(interval, start)
                : byBucket.firstKey();
        Instant last = end != null ? end : clock.instant();

        BucketRange range = IntervalAlignment.intervalRange(interval.getDuration(), first, last);
        if (range.isEmpty()) {
            return new ArrayList<>();
        }

        Duration step = interval.getDuration();
        List<MeasurementPoint> filled = new ArrayList<>();
        for (Instant bucket = range.getStart(); !bucket.isAfter(range.getEnd()); bucket = bucket.plus(step)) {
            MeasurementPoint measurement = byBucket.get(bucket);
            filled.add(measurement != null ? measurement : MeasurementPoint.placeholder(bucket));
        }

        MeasurementPoint head = filled.get(0);
        if (!head.hasData()) {
            Map.Entry<Instant, MeasurementPoint> previous = byBucket.lowerEntry(head.getTimestamp());
            if (previous != null) {
                filled.set(0, previous.getValue().withTimestamp(head.getTimestamp()));
            }
        }
        return filled;
    }
}
