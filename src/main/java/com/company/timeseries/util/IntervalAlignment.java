package com.company.timeseries.util;

import com.company.timeseries.domain.enums.Interval;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Fixed-origin bucket math shared by every reader of the time-series store.
 *
 * <p>Buckets are consecutive spans of the interval length with one boundary on
 * {@link #EPOCH}. This must agree with the origin used by the continuous aggregates
 * (see {@code db/timeseries-schema.sql}), otherwise bucket keys drift apart.
 */
public final class IntervalAlignment {

    /**
     * Origin of all time buckets: Monday 2000-01-03 UTC, so weekly buckets run Monday-Sunday.
     */
    public static final Instant EPOCH = Instant.parse("2000-01-03T00:00:00Z");

    private IntervalAlignment() {
    }

    /**
     * Start of the bucket of {@code interval} containing {@code date}.
     */
    public static Instant alignedStartDate(Interval interval, Instant date) {
        if (interval == null) {
            throw new IllegalArgumentException("Cannot align to a null interval");
        }
        if (date == null) {
            throw new IllegalArgumentException("Cannot align a null date to " + interval);
        }
        long length = interval.getDuration().toMillis();
        long buckets = Math.floorDiv(date.toEpochMilli() - EPOCH.toEpochMilli(), length);
        return EPOCH.plusMillis(buckets * length);
    }

    /**
     * First and last bucket starts whose boundaries fall within {@code [after, before]}.
     * The start rounds up to the next boundary, the end rounds down. When no boundary
     * lies in the range the returned start is after the returned end.
     */
    public static BucketRange intervalRange(Duration delta, Instant after, Instant before) {
        long length = delta.toMillis();
        if (length <= 0) {
            throw new IllegalArgumentException("Interval length must be positive: " + delta);
        }
        long origin = EPOCH.toEpochMilli();
        long first = -Math.floorDiv(origin - after.toEpochMilli(), length);
        long last = Math.floorDiv(before.toEpochMilli() - origin, length);
        return new BucketRange(EPOCH.plusMillis(first * length), EPOCH.plusMillis(last * length));
    }

    /**
     * Number of buckets of {@code interval} from {@code alignedStart} up to and including
     * the bucket starting at or before {@code end}.
     */
    public static long bucketCount(Interval interval, Instant alignedStart, Instant end) {
        BucketRange range = intervalRange(interval.getDuration(), alignedStart, end);
        if (range.isEmpty()) {
            return 0;
        }
        return Duration.between(range.getStart(), range.getEnd()).toMillis()
                / interval.getDuration().toMillis() + 1;
    }

    /**
     * The epoch as a zone-less timestamp, for columns stored without a time zone.
     */
    public static LocalDateTime epochUtc() {
        return LocalDateTime.ofInstant(EPOCH, ZoneOffset.UTC);
    }
}
