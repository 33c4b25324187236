package com.company.timeseries.repository;

import com.company.timeseries.domain.CommitSpan;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.Repo;
import com.company.timeseries.domain.enums.Interval;
import com.company.timeseries.domain.enums.MeasurementName;
import com.company.timeseries.util.IntervalAlignment;
import com.company.timeseries.util.QueryDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Coverage computed straight from the {@code commits} table. Used while the
 * continuous aggregates of a repository are not materialized yet.
 *
 * <p>Buckets come from {@code date_bin} with the origin bound from
 * {@link IntervalAlignment#EPOCH}, so the rows line up with the summary tables.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class CommitCoverageRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String COVERAGE = "(c.totals->>'c')::numeric";

    private static final String BUCKETED_SELECT = """
        SELECT date_bin(make_interval(days => ?), c.timestamp, ?) AS timestamp_bin,
               AVG(%1$s) AS value_avg,
               MIN(%1$s) AS value_min,
               MAX(%1$s) AS value_max,
               COUNT(*) AS value_count
        """.formatted(COVERAGE);

    private static final String COMPLETE_COMMITS = """
        FROM commits c
        WHERE c.state = 'complete'
        AND c.totals->>'c' IS NOT NULL
        """;

    /**
     * Per-bucket avg/min/max/count of commit coverage for every bucket with
     * {@code from <= bucket <= to}. The last bucket is included in full.
     */
    public List<MeasurementSummary> findBucketedCoverage(long repoId, String branch, Interval interval,
                                                         Instant from, Instant to) {
        List<Object> params = binParams(interval);
        StringBuilder sql = new StringBuilder(BUCKETED_SELECT).append(COMPLETE_COMMITS);
        sql.append(" AND c.repoid = ?");
        params.add(repoId);

        if (branch != null) {
            sql.append(" AND c.branch = ?");
            params.add(branch);
        }
        appendBucketRange(sql, params, interval, from, to);
        sql.append(" GROUP BY 1 ORDER BY 1");

        try {
            return jdbcTemplate.query(sql.toString(), new BucketRowMapper(repoId, branch), params.toArray());
        } catch (Exception e) {
            log.error("Failed to compute {} commit coverage for repo {}", interval, repoId, e);
            throw new RuntimeException("Failed to compute commit coverage", e);
        }
    }

    /**
     * Same buckets as {@link #findBucketedCoverage(long, String, Interval, Instant, Instant)}
     * over the default-branch commits of several repositories, merged into one row per bucket.
     */
    public List<MeasurementSummary> findBucketedCoverage(List<Repo> repos, Interval interval,
                                                         Instant from, Instant to) {
        if (repos.isEmpty()) {
            return new ArrayList<>();
        }
        List<Object> params = binParams(interval);
        StringBuilder sql = new StringBuilder(BUCKETED_SELECT).append(COMPLETE_COMMITS);
        sql.append(defaultBranchFilter(repos, params));
        appendBucketRange(sql, params, interval, from, to);
        sql.append(" GROUP BY 1 ORDER BY 1");

        try {
            return jdbcTemplate.query(sql.toString(), new BucketRowMapper(null, null), params.toArray());
        } catch (Exception e) {
            log.error("Failed to compute {} commit coverage for {} repos", interval, repos.size(), e);
            throw new RuntimeException("Failed to compute commit coverage", e);
        }
    }

    /**
     * Coverage of the newest complete commit strictly before {@code before}, placed in its bucket.
     */
    public Optional<MeasurementSummary> findLatestBefore(long repoId, String branch, Interval interval,
                                                         Instant before) {
        List<Object> params = binParams(interval);

        StringBuilder sql = new StringBuilder("""
            SELECT date_bin(make_interval(days => ?), c.timestamp, ?) AS timestamp_bin,
                   %1$s AS value_avg,
                   %1$s AS value_min,
                   %1$s AS value_max,
                   1 AS value_count
            """.formatted(COVERAGE));
        sql.append(COMPLETE_COMMITS);
        sql.append(" AND c.repoid = ?");
        params.add(repoId);

        if (branch != null) {
            sql.append(" AND c.branch = ?");
            params.add(branch);
        }
        sql.append(" AND c.timestamp < ? ORDER BY c.timestamp DESC LIMIT 1");
        params.add(QueryDates.toUtc(before));

        try {
            List<MeasurementSummary> rows = jdbcTemplate.query(
                    sql.toString(), new BucketRowMapper(repoId, branch), params.toArray());
            return rows.stream().findFirst();
        } catch (Exception e) {
            log.error("Failed to fetch commit coverage before {} for repo {}", before, repoId, e);
            throw new RuntimeException("Failed to fetch previous commit coverage", e);
        }
    }

    /**
     * The newest bucket strictly before {@code before} holding a default-branch commit of
     * any of {@code repos}, aggregated over all commits of that bucket.
     */
    public Optional<MeasurementSummary> findLatestBucketBefore(List<Repo> repos, Interval interval,
                                                               Instant before) {
        if (repos.isEmpty()) {
            return Optional.empty();
        }
        List<Object> params = binParams(interval);
        StringBuilder sql = new StringBuilder(BUCKETED_SELECT).append(COMPLETE_COMMITS);
        sql.append(defaultBranchFilter(repos, params));
        sql.append(" AND c.timestamp < ? GROUP BY 1 ORDER BY 1 DESC LIMIT 1");
        params.add(QueryDates.toUtc(before));

        try {
            List<MeasurementSummary> rows = jdbcTemplate.query(
                    sql.toString(), new BucketRowMapper(null, null), params.toArray());
            return rows.stream().findFirst();
        } catch (Exception e) {
            log.error("Failed to fetch commit coverage before {} for {} repos", before, repos.size(), e);
            throw new RuntimeException("Failed to fetch previous commit coverage", e);
        }
    }

    /**
     * Timestamps of the first and last commit of a repository, empty when it has none.
     */
    public Optional<CommitSpan> findCommitSpan(long repoId) {
        String sql = """
            SELECT MIN(timestamp) AS first_commit, MAX(timestamp) AS last_commit
            FROM commits
            WHERE repoid = ?
            """;

        try {
            return jdbcTemplate.query(sql, rs -> {
                if (!rs.next()) {
                    return Optional.empty();
                }
                LocalDateTime first = rs.getObject("first_commit", LocalDateTime.class);
                LocalDateTime last = rs.getObject("last_commit", LocalDateTime.class);
                if (first == null || last == null) {
                    return Optional.empty();
                }
                return Optional.of(new CommitSpan(QueryDates.fromUtc(first), QueryDates.fromUtc(last)));
            }, repoId);
        } catch (Exception e) {
            log.error("Failed to fetch commit span for repo {}", repoId, e);
            throw new RuntimeException("Failed to fetch commit span", e);
        }
    }

    private static List<Object> binParams(Interval interval) {
        List<Object> params = new ArrayList<>();
        params.add(interval.getDays());
        params.add(IntervalAlignment.epochUtc());
        return params;
    }

    // Bounds on the raw timestamp select whole buckets: [start of from's bucket, end of to's bucket).
    private static void appendBucketRange(StringBuilder sql, List<Object> params, Interval interval,
                                          Instant from, Instant to) {
        if (from != null) {
            sql.append(" AND c.timestamp >= ?");
            params.add(QueryDates.toUtc(IntervalAlignment.alignedStartDate(interval, from)));
        }
        if (to != null) {
            sql.append(" AND c.timestamp < ?");
            params.add(QueryDates.toUtc(
                    IntervalAlignment.alignedStartDate(interval, to).plus(interval.getDuration())));
        }
    }

    private static String defaultBranchFilter(List<Repo> repos, List<Object> params) {
        StringJoiner pairs = new StringJoiner(", ", " AND (c.repoid, c.branch) IN (", ")");
        for (Repo repo : repos) {
            pairs.add("(?, ?)");
            params.add(repo.getRepoId());
            params.add(repo.getBranch());
        }
        return pairs.toString();
    }

    private static class BucketRowMapper implements RowMapper<MeasurementSummary> {
        private final Long repoId;
        private final String branch;

        BucketRowMapper(Long repoId, String branch) {
            this.repoId = repoId;
            this.branch = branch;
        }

        @Override
        public MeasurementSummary mapRow(ResultSet rs, int rowNum) throws SQLException {
            return MeasurementSummary.builder()
                    .timestampBin(QueryDates.fromUtc(rs.getObject("timestamp_bin", LocalDateTime.class)))
                    .repoId(repoId)
                    .branch(branch)
                    .name(MeasurementName.COVERAGE.getValue())
                    .valueAvg(rs.getDouble("value_avg"))
                    .valueMin(rs.getDouble("value_min"))
                    .valueMax(rs.getDouble("value_max"))
                    .valueCount(rs.getLong("value_count"))
                    .build();
        }
    }
}
