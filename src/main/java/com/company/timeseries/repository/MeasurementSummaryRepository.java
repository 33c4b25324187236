package com.company.timeseries.repository;

import com.company.timeseries.domain.MeasurementQuery;
import com.company.timeseries.domain.MeasurementSummary;
import com.company.timeseries.domain.Repo;
import com.company.timeseries.domain.enums.Interval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Read access to the continuous aggregates (one table per {@link Interval}).
 * The tables are maintained by TimescaleDB; this repository only reads them and
 * asks for refreshes.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MeasurementSummaryRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_COLUMNS = """
        SELECT timestamp_bin, owner_id, repo_id, flag_id, branch, name,
               value_avg, value_min, value_max, value_count
        FROM %s
        """;

    /**
     * Summary rows of {@code query} with {@code from <= timestamp_bin <= to}; either bound may be null.
     */
    public List<MeasurementSummary> findSummaries(Interval interval, MeasurementQuery query,
                                                  Instant from, Instant to) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(String.format(SELECT_COLUMNS, interval.getSummaryTable()));
        sql.append(scopeFilter(query, params));

        if (from != null) {
            sql.append(" AND timestamp_bin >= ?");
            params.add(toTimestamptz(from));
        }
        if (to != null) {
            sql.append(" AND timestamp_bin <= ?");
            params.add(toTimestamptz(to));
        }
        sql.append(" ORDER BY timestamp_bin");

        try {
            return jdbcTemplate.query(sql.toString(), new MeasurementSummaryRowMapper(), params.toArray());
        } catch (Exception e) {
            log.error("Failed to fetch {} summaries for owner {} repo {} ({})",
                    interval, query.getOwnerId(), query.getRepoId(), query.getName(), e);
            throw new RuntimeException("Failed to fetch measurement summaries", e);
        }
    }

    /**
     * All rows of the most recent bucket strictly before {@code before}.
     */
    public List<MeasurementSummary> findLatestBefore(Interval interval, MeasurementQuery query, Instant before) {
        List<Object> outerParams = new ArrayList<>();
        List<Object> innerParams = new ArrayList<>();
        String outerFilter = scopeFilter(query, outerParams);
        String innerFilter = scopeFilter(query, innerParams);

        String sql = String.format(SELECT_COLUMNS, interval.getSummaryTable())
                + outerFilter
                + " AND timestamp_bin = (SELECT MAX(timestamp_bin) FROM " + interval.getSummaryTable()
                + innerFilter + " AND timestamp_bin < ?)";

        List<Object> params = new ArrayList<>(outerParams);
        params.addAll(innerParams);
        params.add(toTimestamptz(before));

        try {
            return jdbcTemplate.query(sql, new MeasurementSummaryRowMapper(), params.toArray());
        } catch (Exception e) {
            log.error("Failed to fetch {} summary before {} for repo {}",
                    interval, before, query.getRepoId(), e);
            throw new RuntimeException("Failed to fetch previous measurement summary", e);
        }
    }

    /**
     * Re-materialize every continuous aggregate over {@code [start, end]}.
     */
    public void refresh(Instant start, Instant end) {
        for (Interval interval : Interval.values()) {
            log.info("Refreshing {} from {} to {}", interval.getSummaryTable(), start, end);
            try {
                jdbcTemplate.update("CALL refresh_continuous_aggregate(?::regclass, ?, ?)",
                        interval.getSummaryTable(), toTimestamptz(start), toTimestamptz(end));
            } catch (Exception e) {
                log.error("Failed to refresh {}", interval.getSummaryTable(), e);
                throw new RuntimeException("Failed to refresh measurement summaries", e);
            }
        }
    }

    private String scopeFilter(MeasurementQuery query, List<Object> params) {
        StringBuilder where = new StringBuilder(" WHERE name = ? AND owner_id = ?");
        params.add(query.getName().getValue());
        params.add(query.getOwnerId());

        if (query.isOwnerWide()) {
            StringJoiner pairs = new StringJoiner(", ", " AND (repo_id, branch) IN (", ")");
            for (Repo repo : query.getRepos()) {
                pairs.add("(?, ?)");
                params.add(repo.getRepoId());
                params.add(repo.getBranch());
            }
            where.append(pairs);
        } else {
            where.append(" AND repo_id = ?");
            params.add(query.getRepoId());
            if (query.getBranch() != null) {
                where.append(" AND branch = ?");
                params.add(query.getBranch());
            }
        }

        if (query.getFlagId() != null) {
            where.append(" AND flag_id = ?");
            params.add(query.getFlagId());
        }
        return where.toString();
    }

    private static OffsetDateTime toTimestamptz(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static class MeasurementSummaryRowMapper implements RowMapper<MeasurementSummary> {
        @Override
        public MeasurementSummary mapRow(ResultSet rs, int rowNum) throws SQLException {
            long flagId = rs.getLong("flag_id");
            return MeasurementSummary.builder()
                    .timestampBin(rs.getObject("timestamp_bin", OffsetDateTime.class).toInstant())
                    .ownerId(rs.getLong("owner_id"))
                    .repoId(rs.getLong("repo_id"))
                    .flagId(rs.wasNull() ? null : flagId)
                    .branch(rs.getString("branch"))
                    .name(rs.getString("name"))
                    .valueAvg(rs.getDouble("value_avg"))
                    .valueMin(rs.getDouble("value_min"))
                    .valueMax(rs.getDouble("value_max"))
                    .valueCount(rs.getLong("value_count"))
                    .build();
        }
    }
}
