package com.company.timeseries.repository;

import com.company.timeseries.domain.Dataset;
import com.company.timeseries.util.QueryDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
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

@Repository
@RequiredArgsConstructor
@Slf4j
public class DatasetRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<Dataset> findByNameAndRepositoryId(String name, long repositoryId) {
        String sql = """
            SELECT id, name, repository_id, backfilled, created_at, updated_at
            FROM timeseries_dataset
            WHERE name = ? AND repository_id = ?
            """;

        try {
            List<Dataset> datasets = jdbcTemplate.query(sql, new DatasetRowMapper(), name, repositoryId);
            return datasets.stream().findFirst();
        } catch (Exception e) {
            log.error("Failed to fetch dataset {} for repo {}", name, repositoryId, e);
            throw new RuntimeException("Failed to fetch dataset", e);
        }
    }

    public List<Dataset> findByNameAndRepositoryIds(String name, List<Long> repositoryIds) {
        if (repositoryIds.isEmpty()) {
            return new ArrayList<>();
        }
        StringJoiner ids = new StringJoiner(", ", "(", ")");
        List<Object> params = new ArrayList<>();
        params.add(name);
        for (Long repositoryId : repositoryIds) {
            ids.add("?");
            params.add(repositoryId);
        }
        String sql = """
            SELECT id, name, repository_id, backfilled, created_at, updated_at
            FROM timeseries_dataset
            WHERE name = ? AND repository_id IN %s
            """.formatted(ids);

        try {
            return jdbcTemplate.query(sql, new DatasetRowMapper(), params.toArray());
        } catch (Exception e) {
            log.error("Failed to fetch {} datasets for {} repos", name, repositoryIds.size(), e);
            throw new RuntimeException("Failed to fetch datasets", e);
        }
    }

    /**
     * Insert the dataset unless one already exists. The unique constraint on
     * (name, repository_id) decides which concurrent caller creates the row.
     *
     * @return true when this call inserted the row
     */
    public boolean insertIfAbsent(String name, long repositoryId, Instant createdAt) {
        String sql = """
            INSERT INTO timeseries_dataset (name, repository_id, backfilled, created_at, updated_at)
            VALUES (?, ?, false, ?, ?)
            ON CONFLICT (name, repository_id) DO NOTHING
            """;

        LocalDateTime timestamp = QueryDates.toUtc(createdAt);
        try {
            return jdbcTemplate.update(sql, name, repositoryId, timestamp, timestamp) == 1;
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create dataset {} for repo {}", name, repositoryId, e);
            throw new RuntimeException("Failed to create dataset", e);
        }
    }

    /**
     * Datasets created after {@code createdAfter}, i.e. still waiting for their aggregates.
     */
    public long countCreatedAfter(Instant createdAfter) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM timeseries_dataset WHERE created_at > ?",
                Long.class, QueryDates.toUtc(createdAfter));
        return count != null ? count : 0L;
    }

    private static class DatasetRowMapper implements RowMapper<Dataset> {
        @Override
        public Dataset mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Dataset.builder()
                    .id(rs.getInt("id"))
                    .name(rs.getString("name"))
                    .repositoryId(rs.getLong("repository_id"))
                    .backfilled(rs.getBoolean("backfilled"))
                    .createdAt(QueryDates.fromUtc(rs.getObject("created_at", LocalDateTime.class)))
                    .updatedAt(QueryDates.fromUtc(rs.getObject("updated_at", LocalDateTime.class)))
                    .build();
        }
    }
}
