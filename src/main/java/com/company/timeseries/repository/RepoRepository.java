package com.company.timeseries.repository;

import com.company.timeseries.domain.Repo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

@Repository
@RequiredArgsConstructor
@Slf4j
public class RepoRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<Repo> REPO_MAPPER = (rs, rowNum) -> Repo.builder()
            .repoId(rs.getLong("repoid"))
            .ownerId(rs.getLong("ownerid"))
            .name(rs.getString("name"))
            .branch(rs.getString("branch"))
            .build();

    public Optional<Repo> findById(long repoId) {
        String sql = """
            SELECT repoid, ownerid, name, branch
            FROM repos
            WHERE repoid = ? AND deleted IS NOT TRUE
            """;

        try {
            List<Repo> repos = jdbcTemplate.query(sql, REPO_MAPPER, repoId);
            return repos.stream().findFirst();
        } catch (Exception e) {
            log.error("Failed to fetch repository {}", repoId, e);
            throw new RuntimeException("Failed to fetch repository", e);
        }
    }

    /**
     * Live repositories of an owner, optionally narrowed to {@code repoIds}.
     * Ids that are not the owner's are ignored.
     */
    public List<Repo> findByOwner(long ownerId, List<Long> repoIds) {
        StringBuilder sql = new StringBuilder("""
            SELECT repoid, ownerid, name, branch
            FROM repos
            WHERE ownerid = ? AND deleted IS NOT TRUE
            """);
        List<Object> params = new ArrayList<>();
        params.add(ownerId);

        if (repoIds != null) {
            if (repoIds.isEmpty()) {
                return new ArrayList<>();
            }
            StringJoiner ids = new StringJoiner(", ", " AND repoid IN (", ")");
            for (Long repoId : repoIds) {
                ids.add("?");
                params.add(repoId);
            }
            sql.append(ids);
        }
        sql.append(" ORDER BY repoid");

        try {
            return jdbcTemplate.query(sql.toString(), REPO_MAPPER, params.toArray());
        } catch (Exception e) {
            log.error("Failed to fetch repositories of owner {}", ownerId, e);
            throw new RuntimeException("Failed to fetch repositories", e);
        }
    }
}
