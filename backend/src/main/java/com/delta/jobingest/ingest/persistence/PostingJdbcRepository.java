package com.delta.jobingest.ingest.persistence;

import com.delta.jobingest.ingest.model.DatabaseStatistics;
import com.delta.jobingest.ingest.model.PostingRecord;
import com.delta.jobingest.ingest.model.RoleRecord;
import com.delta.jobingest.ingest.model.RoleStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Store access for postings, roles and their association. Only the upsert, lifecycle and
 * classifier services write through this repository.
 */
@Repository
public class PostingJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(PostingJdbcRepository.class);

    private static final RowMapper<PostingRecord> POSTING_MAPPER = (rs, rowNum) -> new PostingRecord(
        rs.getLong("id"),
        rs.getString("external_id"),
        rs.getString("company"),
        rs.getString("title"),
        rs.getString("location"),
        rs.getString("url"),
        rs.getObject("date_posted", LocalDate.class),
        rs.getString("employment_type"),
        rs.getString("description"),
        toInstant(rs.getTimestamp("first_seen")),
        toInstant(rs.getTimestamp("last_updated")),
        rs.getBoolean("is_active")
    );

    private static final RowMapper<RoleRecord> ROLE_MAPPER =
        (rs, rowNum) -> new RoleRecord(rs.getLong("id"), rs.getString("name"));

    private static final String POSTING_COLUMNS = """
        id, external_id, company, title, location, url, date_posted, employment_type,
        description, first_seen, last_updated, is_active
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public PostingJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public PostingRecord findPosting(String externalId, String company) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("company", company);
        List<PostingRecord> rows = jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM postings
                WHERE external_id = :externalId
                  AND company = :company
                """,
            params,
            POSTING_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public PostingRecord findActiveDuplicate(String company, String title, String location) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", company)
            .addValue("title", title)
            .addValue("location", location);
        List<PostingRecord> rows = jdbc.query(
            "SELECT " + POSTING_COLUMNS + """
                FROM postings
                WHERE company = :company
                  AND title = :title
                  AND location = :location
                  AND is_active = TRUE
                ORDER BY id
                LIMIT 1
                """,
            params,
            POSTING_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Overwrites the mutable fields of an existing posting and marks it active again.
     */
    public int updatePosting(long postingId, PostingWrite write) {
        MapSqlParameterSource params = write.toParams().addValue("postingId", postingId);
        return jdbc.update(
            """
                UPDATE postings
                SET title = :title,
                    location = :location,
                    url = :url,
                    date_posted = :datePosted,
                    employment_type = :employmentType,
                    description = :description,
                    raw_payload = :rawPayload,
                    last_updated = :seenAt,
                    is_active = TRUE
                WHERE id = :postingId
                """,
            params
        );
    }

    /**
     * Inserts the posting or updates the row already holding its {@code (external_id, company)}
     * key. Returns true when a new row was inserted.
     *
     * <p>On PostgreSQL this is one {@code INSERT ... ON CONFLICT} statement. Elsewhere it is an
     * update followed by an insert, and a writer that loses the race surfaces the unique
     * constraint as a {@link org.springframework.dao.DuplicateKeyException}.
     */
    public boolean insertOrUpdatePosting(PostingWrite write) {
        MapSqlParameterSource params = write.toParams();
        if (postgres) {
            Boolean inserted = jdbc.queryForObject(
                """
                    INSERT INTO postings (
                        external_id, company, title, location, url, date_posted, employment_type,
                        description, first_seen, last_updated, is_active, raw_payload
                    )
                    VALUES (
                        :externalId, :company, :title, :location, :url, :datePosted, :employmentType,
                        :description, :seenAt, :seenAt, TRUE, :rawPayload
                    )
                    ON CONFLICT (external_id, company)
                    DO UPDATE SET
                        title = EXCLUDED.title,
                        location = EXCLUDED.location,
                        url = EXCLUDED.url,
                        date_posted = EXCLUDED.date_posted,
                        employment_type = EXCLUDED.employment_type,
                        description = EXCLUDED.description,
                        raw_payload = EXCLUDED.raw_payload,
                        last_updated = EXCLUDED.last_updated,
                        is_active = TRUE
                    RETURNING (xmax = 0) AS inserted
                    """,
                params,
                Boolean.class
            );
            return Boolean.TRUE.equals(inserted);
        }

        int updated = jdbc.update(
            """
                UPDATE postings
                SET title = :title,
                    location = :location,
                    url = :url,
                    date_posted = :datePosted,
                    employment_type = :employmentType,
                    description = :description,
                    raw_payload = :rawPayload,
                    last_updated = :seenAt,
                    is_active = TRUE
                WHERE external_id = :externalId
                  AND company = :company
                """,
            params
        );
        if (updated > 0) {
            return false;
        }
        jdbc.update(
            """
                INSERT INTO postings (
                    external_id, company, title, location, url, date_posted, employment_type,
                    description, first_seen, last_updated, is_active, raw_payload
                )
                VALUES (
                    :externalId, :company, :title, :location, :url, :datePosted, :employmentType,
                    :description, :seenAt, :seenAt, TRUE, :rawPayload
                )
                """,
            params
        );
        return true;
    }

    /**
     * Associates a role with a posting. Returns false when the association already existed.
     */
    public boolean attachRole(long postingId, long roleId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("postingId", postingId)
            .addValue("roleId", roleId);
        Integer existing = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM posting_roles
                WHERE posting_id = :postingId
                  AND role_id = :roleId
                """,
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO posting_roles (posting_id, role_id)
                    VALUES (:postingId, :roleId)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Role {} already attached to posting {} by a concurrent writer", roleId, postingId);
            return false;
        }
    }

    public List<String> findRoleNamesForPosting(long postingId) {
        return jdbc.queryForList(
            """
                SELECT r.name
                FROM posting_roles pr
                JOIN roles r ON r.id = pr.role_id
                WHERE pr.posting_id = :postingId
                ORDER BY r.name
                """,
            new MapSqlParameterSource("postingId", postingId),
            String.class
        );
    }

    public int countActivePostings(String company) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM postings
                WHERE company = :company
                  AND is_active = TRUE
                """,
            new MapSqlParameterSource("company", company),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public List<String> findActiveTitlesNotIn(String company, Set<String> externalIds, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", company)
            .addValue("externalIds", externalIds)
            .addValue("limit", limit);
        return jdbc.queryForList(
            """
                SELECT title
                FROM postings
                WHERE company = :company
                  AND is_active = TRUE
                  AND external_id NOT IN (:externalIds)
                ORDER BY id
                LIMIT :limit
                """,
            params,
            String.class
        );
    }

    public int deactivatePostingsNotIn(String company, Set<String> externalIds) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", company)
            .addValue("externalIds", externalIds);
        return jdbc.update(
            """
                UPDATE postings
                SET is_active = FALSE
                WHERE company = :company
                  AND is_active = TRUE
                  AND external_id NOT IN (:externalIds)
                """,
            params
        );
    }

    public RoleRecord findRoleByName(String name) {
        List<RoleRecord> rows = jdbc.query(
            """
                SELECT id, name
                FROM roles
                WHERE name = :name
                """,
            new MapSqlParameterSource("name", name),
            ROLE_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public RoleRecord findOrCreateRole(String name) {
        RoleRecord existing = findRoleByName(name);
        if (existing != null) {
            return existing;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO roles (name)
                    VALUES (:name)
                    """,
                new MapSqlParameterSource("name", name)
            );
            log.info("Created role {}", name);
        } catch (DataIntegrityViolationException e) {
            log.debug("Role {} created concurrently; re-reading", name);
        }
        RoleRecord created = findRoleByName(name);
        if (created == null) {
            throw new IllegalStateException("Failed to create role " + name);
        }
        return created;
    }

    public List<RoleRecord> findAllRoles() {
        return jdbc.query(
            """
                SELECT id, name
                FROM roles
                ORDER BY id
                """,
            ROLE_MAPPER
        );
    }

    public List<RoleStats> findRoleStats() {
        return jdbc.query(
            """
                SELECT r.name AS role_name, COUNT(pr.posting_id) AS posting_count
                FROM roles r
                JOIN posting_roles pr ON pr.role_id = r.id
                GROUP BY r.name
                ORDER BY posting_count DESC, r.name
                """,
            (rs, rowNum) -> new RoleStats(rs.getString("role_name"), rs.getLong("posting_count"))
        );
    }

    public long countPostings(boolean active) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM postings
                WHERE is_active = :active
                """,
            new MapSqlParameterSource("active", active),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Map<String, Long> countActivePostingsByCompany() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT company, COUNT(*) AS total
                FROM postings
                WHERE is_active = TRUE
                GROUP BY company
                ORDER BY total DESC, company
                """,
            rs -> {
                counts.put(rs.getString("company"), rs.getLong("total"));
            }
        );
        return counts;
    }

    public DatabaseStatistics databaseStatistics() {
        Long total = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM postings", Long.class);
        Long companies = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(DISTINCT company) FROM postings", Long.class);
        Long roles = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM roles", Long.class);
        return new DatabaseStatistics(
            countPostings(true),
            total == null ? 0L : total,
            companies == null ? 0L : companies,
            roles == null ? 0L : roles
        );
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upsert", e);
            return false;
        }
    }

    /**
     * Column values for one posting write.
     */
    public record PostingWrite(
        String externalId,
        String company,
        String title,
        String location,
        String url,
        LocalDate datePosted,
        String employmentType,
        String description,
        String rawPayload,
        Instant seenAt
    ) {
        MapSqlParameterSource toParams() {
            return new MapSqlParameterSource()
                .addValue("externalId", externalId)
                .addValue("company", company)
                .addValue("title", title)
                .addValue("location", location)
                .addValue("url", url)
                .addValue("datePosted", datePosted)
                .addValue("employmentType", employmentType)
                .addValue("description", description)
                .addValue("rawPayload", rawPayload)
                .addValue("seenAt", toTimestamp(seenAt));
        }
    }
}
