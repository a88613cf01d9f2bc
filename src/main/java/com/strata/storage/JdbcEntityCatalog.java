package com.strata.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.strata.domain.GroupReleaseRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link EntityCatalog} over the relational store.
 *
 * Project to organization lookups are on the hot path of every query and are
 * cached in Caffeine. Deleted projects are excluded by status.
 */
@Repository
public class JdbcEntityCatalog implements EntityCatalog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityCatalog.class);

    private static final int STATUS_ACTIVE = 0;

    private static final String PROJECT_ORG_SQL =
        "SELECT organization_id FROM sentry_project WHERE id = :id";
    private static final String FIRST_LIVE_PROJECT_ORG_SQL =
        "SELECT organization_id FROM sentry_project WHERE id IN (:ids) AND status = :status ORDER BY id LIMIT 1";
    private static final String PROJECT_KEY_ORG_SQL =
        "SELECT p.organization_id FROM sentry_projectkey k JOIN sentry_project p ON p.id = k.project_id WHERE k.id = :id";
    private static final String ENVIRONMENT_NAMES_SQL =
        "SELECT id, name FROM sentry_environment WHERE id IN (:ids)";
    private static final String RELEASE_VERSIONS_SQL =
        "SELECT id, version FROM sentry_release WHERE id IN (:ids)";
    private static final String GROUP_RELEASES_SQL =
        "SELECT gr.id, gr.group_id, r.version FROM sentry_grouprelease gr "
            + "JOIN sentry_release r ON r.id = gr.release_id WHERE gr.id IN (:ids)";
    private static final String GROUP_PROJECTS_SQL =
        "SELECT DISTINCT project_id FROM sentry_groupedmessage WHERE id IN (:ids) AND project_id IS NOT NULL";
    private static final String RELEASE_PROJECTS_SQL =
        "SELECT DISTINCT project_id FROM sentry_release_project WHERE release_id IN (:ids) AND project_id IS NOT NULL";
    private static final String GROUP_FIRST_SEEN_SQL =
        "SELECT first_seen FROM sentry_groupedmessage WHERE id = :id";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private final Cache<Long, Optional<Long>> projectOrganizations;

    public JdbcEntityCatalog(
            @Qualifier("catalogJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
            @Value("${strata.catalog.project-cache.max-size:10000}") long cacheMaxSize,
            @Value("${strata.catalog.project-cache.ttl-seconds:300}") long cacheTtlSeconds) {
        this.jdbcTemplate = jdbcTemplate;
        this.projectOrganizations = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(cacheTtlSeconds, TimeUnit.SECONDS)
            .build();

        log.info("JdbcEntityCatalog initialized with project cache (ttl={}s, maxSize={})",
            cacheTtlSeconds, cacheMaxSize);
    }

    @Override
    public Long organizationIdForProject(long projectId) {
        return projectOrganizations.get(projectId, id -> {
            List<Long> rows = jdbcTemplate.queryForList(
                PROJECT_ORG_SQL, new MapSqlParameterSource("id", id), Long.class);
            return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
        }).orElse(null);
    }

    @Override
    public Long firstOrganizationIdForProjects(Collection<Long> projectIds) {
        if (projectIds.isEmpty()) {
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource("ids", projectIds)
            .addValue("status", STATUS_ACTIVE);
        List<Long> rows = jdbcTemplate.queryForList(FIRST_LIVE_PROJECT_ORG_SQL, params, Long.class);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public Long organizationIdForProjectKey(long keyId) {
        List<Long> rows = jdbcTemplate.queryForList(
            PROJECT_KEY_ORG_SQL, new MapSqlParameterSource("id", keyId), Long.class);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public Map<Long, String> environmentNames(Collection<Long> environmentIds) {
        return idToString(ENVIRONMENT_NAMES_SQL, environmentIds, "name");
    }

    @Override
    public Map<Long, String> releaseVersions(Collection<Long> releaseIds) {
        return idToString(RELEASE_VERSIONS_SQL, releaseIds, "version");
    }

    @Override
    public Map<Long, GroupReleaseRef> groupReleases(Collection<Long> groupReleaseIds) {
        Map<Long, GroupReleaseRef> result = new HashMap<>();
        if (groupReleaseIds.isEmpty()) {
            return result;
        }
        jdbcTemplate.query(GROUP_RELEASES_SQL, new MapSqlParameterSource("ids", groupReleaseIds), rs -> {
            result.put(rs.getLong("id"), new GroupReleaseRef(rs.getLong("group_id"), rs.getString("version")));
        });
        log.debug("Resolved {} of {} group releases", result.size(), groupReleaseIds.size());
        return result;
    }

    @Override
    public Set<Long> projectIdsForGroups(Collection<Long> groupIds) {
        return projectIds(GROUP_PROJECTS_SQL, groupIds);
    }

    @Override
    public Set<Long> projectIdsForReleases(Collection<Long> releaseIds) {
        return projectIds(RELEASE_PROJECTS_SQL, releaseIds);
    }

    @Override
    public OffsetDateTime groupFirstSeen(long groupId) {
        List<Timestamp> rows = jdbcTemplate.queryForList(
            GROUP_FIRST_SEEN_SQL, new MapSqlParameterSource("id", groupId), Timestamp.class);
        if (rows.isEmpty() || rows.get(0) == null) {
            return null;
        }
        return rows.get(0).toInstant().atOffset(ZoneOffset.UTC);
    }

    private Map<Long, String> idToString(String sql, Collection<Long> ids, String column) {
        Map<Long, String> result = new HashMap<>();
        if (ids.isEmpty()) {
            return result;
        }
        jdbcTemplate.query(sql, new MapSqlParameterSource("ids", ids), rs -> {
            result.put(rs.getLong("id"), rs.getString(column));
        });
        return result;
    }

    private Set<Long> projectIds(String sql, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(jdbcTemplate.queryForList(sql, new MapSqlParameterSource("ids", ids), Long.class));
    }
}
