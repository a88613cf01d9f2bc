package com.strata.query;

import com.strata.domain.Dataset;
import com.strata.query.error.UnqualifiedQueryException;
import com.strata.query.expr.Comparison;
import com.strata.query.expr.Expr;
import com.strata.query.translate.Identifiers;
import com.strata.storage.EntityCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works out which organization a query belongs to, and the project or
 * organization parameters that scope it on the backend.
 *
 * <p>Project-scoped datasets take their projects from the {@code project_id}
 * filter key, or infer them from groups and releases in the filter keys, or
 * from a {@code project_id} condition. Organization-scoped datasets take an
 * {@code org_id} filter key, or go through the project, or through a project
 * key. Anything that cannot be scoped is rejected.
 */
@Component
public class QueryScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(QueryScopeResolver.class);

    private final EntityCatalog catalog;

    public QueryScopeResolver(EntityCatalog catalog) {
        this.catalog = catalog;
    }

    public QueryScope resolve(Dataset dataset, Map<String, List<Object>> filterKeys, List<Expr> conditions) {
        switch (dataset.getScopingFamily()) {
            case PROJECT:
                return forProjects(filterKeys, conditions, dataset == Dataset.SESSIONS);
            case ORGANIZATION:
                return forOrganization(filterKeys, conditions);
            default:
                throw new UnqualifiedQueryException(
                    "No strategy found for getting an organization for the given dataset.");
        }
    }

    QueryScope forProjects(Map<String, List<Object>> filterKeys, List<Expr> conditions, boolean withOrganization) {
        List<Long> projectIds = projectIds(filterKeys, conditions);
        if (projectIds.isEmpty()) {
            throw new UnqualifiedQueryException("No project_id filter, or none could be inferred from other filters.");
        }

        long organizationId = organizationForProjects(projectIds);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("project", projectIds);
        if (withOrganization) {
            params.put("organization", organizationId);
        }
        return new QueryScope(organizationId, params);
    }

    QueryScope forOrganization(Map<String, List<Object>> filterKeys, List<Expr> conditions) {
        Long organizationId;
        if (filterKeys.containsKey("org_id")) {
            List<Long> organizationIds = distinctIds(filterKeys.get("org_id"));
            if (organizationIds.size() != 1) {
                throw new UnqualifiedQueryException("Multiple organization_ids found. Only one allowed.");
            }
            organizationId = organizationIds.get(0);
        } else if (filterKeys.containsKey("project_id")) {
            organizationId = forProjects(filterKeys, conditions, false).getOrganizationId();
        } else if (filterKeys.containsKey("key_id")) {
            List<Long> keyIds = distinctIds(filterKeys.get("key_id"));
            organizationId = keyIds.isEmpty() ? null : catalog.organizationIdForProjectKey(keyIds.get(0));
        } else {
            organizationId = null;
        }

        if (organizationId == null || organizationId == 0L) {
            throw new UnqualifiedQueryException(
                "No organization_id filter, or none could be inferred from other filters.");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("organization", organizationId);
        return new QueryScope(organizationId, params);
    }

    /**
     * Any project will do; all projects of one query belong to the same organization.
     */
    long organizationForProjects(List<Long> projectIds) {
        Long organizationId = catalog.organizationIdForProject(projectIds.get(0));
        if (organizationId == null) {
            log.debug("Project {} not found, falling back to first live project of {}", projectIds.get(0), projectIds);
            organizationId = catalog.firstOrganizationIdForProjects(projectIds);
        }
        if (organizationId == null) {
            throw new UnqualifiedQueryException("All project_ids from the filter no longer exist");
        }
        return organizationId;
    }

    private List<Long> projectIds(Map<String, List<Object>> filterKeys, List<Expr> conditions) {
        if (filterKeys.containsKey("project_id")) {
            return distinctIds(filterKeys.get("project_id"));
        }
        if (!filterKeys.isEmpty()) {
            Set<Long> related = new LinkedHashSet<>();
            filterKeys.forEach((column, ids) -> related.addAll(relatedProjectIds(column, ids)));
            return new ArrayList<>(related);
        }
        List<Long> fromConditions = new ArrayList<>();
        for (Expr condition : conditions) {
            if (condition instanceof Comparison && "project_id".equals(((Comparison) condition).getColumnName())) {
                Comparison comparison = (Comparison) condition;
                Object literal = comparison.getLiteral();
                fromConditions = "=".equals(comparison.getOperator()) || !(literal instanceof Collection)
                    ? distinctIds(Collections.singletonList(literal))
                    : distinctIds((Collection<?>) literal);
            }
        }
        return fromConditions;
    }

    private Set<Long> relatedProjectIds(String column, List<Object> ids) {
        List<Long> keys = distinctIds(ids);
        if (keys.isEmpty()) {
            return Set.of();
        }
        switch (column) {
            case "project_id":
                return new LinkedHashSet<>(keys);
            case "group_id":
                return catalog.projectIdsForGroups(keys);
            case "release":
            case "tags[sentry:release]":
                return catalog.projectIdsForReleases(keys);
            default:
                return Set.of();
        }
    }

    private static List<Long> distinctIds(Collection<?> values) {
        Set<Long> ids = new LinkedHashSet<>();
        if (values != null) {
            for (Object value : values) {
                Long id = Identifiers.toLong(value);
                if (id != null) {
                    ids.add(id);
                }
            }
        }
        return new ArrayList<>(ids);
    }
}
