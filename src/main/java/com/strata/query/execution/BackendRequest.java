package com.strata.query.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request to the analytical backend: the dataset, the query language and
 * the serialized query, plus attribution and flags.
 *
 * <p>Immutable; the {@code with*} methods return modified copies.
 */
public final class BackendRequest {

    private final String dataset;
    private final QueryLanguage language;
    private final Map<String, Object> query;
    private final Map<String, Object> tenantIds;
    private final Boolean consistent;
    private final boolean debug;
    private final String parentApi;

    private BackendRequest(String dataset, QueryLanguage language, Map<String, Object> query,
                           Map<String, Object> tenantIds, Boolean consistent, boolean debug, String parentApi) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.language = Objects.requireNonNull(language, "language");
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.tenantIds = tenantIds != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tenantIds)) : null;
        this.consistent = consistent;
        this.debug = debug;
        this.parentApi = parentApi;
    }

    /**
     * A structured request. {@code query} holds the serialized query fields,
     * e.g. {@code {"query": "MATCH (events) SELECT ..."}}.
     */
    public static BackendRequest of(String dataset, QueryLanguage language, Map<String, Object> query) {
        return new BackendRequest(dataset, language, query, null, null, false, null);
    }

    /**
     * A legacy JSON query whose payload already carries scoping, tenant ids and overrides.
     */
    public static BackendRequest legacy(String dataset, Map<String, Object> payload) {
        return new BackendRequest(dataset, QueryLanguage.LEGACY, payload, null, null, false, null);
    }

    public String getDataset() {
        return dataset;
    }

    public QueryLanguage getLanguage() {
        return language;
    }

    public Map<String, Object> getQuery() {
        return query;
    }

    public Map<String, Object> getTenantIds() {
        return tenantIds;
    }

    public Boolean getConsistent() {
        return consistent;
    }

    public boolean isDebug() {
        return debug;
    }

    public String getParentApi() {
        return parentApi;
    }

    public String getPath() {
        return "/" + dataset + "/" + language.getEndpoint();
    }

    public BackendRequest withReferrer(String referrer) {
        Map<String, Object> tenants = tenantIds != null ? new LinkedHashMap<>(tenantIds) : new LinkedHashMap<>();
        tenants.put("referrer", referrer);
        return new BackendRequest(dataset, language, query, tenants, consistent, debug, parentApi);
    }

    public BackendRequest withConsistent(Boolean consistent) {
        return new BackendRequest(dataset, language, query, tenantIds, consistent, debug, parentApi);
    }

    public BackendRequest withDebug(boolean debug) {
        return new BackendRequest(dataset, language, query, tenantIds, consistent, debug, parentApi);
    }

    public BackendRequest withParentApi(String parentApi) {
        return new BackendRequest(dataset, language, query, tenantIds, consistent, debug, parentApi);
    }

    /**
     * The JSON body sent to the backend.
     */
    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>(query);
        if (tenantIds != null) {
            body.put("tenant_ids", tenantIds);
        }
        if (consistent != null) {
            body.put("consistent", consistent);
        }
        if (debug) {
            body.put("debug", true);
        }
        if (parentApi != null) {
            body.put("parent_api", parentApi);
        }
        return body;
    }

    @Override
    public String toString() {
        return "BackendRequest{" + getPath() + ", query=" + query + "}";
    }
}
