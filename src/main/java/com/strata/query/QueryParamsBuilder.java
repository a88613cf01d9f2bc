package com.strata.query;

import com.strata.domain.Dataset;
import com.strata.query.execution.BackendRequest;
import com.strata.query.execution.PreparedQuery;
import com.strata.query.expr.ConditionWriter;
import com.strata.query.translate.TranslatorChain;
import com.strata.query.translate.TranslatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link QueryIntent} into the payload sent to the backend.
 *
 * <p>Filter keys are translated and appended to the conditions as
 * {@code [column, "IN", keys]}, or {@code [column, "IS NULL", null]} when the
 * only key is null. The payload is assembled from passthrough options, the
 * scoping parameters and the query itself; null entries are dropped, the
 * referrer is added to {@code tenant_ids} and overrides are applied last.
 */
@Component
public class QueryParamsBuilder {

    private static final Logger log = LoggerFactory.getLogger(QueryParamsBuilder.class);

    private final TranslatorFactory translatorFactory;
    private final QueryScopeResolver scopeResolver;
    private final TimeWindowResolver windowResolver;

    public QueryParamsBuilder(TranslatorFactory translatorFactory, QueryScopeResolver scopeResolver,
                              TimeWindowResolver windowResolver) {
        this.translatorFactory = translatorFactory;
        this.scopeResolver = scopeResolver;
        this.windowResolver = windowResolver;
    }

    public PreparedQuery prepare(QueryIntent intent, String referrer, QueryOverrides overrides) {
        Dataset dataset = intent.getDataset() != null ? intent.getDataset() : Dataset.EVENTS;
        Map<String, List<Object>> filterKeys = intent.getFilterKeys();

        TranslatorChain translators = translatorFactory.build(filterKeys, intent.isGroupRelease());
        QueryScope scope = scopeResolver.resolve(dataset, filterKeys, intent.getConditions());

        Map<String, Object> payload = new LinkedHashMap<>(intent.getExtra());
        payload.put("selected_columns", intent.getSelectedColumns());
        payload.put("orderby", intent.getOrderBy());
        payload.put("having", ConditionWriter.writeAll(intent.getHaving()));
        payload.put("limit", intent.getLimit());
        payload.put("offset", intent.getOffset());
        payload.put("totals", intent.getTotals());
        payload.put("arrayjoin", intent.getArrayJoin());
        payload.putAll(scope.getParams());

        List<Object> conditions = ConditionWriter.writeAll(intent.getConditions());
        translators.forward(filterKeys).forEach((column, keys) -> {
            if (keys == null || keys.isEmpty()) {
                return;
            }
            if (keys.size() == 1 && keys.get(0) == null) {
                conditions.add(condition(column, "IS NULL", null));
            } else {
                conditions.add(condition(column, "IN", keys));
            }
        });

        TimeWindow window = windowResolver.resolve(
            intent.getStart(), intent.getEnd(), scope.getOrganizationId(), filterKeys.get("group_id"));

        payload.put("dataset", dataset.getValue());
        payload.put("from_date", window.getFromDate());
        payload.put("to_date", window.getToDate());
        payload.put("groupby", intent.getGroupBy());
        payload.put("conditions", conditions);
        payload.put("aggregations", aggregations(intent.getAggregations()));
        payload.put("granularity", intent.getRollup());
        payload.values().removeIf(Objects::isNull);

        if (referrer != null) {
            Map<String, Object> tenantIds = new LinkedHashMap<>();
            Object existing = payload.get("tenant_ids");
            if (existing instanceof Map) {
                ((Map<?, ?>) existing).forEach((key, value) -> tenantIds.put(String.valueOf(key), value));
            }
            tenantIds.put("referrer", referrer);
            payload.put("tenant_ids", tenantIds);
        }

        payload.putAll(overrides.asMap());

        log.debug("Prepared {} query for organization {} over {}", dataset.getValue(), scope.getOrganizationId(), window);
        return new PreparedQuery(BackendRequest.legacy(dataset.getValue(), payload), translators);
    }

    private static List<Object> condition(String column, String operator, Object literal) {
        List<Object> condition = new ArrayList<>(3);
        condition.add(column);
        condition.add(operator);
        condition.add(literal);
        return condition;
    }

    private static List<Object> aggregations(List<Aggregation> aggregations) {
        List<Object> wire = new ArrayList<>(aggregations.size());
        for (Aggregation aggregation : aggregations) {
            wire.add(aggregation.toWire());
        }
        return wire;
    }
}
