package com.strata.query;

import com.strata.domain.Dataset;
import com.strata.domain.QueryResponse;
import com.strata.query.column.ColumnResolver;
import com.strata.query.error.QueryGatewayException;
import com.strata.query.error.QueryOutsideGroupActivityException;
import com.strata.query.error.QueryOutsideRetentionException;
import com.strata.query.execution.BackendRequest;
import com.strata.query.execution.PreparedQuery;
import com.strata.query.execution.QueryExecutionEngine;
import com.strata.query.expr.ConditionRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Entry point for running analytical queries.
 *
 * <p>Two request forms converge on the {@link QueryExecutionEngine}:
 * {@link QueryIntent}s, which are scoped, translated and windowed by the
 * {@link QueryParamsBuilder}, and pre-built {@link BackendRequest}s, which are
 * only tagged with the referrer and consistency override.
 *
 * <p>Overrides are the configured defaults, then those of any open
 * {@link OverrideContext} scope on the calling thread.
 */
@Service
public class QueryGateway {

    private static final Logger log = LoggerFactory.getLogger(QueryGateway.class);

    private final QueryParamsBuilder paramsBuilder;
    private final QueryExecutionEngine engine;
    private final QueryMetrics metrics;
    private final QueryOverrides defaultOverrides;

    public QueryGateway(QueryParamsBuilder paramsBuilder, QueryExecutionEngine engine, QueryMetrics metrics,
                        @Qualifier("defaultQueryOverrides") QueryOverrides defaultOverrides) {
        this.paramsBuilder = paramsBuilder;
        this.engine = engine;
        this.metrics = metrics;
        this.defaultOverrides = defaultOverrides;
    }

    /**
     * Run one intent, attributed to the intent's referrer.
     */
    public QueryResponse rawQuery(QueryIntent intent, boolean useCache) {
        return bulkRawQuery(List.of(intent), intent.getReferrer(), useCache).get(0);
    }

    public List<QueryResponse> bulkRawQuery(List<QueryIntent> intents, String referrer, boolean useCache) {
        QueryOverrides overrides = effectiveOverrides();
        List<PreparedQuery> prepared = new ArrayList<>(intents.size());
        for (QueryIntent intent : intents) {
            prepared.add(paramsBuilder.prepare(intent, referrer, overrides));
        }
        return engine.executeMany(prepared, referrer, useCache);
    }

    public QueryResponse rawRequest(BackendRequest request, String referrer, boolean useCache) {
        return bulkRequests(List.of(request), referrer, useCache).get(0);
    }

    /**
     * Run pre-built requests. Nothing is added to them beyond the referrer and
     * the consistency override, and their rows are returned untranslated.
     */
    public List<QueryResponse> bulkRequests(List<BackendRequest> requests, String referrer, boolean useCache) {
        metrics.recordApiRequest(referrer);
        QueryOverrides overrides = effectiveOverrides();

        List<PreparedQuery> prepared = new ArrayList<>(requests.size());
        for (BackendRequest request : requests) {
            BackendRequest tagged = request;
            if (overrides.contains(QueryOverrides.CONSISTENT)) {
                tagged = tagged.withConsistent(overrides.getConsistent());
            }
            if (referrer != null) {
                tagged = tagged.withReferrer(referrer);
            }
            prepared.add(PreparedQuery.untranslated(tagged));
        }
        return engine.executeMany(prepared, referrer, useCache);
    }

    /**
     * Resolve the public field names of an intent to the physical columns of its dataset.
     *
     * <p>Selected columns and order-by entries are resolved unless they name an
     * aggregate or function alias; a leading {@code -} on order-by is kept.
     * Conditions are rewritten with {@code conditionResolver} when given, with
     * the dataset's column resolver otherwise. Group-by is left as is.
     *
     * @throws IllegalArgumentException when the intent has no dataset
     */
    public QueryIntent aliasedQueryParams(QueryIntent intent, BiFunction<Object, Dataset, Object> conditionResolver) {
        Dataset dataset = intent.getDataset();
        if (dataset == null) {
            throw new IllegalArgumentException("A dataset is required, and is no longer automatically detected.");
        }
        ColumnResolver resolver = ColumnResolver.forDataset(dataset);
        QueryIntent.Builder resolved = intent.toBuilder();

        Set<String> derivedColumns = new HashSet<>();
        if (intent.getSelectedColumns() != null) {
            List<Object> selected = new ArrayList<>();
            for (Object column : intent.getSelectedColumns()) {
                if (column instanceof List) {
                    List<?> expression = (List<?>) column;
                    if (expression.size() > 2 && expression.get(2) instanceof String) {
                        derivedColumns.add((String) expression.get(2));
                    }
                    selected.add(column);
                } else {
                    Object name = resolver.resolve(column);
                    if (name != null && !"".equals(name)) {
                        selected.add(name);
                    }
                }
            }
            resolved.selectedColumns(selected);
        }

        for (Aggregation aggregation : intent.getAggregations()) {
            derivedColumns.add(aggregation.getAlias());
        }

        if (!intent.getConditions().isEmpty()) {
            ConditionRewriter rewriter = conditionResolver != null
                ? new ConditionRewriter(column -> conditionResolver.apply(column, dataset))
                : ConditionRewriter.forResolver(resolver);
            resolved.conditions(rewriter.rewriteAll(intent.getConditions()));
        }

        if (intent.getOrderBy() != null) {
            List<String> orderBy = new ArrayList<>(intent.getOrderBy().size());
            for (String order : intent.getOrderBy()) {
                boolean descending = order.startsWith("-");
                String field = descending ? order.substring(1) : order;
                if (!derivedColumns.contains(field)) {
                    field = resolver.resolveName(field);
                }
                orderBy.add((descending ? "-" : "") + field);
            }
            resolved.orderBy(orderBy);
        }

        return resolved.build();
    }

    public QueryResponse aliasedQuery(QueryIntent intent, BiFunction<Object, Dataset, Object> conditionResolver,
                                      boolean useCache) {
        return rawQuery(aliasedQueryParams(intent, conditionResolver), useCache);
    }

    /**
     * Run an intent and nest its rows by the group-by columns.
     *
     * <p>Without aggregations the query counts rows as {@code aggregate}. A
     * window outside retention or outside the issue's activity yields an empty
     * result instead of an error.
     *
     * @throws QueryGatewayException when the response columns differ from the requested ones
     */
    public NestedResult query(QueryIntent intent, boolean useCache) {
        QueryIntent effective = intent.getAggregations().isEmpty()
            ? intent.toBuilder().aggregations(List.of(Aggregation.count())).build()
            : intent;
        boolean totals = Boolean.TRUE.equals(effective.getTotals());

        QueryResponse response;
        try {
            response = rawQuery(effective, useCache);
        } catch (QueryOutsideRetentionException | QueryOutsideGroupActivityException e) {
            log.debug("Query window has no data: {}", e.getMessage());
            return new NestedResult(new LinkedHashMap<>(), totals ? new LinkedHashMap<>() : null);
        }

        List<String> aggregateNames = new ArrayList<>();
        for (Aggregation aggregation : effective.getAggregations()) {
            aggregateNames.add(aggregation.getAlias());
        }
        List<String> selectedNames = new ArrayList<>();
        if (effective.getSelectedColumns() != null) {
            for (Object column : effective.getSelectedColumns()) {
                selectedNames.add(column instanceof List ? String.valueOf(((List<?>) column).get(2)) : String.valueOf(column));
            }
        }

        Set<String> expected = new HashSet<>(effective.getGroupBy());
        expected.addAll(aggregateNames);
        expected.addAll(selectedNames);
        Set<String> got = new HashSet<>(response.getColumnNames());
        if (!expected.equals(got)) {
            throw new QueryGatewayException("Unexpected result columns: expected " + expected + ", got " + got);
        }

        List<String> leafColumns = new ArrayList<>(aggregateNames);
        leafColumns.addAll(selectedNames);
        Object groups = ResultNester.nest(response.getData(), effective.getGroupBy(), leafColumns);
        return new NestedResult(groups, totals ? response.getTotals() : null);
    }

    QueryOverrides effectiveOverrides() {
        return defaultOverrides.merge(OverrideContext.current());
    }
}
