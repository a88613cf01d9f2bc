package com.strata.query;

import com.strata.domain.Dataset;
import com.strata.query.expr.ConditionParser;
import com.strata.query.expr.Expr;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a caller wants to query, before scoping, translation and window
 * policy are applied.
 *
 * <p>Filter keys map a column to the identifiers it must be restricted to;
 * they become {@code IN} conditions after translation and also drive project
 * scoping. Options the gateway does not interpret are kept in {@code extra}
 * and sent unchanged.
 */
public class QueryIntent {

    private final Dataset dataset;
    private final TemporalAccessor start;
    private final TemporalAccessor end;
    private final List<String> groupBy;
    private final List<Expr> conditions;
    private final Map<String, List<Object>> filterKeys;
    private final List<Aggregation> aggregations;
    private final Integer rollup;
    private final String referrer;
    private final boolean groupRelease;
    private final List<Object> selectedColumns;
    private final List<String> orderBy;
    private final List<Expr> having;
    private final Integer limit;
    private final Integer offset;
    private final Boolean totals;
    private final String arrayJoin;
    private final Map<String, Object> extra;

    private QueryIntent(Builder builder) {
        this.dataset = builder.dataset;
        this.start = builder.start;
        this.end = builder.end;
        this.groupBy = List.copyOf(builder.groupBy);
        this.conditions = List.copyOf(builder.conditions);
        this.filterKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filterKeys));
        this.aggregations = List.copyOf(builder.aggregations);
        this.rollup = builder.rollup;
        this.referrer = builder.referrer;
        this.groupRelease = builder.groupRelease;
        this.selectedColumns = builder.selectedColumns != null
            ? Collections.unmodifiableList(new ArrayList<>(builder.selectedColumns)) : null;
        this.orderBy = builder.orderBy != null ? List.copyOf(builder.orderBy) : null;
        this.having = builder.having != null ? List.copyOf(builder.having) : null;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.totals = builder.totals;
        this.arrayJoin = builder.arrayJoin;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .dataset(dataset)
            .start(start)
            .end(end)
            .groupBy(groupBy)
            .conditions(conditions)
            .aggregations(aggregations)
            .rollup(rollup)
            .referrer(referrer)
            .groupRelease(groupRelease)
            .selectedColumns(selectedColumns)
            .orderBy(orderBy)
            .having(having)
            .limit(limit)
            .offset(offset)
            .totals(totals)
            .arrayJoin(arrayJoin);
        filterKeys.forEach(builder::filterKey);
        extra.forEach(builder::option);
        return builder;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public TemporalAccessor getStart() {
        return start;
    }

    public TemporalAccessor getEnd() {
        return end;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<Expr> getConditions() {
        return conditions;
    }

    public Map<String, List<Object>> getFilterKeys() {
        return filterKeys;
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public Integer getRollup() {
        return rollup;
    }

    public String getReferrer() {
        return referrer;
    }

    public boolean isGroupRelease() {
        return groupRelease;
    }

    public List<Object> getSelectedColumns() {
        return selectedColumns;
    }

    public List<String> getOrderBy() {
        return orderBy;
    }

    public List<Expr> getHaving() {
        return having;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public Boolean getTotals() {
        return totals;
    }

    public String getArrayJoin() {
        return arrayJoin;
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    public static class Builder {
        private Dataset dataset;
        private TemporalAccessor start;
        private TemporalAccessor end;
        private List<String> groupBy = new ArrayList<>();
        private List<Expr> conditions = new ArrayList<>();
        private final Map<String, List<Object>> filterKeys = new LinkedHashMap<>();
        private List<Aggregation> aggregations = new ArrayList<>();
        private Integer rollup;
        private String referrer;
        private boolean groupRelease;
        private List<Object> selectedColumns;
        private List<String> orderBy;
        private List<Expr> having;
        private Integer limit;
        private Integer offset;
        private Boolean totals;
        private String arrayJoin;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Builder dataset(Dataset dataset) {
            this.dataset = dataset;
            return this;
        }

        public Builder start(TemporalAccessor start) {
            this.start = start;
            return this;
        }

        public Builder end(TemporalAccessor end) {
            this.end = end;
            return this;
        }

        public Builder groupBy(List<String> groupBy) {
            this.groupBy = groupBy != null ? new ArrayList<>(groupBy) : new ArrayList<>();
            return this;
        }

        public Builder conditions(List<Expr> conditions) {
            this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
            return this;
        }

        public Builder condition(Expr condition) {
            this.conditions.add(condition);
            return this;
        }

        /**
         * Adds conditions given in the nested list form.
         */
        public Builder wireConditions(List<?> conditions) {
            this.conditions.addAll(ConditionParser.parseAll(conditions));
            return this;
        }

        public Builder filterKey(String column, List<?> keys) {
            this.filterKeys.put(column, keys != null ? new ArrayList<>(keys) : null);
            return this;
        }

        public Builder aggregations(List<Aggregation> aggregations) {
            this.aggregations = aggregations != null ? new ArrayList<>(aggregations) : new ArrayList<>();
            return this;
        }

        public Builder aggregation(String function, Object column, String alias) {
            this.aggregations.add(new Aggregation(function, column, alias));
            return this;
        }

        public Builder rollup(Integer rollup) {
            this.rollup = rollup;
            return this;
        }

        public Builder referrer(String referrer) {
            this.referrer = referrer;
            return this;
        }

        public Builder groupRelease(boolean groupRelease) {
            this.groupRelease = groupRelease;
            return this;
        }

        public Builder selectedColumns(List<?> selectedColumns) {
            this.selectedColumns = selectedColumns != null ? new ArrayList<>(selectedColumns) : null;
            return this;
        }

        public Builder orderBy(List<String> orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder having(List<Expr> having) {
            this.having = having;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder totals(Boolean totals) {
            this.totals = totals;
            return this;
        }

        public Builder arrayJoin(String arrayJoin) {
            this.arrayJoin = arrayJoin;
            return this;
        }

        /**
         * Passthrough option sent to the backend as is.
         */
        public Builder option(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public QueryIntent build() {
            return new QueryIntent(this);
        }
    }
}
