package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.query.column.ColumnTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of a successful backend response, with rows already translated back
 * to caller identifiers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    @JsonProperty("data")
    private List<Map<String, Object>> data;

    @JsonProperty("meta")
    private List<ColumnMeta> meta;

    @JsonProperty("totals")
    private Map<String, Object> totals;

    @JsonProperty("sql")
    private String sql;

    @JsonIgnore
    private boolean cached;

    /**
     * Default constructor
     */
    public QueryResponse() {
        this.data = new ArrayList<>();
        this.meta = new ArrayList<>();
    }

    public QueryResponse(List<Map<String, Object>> data, List<ColumnMeta> meta) {
        this.data = data != null ? data : new ArrayList<>();
        this.meta = meta != null ? meta : new ArrayList<>();
    }

    public List<Map<String, Object>> getData() {
        return data;
    }

    public void setData(List<Map<String, Object>> data) {
        this.data = data;
    }

    public List<ColumnMeta> getMeta() {
        return meta;
    }

    public void setMeta(List<ColumnMeta> meta) {
        this.meta = meta;
    }

    public Map<String, Object> getTotals() {
        return totals;
    }

    public void setTotals(Map<String, Object> totals) {
        this.totals = totals;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    /**
     * Column names in result order.
     */
    @JsonIgnore
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(meta.size());
        for (ColumnMeta column : meta) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * JSON type of each result column, keyed by column name.
     */
    @JsonIgnore
    public Map<String, String> getJsonTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        for (ColumnMeta column : meta) {
            types.put(column.getName(), ColumnTypes.jsonType(column.getType()));
        }
        return types;
    }
}
