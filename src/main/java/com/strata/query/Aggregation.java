package com.strata.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents an aggregation: {@code function(column) AS alias}. The column may
 * be empty for functions such as {@code count()}.
 */
public class Aggregation {
    private final String function;
    private final Object column;
    private final String alias;

    public Aggregation(String function, Object column, String alias) {
        this.function = function;
        this.column = column;
        this.alias = alias;
    }

    public static Aggregation count() {
        return new Aggregation("count()", "", "aggregate");
    }

    public String getFunction() {
        return function;
    }

    public Object getColumn() {
        return column;
    }

    public String getAlias() {
        return alias;
    }

    public List<Object> toWire() {
        List<Object> wire = new ArrayList<>(3);
        wire.add(function);
        wire.add(column);
        wire.add(alias);
        return wire;
    }

    @Override
    public String toString() {
        return function + "(" + column + ") AS " + alias;
    }
}
