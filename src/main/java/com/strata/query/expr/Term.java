package com.strata.query.expr;

import java.util.Objects;

/**
 * Leaf value: a column name, a quoted string literal, a number, a datetime or null.
 * Whether a string is a column or a literal is decided by the rewriter.
 */
public final class Term implements Expr {

    private final Object value;

    public Term(Object value) {
        this.value = value;
    }

    public static Term of(Object value) {
        return new Term(value);
    }

    public Object getValue() {
        return value;
    }

    public boolean isName() {
        return value instanceof String;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitTerm(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term)) return false;
        return Objects.equals(value, ((Term) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
