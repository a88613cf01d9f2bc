package com.strata.query.expr;

import java.util.Objects;

/**
 * {@code column operator literal}, e.g. {@code environment = 'prod'} or
 * {@code project_id IN [1, 2]}. The column is a {@link Term} or a
 * {@link FunctionCall}; the literal is kept as given.
 */
public final class Comparison implements Expr {

    private final Expr column;
    private final String operator;
    private final Object literal;

    public Comparison(Expr column, String operator, Object literal) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.literal = literal;
    }

    public static Comparison of(String column, String operator, Object literal) {
        return new Comparison(Term.of(column), operator, literal);
    }

    public Expr getColumn() {
        return column;
    }

    public String getOperator() {
        return operator;
    }

    public Object getLiteral() {
        return literal;
    }

    /**
     * Column name when the column is a plain name, otherwise null.
     */
    public String getColumnName() {
        return column instanceof Term && ((Term) column).isName() ? (String) ((Term) column).getValue() : null;
    }

    public Comparison withColumn(Expr newColumn) {
        return new Comparison(newColumn, operator, literal);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comparison)) return false;
        Comparison that = (Comparison) o;
        return column.equals(that.column) && operator.equals(that.operator) && Objects.equals(literal, that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, literal);
    }

    @Override
    public String toString() {
        return "(" + column + " " + operator + " " + literal + ")";
    }
}
