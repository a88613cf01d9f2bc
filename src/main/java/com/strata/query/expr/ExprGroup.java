package com.strata.query.expr;

import java.util.List;

/**
 * Nested list of conditions. The combining semantics belong to the caller;
 * children are kept in the order given.
 */
public final class ExprGroup implements Expr {

    private final List<Expr> children;

    public ExprGroup(List<Expr> children) {
        this.children = List.copyOf(children);
    }

    public static ExprGroup of(Expr... children) {
        return new ExprGroup(List.of(children));
    }

    public List<Expr> getChildren() {
        return children;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExprGroup)) return false;
        return children.equals(((ExprGroup) o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return children.toString();
    }
}
