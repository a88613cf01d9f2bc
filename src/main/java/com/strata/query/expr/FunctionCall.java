package com.strata.query.expr;

import java.util.List;
import java.util.Objects;

/**
 * {@code name(args...) [AS alias]}. Arguments may themselves be calls or groups.
 * The name is validated by {@link SafeFunctions} when built.
 */
public final class FunctionCall implements Expr {

    private final String name;
    private final List<Expr> args;
    private final String alias;

    public FunctionCall(String name, List<Expr> args, String alias) {
        this.name = SafeFunctions.requireSafe(name);
        this.args = List.copyOf(args);
        this.alias = alias;
    }

    public FunctionCall(String name, List<Expr> args) {
        this(name, args, null);
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public String getAlias() {
        return alias;
    }

    public FunctionCall withArgs(List<Expr> newArgs) {
        return new FunctionCall(name, newArgs, alias);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) o;
        return name.equals(that.name) && args.equals(that.args) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, alias);
    }

    @Override
    public String toString() {
        return name + args + (alias != null ? " AS " + alias : "");
    }
}
