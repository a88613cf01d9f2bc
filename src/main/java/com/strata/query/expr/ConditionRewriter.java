package com.strata.query.expr;

import com.strata.query.column.ColumnResolver;
import com.strata.query.time.WireTimestamps;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Re-scopes column references in a condition tree to one dataset.
 *
 * <p>Leaf comparisons resolve only their column. Functions with an operator
 * equivalent ({@code equals}, {@code like}, ...) resolve their first argument
 * and quote the rest as literals. Any other function resolves every string
 * argument as a column. Groups keep their order. The input tree is not
 * modified.
 */
public class ConditionRewriter implements ExprVisitor<Expr> {

    private final Function<Object, Object> resolver;

    public ConditionRewriter(Function<Object, Object> resolver) {
        this.resolver = resolver;
    }

    public static ConditionRewriter forResolver(ColumnResolver columnResolver) {
        return new ConditionRewriter(columnResolver::resolve);
    }

    public Expr rewrite(Expr expr) {
        return expr.accept(this);
    }

    public List<Expr> rewriteAll(List<Expr> conditions) {
        if (conditions == null) {
            return null;
        }
        List<Expr> rewritten = new ArrayList<>(conditions.size());
        for (Expr condition : conditions) {
            rewritten.add(rewrite(condition));
        }
        return rewritten;
    }

    @Override
    public Expr visitTerm(Term term) {
        if (term.isName()) {
            return Term.of(resolver.apply(term.getValue()));
        }
        return Term.of(literal(term.getValue()));
    }

    @Override
    public Expr visitComparison(Comparison comparison) {
        Expr column = comparison.getColumn();
        if (column instanceof Term) {
            return comparison.withColumn(Term.of(resolver.apply(((Term) column).getValue())));
        }
        return comparison.withColumn(rewrite(column));
    }

    @Override
    public Expr visitFunctionCall(FunctionCall call) {
        List<Expr> args = call.getArgs();
        List<Expr> rewritten = new ArrayList<>(args.size());

        if (SafeFunctions.isComparisonFunction(call.getName())) {
            for (int i = 0; i < args.size(); i++) {
                Expr arg = args.get(i);
                if (i == 0) {
                    rewritten.add(arg instanceof Term ? Term.of(resolver.apply(((Term) arg).getValue())) : rewrite(arg));
                } else {
                    rewritten.add(arg instanceof Term ? Term.of(literal(((Term) arg).getValue())) : arg);
                }
            }
        } else {
            for (Expr arg : args) {
                rewritten.add(rewrite(arg));
            }
        }
        return call.withArgs(rewritten);
    }

    @Override
    public Expr visitGroup(ExprGroup group) {
        return new ExprGroup(rewriteAll(group.getChildren()));
    }

    /**
     * Literal form of a value: strings single-quoted unless they already are,
     * timestamps as quoted ISO strings.
     */
    static Object literal(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            return ColumnResolver.isQuotedLiteral(text) ? text : "'" + text + "'";
        }
        if (WireTimestamps.isTimestamp(value)) {
            return "'" + WireTimestamps.format((TemporalAccessor) value) + "'";
        }
        return value;
    }
}
