package com.strata.query.expr;

/**
 * Visitor over the {@link Expr} variants.
 */
public interface ExprVisitor<R> {

    R visitTerm(Term term);

    R visitComparison(Comparison comparison);

    R visitFunctionCall(FunctionCall call);

    R visitGroup(ExprGroup group);
}
