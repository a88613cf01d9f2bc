package com.strata.query.expr;

/**
 * Node of a condition or column expression tree.
 *
 * @see Term
 * @see Comparison
 * @see FunctionCall
 * @see ExprGroup
 */
public interface Expr {

    <R> R accept(ExprVisitor<R> visitor);
}
