package com.strata.query.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a condition tree back to the nested list wire form read by
 * {@link ConditionParser}.
 */
public final class ConditionWriter implements ExprVisitor<Object> {

    private static final ConditionWriter INSTANCE = new ConditionWriter();

    private ConditionWriter() {
    }

    public static Object write(Expr expr) {
        return expr.accept(INSTANCE);
    }

    public static List<Object> writeAll(List<Expr> conditions) {
        if (conditions == null) {
            return null;
        }
        List<Object> wire = new ArrayList<>(conditions.size());
        for (Expr condition : conditions) {
            wire.add(write(condition));
        }
        return wire;
    }

    @Override
    public Object visitTerm(Term term) {
        return term.getValue();
    }

    @Override
    public Object visitComparison(Comparison comparison) {
        List<Object> wire = new ArrayList<>(3);
        wire.add(comparison.getColumn().accept(this));
        wire.add(comparison.getOperator());
        wire.add(comparison.getLiteral());
        return wire;
    }

    @Override
    public Object visitFunctionCall(FunctionCall call) {
        List<Object> wire = new ArrayList<>(3);
        wire.add(call.getName());
        wire.add(writeArgs(call.getArgs()));
        if (call.getAlias() != null) {
            wire.add(call.getAlias());
        }
        return wire;
    }

    @Override
    public Object visitGroup(ExprGroup group) {
        List<Object> wire = new ArrayList<>(group.getChildren().size());
        for (Expr child : group.getChildren()) {
            wire.add(child.accept(this));
        }
        return wire;
    }

    // Nested calls are flattened: g(a), b -> [g, [a], b]
    private List<Object> writeArgs(List<Expr> args) {
        List<Object> wire = new ArrayList<>();
        for (Expr arg : args) {
            if (arg instanceof FunctionCall && ((FunctionCall) arg).getAlias() == null) {
                FunctionCall nested = (FunctionCall) arg;
                wire.add(nested.getName());
                wire.add(writeArgs(nested.getArgs()));
            } else {
                wire.add(arg.accept(this));
            }
        }
        return wire;
    }
}
