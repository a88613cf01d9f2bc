package com.strata.query.expr;

import com.strata.query.error.QueryGatewayException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads conditions and column expressions in the nested list form used by
 * callers and on the wire.
 *
 * <p>A string immediately followed by a list marks the string as a function
 * name: {@code ["f", [a, b]]} is {@code f(a, b)}, {@code ["f", [a], "x"]} is
 * {@code f(a) AS x}, and inside an argument list {@code [g, [a], b]} is
 * {@code g(a), b}. A three element list starting with a column is a
 * comparison; a list of lists is a group.
 */
public final class ConditionParser {

    private ConditionParser() {
    }

    public static List<Expr> parseAll(List<?> conditions) {
        if (conditions == null) {
            return null;
        }
        List<Expr> parsed = new ArrayList<>(conditions.size());
        for (Object condition : conditions) {
            parsed.add(parse(condition));
        }
        return parsed;
    }

    public static Expr parse(Object condition) {
        if (!(condition instanceof List) || ((List<?>) condition).isEmpty()) {
            throw malformed(condition);
        }
        List<?> cond = (List<?>) condition;
        int index = functionIndex(cond);

        if (index >= 0 && !SafeFunctions.isMembershipOperator((String) cond.get(index))) {
            if (index != 0) {
                throw malformed(condition);
            }
            return parseCall(cond);
        }

        Object head = cond.get(0);
        if (head instanceof String && cond.size() == 3) {
            return new Comparison(Term.of(head), operator(cond), cond.get(2));
        }
        if (head instanceof List) {
            List<?> headList = (List<?>) head;
            if (functionIndex(headList) == 0) {
                if (cond.size() != 3) {
                    throw malformed(condition);
                }
                return new Comparison(parseCall(headList), operator(cond), cond.get(2));
            }
            List<Expr> children = new ArrayList<>(cond.size());
            for (Object child : cond) {
                children.add(parse(child));
            }
            return new ExprGroup(children);
        }
        throw malformed(condition);
    }

    /**
     * Parses a column expression: a plain name, a literal or a function call.
     */
    public static Expr parseColumn(Object column) {
        if (column instanceof List && functionIndex((List<?>) column) == 0) {
            return parseCall((List<?>) column);
        }
        if (column instanceof List) {
            throw malformed(column);
        }
        return Term.of(column);
    }

    /**
     * Index of the function name in {@code expr}, or -1. Every candidate name
     * is checked against {@link SafeFunctions}.
     */
    public static int functionIndex(List<?> expr) {
        for (int i = 0; i < expr.size() - 1; i++) {
            if (expr.get(i) instanceof String && expr.get(i + 1) instanceof List) {
                SafeFunctions.requireSafe((String) expr.get(i));
                return i;
            }
        }
        return -1;
    }

    static FunctionCall parseCall(List<?> call) {
        if (call.size() > 3) {
            throw malformed(call);
        }
        Object alias = call.size() == 3 ? call.get(2) : null;
        if (alias != null && !(alias instanceof String)) {
            throw malformed(call);
        }
        return new FunctionCall((String) call.get(0), parseArgs((List<?>) call.get(1)), (String) alias);
    }

    private static List<Expr> parseArgs(List<?> args) {
        List<Expr> parsed = new ArrayList<>(args.size());
        int i = 0;
        while (i < args.size()) {
            Object arg = args.get(i);
            if (arg instanceof String && i + 1 < args.size() && args.get(i + 1) instanceof List) {
                parsed.add(new FunctionCall((String) arg, parseArgs((List<?>) args.get(i + 1))));
                i += 2;
                continue;
            }
            if (arg instanceof List) {
                List<?> nested = (List<?>) arg;
                parsed.add(functionIndex(nested) == 0 ? parseCall(nested) : parse(nested));
            } else {
                parsed.add(Term.of(arg));
            }
            i++;
        }
        return parsed;
    }

    private static String operator(List<?> cond) {
        Object operator = cond.get(1);
        if (!(operator instanceof String)) {
            throw malformed(cond);
        }
        return (String) operator;
    }

    private static QueryGatewayException malformed(Object condition) {
        return new QueryGatewayException("Unexpected condition format " + condition);
    }
}
