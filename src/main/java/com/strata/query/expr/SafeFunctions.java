package com.strata.query.expr;

import com.strata.query.error.QueryGatewayException;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Function name policy. Names reach the backend verbatim, so anything that is
 * not an identifier (or an allowlisted operator) is rejected.
 */
public final class SafeFunctions {

    private static final Set<String> ALLOWLIST = Set.of("NOT IN");
    private static final Pattern IDENTIFIER = Pattern.compile("^-?[a-zA-Z_][a-zA-Z0-9_]*$");

    /** Functions that have an infix operator equivalent. */
    private static final Map<String, String> FUNCTION_TO_OPERATOR = Map.of(
        "like", "LIKE",
        "notLike", "NOT LIKE",
        "equals", "=",
        "notEquals", "!=",
        "greater", ">",
        "less", "<",
        "greaterOrEquals", ">=",
        "lessOrEquals", "<=",
        "isNull", "IS NULL");

    private SafeFunctions() {
    }

    public static boolean isSafe(String name) {
        return name != null && (ALLOWLIST.contains(name) || IDENTIFIER.matcher(name).matches());
    }

    public static String requireSafe(String name) {
        if (!isSafe(name)) {
            throw new QueryGatewayException("Unsafe function name in query: " + name);
        }
        return name;
    }

    /**
     * {@code IN} and {@code NOT IN} are shaped like calls in the list form but are operators.
     */
    public static boolean isMembershipOperator(String name) {
        return "IN".equals(name) || "NOT IN".equals(name);
    }

    public static boolean isComparisonFunction(String name) {
        return FUNCTION_TO_OPERATOR.containsKey(name);
    }

    public static String operatorFor(String function) {
        return FUNCTION_TO_OPERATOR.get(function);
    }
}
