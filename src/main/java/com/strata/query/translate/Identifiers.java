package com.strata.query.translate;

/**
 * Identifier coercion. JSON and caller input mix integer widths.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static Long toLong(Object id) {
        if (id instanceof Number) {
            return ((Number) id).longValue();
        }
        if (id instanceof String) {
            try {
                return Long.parseLong((String) id);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
