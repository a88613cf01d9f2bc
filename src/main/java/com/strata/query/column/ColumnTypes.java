package com.strata.query.column;

import java.util.Map;

/**
 * Maps backend column types, as reported in the response {@code meta}, to the
 * JSON types used when describing result columns. Defaults to {@code string}.
 */
public final class ColumnTypes {

    private static final Map<String, String> JSON_TYPES = Map.of(
        "UInt8", "boolean",
        "UInt16", "integer",
        "UInt32", "integer",
        "UInt64", "integer",
        "Float32", "number",
        "Float64", "number",
        "DateTime", "date");

    private ColumnTypes() {
    }

    public static String jsonType(String backendType) {
        if (backendType == null) {
            return "string";
        }

        String type = backendType;
        if (type.startsWith("Nullable(") && type.endsWith(")")) {
            type = type.substring("Nullable(".length(), type.length() - 1);
        }
        if (type.startsWith("Array(")) {
            return "array";
        }
        // timestamp is DateTime, toStartOfHour and friends are DateTime('UTC')
        if (type.startsWith("DateTime(")) {
            return "date";
        }
        return JSON_TYPES.getOrDefault(type, "string");
    }
}
