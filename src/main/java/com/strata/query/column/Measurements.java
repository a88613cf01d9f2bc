package com.strata.query.column;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the {@code measurements.*} and {@code spans.*} public field
 * families, which are stored in array-backed physical columns.
 */
public final class Measurements {

    private static final Pattern MEASUREMENTS_KEY = Pattern.compile("^measurements\\.([a-zA-Z0-9\\-_.]+)$");
    private static final Pattern SPAN_OP_BREAKDOWNS_FIELD = Pattern.compile("^spans\\.([a-zA-Z0-9\\-_.]+)$");
    private static final Pattern SPAN_OP_BREAKDOWNS_KEY = Pattern.compile("^ops\\.([a-zA-Z0-9\\-_.]+)$");

    private static final String SPAN_OP_BREAKDOWNS_COLUMN = "span_op_breakdowns";
    private static final String TOTAL_TIME = "total.time";

    private static final Set<String> DURATION_MEASUREMENTS = Set.of(
        "measurements.fp",
        "measurements.fcp",
        "measurements.lcp",
        "measurements.fid",
        "measurements.ttfb",
        "measurements.ttfb.requesttime",
        "measurements.time_to_initial_display",
        "measurements.time_to_full_display",
        "measurements.app_start_cold",
        "measurements.app_start_warm");

    private static final Set<String> PERCENTAGE_MEASUREMENTS = Set.of(
        "measurements.frames_slow_rate",
        "measurements.frames_frozen_rate",
        "measurements.stall_percentage");

    private static final Set<String> NUMERIC_MEASUREMENTS = Set.of(
        "measurements.cls",
        "measurements.frames_frozen",
        "measurements.frames_slow",
        "measurements.frames_total",
        "measurements.stall_count");

    private Measurements() {
    }

    /**
     * Lower-cased measurement key of {@code measurements.<key>}, or null.
     */
    public static String measurementName(String field) {
        Matcher matcher = MEASUREMENTS_KEY.matcher(field);
        return matcher.matches() ? matcher.group(1).toLowerCase() : null;
    }

    /**
     * Breakdown key of {@code spans.<op>}: {@code ops.<op>}, or
     * {@code total.time} for the total. Null when the field is not a breakdown.
     */
    public static String spanOpBreakdownName(String field) {
        Matcher matcher = SPAN_OP_BREAKDOWNS_FIELD.matcher(field);
        if (!matcher.matches()) {
            return null;
        }
        String key = matcher.group(1).toLowerCase();
        return TOTAL_TIME.equals(key) ? key : "ops." + key;
    }

    public static boolean isMeasurement(Object field) {
        return field instanceof String && MEASUREMENTS_KEY.matcher((String) field).matches();
    }

    public static boolean isSpanOpBreakdown(Object field) {
        return field instanceof String && spanOpBreakdownName((String) field) != null;
    }

    public static boolean isDurationMeasurement(String field) {
        return DURATION_MEASUREMENTS.contains(field);
    }

    public static boolean isPercentageMeasurement(String field) {
        return PERCENTAGE_MEASUREMENTS.contains(field);
    }

    public static boolean isNumericMeasurement(String field) {
        return NUMERIC_MEASUREMENTS.contains(field);
    }

    /**
     * Public prefix of an array column; breakdowns are shown as {@code spans}.
     */
    public static String arrayColumnAlias(String arrayColumn) {
        return SPAN_OP_BREAKDOWNS_COLUMN.equals(arrayColumn) ? "spans" : arrayColumn;
    }

    /**
     * Public key of an array column entry, stripping the {@code ops.} prefix
     * from breakdown keys.
     */
    public static String arrayColumnField(String arrayColumn, String internalKey) {
        if (!SPAN_OP_BREAKDOWNS_COLUMN.equals(arrayColumn)) {
            return internalKey;
        }
        Matcher matcher = SPAN_OP_BREAKDOWNS_KEY.matcher(internalKey);
        return matcher.matches() ? matcher.group(1).toLowerCase() : internalKey;
    }
}
