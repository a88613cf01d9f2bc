package com.strata.query.column;

import com.strata.domain.Dataset;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps public field names to physical column names of one dataset.
 *
 * Unknown names are assumed to be user-defined tags and are never rejected.
 * Values that are not strings ({@code null}, numbers) are not names and are
 * returned unchanged.
 */
public final class ColumnResolver {

    private static final Set<String> RESERVED = Set.of("group_id", "group_ids", "project_id", "start", "end");
    private static final Set<String> DISCOVER_PASSTHROUGH = Set.of("project_id", "group_id");
    private static final Pattern QUOTED_LITERAL = Pattern.compile("^'[\\s\\S]*'$");

    private static final Map<Dataset, ColumnResolver> RESOLVERS = new EnumMap<>(Dataset.class);

    static {
        for (Dataset dataset : Dataset.values()) {
            RESOLVERS.put(dataset, new ColumnResolver(DatasetColumns.of(dataset)));
        }
    }

    private final DatasetColumns columns;

    private ColumnResolver(DatasetColumns columns) {
        this.columns = columns;
    }

    public static ColumnResolver forDataset(Dataset dataset) {
        return RESOLVERS.get(dataset);
    }

    /**
     * Convenience for {@code forDataset(dataset).resolve(name)}.
     */
    public static Object resolve(Dataset dataset, Object name) {
        return forDataset(dataset).resolve(name);
    }

    public Dataset getDataset() {
        return columns.getDataset();
    }

    public static boolean isQuotedLiteral(String value) {
        return QUOTED_LITERAL.matcher(value).matches();
    }

    /**
     * Resolve a column reference. Strings are names; anything else passes through.
     */
    public Object resolve(Object column) {
        if (!(column instanceof String)) {
            return column;
        }
        return resolveName((String) column);
    }

    public String resolveName(String name) {
        if (name.isEmpty() || RESERVED.contains(name) || name.startsWith("tags[") || isQuotedLiteral(name)) {
            return name;
        }

        if (columns.usesDiscoverRules()) {
            if (DISCOVER_PASSTHROUGH.contains(name)) {
                return name;
            }
        } else if (columns.hasPhysicalPrefix(name) || columns.isKnownField(name)) {
            return name;
        }

        String physical = columns.physicalName(name);
        if (physical != null) {
            return physical;
        }

        String measurement = Measurements.measurementName(name);
        if (measurement != null && columns.supportsMeasurements()) {
            return "measurements[" + measurement + "]";
        }

        String breakdown = Measurements.spanOpBreakdownName(name);
        if (breakdown != null && columns.supportsSpanOpBreakdowns()) {
            return "span_op_breakdowns[" + breakdown + "]";
        }

        return "tags[" + name + "]";
    }
}
