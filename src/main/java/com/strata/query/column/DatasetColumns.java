package com.strata.query.column;

import com.strata.domain.Dataset;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable column namespace of a single dataset: the public alias map, the
 * set of physical field names, and the namespacing capabilities derived from
 * the alias map.
 *
 * All instances are built once when the class is initialized.
 */
public final class DatasetColumns {

    private static final List<String> SESSIONS_FIELDS = List.of(
        "release", "sessions", "sessions_crashed", "users", "users_crashed", "project_id",
        "org_id", "environment", "session.status", "users_errored", "users_abnormal",
        "sessions_errored", "sessions_abnormal", "duration_quantiles", "duration_avg");

    private static final Map<String, String> METRICS_MAP = Map.of(
        "timestamp", "timestamp",
        "project_id", "project_id",
        "project.id", "project_id",
        "organization_id", "org_id");

    private static final Map<Dataset, DatasetColumns> REGISTRY = new EnumMap<>(Dataset.class);

    static {
        Map<String, String> events = fromColumns(Columns::getEventName);
        Map<String, String> transactions = fromColumns(Columns::getTransactionName);
        Map<String, String> discover = fromColumns(Columns::getDiscoverName);
        Map<String, String> issuePlatform = fromColumns(Columns::getIssuePlatformName);

        Map<String, String> metricsSummaries = metricsSummariesMap();
        Map<String, String> spans = spansMap();

        Map<String, String> sessions = new LinkedHashMap<>();
        SESSIONS_FIELDS.forEach(field -> sessions.put(field, field));
        sessions.put("timestamp", "started");

        register(Dataset.EVENTS, events, events.values(), false, Set.of());
        register(Dataset.TRANSACTIONS, transactions, transactions.values(), false, Set.of());
        // Discover never accepts internal column names from callers.
        register(Dataset.DISCOVER, discover, null, true, Set.of());
        register(Dataset.SESSIONS, sessions, SESSIONS_FIELDS, false, Set.of());
        register(Dataset.ISSUE_PLATFORM, issuePlatform, issuePlatform.values(), false, Set.of());
        register(Dataset.METRICS, METRICS_MAP, null, false, Set.of());
        register(Dataset.PERFORMANCE_METRICS, METRICS_MAP, null, false, Set.of());
        register(Dataset.METRICS_SUMMARIES, metricsSummaries, metricsSummaries.values(), false, Set.of());
        register(Dataset.SPANS_INDEXED, spans, spans.values(), false, Set.of("sentry_tags["));
        register(Dataset.REPLAYS, Map.of(), null, false, Set.of());
        register(Dataset.OUTCOMES, Map.of(), null, false, Set.of());
        register(Dataset.OUTCOMES_RAW, Map.of(), null, false, Set.of());
    }

    private final Dataset dataset;
    private final Map<String, String> aliases;
    private final Set<String> fields;
    private final boolean discoverRules;
    private final Set<String> physicalPrefixes;

    private DatasetColumns(Dataset dataset, Map<String, String> aliases, Set<String> fields,
                           boolean discoverRules, Set<String> physicalPrefixes) {
        this.dataset = dataset;
        this.aliases = aliases;
        this.fields = fields;
        this.discoverRules = discoverRules;
        this.physicalPrefixes = physicalPrefixes;
    }

    public static DatasetColumns of(Dataset dataset) {
        DatasetColumns columns = REGISTRY.get(dataset);
        if (columns == null) {
            throw new IllegalArgumentException("No column namespace for dataset " + dataset);
        }
        return columns;
    }

    public Dataset getDataset() {
        return dataset;
    }

    /**
     * Public alias to physical name, in declaration order.
     */
    public Map<String, String> getAliases() {
        return aliases;
    }

    /**
     * Physical field names valid for this dataset. Empty when the dataset does
     * not short-circuit resolution of physical names.
     */
    public Set<String> getFields() {
        return fields;
    }

    public String physicalName(String alias) {
        return aliases.get(alias);
    }

    public boolean isKnownField(String name) {
        return fields.contains(name);
    }

    public boolean usesDiscoverRules() {
        return discoverRules;
    }

    public boolean hasPhysicalPrefix(String name) {
        return physicalPrefixes.stream().anyMatch(name::startsWith);
    }

    public boolean supportsMeasurements() {
        return aliases.containsKey("measurements_key");
    }

    public boolean supportsSpanOpBreakdowns() {
        return aliases.containsKey("span_op_breakdowns_key");
    }

    private static void register(Dataset dataset, Map<String, String> aliases, Iterable<String> fields,
                                 boolean discoverRules, Set<String> physicalPrefixes) {
        Set<String> fieldSet = new LinkedHashSet<>();
        if (fields != null) {
            fields.forEach(fieldSet::add);
        }
        REGISTRY.put(dataset, new DatasetColumns(
            dataset,
            Collections.unmodifiableMap(new LinkedHashMap<>(aliases)),
            Collections.unmodifiableSet(fieldSet),
            discoverRules,
            physicalPrefixes));
    }

    private static Map<String, String> fromColumns(Function<Columns, String> physicalName) {
        Map<String, String> map = new LinkedHashMap<>();
        for (Columns column : Columns.values()) {
            String name = physicalName.apply(column);
            if (name != null) {
                map.put(column.getAlias(), name);
            }
        }
        return map;
    }

    private static Map<String, String> metricsSummariesMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("project", "project_id");
        map.put("id", "span_id");
        map.put("trace", "trace_id");
        map.put("metric", "metric_mri");
        map.put("timestamp", "end_timestamp");
        map.put("segment.id", "segment_id");
        map.put("span.duration", "duration_ms");
        map.put("span.group", "group");
        map.put("min_metric", "min");
        map.put("max_metric", "max");
        map.put("sum_metric", "sum");
        map.put("count_metric", "count");
        return map;
    }

    private static Map<String, String> spansMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("action", "action");
        map.put("description", "description");
        map.put("domain", "domain");
        map.put("group", "group");
        map.put("module", "module");
        map.put("id", "span_id");
        map.put("parent_span", "parent_span_id");
        map.put("platform", "platform");
        map.put("project", "project_id");
        map.put("span.action", "action");
        map.put("span.description", "description");
        map.put("span.domain", "domain");
        map.put("span.group", "group");
        map.put("span.module", "module");
        map.put("span.op", "op");
        map.put("span.self_time", "exclusive_time");
        map.put("span.status", "span_status");
        map.put("timestamp", "timestamp");
        map.put("trace", "trace_id");
        map.put("transaction", "segment_name");
        map.put("transaction.id", "transaction_id");
        map.put("segment.id", "segment_id");
        map.put("transaction.op", "transaction_op");
        map.put("user", "user");
        map.put("profile.id", "profile_id");
        map.put("cache.hit", "sentry_tags[cache.hit]");
        map.put("transaction.method", "sentry_tags[transaction.method]");
        map.put("system", "sentry_tags[system]");
        map.put("raw_domain", "sentry_tags[raw_domain]");
        map.put("release", "sentry_tags[release]");
        map.put("environment", "sentry_tags[environment]");
        map.put("device.class", "sentry_tags[device.class]");
        map.put("category", "sentry_tags[category]");
        map.put("span.category", "sentry_tags[category]");
        map.put("span.status_code", "sentry_tags[status_code]");
        map.put("replay.id", "sentry_tags[replay_id]");
        map.put("browser.name", "sentry_tags[browser.name]");
        map.put("origin.transaction", "sentry_tags[transaction]");
        map.put("is_transaction", "is_segment");
        return map;
    }
}
