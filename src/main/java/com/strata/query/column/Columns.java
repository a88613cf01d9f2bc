package com.strata.query.column;

/**
 * Public column aliases and their physical names in each event-like dataset.
 *
 * A {@code null} physical name means the column does not exist in that
 * dataset. Several public names refer to a tag rather than the top level
 * column of the same name, so those physical names are tag references.
 */
public enum Columns {

    EVENT_ID("id", "event_id", "event_id", "event_id", "event_id"),
    GROUP_ID("issue.id", "group_id", null, "group_id", "group_id"),
    PROJECT_ID("project.id", "project_id", "project_id", "project_id", "project_id"),
    TIMESTAMP("timestamp", "timestamp", "finish_ts", "timestamp", "timestamp"),
    TIME("time", "time", "bucketed_end", "time", null),
    PLATFORM("platform.name", "platform", "platform", "platform", "platform"),
    ENVIRONMENT("environment", "environment", "environment", "environment", "environment"),
    RELEASE("release", "tags[sentry:release]", "release", "release", "release"),
    DIST("dist", "tags[sentry:dist]", "dist", "dist", "tags[sentry:dist]"),
    USER("user", "tags[sentry:user]", "user", "user", "tags[sentry:user]"),
    USER_ID("user.id", "user_id", "user_id", "user_id", "user_id"),
    USER_EMAIL("user.email", "email", "user_email", "email", "user_email"),
    USER_USERNAME("user.username", "username", "user_name", "username", "user_name"),
    USER_IP_ADDRESS("user.ip", "ip_address", "ip_address", "ip_address", "ip_address"),
    MESSAGE("message", "message", "transaction_name", "message", "message"),
    TITLE("title", "title", "transaction_name", "title", "search_title"),
    LOCATION("location", "location", null, "location", null),
    CULPRIT("culprit", "culprit", null, "culprit", null),
    TYPE("event.type", "type", null, "type", "occurrence_type_id"),
    TRANSACTION("transaction", "transaction", "transaction_name", "transaction", "transaction_name"),
    TRANSACTION_DURATION("transaction.duration", null, "duration", "duration", "transaction_duration"),
    TRANSACTION_OP("transaction.op", null, "transaction_op", "transaction_op", null),
    TRANSACTION_STATUS("transaction.status", null, "transaction_status", "transaction_status", null),
    TRACE_ID("trace", "contexts[trace.trace_id]", "trace_id", "trace_id", "trace_id"),
    SPAN_ID("trace.span", "contexts[trace.span_id]", "span_id", "span_id", null),
    HTTP_METHOD("http.method", "http_method", "http_method", "http_method", null),
    HTTP_URL("http.url", "tags[url]", "tags[url]", "tags[url]", null),
    SDK_NAME("sdk.name", "sdk_name", "sdk_name", "sdk_name", "sdk_name"),
    SDK_VERSION("sdk.version", "sdk_version", "sdk_version", "sdk_version", "sdk_version"),
    ERROR_TYPE("error.type", "exception_stacks.type", null, "exception_stacks.type", null),
    ERROR_VALUE("error.value", "exception_stacks.value", null, "exception_stacks.value", null),
    STACK_FILENAME("stack.filename", "exception_frames.filename", null, "exception_frames.filename", null),
    CONTEXTS_KEY("contexts.key", "contexts.key", "contexts.key", "contexts.key", "contexts.key"),
    CONTEXTS_VALUE("contexts.value", "contexts.value", "contexts.value", "contexts.value", "contexts.value"),
    TAGS_KEY("tags.key", "tags.key", "tags.key", "tags.key", "tags.key"),
    TAGS_VALUE("tags.value", "tags.value", "tags.value", "tags.value", "tags.value"),
    MEASUREMENTS_KEY("measurements_key", null, "measurements.key", "measurements.key", null),
    MEASUREMENTS_VALUE("measurements_value", null, "measurements.value", "measurements.value", null),
    SPAN_OP_BREAKDOWNS_KEY("span_op_breakdowns_key", null, "span_op_breakdowns.key", "span_op_breakdowns.key", null),
    SPAN_OP_BREAKDOWNS_VALUE("span_op_breakdowns_value", null, "span_op_breakdowns.value", "span_op_breakdowns.value", null),
    PROFILE_ID("profile.id", null, "profile_id", "profile_id", "profile_id"),
    REPLAY_ID("replay.id", "replay_id", "replay_id", "replay_id", "replay_id"),
    OCCURRENCE_ID("occurrence_id", null, null, null, "occurrence_id");

    private final String alias;
    private final String eventName;
    private final String transactionName;
    private final String discoverName;
    private final String issuePlatformName;

    Columns(String alias, String eventName, String transactionName, String discoverName,
            String issuePlatformName) {
        this.alias = alias;
        this.eventName = eventName;
        this.transactionName = transactionName;
        this.discoverName = discoverName;
        this.issuePlatformName = issuePlatformName;
    }

    public String getAlias() {
        return alias;
    }

    public String getEventName() {
        return eventName;
    }

    public String getTransactionName() {
        return transactionName;
    }

    public String getDiscoverName() {
        return discoverName;
    }

    public String getIssuePlatformName() {
        return issuePlatformName;
    }
}
