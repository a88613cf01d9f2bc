package com.strata.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Thread-local scoped overrides for the current thread.
 *
 * Each {@link #open} layers options on top of the current ones and returns a
 * scope that restores the previous options when closed, so scopes nest:
 * <pre>
 * try (OverrideContext.Scope scope = OverrideContext.open(Map.of("consistent", true))) {
 *     gateway.rawQuery(intent, false);
 * }
 * </pre>
 * The overrides never leave the opening thread. Work handed to other threads
 * must receive them explicitly as a {@link QueryOverrides} value.
 *
 * @see QueryOverrides
 */
public final class OverrideContext {

    private static final Logger log = LoggerFactory.getLogger(OverrideContext.class);

    private static final ThreadLocal<QueryOverrides> CURRENT = ThreadLocal.withInitial(QueryOverrides::none);

    private OverrideContext() {
        throw new UnsupportedOperationException("OverrideContext is a utility class and cannot be instantiated");
    }

    /**
     * Overrides in effect on the current thread.
     */
    public static QueryOverrides current() {
        return CURRENT.get();
    }

    public static Scope open(Map<String, ?> overrides) {
        return open(QueryOverrides.of(overrides));
    }

    public static Scope open(QueryOverrides overrides) {
        QueryOverrides previous = CURRENT.get();
        CURRENT.set(previous.merge(overrides));
        log.debug("Opened override scope: {}", overrides);
        return new Scope(previous, Thread.currentThread());
    }

    /**
     * Restores the overrides that were in effect when it was opened.
     */
    public static final class Scope implements AutoCloseable {

        private final QueryOverrides previous;
        private final Thread owner;
        private boolean closed;

        private Scope(QueryOverrides previous, Thread owner) {
            this.previous = previous;
            this.owner = owner;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("Override scope must be closed on the thread that opened it");
            }
            closed = true;
            if (previous.isEmpty()) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
            log.debug("Closed override scope, restored: {}", previous);
        }
    }
}
