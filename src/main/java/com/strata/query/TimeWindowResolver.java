package com.strata.query;

import com.strata.query.error.QueryOutsideGroupActivityException;
import com.strata.query.error.QueryOutsideRetentionException;
import com.strata.query.time.WireTimestamps;
import com.strata.query.translate.Identifiers;
import com.strata.storage.EntityCatalog;
import com.strata.storage.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Applies defaults, retention and single-issue narrowing to a query window.
 */
@Component
public class TimeWindowResolver {

    private static final Logger log = LoggerFactory.getLogger(TimeWindowResolver.class);

    /** Earliest possible data; clamped by retention in practice. */
    static final LocalDateTime DEFAULT_START = LocalDateTime.of(2008, 5, 8, 0, 0);

    static final Duration FIRST_SEEN_MARGIN = Duration.ofMinutes(5);

    private final RetentionPolicy retentionPolicy;
    private final EntityCatalog catalog;
    private final Clock clock;

    public TimeWindowResolver(RetentionPolicy retentionPolicy, EntityCatalog catalog, Clock clock) {
        this.retentionPolicy = retentionPolicy;
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * @param start          requested start, or null for all retained data
     * @param end            requested exclusive end, or null for now
     * @param organizationId organization whose retention applies
     * @param groupIds       the {@code group_id} filter key, may be null
     * @throws QueryOutsideRetentionException     if the window ends before retention starts
     * @throws QueryOutsideGroupActivityException if the window is empty after narrowing
     */
    public TimeWindow resolve(TemporalAccessor start, TemporalAccessor end, long organizationId, List<Object> groupIds) {
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        LocalDateTime resolvedStart = start != null ? WireTimestamps.toNaiveUtc(start) : DEFAULT_START;
        // The end is exclusive; callers expect "until now" to include now.
        LocalDateTime resolvedEnd = end != null ? WireTimestamps.toNaiveUtc(end) : now.plusSeconds(1);

        Integer retentionDays = retentionPolicy.retentionDays(organizationId);
        if (retentionDays != null) {
            LocalDateTime retentionStart = now.minusDays(retentionDays);
            if (resolvedStart.isBefore(retentionStart)) {
                resolvedStart = retentionStart;
            }
            if (resolvedStart.isAfter(resolvedEnd)) {
                throw new QueryOutsideRetentionException("Invalid date range. Please try a more recent date range.");
            }
        }

        // A narrowed start past the end means the group was inactive in the window. Keep the
        // original start in that case and let the check below decide.
        LocalDateTime narrowed = narrowToGroup(groupIds, resolvedStart);
        if (!narrowed.isAfter(resolvedEnd)) {
            resolvedStart = narrowed;
        }

        if (resolvedStart.isAfter(resolvedEnd)) {
            throw new QueryOutsideGroupActivityException(
                "Query window " + resolvedStart + " - " + resolvedEnd + " is outside the group's activity");
        }
        return new TimeWindow(resolvedStart, resolvedEnd);
    }

    /**
     * Only the start moves: last-seen is updated asynchronously and would hide recent data.
     */
    LocalDateTime narrowToGroup(List<Object> groupIds, LocalDateTime start) {
        if (groupIds == null || groupIds.size() != 1) {
            return start;
        }
        Long groupId = Identifiers.toLong(groupIds.get(0));
        if (groupId == null) {
            return start;
        }
        OffsetDateTime firstSeen = catalog.groupFirstSeen(groupId);
        if (firstSeen == null) {
            log.debug("Group {} not found, window not narrowed", groupId);
            return start;
        }
        LocalDateTime candidate = WireTimestamps.toNaiveUtc(firstSeen).minus(FIRST_SEEN_MARGIN);
        return candidate.isAfter(start) ? candidate : start;
    }
}
