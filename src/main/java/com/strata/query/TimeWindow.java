package com.strata.query;

import com.strata.query.time.WireTimestamps;

import java.time.LocalDateTime;

/**
 * Resolved query window in naive UTC. The end is exclusive.
 */
public class TimeWindow {
    private final LocalDateTime start;
    private final LocalDateTime end;

    public TimeWindow(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public String getFromDate() {
        return WireTimestamps.format(start);
    }

    public String getToDate() {
        return WireTimestamps.format(end);
    }

    @Override
    public String toString() {
        return "[" + getFromDate() + ", " + getToDate() + ")";
    }
}
