package com.strata.query.time;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Rounds query boundaries into fixed windows so that repeated queries share
 * cache entries.
 *
 * <p>Window edges are offset by a jitter derived from a key hash, so queries
 * with different keys roll over to the next window at different seconds.
 * Windows are aligned to the start of the hour.
 */
public final class TimeQuantizer {

    public static final int DEFAULT_DURATION_SECONDS = 300;

    public enum Rounding {
        DOWN,
        UP
    }

    private TimeQuantizer() {
    }

    public static LocalDateTime quantize(LocalDateTime time, long keyHash) {
        return quantize(time, keyHash, DEFAULT_DURATION_SECONDS, Rounding.DOWN);
    }

    /**
     * @param time            time to round
     * @param keyHash         stable hash of the query key
     * @param durationSeconds window length, must be positive
     * @param rounding        DOWN for the start of the window containing {@code time}, UP for its end
     */
    public static LocalDateTime quantize(LocalDateTime time, long keyHash, int durationSeconds, Rounding rounding) {
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException("durationSeconds must be positive: " + durationSeconds);
        }
        long jitter = Math.floorMod(keyHash, (long) durationSeconds);
        long secondsPastHour = time.getMinute() * 60L + time.getSecond();

        long windowStart = secondsPastHour / durationSeconds * durationSeconds + jitter;
        long rounded = windowStart < secondsPastHour ? windowStart : windowStart - durationSeconds;
        if (rounding == Rounding.UP) {
            rounded += durationSeconds;
        }

        return time.truncatedTo(ChronoUnit.HOURS).plusSeconds(rounded);
    }

    /**
     * ISO-8601 timestamp of the start of the hour containing {@code time}.
     */
    public static String toStartOfHour(LocalDateTime time) {
        return WireTimestamps.format(time.truncatedTo(ChronoUnit.HOURS));
    }
}
