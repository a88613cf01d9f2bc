package com.strata.query.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeQuantizer")
class TimeQuantizerTest {

    private static LocalDateTime at(int hour, int minute, int second) {
        return LocalDateTime.of(2024, 5, 1, hour, minute, second);
    }

    @Test
    @DisplayName("should offset windows by the key hash")
    void shouldOffsetWindowsByHash() {
        assertThat(TimeQuantizer.quantize(at(17, 2, 0), 30)).isEqualTo(at(17, 0, 30));
        assertThat(TimeQuantizer.quantize(at(17, 2, 0), 60)).isEqualTo(at(17, 1, 0));
    }

    @Test
    @DisplayName("should keep the same value until the jittered window ends")
    void shouldBeStableWithinWindow() {
        assertThat(TimeQuantizer.quantize(at(17, 5, 0), 30)).isEqualTo(at(17, 0, 30));
        assertThat(TimeQuantizer.quantize(at(17, 5, 30), 30)).isEqualTo(at(17, 0, 30));
        assertThat(TimeQuantizer.quantize(at(17, 5, 31), 30)).isEqualTo(at(17, 5, 30));
    }

    @Test
    @DisplayName("should round up to the end of the window")
    void shouldRoundUp() {
        LocalDateTime rounded = TimeQuantizer.quantize(at(17, 2, 0), 30, 300, TimeQuantizer.Rounding.UP);

        assertThat(rounded).isEqualTo(at(17, 5, 30));
    }

    @Test
    @DisplayName("should cross the hour boundary into the previous window")
    void shouldCrossHourBoundary() {
        assertThat(TimeQuantizer.quantize(at(17, 0, 10), 30)).isEqualTo(at(16, 55, 30));
    }

    @Test
    @DisplayName("should treat negative hashes like their positive remainder")
    void shouldHandleNegativeHashes() {
        assertThat(TimeQuantizer.quantize(at(17, 2, 0), -270)).isEqualTo(at(17, 0, 30));
    }

    @Test
    @DisplayName("should reject a non-positive duration")
    void shouldRejectBadDuration() {
        assertThatThrownBy(() -> TimeQuantizer.quantize(at(17, 2, 0), 1, 0, TimeQuantizer.Rounding.DOWN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should format the start of the hour")
    void shouldFormatStartOfHour() {
        assertThat(TimeQuantizer.toStartOfHour(at(17, 42, 13))).isEqualTo("2024-05-01T17:00:00");
    }
}
