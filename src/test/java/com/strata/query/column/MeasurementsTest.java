package com.strata.query.column;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Measurements")
class MeasurementsTest {

    @Test
    @DisplayName("should extract lower-cased measurement keys")
    void shouldExtractMeasurementKeys() {
        assertThat(Measurements.measurementName("measurements.FCP")).isEqualTo("fcp");
        assertThat(Measurements.measurementName("measurement.fcp")).isNull();
        assertThat(Measurements.isMeasurement("measurements.frames_slow")).isTrue();
        assertThat(Measurements.isMeasurement(3)).isFalse();
    }

    @Test
    @DisplayName("should map span breakdown fields and back")
    void shouldMapSpanBreakdowns() {
        assertThat(Measurements.spanOpBreakdownName("spans.DB")).isEqualTo("ops.db");
        assertThat(Measurements.spanOpBreakdownName("spans.total.time")).isEqualTo("total.time");
        assertThat(Measurements.arrayColumnField("span_op_breakdowns", "ops.db")).isEqualTo("db");
        assertThat(Measurements.arrayColumnAlias("span_op_breakdowns")).isEqualTo("spans");
        assertThat(Measurements.arrayColumnField("measurements", "lcp")).isEqualTo("lcp");
    }

    @Test
    @DisplayName("should classify measurement units")
    void shouldClassifyMeasurementUnits() {
        assertThat(Measurements.isDurationMeasurement("measurements.lcp")).isTrue();
        assertThat(Measurements.isPercentageMeasurement("measurements.frames_slow_rate")).isTrue();
        assertThat(Measurements.isNumericMeasurement("measurements.cls")).isTrue();
        assertThat(Measurements.isDurationMeasurement("measurements.cls")).isFalse();
    }
}
