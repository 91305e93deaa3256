// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MetricTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"gauge", "Gauge", "GAUGE", " gauge "})
    void testParseGauge(String value) {
        assertThat(MetricType.fromTypeName(value)).isEqualTo(MetricType.GAUGE);
    }

    @Test
    void testParseCounter() {
        assertThat(MetricType.fromTypeName("counter")).isEqualTo(MetricType.COUNTER);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "histogram", "summary", "gauges"})
    void testUnknownTypeThrows(String value) {
        assertThatThrownBy(() -> MetricType.fromTypeName(value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown metric type");
    }

    @Test
    void testTypeName() {
        assertThat(MetricType.GAUGE.typeName()).isEqualTo("gauge");
        assertThat(MetricType.COUNTER.typeName()).isEqualTo("counter");
    }
}
