// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.cmdmetrics.core.LabelSet;
import org.cmdmetrics.core.MetricType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JobTest {

    private static final List<String> COMMAND = List.of("/opt/check.sh", "-v");

    @Test
    void testDefaults() {
        Job job = Job.builder("service_check", COMMAND).build();

        assertThat(job.interval()).isEqualTo(Duration.ofSeconds(600));
        assertThat(job.type()).isEqualTo(MetricType.GAUGE);
        assertThat(job.help()).isNotEmpty().isEqualTo("Generic metric HELP");
        assertThat(job.globalLabels().isEmpty()).isTrue();
        assertThat(job.labels().isEmpty()).isTrue();
        assertThat(job.timeout()).isNull();
        assertThat(job.id()).isEqualTo("service_check");
    }

    @Test
    void testJobLabelOverridesGlobalLabel() {
        Job job = Job.builder("service_check", COMMAND)
                .setGlobalLabels(LabelSet.of(Map.of("dc", "X")))
                .setLabels(LabelSet.of(Map.of("dc", "Y")))
                .build();

        LabelSet labels = job.resolveLabels("main");

        assertThat(labels.get("dc")).isEqualTo("Y");
        assertThat(labels.get("component")).isEqualTo("main");
    }

    @Test
    void testConfiguredComponentLabelIsRenamed() {
        Job job = Job.builder("service_check", COMMAND)
                .setLabels(LabelSet.of(Map.of("component", "custom")))
                .build();

        LabelSet labels = job.resolveLabels("health");

        assertThat(labels.get("user_defined_component")).isEqualTo("custom");
        assertThat(labels.get("component")).isEqualTo("health");
    }

    @Test
    void testErrorsMetricName() {
        assertThat(Job.builder("service_check", COMMAND).build().errorsMetricName())
                .isEqualTo("service_check_errors_total");
    }

    @Test
    void testCommandIsCopied() {
        List<String> command = new ArrayList<>(COMMAND);
        Job job = Job.builder("service_check", command).build();
        command.add("extra");

        assertThat(job.command()).containsExactly("/opt/check.sh", "-v");
        assertThatThrownBy(() -> job.command().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "9lives", "bad-name", "bad name"})
    void testInvalidMetricNameThrows(String metricName) {
        assertThatThrownBy(() -> Job.builder(metricName, COMMAND).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmptyCommandThrows() {
        assertThatThrownBy(() -> Job.builder("service_check", List.of()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("command must not be empty");
    }

    @ParameterizedTest
    @ValueSource(longs = {0, -1, -600})
    void testNonPositiveIntervalThrows(long seconds) {
        assertThatThrownBy(() -> Job.builder("service_check", COMMAND)
                        .setInterval(Duration.ofSeconds(seconds))
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interval must be positive");
    }

    @Test
    void testNonPositiveTimeoutThrows() {
        assertThatThrownBy(() -> Job.builder("service_check", COMMAND)
                        .setTimeout(Duration.ZERO)
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout must be positive");
    }

    @Test
    void testLongestIntervalAccepted() {
        Job job = Job.builder("service_check", COMMAND)
                .setInterval(Job.MAX_DURATION)
                .setTimeout(Job.MAX_DURATION)
                .build();

        assertThat(job.interval()).isEqualTo(Duration.ofDays(365));
    }

    @Test
    void testIntervalAboveMaximumThrows() {
        assertThatThrownBy(() -> Job.builder("service_check", COMMAND)
                        .setInterval(Duration.ofSeconds(Long.MAX_VALUE))
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interval must be at most 365 days");
    }

    @Test
    void testTimeoutAboveMaximumThrows() {
        assertThatThrownBy(() -> Job.builder("service_check", COMMAND)
                        .setTimeout(Job.MAX_DURATION.plusSeconds(1))
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout must be at most 365 days");
    }
}
