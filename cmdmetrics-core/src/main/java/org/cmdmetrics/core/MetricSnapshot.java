// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable copy of one metric at a point in time.
 *
 * @param name       the metric name
 * @param help       the help text, may be empty
 * @param type       the metric type
 * @param labelNames the label names, in the order of the values of each sample
 * @param samples    the samples in insertion order
 */
public record MetricSnapshot(
        @NonNull String name,
        @NonNull String help,
        @NonNull MetricType type,
        @NonNull List<String> labelNames,
        @NonNull List<Sample> samples) {

    public MetricSnapshot {
        labelNames = List.copyOf(labelNames);
        samples = List.copyOf(samples);
    }

    /**
     * Finds the value of the sample with exactly the given labels.
     *
     * @param labels the label names and values of the sample
     * @return the value or empty if there is no such sample
     */
    @NonNull
    public OptionalDouble valueOf(@NonNull Map<String, String> labels) {
        if (labels.size() != labelNames.size()) {
            return OptionalDouble.empty();
        }
        for (Sample sample : samples) {
            boolean matches = true;
            for (int i = 0; i < labelNames.size() && matches; i++) {
                matches = sample.labelValues().get(i).equals(labels.get(labelNames.get(i)));
            }
            if (matches) {
                return OptionalDouble.of(sample.value());
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * One sample of a metric.
     *
     * @param labelValues the label values, ordered like {@link MetricSnapshot#labelNames()}
     * @param value       the latest value
     */
    public record Sample(@NonNull LabelValues labelValues, double value) {}
}
