// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema and latest values of one metric name.
 * <p>
 * Label names are fixed by the first observation. Values are keyed by their {@link LabelValues}, ordered like
 * the label names. All value access is guarded by the instance monitor, so a snapshot never observes
 * a partially applied update.
 */
final class MetricSeries {

    private final String name;
    private final String help;
    private final MetricType type;
    private final List<String> labelNames;
    private final Set<String> labelNameSet;

    private final Map<LabelValues, Double> values = new LinkedHashMap<>();

    MetricSeries(@NonNull String name, @NonNull String help, @NonNull MetricType type, @NonNull Set<String> labelNames) {
        this.name = name;
        this.help = help;
        this.type = type;
        this.labelNames = List.copyOf(labelNames);
        this.labelNameSet = new HashSet<>(labelNames);
    }

    String name() {
        return name;
    }

    String help() {
        return help;
    }

    MetricType type() {
        return type;
    }

    List<String> labelNames() {
        return labelNames;
    }

    /**
     * Sets the value of the sample identified by the given labels.
     *
     * @throws LabelMismatchException if label names differ from the registered ones
     */
    void set(@NonNull LabelSet labels, double value) {
        final LabelValues labelValues = toLabelValues(labels);
        synchronized (this) {
            values.put(labelValues, value);
        }
    }

    /**
     * Adds the delta to the value of the sample identified by the given labels, starting from zero.
     *
     * @return the new value
     * @throws LabelMismatchException if label names differ from the registered ones
     */
    double add(@NonNull LabelSet labels, double delta) {
        final LabelValues labelValues = toLabelValues(labels);
        synchronized (this) {
            return values.merge(labelValues, delta, Double::sum);
        }
    }

    synchronized MetricSnapshot snapshot() {
        List<MetricSnapshot.Sample> samples = new ArrayList<>(values.size());
        values.forEach((labelValues, value) -> samples.add(new MetricSnapshot.Sample(labelValues, value)));
        return new MetricSnapshot(name, help, type, labelNames, samples);
    }

    private LabelValues toLabelValues(LabelSet labels) {
        if (labels.size() != labelNameSet.size() || !labelNameSet.containsAll(labels.names())) {
            throw new LabelMismatchException(name, labelNames, labels.names());
        }
        if (labelNames.isEmpty()) {
            return LabelValues.EMPTY;
        }

        final String[] orderedValues = new String[labelNames.size()];
        for (int i = 0; i < orderedValues.length; i++) {
            orderedValues[i] = labels.get(labelNames.get(i));
        }
        return new LabelValues(orderedValues);
    }
}
