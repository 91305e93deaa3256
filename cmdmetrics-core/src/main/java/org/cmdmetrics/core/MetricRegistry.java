// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A thread-safe registry of metrics whose schema is established at runtime by their first observation.
 * <p>
 * The first observation of a metric name registers its help text, type and label names. Later observations
 * must carry exactly the same label names (in any order), otherwise they are rejected with
 * {@link LabelMismatchException} and the registered values stay untouched. Help text and type of later
 * observations are ignored.
 * <p>
 * Many threads may observe values concurrently while exporters take {@link #snapshot()}s. Updates of one
 * metric are atomic relative to snapshots of that metric.
 * <p>
 * New registry can be created via {@link #builder()}. It can optionally be associated with a
 * {@link MetricsExporter}, which is closed together with the registry.
 */
public final class MetricRegistry implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    private final Map<String, MetricSeries> series = new ConcurrentHashMap<>();
    private final Queue<MetricSeries> registrationOrder = new ConcurrentLinkedQueue<>();

    @Nullable
    private final MetricsExporter exporter;

    private MetricRegistry(@Nullable MetricsExporter exporter) {
        this.exporter = exporter;

        if (exporter != null) {
            exporter.setSnapshotSupplier(this::snapshot);
            logger.info("Created metric registry. exporter={}", exporter.getClass().getName());
        } else {
            logger.info("Created metric registry without exporter");
        }
    }

    /**
     * @return a new {@link Builder} for constructing {@link MetricRegistry} instance.
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if this registry has an associated {@link MetricsExporter}, {@code false} otherwise
     */
    public boolean hasMetricsExporter() {
        return exporter != null;
    }

    /**
     * Records the latest value of a sample, adding the {@value LabelResolver#COMPONENT_LABEL} label to the labels.
     *
     * @param metricName the metric name
     * @param help       the help text used if the metric is not registered yet
     * @param type       the type used if the metric is not registered yet
     * @param labels     the labels of the sample without component
     * @param component  the value of the {@value LabelResolver#COMPONENT_LABEL} label
     * @param value      the value
     * @throws LabelMismatchException if the metric is registered with different label names
     * @see #observe(String, String, MetricType, LabelSet, double)
     */
    public void observe(
            @NonNull String metricName,
            @NonNull String help,
            @NonNull MetricType type,
            @NonNull LabelSet labels,
            @NonNull String component,
            double value) {
        observe(metricName, help, type, LabelResolver.resolve(LabelSet.empty(), labels, component), value);
    }

    /**
     * Records the latest value of a sample. Registers the metric, if this is its first observation,
     * otherwise inserts or overwrites the value of the sample with the given label values.
     *
     * @param metricName the metric name, must match {@value MetricUtils#METRIC_NAME_REGEX}
     * @param help       the help text used if the metric is not registered yet, may be empty
     * @param type       the type used if the metric is not registered yet
     * @param labels     the complete labels of the sample
     * @param value      the value
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if the metric name is invalid
     * @throws LabelMismatchException   if the metric is registered with different label names
     */
    public void observe(
            @NonNull String metricName,
            @NonNull String help,
            @NonNull MetricType type,
            @NonNull LabelSet labels,
            double value) {
        getOrRegister(metricName, help, type, labels).set(labels, value);
    }

    /**
     * Increments a counter sample by the given delta. The sample starts from zero.
     *
     * @param metricName the metric name, must match {@value MetricUtils#METRIC_NAME_REGEX}
     * @param help       the help text used if the metric is not registered yet, may be empty
     * @param labels     the complete labels of the sample
     * @param delta      the non-negative increment
     * @return the value after the increment
     * @throws IllegalArgumentException if the delta is negative or the metric name is invalid
     * @throws LabelMismatchException   if the metric is registered with different label names
     */
    public double increment(
            @NonNull String metricName, @NonNull String help, @NonNull LabelSet labels, double delta) {
        if (delta < 0 || Double.isNaN(delta)) {
            throw new IllegalArgumentException("Counter increment must be non-negative: " + delta);
        }
        return getOrRegister(metricName, help, MetricType.COUNTER, labels).add(labels, delta);
    }

    /**
     * @param metricName the metric name
     * @return {@code true} if a metric with the given name has been observed
     */
    public boolean containsMetric(@NonNull String metricName) {
        return series.containsKey(metricName);
    }

    /**
     * Takes a snapshot of all metrics in registration order.
     *
     * @return the snapshot, never {@code null}
     */
    @NonNull
    public MetricRegistrySnapshot snapshot() {
        return new MetricRegistrySnapshot(
                registrationOrder.stream().map(MetricSeries::snapshot).toList());
    }

    @Override
    public void close() throws IOException {
        if (exporter != null) {
            logger.info("Closing metrics exporter: {}", exporter.getClass().getName());
            exporter.close();
        }
    }

    private MetricSeries getOrRegister(String metricName, String help, MetricType type, LabelSet labels) {
        Objects.requireNonNull(metricName, "metric name must not be null");
        Objects.requireNonNull(help, "help must not be null");
        Objects.requireNonNull(type, "metric type must not be null");
        Objects.requireNonNull(labels, "labels must not be null");

        MetricSeries existing = series.get(metricName);
        if (existing == null) {
            MetricUtils.validateMetricNameCharacters(metricName);
            existing = series.computeIfAbsent(metricName, name -> {
                MetricSeries created = new MetricSeries(name, help, type, labels.names());
                registrationOrder.add(created);
                logger.debug("Registered metric. name={}, type={}, labelNames={}", name, type, created.labelNames());
                return created;
            });
        }

        if (existing.type() != type) {
            logger.debug(
                    "Metric {} is registered as {}, ignoring type {} of the observation",
                    metricName,
                    existing.type(),
                    type);
        }
        return existing;
    }

    /**
     * Builder for constructing {@link MetricRegistry} instances.
     */
    public static final class Builder {

        private MetricsExporter metricsExporter;

        private Builder() {}

        /**
         * Sets the {@link MetricsExporter} to be associated with the registry.
         *
         * @param metricsExporter the metrics exporter, must not be {@code null}
         * @return this builder instance
         * @throws NullPointerException if the metrics exporter is {@code null}
         */
        @NonNull
        public Builder setMetricsExporter(@NonNull MetricsExporter metricsExporter) {
            this.metricsExporter = Objects.requireNonNull(metricsExporter, "metrics exporter must not be null");
            return this;
        }

        /**
         * Builds the {@link MetricRegistry} instance and hands its snapshot supplier to the exporter, if set.
         *
         * @return the constructed {@link MetricRegistry}
         */
        @NonNull
        public MetricRegistry build() {
            return new MetricRegistry(metricsExporter);
        }
    }
}
