// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.job;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.cmdmetrics.core.LabelResolver;
import org.cmdmetrics.core.LabelSet;
import org.cmdmetrics.core.MetricType;
import org.cmdmetrics.core.MetricUtils;

/**
 * A recurring command whose output is published under one metric name.
 * <p>
 * Jobs are immutable. The time a job is due next is kept by the scheduler, not by the job.
 * New jobs are created via {@link #builder(String, List)}.
 *
 * @param id           identifier used in logs, e.g. {@code checks.json#0}
 * @param command      the program followed by its arguments
 * @param interval     the time between two runs
 * @param metricName   the metric the output is published under
 * @param help         the help text of the metric
 * @param type         the type of the metric
 * @param globalLabels the global labels of the definition file the job comes from
 * @param labels       the labels of the job, overriding global labels with the same name
 * @param timeout      the maximum run time or {@code null} to use the executor default
 */
public record Job(
        @NonNull String id,
        @NonNull List<String> command,
        @NonNull Duration interval,
        @NonNull String metricName,
        @NonNull String help,
        @NonNull MetricType type,
        @NonNull LabelSet globalLabels,
        @NonNull LabelSet labels,
        @Nullable Duration timeout) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(600);
    public static final String DEFAULT_HELP = "Generic metric HELP";
    public static final MetricType DEFAULT_TYPE = MetricType.GAUGE;

    /** Upper bound of intervals and timeouts. */
    public static final Duration MAX_DURATION = Duration.ofDays(365);

    /** Suffix of the counter tracking failed runs of a job. */
    public static final String ERRORS_METRIC_SUFFIX = "_errors_total";

    public Job {
        MetricUtils.validateMetricNameCharacters(metricName);
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(help, "help must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(globalLabels, "global labels must not be null");
        Objects.requireNonNull(labels, "labels must not be null");

        command = List.copyOf(command);
        if (command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        requireInRange(interval, "interval");
        if (timeout != null) {
            requireInRange(timeout, "timeout");
        }
    }

    /**
     * Checks that the duration is positive and at most {@link #MAX_DURATION}.
     *
     * @param duration the duration to check
     * @param name     the name used in the exception message
     * @return the duration
     * @throws IllegalArgumentException if the duration is out of range
     */
    @NonNull
    public static Duration requireInRange(@NonNull Duration duration, @NonNull String name) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException(
                    name + " must be at most " + MAX_DURATION.toDays() + " days: " + duration);
        }
        return duration;
    }

    /**
     * @param metricName the metric name
     * @param command    the program followed by its arguments
     * @return a new builder with default interval, help and type
     */
    @NonNull
    public static Builder builder(@NonNull String metricName, @NonNull List<String> command) {
        return new Builder(metricName, command);
    }

    /**
     * Resolves the labels of one observation of this job.
     *
     * @param component the component of the observation
     * @return global labels overridden by job labels, followed by the component label
     */
    @NonNull
    public LabelSet resolveLabels(@NonNull String component) {
        return LabelResolver.resolve(globalLabels, labels, component);
    }

    /**
     * @return name of the counter incremented on failed runs
     */
    @NonNull
    public String errorsMetricName() {
        return metricName + ERRORS_METRIC_SUFFIX;
    }

    /**
     * Builder of {@link Job} instances.
     */
    public static final class Builder {

        private final String metricName;
        private final List<String> command;

        private String id;
        private Duration interval = DEFAULT_INTERVAL;
        private String help = DEFAULT_HELP;
        private MetricType type = DEFAULT_TYPE;
        private LabelSet globalLabels = LabelSet.empty();
        private LabelSet labels = LabelSet.empty();
        private Duration timeout;

        private Builder(String metricName, List<String> command) {
            this.metricName = metricName;
            this.command = command;
        }

        @NonNull
        public Builder setId(@NonNull String id) {
            this.id = id;
            return this;
        }

        @NonNull
        public Builder setInterval(@NonNull Duration interval) {
            this.interval = interval;
            return this;
        }

        @NonNull
        public Builder setHelp(@NonNull String help) {
            this.help = help;
            return this;
        }

        @NonNull
        public Builder setType(@NonNull MetricType type) {
            this.type = type;
            return this;
        }

        @NonNull
        public Builder setGlobalLabels(@NonNull LabelSet globalLabels) {
            this.globalLabels = globalLabels;
            return this;
        }

        @NonNull
        public Builder setLabels(@NonNull LabelSet labels) {
            this.labels = labels;
            return this;
        }

        @NonNull
        public Builder setTimeout(@Nullable Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * @return the job, identified by its metric name unless an id was set
         * @throws IllegalArgumentException if any value is invalid
         */
        @NonNull
        public Job build() {
            return new Job(
                    id != null ? id : metricName,
                    command,
                    interval,
                    metricName,
                    help,
                    type,
                    globalLabels,
                    labels,
                    timeout);
        }
    }
}
