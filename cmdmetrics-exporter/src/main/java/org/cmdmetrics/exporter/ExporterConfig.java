// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.cmdmetrics.exporter.job.Job;
import org.cmdmetrics.openmetrics.config.OpenMetricsHttpServerConfig;

/**
 * Configuration of the exporter process.
 *
 * @param configDir      directory with the job definition files (default: configs)
 * @param tick           longest sleep of the scheduler loop (default: 1s, must be positive)
 * @param defaultTimeout timeout of jobs without own timeout, zero to use the job interval (default: 0)
 * @param shutdownGrace  time to wait for running commands on shutdown (default: 10s)
 * @param server         configuration of the metrics endpoint
 */
public record ExporterConfig(
        @NonNull Path configDir,
        @NonNull Duration tick,
        @NonNull Duration defaultTimeout,
        @NonNull Duration shutdownGrace,
        @NonNull OpenMetricsHttpServerConfig server) {

    public static final String DEFAULT_CONFIG_DIR = "configs";

    public ExporterConfig {
        Objects.requireNonNull(configDir, "config dir must not be null");
        Objects.requireNonNull(tick, "tick must not be null");
        Objects.requireNonNull(defaultTimeout, "default timeout must not be null");
        Objects.requireNonNull(shutdownGrace, "shutdown grace must not be null");
        Objects.requireNonNull(server, "server config must not be null");

        if (tick.isNegative() || tick.isZero()) {
            throw new IllegalArgumentException("tick must be positive, but was: " + tick.toSeconds() + "s");
        }
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException(
                    "default timeout must not be negative, but was: " + defaultTimeout.toSeconds() + "s");
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException(
                    "shutdown grace must not be negative, but was: " + shutdownGrace.toSeconds() + "s");
        }
        requireAtMostMax(tick, "tick");
        requireAtMostMax(defaultTimeout, "default timeout");
        requireAtMostMax(shutdownGrace, "shutdown grace");
    }

    private static void requireAtMostMax(Duration duration, String name) {
        if (duration.compareTo(Job.MAX_DURATION) > 0) {
            throw new IllegalArgumentException(name + " must be at most " + Job.MAX_DURATION.toSeconds()
                    + "s, but was: " + duration.toSeconds() + "s");
        }
    }
}
