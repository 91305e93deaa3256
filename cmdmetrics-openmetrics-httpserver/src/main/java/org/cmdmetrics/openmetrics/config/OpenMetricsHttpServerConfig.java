// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.text.DecimalFormat;
import java.util.Objects;

/**
 * Configuration for the OpenMetrics HTTP server.
 *
 * @param enabled whether the server is enabled (default: true)
 * @param hostname the hostname to bind to, while empty means all interfaces (default: empty)
 * @param port the port to listen on (default: 8000, range: 1-65535)
 * @param path the HTTP path to serve metrics on (default: /metrics)
 * @param bufferSize the buffer size for HTTP response output stream (default: 1024, range: 0-2mb, 0 = no buffering)
 * @param decimalFormat the {@link DecimalFormat} pattern for numbers, empty for the shortest text that parses
 *                      back to the same double (default: empty)
 */
public record OpenMetricsHttpServerConfig(
        boolean enabled,
        @NonNull String hostname,
        int port,
        @NonNull String path,
        int bufferSize,
        @NonNull String decimalFormat) {

    public static final String DEFAULT_HOSTNAME = "";
    public static final int DEFAULT_PORT = 8000;
    public static final String DEFAULT_PATH = "/metrics";
    public static final int DEFAULT_BUFFER_SIZE = 1024;
    public static final String DEFAULT_DECIMAL_FORMAT = "";

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;
    private static final int MAX_BUFFER_SIZE = 2097152;

    public OpenMetricsHttpServerConfig {
        Objects.requireNonNull(hostname, "hostname must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(decimalFormat, "decimal format must not be null");

        if (port < MIN_PORT || port > MAX_PORT) {
            throw new IllegalArgumentException(
                    "port must be in range [" + MIN_PORT + ", " + MAX_PORT + "], but was: " + port);
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        if (bufferSize < 0 || bufferSize > MAX_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                    "bufferSize must be in range [0, " + MAX_BUFFER_SIZE + "], but was: " + bufferSize);
        }
        if (!decimalFormat.isEmpty()) {
            // fails on malformed patterns
            new DecimalFormat(decimalFormat);
        }
    }

    /**
     * @return the configuration with all default values
     */
    @NonNull
    public static OpenMetricsHttpServerConfig defaults() {
        return new OpenMetricsHttpServerConfig(
                true, DEFAULT_HOSTNAME, DEFAULT_PORT, DEFAULT_PATH, DEFAULT_BUFFER_SIZE, DEFAULT_DECIMAL_FORMAT);
    }

    /**
     * @param hostname the hostname to bind to, empty for all interfaces
     * @param port     the port to listen on
     * @param path     the HTTP path to serve metrics on
     * @return an enabled configuration with default buffer size and decimal format
     */
    @NonNull
    public static OpenMetricsHttpServerConfig of(@NonNull String hostname, int port, @NonNull String path) {
        return new OpenMetricsHttpServerConfig(
                true, hostname, port, path, DEFAULT_BUFFER_SIZE, DEFAULT_DECIMAL_FORMAT);
    }
}
