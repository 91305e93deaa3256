// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.cmdmetrics.core.MetricsExporter;
import org.cmdmetrics.openmetrics.config.OpenMetricsHttpServerConfig;

/**
 * Creates OpenMetrics HTTP server exporters from {@link OpenMetricsHttpServerConfig}.
 */
public final class OpenMetricsHttpServerFactory {

    /**
     * Creates and starts the HTTP server.
     *
     * @param config the server configuration, must not be {@code null}
     * @return the started exporter or {@code null} if the server is disabled
     * @throws UncheckedIOException if the server cannot be bound
     */
    @Nullable
    public MetricsExporter createExporter(@NonNull OpenMetricsHttpServerConfig config) {
        Objects.requireNonNull(config, "OpenMetrics HTTP endpoint config must not be null");

        if (!config.enabled()) {
            return null;
        }

        try {
            return new OpenMetricsHttpServer(config);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
