// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetAddress;
import java.net.ServerSocket;
import org.cmdmetrics.core.MetricsExporter;
import org.cmdmetrics.openmetrics.config.OpenMetricsHttpServerConfig;
import org.junit.jupiter.api.Test;

public class OpenMetricsHttpServerFactoryTest {

    @Test
    void testNoExporterCreatedWhenDisabled() {
        OpenMetricsHttpServerConfig config = new OpenMetricsHttpServerConfig(
                false,
                OpenMetricsHttpServerConfig.DEFAULT_HOSTNAME,
                OpenMetricsHttpServerConfig.DEFAULT_PORT,
                OpenMetricsHttpServerConfig.DEFAULT_PATH,
                OpenMetricsHttpServerConfig.DEFAULT_BUFFER_SIZE,
                OpenMetricsHttpServerConfig.DEFAULT_DECIMAL_FORMAT);
        MetricsExporter exporter = new OpenMetricsHttpServerFactory().createExporter(config);

        assertThat(exporter).isNull();
    }

    @Test
    void testNullConfigThrows() {
        assertThatThrownBy(() -> new OpenMetricsHttpServerFactory().createExporter(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testFailingCreation() throws IOException {
        // Occupy any port first
        try (ServerSocket socket = new ServerSocket(0, 10, InetAddress.getByName("localhost"))) {
            OpenMetricsHttpServerConfig config =
                    OpenMetricsHttpServerConfig.of("localhost", socket.getLocalPort(), "/metrics");

            assertThatThrownBy(() -> new OpenMetricsHttpServerFactory().createExporter(config))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasCauseInstanceOf(BindException.class);
        }
    }
}
