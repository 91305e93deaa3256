// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.openmetrics;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.spi.HttpServerProvider;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cmdmetrics.core.MetricRegistrySnapshot;
import org.cmdmetrics.core.MetricsExporter;
import org.cmdmetrics.core.concurrent.NamedThreadFactory;
import org.cmdmetrics.openmetrics.config.OpenMetricsHttpServerConfig;

/**
 * An HTTP server that exposes metrics in the Prometheus or OpenMetrics text format.
 * <p>
 * The server listens on a configurable hostname, port and path, and serves metrics snapshots
 * in response to HTTP GET requests. HEAD requests are also supported for health checks.
 * The format is chosen from the "Accept" header, see {@link ExpositionFormat#negotiate(List)}.
 * It supports gzip compression if the client indicates support for it via the "Accept-Encoding" header.
 * <p>
 * Exposed endpoint allows only one GET request at a time. Concurrent GET requests will be rejected
 * with 429 (Too Many Requests).
 */
class OpenMetricsHttpServer implements MetricsExporter {

    private static final Logger logger = LogManager.getLogger(OpenMetricsHttpServer.class);

    private static final int HANDLER_THREADS = 2;

    private final OpenMetricsWriter writer;
    private final ExecutorService executorService;

    private final HttpServer server;
    private final int bufferSize;

    // This flag is used to prohibit concurrent GET requests to scrape metrics.
    // Additionally, OpenMetricsWriter is not thread safe due to DecimalFormat usage.
    private final AtomicBoolean isHandlingRequest = new AtomicBoolean(false);

    private volatile Supplier<MetricRegistrySnapshot> snapshotSupplier;

    OpenMetricsHttpServer(@NonNull OpenMetricsHttpServerConfig config) throws IOException {
        Objects.requireNonNull(config, "OpenMetrics HTTP endpoint config must not be null");

        bufferSize = config.bufferSize();
        writer = new OpenMetricsWriter(config.decimalFormat());
        executorService = Executors.newFixedThreadPool(HANDLER_THREADS, new NamedThreadFactory("openmetrics-http"));

        final InetSocketAddress address;
        if (!config.hostname().isBlank()) {
            address = new InetSocketAddress(config.hostname(), config.port());
        } else {
            address = new InetSocketAddress(config.port());
        }

        // Use a small accept backlog to absorb short TCP connection bursts so clients can receive an HTTP
        // response (e.g., 429) instead of failing at the TCP layer. GET concurrency is limited separately.
        try {
            server = HttpServerProvider.provider().createHttpServer(address, 3);
        } catch (IOException e) {
            executorService.shutdown();
            throw e;
        }
        server.setExecutor(executorService);
        server.createContext(config.path(), this::handleMetricsPath);
        server.start();

        logger.info(
                "OpenMetrics HTTP server started. hostname={}, port={}, path={}",
                config.hostname().isBlank() ? "*" : config.hostname(),
                config.port(),
                config.path());
    }

    @Override
    public void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        this.snapshotSupplier = snapshotSupplier;
    }

    private void handleMetricsPath(HttpExchange exchange) throws IOException {
        try {
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                handleGetRequest(exchange);
            } else if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
                handleHeadRequest(exchange);
            } else {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                exchange.sendResponseHeaders(405, -1);
            }
        } catch (RuntimeException e) {
            logger.warn("Unexpected error while handling metrics request", e);
            // Only attempt to send 500 if the response is not committed yet
            if (exchange.getResponseCode() == -1) {
                try {
                    exchange.sendResponseHeaders(500, -1);
                } catch (IOException sendError) {
                    logger.debug("Failed to send error response", sendError);
                }
            }
        } finally {
            exchange.close();
        }
    }

    private void handleHeadRequest(HttpExchange exchange) throws IOException {
        if (snapshotSupplier == null) {
            handleNoSnapshotSupplier(exchange);
        } else {
            setCommonOkResponseHeaders(exchange);
            handleGzipHeaders(exchange);
            exchange.sendResponseHeaders(200, -1);
        }
    }

    private void handleGetRequest(HttpExchange exchange) throws IOException {
        final Supplier<MetricRegistrySnapshot> snapshotSupplierRef = this.snapshotSupplier;

        if (snapshotSupplierRef == null) {
            handleNoSnapshotSupplier(exchange);
            return;
        }

        if (!isHandlingRequest.compareAndSet(false, true)) {
            logger.warn("Another request is being processed, rejecting this one");
            exchange.getResponseHeaders().set("Retry-After", "3");
            exchange.getResponseHeaders().set("Cache-Control", "no-store");
            exchange.sendResponseHeaders(429, -1);
            return;
        }

        try {
            MetricRegistrySnapshot registrySnapshot = snapshotSupplierRef.get();

            ExpositionFormat format = setCommonOkResponseHeaders(exchange);
            boolean useGzip = handleGzipHeaders(exchange);

            exchange.sendResponseHeaders(200, 0);

            // Choose output stream based on compression and buffer size and send body
            OutputStream outputStream = exchange.getResponseBody();
            if (useGzip) {
                outputStream = new GZIPOutputStream(outputStream);
            }
            if (bufferSize != 0) {
                outputStream = new BufferedOutputStream(outputStream, bufferSize);
            }
            try (OutputStream os = outputStream) {
                writer.write(registrySnapshot, format, os);
            }
        } finally {
            isHandlingRequest.set(false);
        }
    }

    private void handleNoSnapshotSupplier(HttpExchange exchange) throws IOException {
        logger.info("No snapshot supplier configured yet. method={}", exchange.getRequestMethod());
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(204, -1);
    }

    private ExpositionFormat setCommonOkResponseHeaders(HttpExchange exchange) {
        ExpositionFormat format =
                ExpositionFormat.negotiate(exchange.getRequestHeaders().get("Accept"));
        Headers responseHeaders = exchange.getResponseHeaders();
        responseHeaders.set("Content-Type", format.contentType());
        responseHeaders.set("Cache-Control", "no-store");
        responseHeaders.set("Vary", "Accept, Accept-Encoding");
        return format;
    }

    private boolean handleGzipHeaders(HttpExchange exchange) {
        List<String> encodingHeaders = exchange.getRequestHeaders().get("Accept-Encoding");
        if (encodingHeaders == null) {
            return false;
        }
        for (String encodingHeader : encodingHeaders) {
            String[] encodings = encodingHeader.split(",");
            for (String encoding : encodings) {
                if (encoding.trim().equalsIgnoreCase("gzip")) {
                    exchange.getResponseHeaders().set("Content-Encoding", "gzip");
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void close() {
        logger.info("Stopping OpenMetrics HttpServer...");
        server.stop(1);
        executorService.shutdownNow();
    }
}
