// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.cmdmetrics.core.MetricRegistry;
import org.cmdmetrics.core.MetricsExporter;
import org.cmdmetrics.exporter.exec.JobRunner;
import org.cmdmetrics.exporter.exec.ProcessCommandExecutor;
import org.cmdmetrics.exporter.job.Job;
import org.cmdmetrics.exporter.job.JobDefinitionLoader;
import org.cmdmetrics.exporter.schedule.JobScheduler;
import org.cmdmetrics.openmetrics.OpenMetricsHttpServerFactory;
import org.cmdmetrics.openmetrics.config.OpenMetricsHttpServerConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Entry point of the exporter: runs the commands of all job definition files on their schedules and serves
 * the latest results on an HTTP metrics endpoint.
 * <p>
 * Options fall back to environment variables where noted in their description. The scheduler runs on the
 * calling thread until the process receives a termination signal.
 */
@Command(
        name = "cmdmetrics-exporter",
        mixinStandardHelpOptions = true,
        version = "cmdmetrics-exporter " + CommandMetricsExporter.VERSION,
        description = "Run external commands periodically and export their output as metrics.")
public final class CommandMetricsExporter implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CommandMetricsExporter.class);

    static final String VERSION = "0.10.0";

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-c", "--config-dir"},
            defaultValue = "${env:CONFIG_DIR:-" + ExporterConfig.DEFAULT_CONFIG_DIR + "}",
            description = "Directory with *.json job definition files, env CONFIG_DIR (default: ${DEFAULT-VALUE}).")
    private Path configDir;

    @Option(
            names = {"--host"},
            defaultValue = "${env:METRICS_HOST}",
            description = "Address the metrics endpoint binds to, env METRICS_HOST (default: all interfaces).")
    private String host;

    @Option(
            names = {"-p", "--port"},
            defaultValue = "${env:METRICS_PORT:-8000}",
            description = "Port of the metrics endpoint, env METRICS_PORT (default: ${DEFAULT-VALUE}).")
    private int port;

    @Option(
            names = {"--path"},
            defaultValue = OpenMetricsHttpServerConfig.DEFAULT_PATH,
            description = "HTTP path of the metrics endpoint (default: ${DEFAULT-VALUE}).")
    private String path;

    @Option(
            names = {"--decimal-format"},
            defaultValue = OpenMetricsHttpServerConfig.DEFAULT_DECIMAL_FORMAT,
            description = "java.text.DecimalFormat pattern of exposed values"
                    + " (default: shortest form that reads back as the same value).")
    private String decimalFormat;

    @Option(
            names = {"--tick"},
            defaultValue = "1",
            description = "Longest time in seconds between two checks for due jobs (default: ${DEFAULT-VALUE}).")
    private long tickSeconds;

    @Option(
            names = {"--default-timeout"},
            defaultValue = "0",
            description = "Timeout in seconds of jobs without own timeout, 0 to use the job interval"
                    + " (default: ${DEFAULT-VALUE}).")
    private long defaultTimeoutSeconds;

    @Option(
            names = {"--shutdown-grace"},
            defaultValue = "10",
            description = "Seconds to wait for running commands on shutdown (default: ${DEFAULT-VALUE}).")
    private long shutdownGraceSeconds;

    @Option(
            names = {"--log-level"},
            defaultValue = "${env:LOG_LEVEL:-INFO}",
            description = "Log level, e.g. DEBUG, INFO, WARNING, ERROR, env LOG_LEVEL (default: ${DEFAULT-VALUE}).")
    private String logLevel;

    private final AtomicBoolean stopped = new AtomicBoolean();

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandMetricsExporter()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        final Level level = resolveLogLevel(logLevel);
        if (level == null) {
            throw new ParameterException(spec.commandLine(), "Unknown log level: " + logLevel);
        }
        Configurator.setRootLevel(level);
        logger.info("Starting command metrics exporter version \"{}\"", VERSION);
        logger.info("Using log level {}", level);

        final ExporterConfig config = toConfig();

        final List<Job> jobs = new JobDefinitionLoader().load(config.configDir());
        if (jobs.isEmpty()) {
            logger.error("No valid job definitions in {}, serving an empty exposition", config.configDir());
        }

        final MetricsExporter server;
        try {
            server = new OpenMetricsHttpServerFactory().createExporter(config.server());
        } catch (UncheckedIOException e) {
            logger.error("Failed to start metrics endpoint on port {}", config.server().port(), e.getCause());
            return 1;
        }

        final MetricRegistry.Builder registryBuilder = MetricRegistry.builder();
        if (server != null) {
            registryBuilder.setMetricsExporter(server);
        }
        final MetricRegistry registry = registryBuilder.build();
        final ProcessCommandExecutor executor = new ProcessCommandExecutor(config.defaultTimeout());
        final JobScheduler scheduler =
                new JobScheduler(jobs, new JobRunner(executor, registry), Clock.systemUTC(), config.tick());

        final Thread shutdownHook = new Thread(
                () -> stop(scheduler, executor, registry, config.shutdownGrace()), "exporter-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        scheduler.run();

        // loop ended without a termination signal, e.g. by interruption
        if (!stopped.get()) {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
            stop(scheduler, executor, registry, config.shutdownGrace());
        }
        return 0;
    }

    /**
     * Builds the validated configuration from the parsed options.
     *
     * @throws ParameterException if any option value is out of range
     */
    @NonNull
    ExporterConfig toConfig() {
        try {
            OpenMetricsHttpServerConfig serverConfig = new OpenMetricsHttpServerConfig(
                    true,
                    host == null ? OpenMetricsHttpServerConfig.DEFAULT_HOSTNAME : host.trim(),
                    port,
                    path,
                    OpenMetricsHttpServerConfig.DEFAULT_BUFFER_SIZE,
                    decimalFormat == null ? OpenMetricsHttpServerConfig.DEFAULT_DECIMAL_FORMAT : decimalFormat);
            return new ExporterConfig(
                    configDir,
                    Duration.ofSeconds(tickSeconds),
                    Duration.ofSeconds(defaultTimeoutSeconds),
                    Duration.ofSeconds(shutdownGraceSeconds),
                    serverConfig);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves Log4j level names and the level names {@code CRITICAL}, {@code WARNING} and {@code NOTSET}.
     *
     * @param name the level name, case-insensitive
     * @return the level or {@code null} if the name is unknown
     */
    @Nullable
    static Level resolveLogLevel(@Nullable String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL" -> Level.FATAL;
            case "WARNING" -> Level.WARN;
            case "NOTSET" -> Level.ALL;
            default -> Level.getLevel(name.trim().toUpperCase(Locale.ROOT));
        };
    }

    private void stop(JobScheduler scheduler, ProcessCommandExecutor executor, MetricRegistry registry, Duration grace) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down, waiting up to {}s for running commands", grace.toSeconds());
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(grace)) {
                logger.warn("Commands still running after {}s, not waiting any longer", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for running commands");
        } finally {
            executor.close();
            try {
                registry.close();
            } catch (IOException e) {
                logger.warn("Failed to close metrics endpoint", e);
            }
        }
        logger.info("Command metrics exporter stopped");
    }
}
