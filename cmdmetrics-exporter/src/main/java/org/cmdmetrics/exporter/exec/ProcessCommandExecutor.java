// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cmdmetrics.core.concurrent.NamedThreadFactory;
import org.cmdmetrics.exporter.job.Job;

/**
 * Runs job commands as operating system processes.
 * <p>
 * The command is started without a shell. Standard output and standard error are read concurrently while
 * the process runs, so a process filling one of the pipes never blocks. A process still running after its
 * timeout is killed together with its descendants.
 * <p>
 * The timeout of a run is the job timeout if set, otherwise the default timeout if positive, otherwise the
 * job interval.
 */
public final class ProcessCommandExecutor implements CommandExecutor, Closeable {

    private static final Logger logger = LogManager.getLogger(ProcessCommandExecutor.class);

    private final Duration defaultTimeout;
    private final OutputClassifier classifier;
    private final ExecutorService streamReaders;

    /**
     * @param defaultTimeout the timeout of jobs without own timeout, zero to time out after the job interval
     */
    public ProcessCommandExecutor(@NonNull Duration defaultTimeout) {
        this(defaultTimeout, new OutputClassifier());
    }

    ProcessCommandExecutor(@NonNull Duration defaultTimeout, @NonNull OutputClassifier classifier) {
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "default timeout must not be null");
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("default timeout must not be negative: " + defaultTimeout);
        }
        if (!defaultTimeout.isZero()) {
            Job.requireInRange(defaultTimeout, "default timeout");
        }
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.streamReaders = Executors.newCachedThreadPool(new NamedThreadFactory("command-output"));
    }

    @NonNull
    @Override
    public List<Observation> execute(@NonNull Job job) throws CommandExecutionException, InterruptedException {
        Objects.requireNonNull(job, "job must not be null");
        final Duration timeout = timeoutOf(job);

        logger.debug("Executing job {} with command {}", job.id(), job.command());
        final Process process;
        try {
            process = new ProcessBuilder(job.command()).start();
        } catch (IOException | SecurityException e) {
            throw new CommandLaunchException(job, e);
        }

        try {
            closeStdin(process);
            final Future<String> stdout = streamReaders.submit(() -> readFully(process.getInputStream()));
            final Future<String> stderr = streamReaders.submit(() -> readFully(process.getErrorStream()));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(process);
                throw new CommandTimeoutException(job, timeout);
            }

            final int exitCode = process.exitValue();
            final String output = await(job, stdout);
            final String errors = await(job, stderr);
            logger.debug("Job {} exited with code {}, output: '{}'", job.id(), exitCode, output.strip());

            if (exitCode != 0) {
                throw new CommandExitException(job, exitCode, errors);
            }

            final CommandOutput commandOutput = classifier.classify(output);
            if (commandOutput instanceof CommandOutput.ParseFailure failure) {
                throw new OutputParseException(job, failure.raw());
            }
            return commandOutput.observations();
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }
    }

    /**
     * @param job the job
     * @return the time a run of the job may take
     */
    @NonNull
    public Duration timeoutOf(@NonNull Job job) {
        if (job.timeout() != null) {
            return job.timeout();
        }
        return defaultTimeout.isZero() ? job.interval() : defaultTimeout;
    }

    @Override
    public void close() {
        streamReaders.shutdown();
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Failed to close standard input of process {}", process.pid(), e);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String readFully(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String await(Job job, Future<String> stream) throws OutputParseException, InterruptedException {
        try {
            return stream.get();
        } catch (ExecutionException e) {
            throw new OutputParseException(job, "Failed to read output of command " + job.command(), e.getCause());
        }
    }
}
