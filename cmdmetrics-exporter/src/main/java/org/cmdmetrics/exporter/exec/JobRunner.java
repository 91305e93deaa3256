// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cmdmetrics.core.LabelMismatchException;
import org.cmdmetrics.core.LabelResolver;
import org.cmdmetrics.core.MetricRegistry;
import org.cmdmetrics.exporter.job.Job;

/**
 * Performs one run of a job: executes its command and records the observations in the registry.
 * <p>
 * A failed run leaves the previously recorded values in place and increments the counter
 * {@code <metric>_errors_total} of the job, labelled like a {@value LabelResolver#MAIN_COMPONENT} observation.
 * An observation whose labels do not match the registered metric is logged and dropped, other observations
 * of the same run are still recorded.
 */
public class JobRunner {

    private static final Logger logger = LogManager.getLogger(JobRunner.class);

    private final CommandExecutor executor;
    private final MetricRegistry registry;

    public JobRunner(@NonNull CommandExecutor executor, @NonNull MetricRegistry registry) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Runs the job once. Never throws for failures of the command.
     *
     * @param job the job to run
     */
    public void run(@NonNull Job job) {
        final List<Observation> observations;
        try {
            observations = executor.execute(job);
        } catch (CommandExitException e) {
            logger.warn(
                    "Job {}: command {} returned error. exitCode={}, stderr='{}'",
                    job.id(),
                    job.command(),
                    e.getExitCode(),
                    e.getStderr().strip());
            recordError(job);
            return;
        } catch (CommandExecutionException e) {
            logger.warn("Job {}: {}", job.id(), e.getMessage());
            recordError(job);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Job {} interrupted", job.id());
            return;
        }

        if (observations.isEmpty()) {
            logger.debug("Job {} produced no observations", job.id());
        }
        for (Observation observation : observations) {
            try {
                registry.observe(
                        job.metricName(),
                        job.help(),
                        job.type(),
                        job.resolveLabels(observation.component()),
                        observation.value());
            } catch (LabelMismatchException e) {
                logger.error("Job {}: invalid combination of metric and labels. {}", job.id(), e.getMessage());
            }
        }
    }

    private void recordError(Job job) {
        try {
            registry.increment(
                    job.errorsMetricName(), job.help(), job.resolveLabels(LabelResolver.MAIN_COMPONENT), 1);
        } catch (LabelMismatchException e) {
            logger.error("Job {}: cannot count error. {}", job.id(), e.getMessage());
        }
    }
}
