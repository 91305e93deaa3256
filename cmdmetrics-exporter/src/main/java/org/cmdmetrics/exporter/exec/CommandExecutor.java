// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import org.cmdmetrics.exporter.job.Job;

/**
 * Runs the command of a job to completion and turns its output into observations.
 */
public interface CommandExecutor {

    /**
     * Runs the command of the given job once.
     *
     * @param job the job to run
     * @return the observations of the run, empty if the output is an empty JSON object
     * @throws CommandLaunchException  if the command cannot be started
     * @throws CommandExitException    if the command exits with a non-zero status
     * @throws OutputParseException    if the output has no supported shape
     * @throws CommandTimeoutException if the command does not finish in time
     * @throws InterruptedException    if the calling thread is interrupted while waiting for the command
     */
    @NonNull
    List<Observation> execute(@NonNull Job job) throws CommandExecutionException, InterruptedException;
}
