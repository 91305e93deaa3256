// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.cmdmetrics.exporter.job.Job;

/**
 * The command exited with a non-zero status.
 */
public class CommandExitException extends CommandExecutionException {

    private final int exitCode;
    private final String stderr;

    public CommandExitException(Job job, int exitCode, @NonNull String stderr) {
        super(job, "Command " + job.command() + " exited with code " + exitCode + ": '" + stderr.strip() + "'");
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * @return the captured standard error output
     */
    @NonNull
    public String getStderr() {
        return stderr;
    }
}
