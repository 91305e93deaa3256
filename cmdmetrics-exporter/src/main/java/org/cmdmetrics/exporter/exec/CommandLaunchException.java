// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import org.cmdmetrics.exporter.job.Job;

/**
 * The command could not be started, e.g. the program does not exist or is not executable.
 */
public class CommandLaunchException extends CommandExecutionException {

    public CommandLaunchException(Job job, Throwable cause) {
        super(job, "Failed to launch command " + job.command() + ": " + cause.getMessage(), cause);
    }
}
