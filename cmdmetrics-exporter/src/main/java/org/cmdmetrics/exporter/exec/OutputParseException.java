// SPDX-License-Identifier: Apache-2.0
package org.cmdmetrics.exporter.exec;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.cmdmetrics.exporter.job.Job;

/**
 * The command succeeded but its output is neither a number nor a JSON object of numbers.
 */
public class OutputParseException extends CommandExecutionException {

    private final String output;

    public OutputParseException(Job job, @NonNull String output) {
        super(job, "Command " + job.command() + " returned unsupported output: '" + output + "'");
        this.output = output;
    }

    public OutputParseException(Job job, @NonNull String message, Throwable cause) {
        super(job, message, cause);
        this.output = "";
    }

    /**
     * @return the trimmed standard output
     */
    @NonNull
    public String getOutput() {
        return output;
    }
}
