package com.buildmender.core.executor;

/**
 * CommandResult - exit status and merged stdout/stderr of one external command.
 *
 * exitCode is -1 when the process was killed on timeout.
 */
public class CommandResult {

    private final int exitCode;
    private final String output;
    private final boolean timedOut;
    private final long elapsedTimeMs;

    public CommandResult(int exitCode, String output, boolean timedOut, long elapsedTimeMs) {
        this.exitCode = exitCode;
        this.output = output != null ? output : "";
        this.timedOut = timedOut;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static CommandResult timedOut(String partialOutput, long elapsedTimeMs) {
        return new CommandResult(-1, partialOutput, true, elapsedTimeMs);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    @Override
    public String toString() {
        return String.format(
            "CommandResult{exitCode=%d, outputLen=%d, timedOut=%b, elapsedMs=%d}",
            exitCode,
            output.length(),
            timedOut,
            elapsedTimeMs
        );
    }
}
