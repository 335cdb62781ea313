package com.buildmender.core.build;

/**
 * BuildResult - immutable outcome of one build tool invocation.
 *
 * Fields:
 *   - success: exit code 0 and not timed out
 *   - rawOutput: merged stdout/stderr, in the order the tool wrote it
 *   - exitCode: process exit code, -1 when killed on timeout
 *   - timedOut: the build was killed after exceeding its timeout
 *   - elapsedTimeMs: wall-clock time of the build
 */
public final class BuildResult {

    private final boolean success;
    private final String rawOutput;
    private final int exitCode;
    private final boolean timedOut;
    private final long elapsedTimeMs;

    public BuildResult(boolean success, String rawOutput, int exitCode, boolean timedOut, long elapsedTimeMs) {
        this.success = success;
        this.rawOutput = rawOutput != null ? rawOutput : "";
        this.exitCode = exitCode;
        this.timedOut = timedOut;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static BuildResult passed(String rawOutput) {
        return new BuildResult(true, rawOutput, 0, false, 0);
    }

    public static BuildResult failed(String rawOutput) {
        return new BuildResult(false, rawOutput, 1, false, 0);
    }

    public static BuildResult timedOut(String partialOutput, long elapsedTimeMs) {
        return new BuildResult(false, partialOutput, -1, true, elapsedTimeMs);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getRawOutput() {
        return rawOutput;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    @Override
    public String toString() {
        return String.format(
            "BuildResult{success=%b, exitCode=%d, timedOut=%b, outputLen=%d, elapsedMs=%d}",
            success,
            exitCode,
            timedOut,
            rawOutput.length(),
            elapsedTimeMs
        );
    }
}
