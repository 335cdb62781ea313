package com.buildmender.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response of POST /repair/update-and-build.
 *
 * finalBuildOutput is already cut to the transport bound.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RepairResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED  = "failed";

    private final String status;
    private final int attempts;
    private final String finalBuildOutput;
    private final String lastAppliedFix;
    private final String terminalState;
    private final String failureReason;

    public RepairResponse(
            String status,
            int attempts,
            String finalBuildOutput,
            String lastAppliedFix,
            String terminalState,
            String failureReason
    ) {
        this.status = status;
        this.attempts = attempts;
        this.finalBuildOutput = finalBuildOutput;
        this.lastAppliedFix = lastAppliedFix;
        this.terminalState = terminalState;
        this.failureReason = failureReason;
    }

    /** A request that failed before any repair session ran. */
    public static RepairResponse failedBeforeSession(String failureReason, String detail) {
        return new RepairResponse(STATUS_FAILED, 0, detail, null, "FAILED", failureReason);
    }

    public String getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getFinalBuildOutput() {
        return finalBuildOutput;
    }

    public String getLastAppliedFix() {
        return lastAppliedFix;
    }

    public String getTerminalState() {
        return terminalState;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
