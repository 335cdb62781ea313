package com.buildmender.core.state;

import com.buildmender.core.build.BuildResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one repair run over one project directory.
 *
 * Owned by a single RepairOrchestrator call and never shared or reused.
 * Enforces the session invariants:
 *   - attempts.size() never exceeds maxAttempts
 *   - the terminal state is assigned exactly once
 *   - attempt history is append-only
 */
public class RepairSession {

    private final Path projectPath;
    private final int  maxAttempts;
    private final long startedAt;

    private final List<AttemptRecord> attempts = new ArrayList<>();

    private RepairState   state = RepairState.INIT;
    private FailureReason failureReason;
    private String        failureDetail;
    private BuildResult   lastBuildResult;
    private int           buildRuns;
    private int           consecutiveTimeouts;
    private String        lastAppliedFix;

    public RepairSession(Path projectPath, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.projectPath = Objects.requireNonNull(projectPath, "projectPath");
        this.maxAttempts = maxAttempts;
        this.startedAt   = System.currentTimeMillis();
    }

    // ================================================================
    // Transitions
    // ================================================================

    public void transitionTo(RepairState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Session already terminal (" + state + "); cannot move to " + next);
        }
        if (next.isTerminal()) {
            throw new IllegalStateException("Use succeed/fail/exhaust for terminal state " + next);
        }
        state = next;
    }

    public void succeed() {
        terminate(RepairState.SUCCESS, null, null);
    }

    public void fail(FailureReason reason, String detail) {
        terminate(RepairState.FAILED, Objects.requireNonNull(reason, "reason"), detail);
    }

    public void exhaust() {
        terminate(RepairState.MAX_ATTEMPTS_EXHAUSTED, null,
                "Build still failing after " + attempts.size() + " attempts");
    }

    private void terminate(RepairState terminal, FailureReason reason, String detail) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Terminal state already assigned: " + state);
        }
        this.state         = terminal;
        this.failureReason = reason;
        this.failureDetail = detail;
    }

    // ================================================================
    // History
    // ================================================================

    public void recordBuild(BuildResult result) {
        this.lastBuildResult = Objects.requireNonNull(result, "result");
        this.buildRuns++;
        this.consecutiveTimeouts = result.isTimedOut() ? consecutiveTimeouts + 1 : 0;
    }

    public void recordAttempt(AttemptRecord attempt) {
        if (attempts.size() >= maxAttempts) {
            throw new IllegalStateException("Attempt cap reached (" + maxAttempts + ")");
        }
        if (attempt.getIndex() != attempts.size() + 1) {
            throw new IllegalStateException("Attempt index " + attempt.getIndex()
                    + " out of sequence; expected " + (attempts.size() + 1));
        }
        attempts.add(attempt);
    }

    public void recordAppliedFix(String description) {
        this.lastAppliedFix = description;
    }

    public boolean hasAttemptsLeft() {
        return attempts.size() < maxAttempts;
    }

    public int nextAttemptIndex() {
        return attempts.size() + 1;
    }

    // ================================================================
    // Accessors
    // ================================================================

    public Path                getProjectPath()         { return projectPath; }
    public int                 getMaxAttempts()         { return maxAttempts; }
    public long                getStartedAt()           { return startedAt; }
    public List<AttemptRecord> getAttempts()            { return Collections.unmodifiableList(attempts); }
    public RepairState         getState()               { return state; }
    public FailureReason       getFailureReason()       { return failureReason; }
    public String              getFailureDetail()       { return failureDetail; }
    public BuildResult         getLastBuildResult()     { return lastBuildResult; }
    public int                 getBuildRuns()           { return buildRuns; }
    public int                 getConsecutiveTimeouts() { return consecutiveTimeouts; }
    public String              getLastAppliedFix()      { return lastAppliedFix; }

    @Override
    public String toString() {
        return "RepairSession{project=" + projectPath + ", state=" + state
                + ", attempts=" + attempts.size() + "/" + maxAttempts + "}";
    }
}
