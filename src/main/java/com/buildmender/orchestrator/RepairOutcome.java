package com.buildmender.orchestrator;

import com.buildmender.core.build.BuildResult;
import com.buildmender.core.state.AttemptRecord;
import com.buildmender.core.state.FailureReason;
import com.buildmender.core.state.RepairSession;
import com.buildmender.core.state.RepairState;

import java.nio.file.Path;
import java.util.List;

/**
 * Terminal result of one repair session. Immutable snapshot of the session
 * taken once its terminal state is assigned.
 */
public final class RepairOutcome {

    private final Path                projectPath;
    private final RepairState         state;
    private final FailureReason       failureReason;
    private final String              detail;
    private final List<AttemptRecord> attempts;
    private final BuildResult         lastBuildResult;
    private final int                 buildRuns;
    private final String              lastAppliedFix;
    private final long                elapsedTimeMs;

    private RepairOutcome(RepairSession session, long elapsedTimeMs) {
        this.projectPath     = session.getProjectPath();
        this.state           = session.getState();
        this.failureReason   = session.getFailureReason();
        this.detail          = session.getFailureDetail();
        this.attempts        = List.copyOf(session.getAttempts());
        this.lastBuildResult = session.getLastBuildResult();
        this.buildRuns       = session.getBuildRuns();
        this.lastAppliedFix  = session.getLastAppliedFix();
        this.elapsedTimeMs   = elapsedTimeMs;
    }

    static RepairOutcome of(RepairSession session) {
        if (!session.getState().isTerminal()) {
            throw new IllegalStateException("Session not terminal: " + session.getState());
        }
        return new RepairOutcome(session, System.currentTimeMillis() - session.getStartedAt());
    }

    public boolean isSuccess() {
        return state == RepairState.SUCCESS;
    }

    public Path                getProjectPath()     { return projectPath; }
    public RepairState         getState()           { return state; }
    /** null unless state is FAILED */
    public FailureReason       getFailureReason()   { return failureReason; }
    public String              getDetail()          { return detail; }
    public List<AttemptRecord> getAttempts()        { return attempts; }
    /** null only if no build ever ran */
    public BuildResult         getLastBuildResult() { return lastBuildResult; }
    public int                 getBuildRuns()       { return buildRuns; }
    public String              getLastAppliedFix()  { return lastAppliedFix; }
    public long                getElapsedTimeMs()   { return elapsedTimeMs; }

    @Override
    public String toString() {
        return "RepairOutcome{state=" + state
                + (failureReason != null ? "(" + failureReason + ")" : "")
                + ", attempts=" + attempts.size()
                + ", buildRuns=" + buildRuns + "}";
    }
}
