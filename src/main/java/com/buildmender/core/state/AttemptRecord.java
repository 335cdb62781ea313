package com.buildmender.core.state;

import com.buildmender.core.build.BuildResult;
import com.buildmender.core.diagnostics.DiagnosticExcerpt;
import com.buildmender.core.proposal.FixProposal;

import java.util.Objects;

/**
 * Immutable record of one loop iteration: the failed build, what the oracle
 * proposed for it, and whether the proposal changed a file.
 *
 * Appended to RepairSession by RepairOrchestrator only.
 */
public final class AttemptRecord {

    private final int               index;
    private final BuildResult       buildResult;
    private final DiagnosticExcerpt diagnostic;

    /** Null only when the oracle never answered (timeout or transport error). */
    private final FixProposal proposal;

    private final boolean applied;

    /** What the patch step did, or why it did not run. */
    private final String patchDetail;

    private AttemptRecord(Builder b) {
        this.index       = b.index;
        this.buildResult = Objects.requireNonNull(b.buildResult, "buildResult");
        this.diagnostic  = b.diagnostic;
        this.proposal    = b.proposal;
        this.applied     = b.applied;
        this.patchDetail = b.patchDetail;
    }

    public int               getIndex()       { return index; }
    public BuildResult       getBuildResult() { return buildResult; }
    public DiagnosticExcerpt getDiagnostic()  { return diagnostic; }
    public FixProposal       getProposal()    { return proposal; }
    public boolean           isApplied()      { return applied; }
    public String            getPatchDetail() { return patchDetail; }

    /**
     * Plain-text summary, one field per line.
     */
    public String toSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(index).append("\n");
        sb.append("  Build     : ").append(buildResult.isTimedOut() ? "TIMED OUT" : "exit " + buildResult.getExitCode()).append("\n");
        if (proposal != null) {
            sb.append("  Proposal  : ").append(proposal.describe()).append("\n");
            if (proposal.getErrorType() != null && !proposal.getErrorType().isBlank()) {
                sb.append("  Diagnosis : ").append(proposal.getErrorType()).append("\n");
            }
        } else {
            sb.append("  Proposal  : none (oracle did not answer)\n");
        }
        sb.append("  Applied   : ").append(applied).append("\n");
        if (patchDetail != null && !patchDetail.isBlank()) {
            sb.append("  Detail    : ").append(patchDetail).append("\n");
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int index, BuildResult buildResult) {
        return new Builder(index, buildResult);
    }

    public static final class Builder {
        private final int         index;
        private final BuildResult buildResult;
        private DiagnosticExcerpt diagnostic  = null;
        private FixProposal       proposal    = null;
        private boolean           applied     = false;
        private String            patchDetail = null;

        private Builder(int index, BuildResult buildResult) {
            this.index       = index;
            this.buildResult = buildResult;
        }

        public Builder diagnostic(DiagnosticExcerpt v) { this.diagnostic = v;  return this; }
        public Builder proposal(FixProposal v)         { this.proposal = v;    return this; }
        public Builder applied(boolean v)              { this.applied = v;     return this; }
        public Builder patchDetail(String v)           { this.patchDetail = v; return this; }

        public AttemptRecord build() { return new AttemptRecord(this); }
    }

    @Override
    public String toString() {
        return "AttemptRecord{#" + index + ", action="
                + (proposal != null ? proposal.getAction() : "none") + ", applied=" + applied + "}";
    }
}
