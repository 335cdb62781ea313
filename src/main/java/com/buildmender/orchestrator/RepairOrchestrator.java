package com.buildmender.orchestrator;

import com.buildmender.config.BuildMenderProperties;
import com.buildmender.core.build.BuildInvocationException;
import com.buildmender.core.build.BuildResult;
import com.buildmender.core.build.BuildRunner;
import com.buildmender.core.diagnostics.DiagnosticExcerpt;
import com.buildmender.core.diagnostics.ErrorExtractor;
import com.buildmender.core.filesystem.FileSystemManager;
import com.buildmender.core.filesystem.FileSystemManager.FileSystemException;
import com.buildmender.core.patch.PatchApplier;
import com.buildmender.core.patch.PatchResult;
import com.buildmender.core.patch.PatchWriteException;
import com.buildmender.core.proposal.FixProposal;
import com.buildmender.core.proposal.FixResponseParser;
import com.buildmender.core.proposal.TargetFile;
import com.buildmender.core.state.AttemptRecord;
import com.buildmender.core.state.FailureReason;
import com.buildmender.core.state.RepairSession;
import com.buildmender.core.state.RepairState;
import com.buildmender.llm.FixOracle;
import com.buildmender.llm.OracleException;
import com.buildmender.llm.OracleTimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RepairOrchestrator - drives one build repair session.
 *
 * Cycle:  RUNNING → AWAITING_ORACLE → APPLYING → RUNNING ...
 *
 * Each failed build that reaches the oracle produces exactly one AttemptRecord.
 * After the last permitted attempt the build is re-run once to verify; if it
 * still fails the session ends MAX_ATTEMPTS_EXHAUSTED.
 *
 * The oracle is passed in per call; this bean holds no per-session state and
 * may serve concurrent sessions on different directories. Callers serialize
 * sessions on the same directory (see ProjectLockRegistry).
 */
@Component
public class RepairOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RepairOrchestrator.class);

    private final BuildRunner       buildRunner;
    private final ErrorExtractor    errorExtractor;
    private final FixResponseParser responseParser;
    private final PatchApplier      patchApplier;
    private final FileSystemManager fileSystemManager;
    private final BuildMenderProperties.Repair settings;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public RepairOrchestrator(
            BuildRunner           buildRunner,
            ErrorExtractor        errorExtractor,
            FixResponseParser     responseParser,
            PatchApplier          patchApplier,
            FileSystemManager     fileSystemManager,
            BuildMenderProperties properties
    ) {
        this.buildRunner       = buildRunner;
        this.errorExtractor    = errorExtractor;
        this.responseParser    = responseParser;
        this.patchApplier      = patchApplier;
        this.fileSystemManager = fileSystemManager;
        this.settings          = properties.getRepair();
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public RepairOutcome repair(Path projectDir, FixOracle oracle) {

        log.info("========== REPAIR SESSION START: {} ==========", projectDir);

        RepairSession session = new RepairSession(projectDir, settings.getMaxAttempts());
        Duration buildTimeout = settings.getBuildTimeout();

        try {
            while (!session.getState().isTerminal()) {
                runCycle(session, oracle, buildTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Orchestrator] Session interrupted in state {}", session.getState());
            session.fail(FailureReason.CANCELLED, "Interrupted in state " + session.getState());
        }

        RepairOutcome outcome = RepairOutcome.of(session);
        if (log.isDebugEnabled()) {
            outcome.getAttempts().forEach(a -> log.debug("[Orchestrator] {}", a.toSummary()));
        }
        logSummary(outcome);
        log.info("========== REPAIR SESSION END: {} ==========", outcome);
        return outcome;
    }

    // =========================================================================
    // ONE CYCLE: build, then (on failure) oracle + patch
    // =========================================================================

    private void runCycle(RepairSession session, FixOracle oracle, Duration buildTimeout)
            throws InterruptedException {

        Path projectDir = session.getProjectPath();

        // ---------------------------------------------------------------------
        // RUNNING
        // ---------------------------------------------------------------------
        session.transitionTo(RepairState.RUNNING);

        BuildResult build;
        try {
            build = buildRunner.run(projectDir, buildTimeout);
        } catch (BuildInvocationException e) {
            log.error("[Orchestrator] Build could not be invoked: {}", e.getMessage(), e);
            session.fail(FailureReason.BUILD_INVOCATION, e.getMessage());
            return;
        }
        session.recordBuild(build);
        log.info("[Orchestrator] Build #{} -> {}", session.getBuildRuns(), build);

        if (build.isSuccess()) {
            log.info("[Orchestrator] Build passed after {} attempt(s)", session.getAttempts().size());
            session.succeed();
            return;
        }

        int timeoutLimit = settings.getMaxConsecutiveBuildTimeouts();
        if (timeoutLimit > 0 && session.getConsecutiveTimeouts() >= timeoutLimit) {
            log.error("[Orchestrator] Build timed out {} times in a row. Aborting.", session.getConsecutiveTimeouts());
            session.fail(FailureReason.BUILD_TIMEOUT,
                    "Build timed out on " + session.getConsecutiveTimeouts() + " consecutive runs");
            return;
        }

        if (!session.hasAttemptsLeft()) {
            log.warn("[Orchestrator] Build still failing after {} attempts", session.getMaxAttempts());
            session.exhaust();
            return;
        }

        // ---------------------------------------------------------------------
        // AWAITING_ORACLE
        // ---------------------------------------------------------------------
        session.transitionTo(RepairState.AWAITING_ORACLE);

        int index = session.nextAttemptIndex();
        DiagnosticExcerpt diagnostic = errorExtractor.extract(build.getRawOutput());
        AttemptRecord.Builder attempt = AttemptRecord.builder(index, build).diagnostic(diagnostic);

        log.info("[Orchestrator] Attempt {}/{}: consulting oracle ({} chars of diagnostic)",
                index, session.getMaxAttempts(), diagnostic.getText().length());

        Map<TargetFile, String> contents;
        try {
            contents = readCurrentContents(projectDir);
        } catch (FileSystemException e) {
            log.error("[Orchestrator] Could not read configuration files: {}", e.getMessage(), e);
            session.recordAttempt(attempt.build());
            session.fail(FailureReason.APPLY_FAILED, "Could not read configuration files: " + e.getMessage());
            return;
        }

        String rawResponse;
        try {
            rawResponse = oracle.propose(diagnostic, contents);
        } catch (OracleTimeoutException e) {
            log.warn("[Orchestrator] {}", e.getMessage());
            session.recordAttempt(attempt.build());
            session.fail(FailureReason.ORACLE_TIMEOUT, e.getMessage());
            return;
        } catch (OracleException e) {
            log.error("[Orchestrator] Oracle failed: {}", e.getMessage(), e);
            session.recordAttempt(attempt.build());
            session.fail(FailureReason.ORACLE_ERROR, e.getMessage());
            return;
        }

        FixProposal proposal = responseParser.parse(rawResponse);
        attempt.proposal(proposal);

        switch (proposal.getAction()) {
            case NO_FIX -> {
                log.info("[Orchestrator] Oracle has no fix (errorType={})", proposal.getErrorType());
                session.recordAttempt(attempt.applied(false).build());
                session.fail(FailureReason.NO_FIX, "Oracle proposed no fix");
            }
            case INVALID -> {
                session.recordAttempt(attempt.applied(false).build());
                session.fail(FailureReason.UNPARSABLE, proposal.getInvalidReason());
            }
            case APPEND, REPLACE_MATCH -> applyProposal(session, attempt, proposal);
        }
    }

    // =========================================================================
    // APPLYING
    // =========================================================================

    private void applyProposal(RepairSession session, AttemptRecord.Builder attempt, FixProposal proposal) {

        session.transitionTo(RepairState.APPLYING);

        PatchResult result;
        try {
            result = patchApplier.apply(proposal, session.getProjectPath());
        } catch (PatchWriteException e) {
            log.error("[Orchestrator] Patch failed: {}", e.getMessage(), e);
            session.recordAttempt(attempt.applied(false).patchDetail(e.getMessage()).build());
            session.fail(FailureReason.APPLY_FAILED, e.getMessage());
            return;
        }

        session.recordAttempt(attempt.applied(result.isApplied()).patchDetail(result.getDetail()).build());

        if (result.isApplied()) {
            session.recordAppliedFix(proposal.describe());
            log.info("[Orchestrator] Applied: {}", proposal.describe());
        } else {
            log.warn("[Orchestrator] Patch not applicable: {}", result.getDetail());
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private Map<TargetFile, String> readCurrentContents(Path projectDir) throws FileSystemException {
        Map<TargetFile, String> contents = new EnumMap<>(TargetFile.class);
        for (TargetFile target : new TargetFile[] {TargetFile.PROPERTIES_FILE, TargetFile.BUILD_SCRIPT}) {
            contents.put(target, fileSystemManager.readIfExists(projectDir, target.relativePath(projectDir)));
        }
        return contents;
    }

    private void logSummary(RepairOutcome outcome) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("project",        outcome.getProjectPath().toString());
        summary.put("state",          outcome.getState().name());
        summary.put("reason",         outcome.getFailureReason() != null ? outcome.getFailureReason().getLabel() : null);
        summary.put("attempts",       outcome.getAttempts().size());
        summary.put("buildRuns",      outcome.getBuildRuns());
        summary.put("lastAppliedFix", outcome.getLastAppliedFix());
        summary.put("wallTimeMs",     outcome.getElapsedTimeMs());

        try {
            log.info("[Summary] {}", objectMapper.writeValueAsString(summary));
        } catch (JsonProcessingException e) {
            log.warn("[Summary] Could not serialize summary {}: {}", summary, e.getMessage());
        }
    }
}
