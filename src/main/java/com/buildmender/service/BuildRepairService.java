package com.buildmender.service;

import com.buildmender.config.BuildMenderProperties;
import com.buildmender.core.build.BuildResult;
import com.buildmender.core.filesystem.FileSystemManager;
import com.buildmender.core.filesystem.FileSystemManager.FileSystemException;
import com.buildmender.core.patch.PatchWriteException;
import com.buildmender.core.patch.PropertyFileUpdater;
import com.buildmender.core.state.FailureReason;
import com.buildmender.llm.FixOracleFactory;
import com.buildmender.llm.LlmFixOracle;
import com.buildmender.orchestrator.ProjectLockRegistry;
import com.buildmender.orchestrator.RepairOrchestrator;
import com.buildmender.orchestrator.RepairOutcome;
import com.buildmender.source.SourceFetchException;
import com.buildmender.source.SourceFetcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Update-and-build request flow:
 *
 *   lock project dir → fetch sources → pin dependency in gradle.properties
 *   → repair session → response
 *
 * The directory lock is held for the whole request.
 */
@Service
public class BuildRepairService {

    private static final Logger log = LoggerFactory.getLogger(BuildRepairService.class);

    private final FileSystemManager   fileSystemManager;
    private final ProjectLockRegistry lockRegistry;
    private final SourceFetcher       sourceFetcher;
    private final PropertyFileUpdater propertyFileUpdater;
    private final RepairOrchestrator  orchestrator;
    private final FixOracleFactory    oracleFactory;
    private final int                 maxOutputChars;

    public BuildRepairService(
            FileSystemManager     fileSystemManager,
            ProjectLockRegistry   lockRegistry,
            SourceFetcher         sourceFetcher,
            PropertyFileUpdater   propertyFileUpdater,
            RepairOrchestrator    orchestrator,
            FixOracleFactory      oracleFactory,
            BuildMenderProperties properties
    ) {
        this.fileSystemManager   = fileSystemManager;
        this.lockRegistry        = lockRegistry;
        this.sourceFetcher       = sourceFetcher;
        this.propertyFileUpdater = propertyFileUpdater;
        this.orchestrator        = orchestrator;
        this.oracleFactory       = oracleFactory;
        this.maxOutputChars      = properties.getHttp().getMaxOutputChars();
    }

    /**
     * @throws IllegalArgumentException the URL does not name a usable project directory
     * @throws SourceFetchException     the sources could not be fetched
     */
    public RepairResponse updateAndBuild(RepairRequest request) throws SourceFetchException {

        log.info("[Service] {}", request);

        Path projectDir;
        try {
            projectDir = fileSystemManager.resolveProjectDirectory(projectNameOf(request.getProjectUrl()));
        } catch (FileSystemException e) {
            throw new IllegalArgumentException("Unusable project URL: " + request.getProjectUrl(), e);
        }

        try (ProjectLockRegistry.Guard guard = lockRegistry.acquire(projectDir)) {

            sourceFetcher.ensurePresent(request.getProjectUrl(), projectDir);

            propertyFileUpdater.setProperty(projectDir, request.getDependencyName(), request.getDependencyValue());

            RepairOutcome outcome;
            try (LlmFixOracle oracle = oracleFactory.create()) {
                outcome = orchestrator.repair(projectDir, oracle);
            }
            return toResponse(outcome);

        } catch (PatchWriteException e) {
            log.error("[Service] Could not set {} in {}: {}", request.getDependencyName(), projectDir, e.getMessage(), e);
            return RepairResponse.failedBeforeSession(FailureReason.APPLY_FAILED.getLabel(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Service] Interrupted while handling {}", projectDir);
            return RepairResponse.failedBeforeSession(FailureReason.CANCELLED.getLabel(), "Request interrupted");
        }
    }

    RepairResponse toResponse(RepairOutcome outcome) {
        BuildResult last = outcome.getLastBuildResult();
        String output = last != null ? last.getRawOutput() : outcome.getDetail();

        return new RepairResponse(
                outcome.isSuccess() ? RepairResponse.STATUS_SUCCESS : RepairResponse.STATUS_FAILED,
                outcome.getAttempts().size(),
                tail(output, maxOutputChars),
                outcome.getLastAppliedFix(),
                outcome.getState().name(),
                outcome.getFailureReason() != null ? outcome.getFailureReason().getLabel() : null);
    }

    /**
     * Last path segment of the URL, without a trailing ".git".
     */
    static String projectNameOf(String projectUrl) {
        String trimmed = projectUrl.trim();
        if (trimmed.startsWith("-")) {
            throw new IllegalArgumentException("Project URL must not start with '-': " + projectUrl);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        String name = trimmed.substring(slash + 1);
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - ".git".length());
        }
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Cannot derive a project name from " + projectUrl);
        }
        return name;
    }

    static String tail(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }
}
