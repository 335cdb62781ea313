package com.buildmender.source;

import com.buildmender.config.BuildMenderProperties;
import com.buildmender.core.executor.CommandExecutor;
import com.buildmender.core.executor.CommandResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * SourceFetcher backed by the git command line.
 *
 *   absent or empty directory  → git clone
 *   existing checkout          → git reset --hard + git clean -fdx, so no edit
 *                                from an earlier session survives; then
 *                                git pull --ff-only when
 *                                buildmender.source.update-existing=true
 *   anything else              → SourceFetchException
 *
 * The URL always follows "--" so it can never be read as a git option.
 */
@Component
public class GitSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitSourceFetcher.class);

    private final CommandExecutor executor;
    private final BuildMenderProperties.Source settings;

    public GitSourceFetcher(CommandExecutor executor, BuildMenderProperties properties) {
        this.executor = executor;
        this.settings = properties.getSource();
    }

    @Override
    public void ensurePresent(String projectUrl, Path projectDir) throws SourceFetchException, InterruptedException {

        if (projectUrl == null || projectUrl.isBlank() || projectUrl.trim().startsWith("-")) {
            throw new SourceFetchException("Refusing project URL: " + projectUrl);
        }

        if (isAbsentOrEmpty(projectDir)) {
            log.info("[Git] Cloning {} into {}", projectUrl, projectDir);
            Path parent = projectDir.toAbsolutePath().getParent();
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new SourceFetchException("Could not create " + parent, e);
            }
            run(List.of(settings.getGitCommand(), "clone", "--", projectUrl.trim(), projectDir.toAbsolutePath().toString()),
                    parent, "clone " + projectUrl);
            return;
        }

        if (!Files.isDirectory(projectDir.resolve(".git"))) {
            throw new SourceFetchException(projectDir + " exists but is not a git checkout");
        }

        log.info("[Git] Restoring clean checkout {}", projectDir);
        run(List.of(settings.getGitCommand(), "reset", "--hard"), projectDir, "reset in " + projectDir);
        run(List.of(settings.getGitCommand(), "clean", "-fdx"), projectDir, "clean in " + projectDir);

        if (settings.isUpdateExisting()) {
            log.info("[Git] Updating existing checkout {}", projectDir);
            run(List.of(settings.getGitCommand(), "pull", "--ff-only"), projectDir, "pull in " + projectDir);
        }
    }

    private void run(List<String> command, Path workingDir, String what)
            throws SourceFetchException, InterruptedException {

        CommandResult result;
        try {
            result = executor.execute(command, workingDir, settings.getTimeout());
        } catch (IOException e) {
            throw new SourceFetchException("Could not start git for " + what + ": " + e.getMessage(), e);
        }

        if (result.isTimedOut()) {
            throw new SourceFetchException("git " + what + " timed out after " + settings.getTimeout());
        }
        if (!result.isSuccess()) {
            log.warn("[Git] {} failed (exit {}):\n{}", what, result.getExitCode(), result.getOutput());
            throw new SourceFetchException("git " + what + " failed with exit code " + result.getExitCode());
        }
    }

    private boolean isAbsentOrEmpty(Path dir) throws SourceFetchException {
        if (!Files.exists(dir)) {
            return true;
        }
        if (!Files.isDirectory(dir)) {
            throw new SourceFetchException(dir + " exists and is not a directory");
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            throw new SourceFetchException("Could not list " + dir, e);
        }
    }
}
