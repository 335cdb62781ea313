package com.buildmender.core.build;

import com.buildmender.config.BuildMenderProperties;
import com.buildmender.core.executor.CommandExecutor;
import com.buildmender.core.executor.CommandResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs Gradle against a project directory.
 *
 * Entry point resolution, in order:
 *   1. the project's own wrapper (./gradlew, gradlew.bat on Windows)
 *   2. the global command (gradle) if it can be found on PATH
 * Neither present → BuildInvocationException.
 */
@Component
public class GradleBuildRunner implements BuildRunner {

    private static final Logger log = LoggerFactory.getLogger(GradleBuildRunner.class);

    private static final boolean WINDOWS =
            System.getProperty("os.name", "").toLowerCase().contains("win");

    private final CommandExecutor executor;
    private final BuildMenderProperties.Build settings;

    public GradleBuildRunner(CommandExecutor executor, BuildMenderProperties properties) {
        this.executor = executor;
        this.settings = properties.getBuild();
    }

    @Override
    public BuildResult run(Path projectRoot, Duration timeout)
            throws BuildInvocationException, InterruptedException {

        if (!Files.isDirectory(projectRoot)) {
            throw new BuildInvocationException("Project directory does not exist: " + projectRoot);
        }

        List<String> command = new ArrayList<>();
        command.add(resolveEntryPoint(projectRoot));
        command.addAll(settings.getArguments());

        CommandResult result;
        try {
            result = executor.execute(command, projectRoot, timeout);
        } catch (IOException e) {
            log.error("[BuildRunner] Failed to start {}: {}", command.get(0), e.getMessage());
            throw new BuildInvocationException("Failed to start build tool: " + command.get(0), e);
        }

        if (result.isTimedOut()) {
            log.warn("[BuildRunner] Build timed out after {} in {}", timeout, projectRoot);
            return BuildResult.timedOut(result.getOutput(), result.getElapsedTimeMs());
        }

        BuildResult buildResult = new BuildResult(
                result.isSuccess(),
                result.getOutput(),
                result.getExitCode(),
                false,
                result.getElapsedTimeMs()
        );
        log.info("[BuildRunner] {}", buildResult);
        return buildResult;
    }

    String resolveEntryPoint(Path projectRoot) throws BuildInvocationException {
        String wrapperName = WINDOWS ? settings.getWrapperName() + ".bat" : settings.getWrapperName();
        Path wrapper = projectRoot.resolve(wrapperName);

        if (Files.isRegularFile(wrapper)) {
            if (!WINDOWS && !Files.isExecutable(wrapper) && !wrapper.toFile().setExecutable(true)) {
                throw new BuildInvocationException("Build wrapper is not executable: " + wrapper);
            }
            log.info("[BuildRunner] Using project wrapper {}", wrapper);
            return wrapper.toAbsolutePath().toString();
        }

        String global = settings.getGlobalCommand();
        if (global != null && !global.isBlank() && isOnPath(global)) {
            log.info("[BuildRunner] No wrapper in {}; using global '{}'", projectRoot, global);
            return global;
        }

        throw new BuildInvocationException(
                "No build entry point: neither " + wrapperName + " in " + projectRoot
                        + " nor '" + global + "' on PATH");
    }

    private boolean isOnPath(String command) {
        Path direct = Path.of(command);
        if (direct.isAbsolute()) {
            return Files.isExecutable(direct);
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir).resolve(WINDOWS ? command + ".bat" : command);
            if (Files.isExecutable(candidate)) {
                return true;
            }
        }
        return false;
    }
}
