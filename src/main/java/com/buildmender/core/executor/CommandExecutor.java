package com.buildmender.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with a bounded wait.
 *
 * stderr is merged into stdout at the OS level so the captured output keeps
 * the order the tool printed it in. Build tools interleave both streams and
 * the error extractor's block patterns ("* What went wrong:" ... "* Try:")
 * rely on that order.
 */
@Component
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private static final long READER_JOIN_MILLIS = 1000;

    /**
     * @throws IOException          the process could not be started at all
     * @throws InterruptedException the caller was interrupted; the process tree is killed first
     */
    public CommandResult execute(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, InterruptedException {

        long startTime = System.currentTimeMillis();
        log.info("[Executor] Executing in {}: {}", workingDirectory, String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDirectory.toFile());
        builder.redirectErrorStream(true);

        Process process = builder.start();

        StringBuffer output = new StringBuffer();
        Thread outThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                }
            } catch (IOException e) {
                log.warn("[Executor] Error reading output: {}", e.getMessage());
            }
        }, "command-output-" + process.pid());
        outThread.setDaemon(true);
        outThread.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("[Executor] Interrupted while waiting for pid {}; killing process tree", process.pid());
            destroyTree(process);
            throw e;
        }

        if (!finished) {
            destroyTree(process);
            outThread.join(READER_JOIN_MILLIS);
            long elapsed = System.currentTimeMillis() - startTime;
            log.warn("[Executor] Process timed out after {} ms", timeout.toMillis());
            return CommandResult.timedOut(output.toString(), elapsed);
        }

        outThread.join(READER_JOIN_MILLIS);

        String mergedOutput = output.toString();
        int exitCode = process.exitValue();
        long elapsed = System.currentTimeMillis() - startTime;

        log.info("[Executor] Exit code: {}, Output length: {} chars, elapsed {} ms",
                exitCode, mergedOutput.length(), elapsed);

        return new CommandResult(exitCode, mergedOutput, false, elapsed);
    }

    /**
     * Gradle leaves a daemon and worker JVMs behind, so descendants go first.
     */
    private void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.onExit().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Executor] Process {} did not exit after kill: {}", process.pid(), e.getMessage());
        }
    }
}
