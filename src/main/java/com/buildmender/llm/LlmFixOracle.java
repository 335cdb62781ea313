package com.buildmender.llm;

import com.buildmender.core.diagnostics.DiagnosticExcerpt;
import com.buildmender.core.proposal.FixResponseParser;
import com.buildmender.core.proposal.TargetFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * FixOracle backed by an LLM.
 *
 * Renders the repair prompt and runs the LLM call on a private worker thread
 * so it can be abandoned after {@code timeout}. A timed-out or interrupted
 * call is cancelled (its worker interrupted) before control returns.
 *
 * Owns that worker; close() when the sessions using this oracle are done.
 */
public class LlmFixOracle implements FixOracle, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmFixOracle.class);

    private final LLMClient         client;
    private final GenerationOptions options;
    private final Duration          timeout;
    private final ExecutorService   worker;

    public LlmFixOracle(LLMClient client, GenerationOptions options, Duration timeout) {
        this.client  = client;
        this.options = options;
        this.timeout = timeout;
        this.worker  = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "fix-oracle");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String propose(DiagnosticExcerpt diagnostic, Map<TargetFile, String> currentContents)
            throws OracleTimeoutException, OracleException, InterruptedException {

        String prompt = buildPrompt(diagnostic, currentContents);
        log.debug("[Oracle] promptLen={} {}", prompt.length(), options);

        Future<String> call = worker.submit(() -> client.generate(prompt, options));
        try {
            String response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Oracle] Response received ({} chars)", response != null ? response.length() : 0);
            log.debug("[Oracle] Response:\n{}", response);
            return response != null ? response : "";
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("[Oracle] No answer within {}; call cancelled", timeout);
            throw new OracleTimeoutException(timeout);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Oracle] LLM call failed: {}", cause.getMessage());
            throw new OracleException("LLM call failed: " + cause.getMessage(), cause);
        }
    }

    String buildPrompt(DiagnosticExcerpt diagnostic, Map<TargetFile, String> currentContents) {
        String properties = currentContents.getOrDefault(TargetFile.PROPERTIES_FILE, "");
        String buildScript = currentContents.getOrDefault(TargetFile.BUILD_SCRIPT, "");

        return """
                You are an expert Gradle build engineer.
                A Gradle build has failed with the following error:
                --- ERROR ---
                %s
                --- END ERROR ---

                Here is the current content of gradle.properties:
                --- GRADLE.PROPERTIES ---
                %s
                --- END GRADLE.PROPERTIES ---

                Here is the current content of build.gradle:
                --- BUILD.GRADLE ---
                %s
                --- END BUILD.GRADLE ---

                Identify the problem and provide one precise fix to ONE of the two files.
                To change an existing line, give a Match_Pattern (a Java regular expression
                matching exactly the text to replace) and the replacement as Fix_Content.
                To add new lines, omit Match_Pattern; Fix_Content is appended to the file.
                If you cannot fix it, answer Fix_Content: %s

                Response format (tags in this order, Fix_Content last):
                Observation: <what you observe in the error>
                Thought: <your reasoning>
                Error_Type: <short classification of the error>
                Target_File: <gradle.properties or build.gradle>
                Match_Pattern: <optional regex of the text to replace>
                Fix_Content: <the exact content, or %s>
                """.formatted(
                        diagnostic.getText(),
                        properties,
                        buildScript,
                        FixResponseParser.NO_FIX_SENTINEL,
                        FixResponseParser.NO_FIX_SENTINEL);
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
