package com.buildmender.llm;

import com.buildmender.core.diagnostics.DiagnosticExcerpt;
import com.buildmender.core.proposal.TargetFile;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LlmFixOracleTest {

    private static final GenerationOptions OPTIONS = new GenerationOptions(0.7, 2048, 4096);

    private static final DiagnosticExcerpt DIAGNOSTIC = new DiagnosticExcerpt(
            "Could not resolve all dependencies for configuration ':app'", false);

    private static final Map<TargetFile, String> CONTENTS = Map.of(
            TargetFile.PROPERTIES_FILE, "guavaVersion=99.0\n",
            TargetFile.BUILD_SCRIPT, "implementation \"com.google.guava:guava:${guavaVersion}\"\n");

    @Test
    void testPromptCarriesDiagnosticAndFiles() throws Exception {
        AtomicReference<String> seenPrompt = new AtomicReference<>();
        AtomicReference<GenerationOptions> seenOptions = new AtomicReference<>();
        LLMClient client = (prompt, options) -> {
            seenPrompt.set(prompt);
            seenOptions.set(options);
            return "NO_FIX";
        };

        try (LlmFixOracle oracle = new LlmFixOracle(client, OPTIONS, Duration.ofSeconds(5))) {
            assertEquals("NO_FIX", oracle.propose(DIAGNOSTIC, CONTENTS));
        }

        String prompt = seenPrompt.get();
        assertTrue(prompt.contains("configuration ':app'"));
        assertTrue(prompt.contains("guavaVersion=99.0"));
        assertTrue(prompt.contains("com.google.guava:guava"));
        assertTrue(prompt.contains("Error_Type:"));
        assertTrue(prompt.contains("Target_File:"));
        assertTrue(prompt.contains("Match_Pattern:"));
        assertTrue(prompt.contains("Fix_Content:"));
        assertSame(OPTIONS, seenOptions.get());
    }

    @Test
    void testSlowClientTimesOutAndIsCancelled() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        LLMClient slow = (prompt, options) -> {
            try {
                Thread.sleep(30_000);
                return "too late";
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        };

        try (LlmFixOracle oracle = new LlmFixOracle(slow, OPTIONS, Duration.ofMillis(200))) {
            OracleTimeoutException e = assertThrows(OracleTimeoutException.class,
                    () -> oracle.propose(DIAGNOSTIC, CONTENTS));
            assertEquals(Duration.ofMillis(200), e.getTimeout());
            assertTrue(interrupted.await(5, TimeUnit.SECONDS), "timed-out call should be cancelled");
        }
    }

    @Test
    void testClientFailureBecomesOracleException() {
        LLMClient failing = (prompt, options) -> {
            throw new IllegalStateException("Ollama LLM call failed: connection refused");
        };

        try (LlmFixOracle oracle = new LlmFixOracle(failing, OPTIONS, Duration.ofSeconds(5))) {
            OracleException e = assertThrows(OracleException.class,
                    () -> oracle.propose(DIAGNOSTIC, CONTENTS));
            assertTrue(e.getMessage().contains("connection refused"));
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    void testNullResponseBecomesEmpty() throws Exception {
        try (LlmFixOracle oracle = new LlmFixOracle((p, o) -> null, OPTIONS, Duration.ofSeconds(5))) {
            assertEquals("", oracle.propose(DIAGNOSTIC, CONTENTS));
        }
    }
}
