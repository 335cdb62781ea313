package com.buildmender.core.diagnostics;

import com.buildmender.config.BuildMenderProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ErrorExtractor - reduces raw Gradle output to a bounded diagnostic excerpt.
 *
 * Heuristics, in order of precedence:
 *
 * 1. "FAILURE: Build failed with an exception." marker
 * 2. "* What went wrong:" block, up to "* Try:"
 * 3. "Could not resolve all dependencies for configuration ':x'"
 * 4. "Execution failed for task ':x:y'"
 * 5. "Caused by:" blocks, up to a blank line
 * 6. generic "Error:" blocks, up to a blank line
 *
 * Every match of a heuristic is collected before the next one is tried.
 * Collection stops as soon as the excerpt reaches the character budget, so the
 * excerpt never exceeds budget + the longest single match.
 *
 * Nothing matched → the last N lines of the output.
 */
@Component
public class ErrorExtractor {

    private static final Logger log = LoggerFactory.getLogger(ErrorExtractor.class);

    public static final int DEFAULT_BUDGET = 1500;
    public static final int DEFAULT_TAIL_LINES = 50;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final List<Heuristic> HEURISTICS = List.of(
        new Heuristic("build-failed",
            Pattern.compile("FAILURE: Build failed with an exception\\.", FLAGS), 0),
        // Block body only; the "* What went wrong:" header carries no signal
        new Heuristic("what-went-wrong",
            Pattern.compile("\\* What went wrong:(.*?)\\* Try:", FLAGS), 1),
        // Whole match so the configuration id keeps its leading ':'
        new Heuristic("unresolved-dependencies",
            Pattern.compile("Could not resolve all dependencies for configuration '[^'\\n]*'", FLAGS), 0),
        new Heuristic("task-failed",
            Pattern.compile("Execution failed for task '[^'\\n]*'", FLAGS), 0),
        new Heuristic("caused-by",
            Pattern.compile("Caused by:.*?(?:\\r?\\n\\r?\\n|\\z)", FLAGS), 0),
        new Heuristic("error-line",
            Pattern.compile("Error:.*?(?:\\r?\\n\\r?\\n|\\z)", FLAGS), 0)
    );

    private final int budget;
    private final int tailLines;

    @Autowired
    public ErrorExtractor(BuildMenderProperties properties) {
        this(properties.getRepair().getExcerptBudget(), properties.getRepair().getExcerptTailLines());
    }

    public ErrorExtractor(int budget, int tailLines) {
        if (budget <= 0) {
            throw new IllegalArgumentException("Excerpt budget must be positive: " + budget);
        }
        if (tailLines <= 0) {
            throw new IllegalArgumentException("Tail line count must be positive: " + tailLines);
        }
        this.budget = budget;
        this.tailLines = tailLines;
    }

    public DiagnosticExcerpt extract(String rawOutput) {

        String output = rawOutput != null ? rawOutput : "";
        log.info("[Extractor] Analyzing {} chars of build output", output.length());

        Set<String> collected = new LinkedHashSet<>();
        int length = 0;

        heuristics:
        for (Heuristic heuristic : HEURISTICS) {
            Matcher matcher = heuristic.pattern.matcher(output);
            while (matcher.find()) {
                if (length >= budget) {
                    break heuristics;
                }
                String group = matcher.group(heuristic.group);
                String match = group != null ? group.trim() : "";
                if (match.isEmpty() || !collected.add(match)) {
                    continue;
                }
                length += (collected.size() > 1 ? 1 : 0) + match.length();
                log.debug("[Extractor] {} matched {} chars", heuristic.name, match.length());
            }
        }

        if (!collected.isEmpty()) {
            String text = String.join("\n", collected);
            log.info("[Extractor] Excerpt of {} chars from {} matches", text.length(), collected.size());
            return new DiagnosticExcerpt(text, false);
        }

        String tail = tail(output);
        log.info("[Extractor] No heuristic matched; using last {} lines ({} chars)", tailLines, tail.length());
        return new DiagnosticExcerpt(tail, true);
    }

    private String tail(String output) {
        String[] lines = output.split("\\R", -1);
        int count = lines.length;
        // A trailing newline produces one empty element that is not a line
        if (count > 0 && lines[count - 1].isEmpty()) {
            count--;
        }
        if (count <= tailLines) {
            return output;
        }
        return String.join("\n", Arrays.asList(lines).subList(count - tailLines, count));
    }

    private static final class Heuristic {
        private final String name;
        private final Pattern pattern;
        private final int group;

        private Heuristic(String name, Pattern pattern, int group) {
            this.name = name;
            this.pattern = pattern;
            this.group = group;
        }
    }
}
