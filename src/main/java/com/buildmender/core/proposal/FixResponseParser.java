package com.buildmender.core.proposal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * FixResponseParser - the only place an oracle response is turned into a
 * FixProposal.
 *
 * Expected response (free-form Observation/Thought lines may precede it):
 *
 *   Error_Type: <classification>
 *   Target_File: gradle.properties | build.gradle
 *   Match_Pattern: <regex>              optional, selects REPLACE_MATCH
 *   Fix_Content: <exact content>        runs to the end of the response
 *
 * Rules:
 *   - Fix_Content whose first line is NO_FIX (trailing punctuation and quotes
 *     ignored), or a response that starts with NO_FIX → NO_FIX, whatever the
 *     other tags say
 *   - Error_Type, Target_File, Fix_Content must all be present, in that order;
 *     Match_Pattern, when present, sits between Target_File and Fix_Content
 *   - anything else → INVALID with a reason; never guessed into an edit
 */
@Component
public class FixResponseParser {

    private static final Logger log = LoggerFactory.getLogger(FixResponseParser.class);

    public static final String NO_FIX_SENTINEL = "NO_FIX";

    enum Tag {
        ERROR_TYPE("Error_Type"),
        TARGET_FILE("Target_File"),
        MATCH_PATTERN("Match_Pattern"),
        FIX_CONTENT("Fix_Content");

        private final String label;

        Tag(String label) {
            this.label = label;
        }

        static Optional<Tag> fromLabel(String label) {
            for (Tag tag : values()) {
                if (tag.label.equalsIgnoreCase(label)) {
                    return Optional.of(tag);
                }
            }
            return Optional.empty();
        }
    }

    private static final Pattern TAG_PATTERN = Pattern.compile(
            "^[ \\t]*(Error_Type|Target_File|Match_Pattern|Fix_Content)[ \\t]*:[ \\t]*",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    /** Quotes around the sentinel and punctuation after it. */
    private static final Pattern SENTINEL_DECORATION = Pattern.compile("^[\\s\"'`]+|[\\s\"'`.,;:!]+$");

    private static final Pattern FENCE_PATTERN = Pattern.compile(
            "^```[\\w.-]*[ \\t]*\\R(.*?)\\R?```$", Pattern.DOTALL);

    public FixProposal parse(String rawResponse) {

        if (rawResponse == null || rawResponse.isBlank()) {
            log.warn("[Parser] Empty oracle response");
            return FixProposal.invalid("empty response");
        }

        Map<Tag, TagValue> tags = scanTags(rawResponse);
        TagValue fixContent = tags.get(Tag.FIX_CONTENT);
        TagValue errorType  = tags.get(Tag.ERROR_TYPE);

        if (fixContent != null && isSentinel(fixContent.text)) {
            log.info("[Parser] Oracle declined to fix (sentinel in Fix_Content)");
            return FixProposal.noFix(errorType != null ? firstLine(errorType.text) : null);
        }
        if (fixContent == null && isSentinel(rawResponse)) {
            log.info("[Parser] Oracle declined to fix (bare sentinel)");
            return FixProposal.noFix(null);
        }

        for (Tag required : new Tag[] {Tag.ERROR_TYPE, Tag.TARGET_FILE, Tag.FIX_CONTENT}) {
            if (!tags.containsKey(required)) {
                return invalid("missing required tag " + required.label);
            }
        }

        TagValue targetTag  = tags.get(Tag.TARGET_FILE);
        TagValue patternTag = tags.get(Tag.MATCH_PATTERN);

        if (!(errorType.position < targetTag.position && targetTag.position < fixContent.position)) {
            return invalid("tags out of order; expected Error_Type, Target_File, Fix_Content");
        }
        if (patternTag != null
                && !(targetTag.position < patternTag.position && patternTag.position < fixContent.position)) {
            return invalid("Match_Pattern must sit between Target_File and Fix_Content");
        }

        String targetId = firstLine(targetTag.text);
        Optional<TargetFile> target = TargetFile.fromIdentifier(targetId);
        if (target.isEmpty()) {
            return invalid("unknown target file '" + targetId + "'");
        }

        String content = stripFences(fixContent.text);
        if (content.isEmpty()) {
            return invalid("empty Fix_Content");
        }

        String classification = firstLine(errorType.text);

        String patternText = patternTag != null ? stripInlineQuotes(stripFences(patternTag.text)) : "";
        if (patternText.isEmpty()) {
            FixProposal proposal = FixProposal.append(target.get(), content, classification);
            log.info("[Parser] Parsed {}", proposal);
            return proposal;
        }

        Pattern compiled;
        try {
            compiled = Pattern.compile(firstLine(patternText), Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            return invalid("Match_Pattern does not compile: " + e.getDescription());
        }

        FixProposal proposal = FixProposal.replaceMatch(target.get(), compiled, content, classification);
        log.info("[Parser] Parsed {}", proposal);
        return proposal;
    }

    // ================================================================
    // Private helpers
    // ================================================================

    /**
     * First occurrence of each tag wins. A value runs to the start of the next
     * tag of any kind, or to the end of the response.
     */
    private Map<Tag, TagValue> scanTags(String response) {
        Map<Tag, TagValue> tags = new EnumMap<>(Tag.class);
        Matcher matcher = TAG_PATTERN.matcher(response);

        Tag pendingTag = null;
        int pendingStart = -1;
        int pendingPosition = -1;

        while (matcher.find()) {
            if (pendingTag != null) {
                tags.putIfAbsent(pendingTag, new TagValue(pendingPosition,
                        response.substring(pendingStart, matcher.start()).strip()));
            }
            pendingTag = Tag.fromLabel(matcher.group(1)).orElseThrow();
            pendingStart = matcher.end();
            pendingPosition = matcher.start();
        }
        if (pendingTag != null) {
            tags.putIfAbsent(pendingTag, new TagValue(pendingPosition,
                    response.substring(pendingStart).strip()));
        }
        return tags;
    }

    /**
     * Only the first line counts; models often follow the sentinel with a
     * sentence of explanation or close it with a full stop.
     */
    private boolean isSentinel(String text) {
        String head = firstLine(stripFences(text));
        return SENTINEL_DECORATION.matcher(head).replaceAll("").equalsIgnoreCase(NO_FIX_SENTINEL);
    }

    private String stripFences(String text) {
        String trimmed = text.strip();
        Matcher fence = FENCE_PATTERN.matcher(trimmed);
        if (fence.matches()) {
            return fence.group(1).strip();
        }
        return trimmed;
    }

    private String stripInlineQuotes(String text) {
        String trimmed = text.strip();
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            return trimmed.substring(1, trimmed.length() - 1).strip();
        }
        return trimmed;
    }

    private String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return (newline == -1 ? trimmed : trimmed.substring(0, newline)).strip();
    }

    private FixProposal invalid(String reason) {
        log.warn("[Parser] Unparsable oracle response: {}", reason);
        return FixProposal.invalid(reason);
    }

    private static final class TagValue {
        private final int position;
        private final String text;

        private TagValue(int position, String text) {
            this.position = position;
            this.text = text;
        }
    }
}
