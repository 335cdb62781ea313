package com.buildmender.core.proposal;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FixProposal - immutable, structured form of one oracle answer.
 *
 * Always construct via the static factories; each one fixes which fields are
 * meaningful for its action:
 *   append(target, content, errorType)
 *   replaceMatch(target, pattern, content, errorType)
 *   noFix(errorType)
 *   invalid(reason)
 */
public final class FixProposal {

    private final TargetFile targetFile;
    private final FixAction  action;
    private final Pattern    matchPattern;
    private final String     content;
    private final String     errorType;
    private final String     invalidReason;

    private FixProposal(TargetFile targetFile, FixAction action, Pattern matchPattern,
                        String content, String errorType, String invalidReason) {
        this.targetFile    = targetFile;
        this.action        = action;
        this.matchPattern  = matchPattern;
        this.content       = content != null ? content : "";
        this.errorType     = errorType;
        this.invalidReason = invalidReason;
    }

    public static FixProposal append(TargetFile target, String content, String errorType) {
        requireEditTarget(target);
        return new FixProposal(target, FixAction.APPEND, null, content, errorType, null);
    }

    public static FixProposal replaceMatch(TargetFile target, Pattern pattern, String content, String errorType) {
        requireEditTarget(target);
        Objects.requireNonNull(pattern, "pattern");
        return new FixProposal(target, FixAction.REPLACE_MATCH, pattern, content, errorType, null);
    }

    public static FixProposal noFix(String errorType) {
        return new FixProposal(TargetFile.NONE, FixAction.NO_FIX, null, "", errorType, null);
    }

    public static FixProposal invalid(String reason) {
        return new FixProposal(TargetFile.NONE, FixAction.INVALID, null, "", null,
                reason != null ? reason : "unparsable response");
    }

    private static void requireEditTarget(TargetFile target) {
        if (target == null || target == TargetFile.NONE) {
            throw new IllegalArgumentException("An edit proposal needs a concrete target file");
        }
    }

    public TargetFile getTargetFile()    { return targetFile; }
    public FixAction  getAction()        { return action; }
    /** Null unless the action is REPLACE_MATCH. */
    public Pattern    getMatchPattern()  { return matchPattern; }
    public String     getContent()       { return content; }
    /** The oracle's error classification, if it gave one. */
    public String     getErrorType()     { return errorType; }
    /** Null unless the action is INVALID. */
    public String     getInvalidReason() { return invalidReason; }

    /** One-line rendering for logs and the HTTP response. */
    public String describe() {
        switch (action) {
            case APPEND:
                return "append to " + targetFile.getFileName() + ": " + content;
            case REPLACE_MATCH:
                return "replace /" + matchPattern.pattern() + "/ in " + targetFile.getFileName() + " with: " + content;
            case NO_FIX:
                return "no fix";
            default:
                return "invalid: " + invalidReason;
        }
    }

    @Override
    public String toString() {
        String preview = content.length() > 80 ? content.substring(0, 80) + "..." : content;
        return String.format("FixProposal{action=%s, target=%s, pattern=%s, content='%s'}",
                action, targetFile, matchPattern != null ? matchPattern.pattern() : null, preview);
    }
}
