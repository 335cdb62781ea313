package com.buildmender.core.diagnostics;

/**
 * Bounded summary of a failed build's output, fed to the fix oracle.
 */
public final class DiagnosticExcerpt {

    private final String text;
    private final boolean fromTail;

    public DiagnosticExcerpt(String text, boolean fromTail) {
        this.text = text != null ? text : "";
        this.fromTail = fromTail;
    }

    public String getText() {
        return text;
    }

    /** True when no heuristic matched and the excerpt is the tail of the output. */
    public boolean isFromTail() {
        return fromTail;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public String toString() {
        return "DiagnosticExcerpt{len=" + text.length() + ", fromTail=" + fromTail + "}";
    }
}
