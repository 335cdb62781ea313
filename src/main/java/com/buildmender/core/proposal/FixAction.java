package com.buildmender.core.proposal;

/**
 * FixAction - exhaustive set of outcomes of parsing one oracle response.
 *
 *   APPEND        - add content after the end of the target file
 *   REPLACE_MATCH - replace the first match of the proposal's pattern
 *   NO_FIX        - the oracle explicitly declined; the session ends "no-fix"
 *   INVALID       - the response broke the grammar; the session ends "unparsable"
 *
 * NO_FIX and INVALID are deliberately distinct: INVALID is an error, NO_FIX is
 * an answer.
 */
public enum FixAction {
    APPEND,
    REPLACE_MATCH,
    NO_FIX,
    INVALID;

    public boolean isEdit() {
        return this == APPEND || this == REPLACE_MATCH;
    }
}
