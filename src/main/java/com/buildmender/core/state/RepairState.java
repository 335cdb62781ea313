package com.buildmender.core.state;

/**
 * Explicit state graph of one repair session.
 *
 * INIT → RUNNING → AWAITING_ORACLE → APPLYING → RUNNING → ...
 *
 * INIT            - session created, nothing run yet.
 * RUNNING         - the build tool is executing.
 * AWAITING_ORACLE - the build failed; diagnostic extracted, oracle consulted.
 * APPLYING        - an APPEND or REPLACE_MATCH proposal is being written.
 *
 * Terminal:
 * SUCCESS                - the last build passed.
 * FAILED                 - ended early; the FailureReason says why.
 * MAX_ATTEMPTS_EXHAUSTED - every allowed attempt was spent and the build still fails.
 */
public enum RepairState {
    INIT,
    RUNNING,
    AWAITING_ORACLE,
    APPLYING,
    SUCCESS,
    FAILED,
    MAX_ATTEMPTS_EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == MAX_ATTEMPTS_EXHAUSTED;
    }
}
