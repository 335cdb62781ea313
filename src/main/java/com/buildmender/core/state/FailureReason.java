package com.buildmender.core.state;

/**
 * Why a session ended in RepairState.FAILED.
 */
public enum FailureReason {
    /** The oracle answered NO_FIX. */
    NO_FIX("no-fix"),
    /** The oracle's answer broke the response grammar. */
    UNPARSABLE("unparsable"),
    /** The patch could not be written (I/O). */
    APPLY_FAILED("apply-failed"),
    /** The build tool could not be started at all. */
    BUILD_INVOCATION("build-invocation"),
    /** The build timed out on too many consecutive runs. */
    BUILD_TIMEOUT("build-timeout"),
    /** The oracle did not answer within its timeout. */
    ORACLE_TIMEOUT("oracle-timeout"),
    /** The oracle call failed outright. */
    ORACLE_ERROR("oracle-error"),
    /** The session thread was interrupted. */
    CANCELLED("cancelled");

    private final String label;

    FailureReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
