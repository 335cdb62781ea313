package com.buildmender.llm;

import java.time.Duration;

/**
 * The fix oracle did not answer within its call timeout. The call has been
 * cancelled.
 */
public class OracleTimeoutException extends Exception {

    private final Duration timeout;

    public OracleTimeoutException(Duration timeout) {
        super("Oracle did not answer within " + timeout);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
