package com.buildmender.llm;

/**
 * The fix oracle failed to produce an answer for a reason other than its timeout.
 */
public class OracleException extends Exception {

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
