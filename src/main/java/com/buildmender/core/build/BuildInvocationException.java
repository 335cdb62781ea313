package com.buildmender.core.build;

/**
 * The build tool could not be invoked at all. Fatal for a repair session and
 * never counted as a failed build.
 */
public class BuildInvocationException extends Exception {

    public BuildInvocationException(String message) {
        super(message);
    }

    public BuildInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
