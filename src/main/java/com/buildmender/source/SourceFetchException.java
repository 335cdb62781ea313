package com.buildmender.source;

/**
 * The project sources could not be made present in the workspace.
 */
public class SourceFetchException extends Exception {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
