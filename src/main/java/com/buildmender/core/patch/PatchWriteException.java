package com.buildmender.core.patch;

/**
 * A patch could not be committed to disk. The target file is left exactly as
 * it was before the call.
 */
public class PatchWriteException extends Exception {

    public PatchWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
