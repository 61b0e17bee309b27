package com.mirrorup.mirror.service;

/**
 * Base type for errors that abort a ranking run. The command-line runner maps any of these to a
 * non-zero exit status.
 */
public class MirrorUpException extends RuntimeException {
    public MirrorUpException(String message) {
        super(message);
    }

    public MirrorUpException(String message, Throwable cause) {
        super(message, cause);
    }
}
