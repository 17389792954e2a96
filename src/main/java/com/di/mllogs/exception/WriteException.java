package com.di.mllogs.exception;

/**
 * Thrown when the output destination cannot be used: it already holds data and
 * overwrite is disabled, or it could not be cleared.
 */
public class WriteException extends EtlException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
