package com.di.mllogs.exception;

/**
 * Base type for every failure raised by the logs pipeline.
 *
 * <p>Row-level malformation never ends up here: bad fields degrade to null and the
 * row is excluded further down the pipeline.
 */
public class EtlException extends RuntimeException {

    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
