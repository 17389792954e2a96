package com.di.mllogs.exception;

/**
 * Thrown when the engine reports that a submitted pipeline did not finish successfully.
 */
public class PipelineRunException extends EtlException {

    public PipelineRunException(String message) {
        super(message);
    }

    public PipelineRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
