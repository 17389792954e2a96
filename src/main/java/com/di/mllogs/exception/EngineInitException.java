package com.di.mllogs.exception;

/**
 * Thrown by {@link com.di.mllogs.engine.EngineProvider} when the Beam engine cannot be
 * configured, e.g. an unsupported execution mode such as {@code local[0]}.
 */
public class EngineInitException extends EtlException {

    public EngineInitException(String message) {
        super(message);
    }

    public EngineInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
