package com.di.mllogs.exception;

/**
 * Thrown when an input path is missing, matches nothing or cannot be read.
 */
public class DataSourceException extends EtlException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
