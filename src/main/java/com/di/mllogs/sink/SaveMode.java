package com.di.mllogs.sink;

/**
 * What the writer does when the output path already holds data.
 */
public enum SaveMode {
    /** Fail with {@link com.di.mllogs.exception.WriteException}. */
    ERROR_IF_EXISTS,
    /** Delete the existing path before writing. */
    OVERWRITE;

    public static SaveMode of(boolean overwrite) {
        return overwrite ? OVERWRITE : ERROR_IF_EXISTS;
    }
}
