package com.di.mllogs.engine;

import com.di.mllogs.exception.EngineInitException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed execution-mode descriptor.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code local} - one worker thread</li>
 *   <li>{@code local[N]} - N worker threads, N &gt;= 1</li>
 *   <li>{@code local[*]} - one worker thread per available processor</li>
 * </ul>
 */
public record ExecutionMode(String descriptor, int parallelism) {

    private static final Pattern LOCAL_PATTERN = Pattern.compile("^local(?:\\[(\\*|\\d+)])?$");

    public static ExecutionMode parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new EngineInitException("Execution mode cannot be null or blank");
        }
        String normalized = descriptor.trim();
        Matcher matcher = LOCAL_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new EngineInitException(String.format(
                    "Unsupported execution mode '%s'. Expected local, local[N] or local[*]", descriptor));
        }

        String threads = matcher.group(1);
        if (threads == null) {
            return new ExecutionMode(normalized, 1);
        }
        if ("*".equals(threads)) {
            return new ExecutionMode(normalized, Runtime.getRuntime().availableProcessors());
        }

        int parallelism;
        try {
            parallelism = Integer.parseInt(threads);
        } catch (NumberFormatException e) {
            throw new EngineInitException("Thread count out of range in execution mode: " + descriptor, e);
        }
        if (parallelism < 1) {
            throw new EngineInitException("Thread count must be at least 1 in execution mode: " + descriptor);
        }
        return new ExecutionMode(normalized, parallelism);
    }
}
