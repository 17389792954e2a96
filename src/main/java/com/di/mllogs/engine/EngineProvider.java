package com.di.mllogs.engine;

import com.di.mllogs.exception.EngineInitException;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.runners.direct.DirectOptions;
import org.apache.beam.runners.direct.DirectRunner;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.options.PipelineOptionsValidator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Lazily builds the engine handle on first use and hands out the same instance afterwards.
 *
 * <p>Only the first call decides mode and job name. Later calls asking for something else
 * get the existing handle and a warning, the same way a session builder's getOrCreate would.
 */
@Slf4j
@Component
public class EngineProvider {

    private volatile EngineHandle handle;

    public EngineHandle getEngine(String mode, String jobName) {
        EngineHandle current = handle;
        if (current != null) {
            warnIfDifferent(current, mode, jobName);
            return current;
        }
        synchronized (this) {
            if (handle == null) {
                try {
                    handle = createHandle(mode, jobName);
                } catch (RuntimeException e) {
                    log.error("Error initializing engine (mode={}, jobName={}): {}", mode, jobName, e.getMessage());
                    throw e instanceof EngineInitException
                            ? e
                            : new EngineInitException("Error initializing engine: " + e.getMessage(), e);
                }
                log.info("Engine initialized: mode={} parallelism={} jobName='{}'",
                        handle.getMode().descriptor(), handle.getMode().parallelism(), jobName);
            } else {
                warnIfDifferent(handle, mode, jobName);
            }
            return handle;
        }
    }

    private static EngineHandle createHandle(String mode, String jobName) {
        ExecutionMode executionMode = ExecutionMode.parse(mode);
        if (jobName == null || jobName.isBlank()) {
            throw new EngineInitException("Job name cannot be null or blank");
        }

        DirectOptions options = PipelineOptionsFactory.as(DirectOptions.class);
        options.setRunner(DirectRunner.class);
        options.setTargetParallelism(executionMode.parallelism());
        options.setBlockOnRun(true);
        options.setJobName(toBeamJobName(jobName));
        options.setAppName(jobName);
        PipelineOptionsValidator.validate(DirectOptions.class, options);
        FileSystems.setDefaultPipelineOptions(options);

        return new EngineHandle(executionMode, jobName, options);
    }

    /** Beam job names are restricted to lower-case letters, digits and dashes. */
    static String toBeamJobName(String jobName) {
        String cleaned = jobName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]+", "-").replaceAll("^-+|-+$", "");
        return cleaned.isEmpty() ? "mllogs-etl" : cleaned;
    }

    private static void warnIfDifferent(EngineHandle current, String mode, String jobName) {
        boolean sameMode = mode != null && mode.trim().equals(current.getMode().descriptor());
        boolean sameName = current.getJobName().equals(jobName);
        if (!sameMode || !sameName) {
            log.warn("Engine already initialized with mode={} jobName='{}'; ignoring request for mode={} jobName='{}'",
                    current.getMode().descriptor(), current.getJobName(), mode, jobName);
        }
    }
}
