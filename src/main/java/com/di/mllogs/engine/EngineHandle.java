package com.di.mllogs.engine;

import com.di.mllogs.exception.PipelineRunException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.runners.direct.DirectOptions;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;

/**
 * Reusable handle to the Beam engine: the validated pipeline options of one execution mode
 * and job name. Pipelines are created from it and run to completion through it.
 */
@Slf4j
@Getter
public class EngineHandle {

    private final ExecutionMode mode;
    private final String jobName;
    private final DirectOptions options;

    EngineHandle(ExecutionMode mode, String jobName, DirectOptions options) {
        this.mode = mode;
        this.jobName = jobName;
        this.options = options;
    }

    /** Creates an empty pipeline bound to this engine's options. */
    public Pipeline newPipeline() {
        return Pipeline.create(options);
    }

    /**
     * Runs the pipeline and blocks until it finishes.
     *
     * @throws PipelineRunException if the runner fails or the pipeline ends in a state other than DONE
     */
    public PipelineResult run(Pipeline pipeline) {
        log.info("Running job '{}' with mode {} (parallelism={})", jobName, mode.descriptor(), mode.parallelism());
        PipelineResult result;
        PipelineResult.State state;
        try {
            result = pipeline.run();
            state = result.waitUntilFinish();
        } catch (Pipeline.PipelineExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PipelineRunException("Job '" + jobName + "' failed: " + cause.getMessage(), cause);
        }
        if (state != PipelineResult.State.DONE) {
            throw new PipelineRunException("Job '" + jobName + "' finished in state " + state);
        }
        return result;
    }
}
