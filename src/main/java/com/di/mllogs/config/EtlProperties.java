package com.di.mllogs.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binding for the {@code etl.*} properties.
 *
 * <pre>
 * etl:
 *   master: local[1]
 *   app-name: ML Logs Transformer
 *   logs-path: data/logs.jsonl
 *   experiments-path: data/experiments.csv
 *   output-path: output/scores
 *   hours: 1
 *   overwrite: false
 * </pre>
 *
 * Input and output paths are checked when the pipeline runs, so the application can start
 * without them when {@link #runOnStartup} is false.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {

    /** Execution mode: local, local[N] or local[*]. */
    @NotBlank
    private String master = "local[1]";

    /** Job / application display name. */
    @NotBlank
    private String appName = "ML Logs Transformer";

    /** Newline-delimited JSON log records (file or glob). */
    private String logsPath;

    /** CSV with header: expId,expName (file or glob). */
    private String experimentsPath;

    /** Output directory of the partitioned Parquet scores. */
    private String outputPath;

    /** Logs ingested more than this many hours after creation are kept. */
    private double hours = 1.0;

    /** Replace an existing non-empty output directory instead of failing. */
    private boolean overwrite = false;

    /** Run the pipeline once the application context is up. */
    private boolean runOnStartup = true;

    /** Number of late rows logged at INFO for debugging; 0 disables it. */
    @Min(0)
    private int sampleLateRows = 0;
}
