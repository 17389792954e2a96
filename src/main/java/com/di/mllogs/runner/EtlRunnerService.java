package com.di.mllogs.runner;

import com.di.mllogs.config.EtlProperties;
import com.di.mllogs.engine.EngineHandle;
import com.di.mllogs.engine.EngineProvider;
import com.di.mllogs.exception.EtlException;
import com.di.mllogs.loader.ExperimentLoader;
import com.di.mllogs.loader.LogLoader;
import com.di.mllogs.loader.MetricLoader;
import com.di.mllogs.schema.TableSchemas;
import com.di.mllogs.sink.ParquetScoreWriter;
import com.di.mllogs.sink.SaveMode;
import com.di.mllogs.transform.LateLogFilter;
import com.di.mllogs.transform.ScoreAggregator;
import com.di.mllogs.transform.TableJoiner;
import com.di.mllogs.util.RowLogging;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;
import java.util.stream.StreamSupport;

/**
 * Wires the loaders, joins, late-log filter, aggregation and writer into one pipeline and runs it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EtlRunnerService {

    static final String METRICS_NAMESPACE = "mllogs";
    static final String LOGS_LOADED = "logs_loaded";
    static final String ROWS_JOINED = "rows_joined";
    static final String LATE_ROWS = "late_rows";
    static final String SCORES_WRITTEN = "scores_written";

    private final EtlProperties properties;
    private final EngineProvider engineProvider;
    private final LogLoader logLoader;
    private final ExperimentLoader experimentLoader;
    private final MetricLoader metricLoader;
    private final TableJoiner joiner;
    private final LateLogFilter lateLogFilter;
    private final ScoreAggregator aggregator;
    private final ParquetScoreWriter writer;

    /**
     * Builds and runs the pipeline, blocking until the output is written.
     *
     * @return per-stage row counts of the finished run
     * @throws EtlException on any failure; the error is logged with the job id and rethrown
     */
    public RunSummary runPipeline() {
        String jobId = "job-" + UUID.randomUUID();
        MDC.put("jobId", jobId);

        try {
            log.info("Starting pipeline: logs={} experiments={} output={} hours={}",
                    properties.getLogsPath(), properties.getExperimentsPath(),
                    properties.getOutputPath(), properties.getHours());

            EngineHandle engine = engineProvider.getEngine(properties.getMaster(), properties.getAppName());
            Pipeline pipeline = engine.newPipeline();

            PCollection<Row> logs = logLoader.loadLogs(pipeline, properties.getLogsPath());
            PCollection<Row> experiments = experimentLoader.loadExperiments(pipeline, properties.getExperimentsPath());
            PCollection<Row> metrics = metricLoader.loadMetrics(pipeline);

            PCollection<Row> joined = joiner.join(logs, experiments, metrics);
            PCollection<Row> late = lateLogFilter.filterLate(joined, properties.getHours());
            PCollection<Row> scores = aggregator.aggregate(late);

            count(logs, LOGS_LOADED);
            count(joined, ROWS_JOINED);
            count(late, LATE_ROWS);
            count(scores, SCORES_WRITTEN);
            if (properties.getSampleLateRows() > 0) {
                RowLogging.logSample(late, properties.getSampleLateRows(), "LateLogs", jobId,
                        RowLogging.fieldsFormatter(200, TableSchemas.LOG_ID, TableSchemas.EXP_ID,
                                TableSchemas.METRIC_ID, TableSchemas.TIME_DIFF_HOURS, TableSchemas.VALUE));
            }

            writer.save(scores, properties.getOutputPath(), SaveMode.of(properties.isOverwrite()));

            PipelineResult result = engine.run(pipeline);

            RunSummary summary = new RunSummary(jobId,
                    counter(result, LOGS_LOADED),
                    counter(result, ROWS_JOINED),
                    counter(result, LATE_ROWS),
                    counter(result, SCORES_WRITTEN));
            log.info("Pipeline finished: logsLoaded={} rowsJoined={} lateRows={} scoresWritten={}",
                    summary.logsLoaded(), summary.rowsJoined(), summary.lateRows(), summary.scoresWritten());
            return summary;

        } catch (EtlException e) {
            log.error("Pipeline {} failed: {}", jobId, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("jobId");
        }
    }

    private static void count(PCollection<Row> rows, String name) {
        rows.apply("Count_" + name, ParDo.of(new CountRowsFn(name)));
    }

    private static long counter(PipelineResult result, String name) {
        MetricQueryResults mqr = result.metrics().queryMetrics(
                MetricsFilter.builder()
                        .addNameFilter(MetricNameFilter.named(METRICS_NAMESPACE, name))
                        .build());

        return StreamSupport.stream(mqr.getCounters().spliterator(), false)
                .map(MetricResult::getAttempted)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
    }

    /** Row counts of one finished run. */
    public record RunSummary(String jobId, long logsLoaded, long rowsJoined, long lateRows, long scoresWritten) {}

    static class CountRowsFn extends DoFn<Row, Void> {
        private final Counter counter;

        CountRowsFn(String name) {
            this.counter = Metrics.counter(METRICS_NAMESPACE, name);
        }

        @ProcessElement
        public void process(@Element Row r) {
            counter.inc();
        }
    }
}
