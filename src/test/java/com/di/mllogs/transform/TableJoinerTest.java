package com.di.mllogs.transform;

import com.di.mllogs.TestPipelines;
import com.di.mllogs.loader.MetricLoader;
import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableJoiner Tests")
class TableJoinerTest {

    private final TableJoiner joiner = new TableJoiner();
    private Pipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = TestPipelines.create();
    }

    static Row log(String logId, Integer expId, Integer metricId, Boolean valid, float value) {
        return Row.withSchema(TableSchemas.LOG)
                .addValues(logId, expId, metricId, valid, "2024-01-01T00:00:00", "2024-01-01T05:00:00", 1, value)
                .build();
    }

    static Row experiment(Integer expId, String expName) {
        return Row.withSchema(TableSchemas.EXPERIMENT).addValues(expId, expName).build();
    }

    static Row joined(String logId, int expId, String expName, int metricId, String metricName,
                      Boolean valid, float value) {
        return Row.withSchema(TableSchemas.JOINED)
                .addValues(logId, expId, expName, metricId, metricName, valid,
                        "2024-01-01T00:00:00", "2024-01-01T05:00:00", 1, value)
                .build();
    }

    private PCollection<Row> logs(Row... rows) {
        return pipeline.apply("Logs", Create.of(List.of(rows)).withRowSchema(TableSchemas.LOG));
    }

    private PCollection<Row> experiments(Row... rows) {
        return pipeline.apply("Experiments", Create.of(List.of(rows)).withRowSchema(TableSchemas.EXPERIMENT));
    }

    private PCollection<Row> metrics() {
        return new MetricLoader().loadMetrics(pipeline);
    }

    @Test
    @DisplayName("Should project joined rows to the fixed column order")
    void testJoin_Projection() {
        PCollection<Row> result = joiner.join(
                logs(log("a", 1, 0, true, 2.0f), log("b", 1, 1, false, 0.5f)),
                experiments(experiment(1, "Exp1")),
                metrics());

        assertEquals(TableSchemas.JOINED, result.getSchema());
        assertEquals(List.of("logId", "expId", "expName", "metricId", "metricName", "valid",
                        "createdAt", "ingestedAt", "step", "value"),
                result.getSchema().getFieldNames());
        PAssert.that(result).containsInAnyOrder(
                joined("a", 1, "Exp1", 0, "Loss", true, 2.0f),
                joined("b", 1, "Exp1", 1, "Accuracy", false, 0.5f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should drop logs without a matching experiment or metric")
    void testJoin_DropsUnmatched() {
        PCollection<Row> result = joiner.join(
                logs(log("kept", 1, 0, null, 1.0f),
                        log("unknownExperiment", 9, 0, true, 1.0f),
                        log("unknownMetric", 1, 2, true, 1.0f),
                        log("nullExperiment", null, 0, true, 1.0f),
                        log("nullMetric", 1, null, true, 1.0f)),
                experiments(experiment(1, "Exp1"), experiment(null, "NoId")),
                metrics());

        PAssert.that(result).containsInAnyOrder(joined("kept", 1, "Exp1", 0, "Loss", null, 1.0f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should fan out a log once per duplicate experiment id")
    void testJoin_FanOut() {
        PCollection<Row> result = joiner.join(
                logs(log("a", 1, 0, true, 3.0f)),
                experiments(experiment(1, "First"), experiment(1, "Second")),
                metrics());

        PAssert.that(result).containsInAnyOrder(
                joined("a", 1, "First", 0, "Loss", true, 3.0f),
                joined("a", 1, "Second", 0, "Loss", true, 3.0f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should produce nothing when there are no experiments")
    void testJoin_NoExperiments() {
        PCollection<Row> result = joiner.join(logs(log("a", 1, 0, true, 3.0f)), experiments(), metrics());

        PAssert.that(result).empty();
        TestPipelines.run(pipeline);
    }
}
