package com.di.mllogs.transform;

import com.di.mllogs.TestPipelines;
import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoreAggregator Tests")
class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator();

    static Row filtered(Integer expId, Integer metricId, Float value) {
        Row joined = Row.withSchema(TableSchemas.JOINED)
                .addValues("log", expId, "Exp", metricId, "Metric", true,
                        "2024-01-01T00:00:00", "2024-01-01T05:00:00", 1, value)
                .build();
        return LateLogFilter.withIngestionLag(joined);
    }

    static Row score(Integer expId, Integer metricId, float max, float min) {
        return Row.withSchema(TableSchemas.SCORE).addValues(expId, metricId, max, min).build();
    }

    private static PCollection<Row> input(Pipeline pipeline, Row... rows) {
        return pipeline.apply(Create.of(List.of(rows)).withRowSchema(TableSchemas.FILTERED));
    }

    @Test
    @DisplayName("Should compute max and min per experiment and metric, ignoring nulls")
    void testAggregate() {
        Pipeline pipeline = TestPipelines.create();
        PCollection<Row> scores = aggregator.aggregate(input(pipeline,
                filtered(1, 0, 3.0f), filtered(1, 0, 1.0f), filtered(1, 0, 5.0f), filtered(1, 0, null),
                filtered(1, 1, 0.9f),
                filtered(2, 0, -4.0f), filtered(2, 0, 7.5f)));

        assertEquals(TableSchemas.SCORE, scores.getSchema());
        PAssert.that(scores).containsInAnyOrder(
                score(1, 0, 5.0f, 1.0f),
                score(1, 1, 0.9f, 0.9f),
                score(2, 0, 7.5f, -4.0f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should drop groups whose values are all null")
    void testAggregate_AllNullGroup() {
        Pipeline pipeline = TestPipelines.create();
        PCollection<Row> scores = aggregator.aggregate(input(pipeline,
                filtered(1, 0, null), filtered(1, 0, null),
                filtered(1, 1, 2.0f)));

        PAssert.that(scores).containsInAnyOrder(score(1, 1, 2.0f, 2.0f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should treat null experiment and metric ids as their own groups")
    void testAggregate_NullKeys() {
        Pipeline pipeline = TestPipelines.create();
        PCollection<Row> scores = aggregator.aggregate(input(pipeline,
                filtered(null, 0, 1.0f), filtered(null, 0, 4.0f),
                filtered(1, null, 2.0f),
                filtered(null, null, -3.0f),
                filtered(1, 0, 6.0f)));

        PAssert.that(scores).containsInAnyOrder(
                score(null, 0, 4.0f, 1.0f),
                score(1, null, 2.0f, 2.0f),
                score(null, null, -3.0f, -3.0f),
                score(1, 0, 6.0f, 6.0f));
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should produce nothing for empty input")
    void testAggregate_Empty() {
        Pipeline pipeline = TestPipelines.create();
        PAssert.that(aggregator.aggregate(input(pipeline))).empty();
        TestPipelines.run(pipeline);
    }

    @Test
    @DisplayName("Should order NaN above every other value")
    void testMinMax_NaN() {
        ScoreAggregator.MinMax minMax = new ScoreAggregator.MinMax()
                .accept(2.0f).accept(Float.NaN).accept(-1.0f);
        assertTrue(Float.isNaN(minMax.getMax()));
        assertEquals(-1.0f, minMax.getMin());
    }

    @Test
    @DisplayName("Should merge partial accumulators")
    void testMinMaxFn_Merge() {
        ScoreAggregator.MinMaxFn fn = new ScoreAggregator.MinMaxFn();
        ScoreAggregator.MinMax left = fn.addInput(fn.addInput(fn.createAccumulator(), 4.0f), 6.0f);
        ScoreAggregator.MinMax right = fn.addInput(fn.createAccumulator(), -2.0f);
        ScoreAggregator.MinMax merged = fn.mergeAccumulators(List.of(left, right, fn.createAccumulator()));

        assertEquals(6.0f, merged.getMax());
        assertEquals(-2.0f, merged.getMin());
    }
}
