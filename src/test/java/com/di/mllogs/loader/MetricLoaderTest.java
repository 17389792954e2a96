package com.di.mllogs.loader;

import com.di.mllogs.TestPipelines;
import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricLoader Tests")
class MetricLoaderTest {

    @Test
    @DisplayName("Should produce the two known metrics")
    void testLoadMetrics() {
        Pipeline pipeline = TestPipelines.create();
        PCollection<Row> metrics = new MetricLoader().loadMetrics(pipeline);

        assertEquals(TableSchemas.METRIC, metrics.getSchema());
        PAssert.that(metrics).containsInAnyOrder(
                Row.withSchema(TableSchemas.METRIC).addValues(0, "Loss").build(),
                Row.withSchema(TableSchemas.METRIC).addValues(1, "Accuracy").build());
        TestPipelines.run(pipeline);
    }
}
