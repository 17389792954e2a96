package com.di.mllogs.util;

import com.di.mllogs.TestPipelines;
import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RowLogging Tests")
class RowLoggingTest {

    private static final Row METRIC = Row.withSchema(TableSchemas.METRIC).addValues(1, "Accuracy").build();

    @Test
    @DisplayName("Should render the selected fields in order")
    void testFieldsFormatter() {
        SerializableFunction<Row, String> formatter =
                RowLogging.fieldsFormatter(0, TableSchemas.METRIC_NAME, TableSchemas.METRIC_ID);
        assertEquals("{metricName=Accuracy, metricId=1}", formatter.apply(METRIC));
    }

    @Test
    @DisplayName("Should mark null values and unknown fields")
    void testFieldsFormatter_NullAndMissing() {
        Row row = Row.withSchema(TableSchemas.METRIC).addValues(0, null).build();
        SerializableFunction<Row, String> formatter =
                RowLogging.fieldsFormatter(10, TableSchemas.METRIC_NAME, TableSchemas.EXP_ID);
        assertEquals("{metricName=<null>, expId=<missing>}", formatter.apply(row));
    }

    @Test
    @DisplayName("Should cut long values")
    void testRender_Truncates() {
        assertEquals("Acc...", RowLogging.render(METRIC, TableSchemas.METRIC_NAME, 3));
        assertEquals("Accuracy", RowLogging.render(METRIC, TableSchemas.METRIC_NAME, 8));
    }

    @Test
    @DisplayName("Should log a sample without failing the pipeline")
    void testLogSample() {
        Pipeline pipeline = TestPipelines.create();
        RowLogging.logSample(
                pipeline.apply(Create.of(List.of(METRIC, METRIC)).withRowSchema(TableSchemas.METRIC)),
                1, "SampleTest", "job-test", RowLogging.fieldsFormatter(0, TableSchemas.METRIC_NAME));
        assertEquals(PipelineResult.State.DONE, TestPipelines.run(pipeline));
    }
}
