package com.di.mllogs.loader;

import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Static metric lookup. Logs whose metricId is not listed here are dropped by the join.
 */
@Component
public class MetricLoader {

    public static final List<Row> METRICS = List.of(
            Row.withSchema(TableSchemas.METRIC).addValues(0, "Loss").build(),
            Row.withSchema(TableSchemas.METRIC).addValues(1, "Accuracy").build());

    public PCollection<Row> loadMetrics(Pipeline pipeline) {
        return pipeline.apply("CreateMetrics", Create.of(METRICS).withRowSchema(TableSchemas.METRIC));
    }
}
