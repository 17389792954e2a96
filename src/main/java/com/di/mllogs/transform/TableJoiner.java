package com.di.mllogs.transform;

import com.di.mllogs.schema.TableSchemas;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.transforms.Join;
import org.apache.beam.sdk.transforms.Filter;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Denormalizes logs with experiment and metric names through two inner joins.
 *
 * <p>Rows without a match on either side are dropped silently; rows with a null key never match.
 * A key present more than once on the right side fans the log out once per match.
 */
@Component
public class TableJoiner {

    /**
     * {@code logs ⋈ experiments ON expId ⋈ metrics ON metricId}, projected to {@link TableSchemas#JOINED}.
     */
    public PCollection<Row> join(PCollection<Row> logs, PCollection<Row> experiments, PCollection<Row> metrics) {
        PCollection<Row> logsWithExperiment = withNonNullKey(logs, TableSchemas.EXP_ID, "Logs")
                .apply("JoinExperiments", Join.<Row, Row>innerJoin(
                                withNonNullKey(experiments, TableSchemas.EXP_ID, "Experiments"))
                        .using(TableSchemas.EXP_ID))
                .apply("FlattenLogExperiment", MapElements.into(TypeDescriptors.rows())
                        .via(TableJoiner::toLogWithExperiment))
                .setRowSchema(TableSchemas.LOG_WITH_EXPERIMENT);

        return withNonNullKey(logsWithExperiment, TableSchemas.METRIC_ID, "LogExperiments")
                .apply("JoinMetrics", Join.<Row, Row>innerJoin(
                                withNonNullKey(metrics, TableSchemas.METRIC_ID, "Metrics"))
                        .using(TableSchemas.METRIC_ID))
                .apply("ProjectJoined", MapElements.into(TypeDescriptors.rows())
                        .via(TableJoiner::toJoined))
                .setRowSchema(TableSchemas.JOINED);
    }

    private static PCollection<Row> withNonNullKey(PCollection<Row> rows, String key, String label) {
        SerializableFunction<Row, Boolean> hasKey = row -> row.getValue(key) != null;
        return rows.apply("Drop" + label + "NullKey_" + key, Filter.by(hasKey))
                .setRowSchema(rows.getSchema());
    }

    static Row toLogWithExperiment(Row joined) {
        Row log = joined.getRow(Join.LHS_TAG);
        Row experiment = joined.getRow(Join.RHS_TAG);
        List<Object> values = new ArrayList<>(log.getValues());
        values.add(experiment.getString(TableSchemas.EXP_NAME));
        return Row.withSchema(TableSchemas.LOG_WITH_EXPERIMENT).addValues(values).build();
    }

    static Row toJoined(Row joined) {
        Row left = joined.getRow(Join.LHS_TAG);
        Row metric = joined.getRow(Join.RHS_TAG);
        Schema schema = TableSchemas.JOINED;
        List<Object> values = new ArrayList<>(schema.getFieldCount());
        for (Schema.Field field : schema.getFields()) {
            String name = field.getName();
            values.add(TableSchemas.METRIC_NAME.equals(name) ? metric.getString(name) : left.getValue(name));
        }
        return Row.withSchema(schema).addValues(values).build();
    }
}
