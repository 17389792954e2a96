package com.di.mllogs.transform;

import com.di.mllogs.schema.TableSchemas;
import com.di.mllogs.util.LogTimestamps;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.springframework.stereotype.Component;

/**
 * Keeps logs that were ingested more than a given number of hours after they were created.
 *
 * <p>The comparison is strict: a lag exactly equal to the threshold is dropped. A timestamp that
 * does not match {@link LogTimestamps#PATTERN} gives a null lag, which never passes.
 */
@Component
public class LateLogFilter {

    /**
     * @param joined rows with the {@link TableSchemas#JOINED} schema
     * @param hours  threshold in hours; any value is accepted, including negative or fractional
     * @return rows with the {@link TableSchemas#FILTERED} schema
     */
    public PCollection<Row> filterLate(PCollection<Row> joined, double hours) {
        return joined
                .apply("FilterLateLogs", ParDo.of(new LateLogFn(hours)))
                .setRowSchema(TableSchemas.FILTERED);
    }

    static class LateLogFn extends DoFn<Row, Row> {
        private final double hours;

        LateLogFn(double hours) {
            this.hours = hours;
        }

        @ProcessElement
        public void process(@Element Row row, OutputReceiver<Row> out) {
            Row withLag = withIngestionLag(row);
            Double lag = withLag.getDouble(TableSchemas.TIME_DIFF_HOURS);
            if (lag != null && lag > hours) {
                out.output(withLag);
            }
        }
    }

    /** Adds the parsed timestamps and the ingestion lag in hours to a joined row. */
    static Row withIngestionLag(Row row) {
        DateTime createdAt = LogTimestamps.parse(row.getString(TableSchemas.CREATED_AT));
        DateTime ingestedAt = LogTimestamps.parse(row.getString(TableSchemas.INGESTED_AT));
        return Row.withSchema(TableSchemas.FILTERED)
                .addValues(row.getValues())
                .addValues(createdAt, ingestedAt, LogTimestamps.hoursBetween(createdAt, ingestedAt))
                .build();
    }
}
