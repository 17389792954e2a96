package com.di.mllogs.util;

import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.Sample;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Debug logging of a bounded sample of pipeline rows, one log line per row.
 */
public final class RowLogging {

    static final String NULL_VALUE = "<null>";
    static final String MISSING_FIELD = "<missing>";

    private RowLogging() {}

    /**
     * Attaches a side branch that logs at most {@code maxRows} rows of {@code rows} to the named logger.
     * The rows themselves are left untouched.
     */
    public static void logSample(PCollection<Row> rows, int maxRows, String loggerName, String jobId,
                                 SerializableFunction<Row, String> formatter) {
        rows.apply("Sample" + loggerName, Sample.any(maxRows))
                .apply("Log" + loggerName, ParDo.of(new LogRowFn(loggerName, jobId, formatter)));
    }

    /**
     * Renders {@code field=value} pairs for the given fields, e.g. {@code {logId=a, value=2.0}}.
     * Values longer than {@code maxChars} are cut; {@code maxChars <= 0} disables the cut.
     */
    public static SerializableFunction<Row, String> fieldsFormatter(int maxChars, String... fieldNames) {
        List<String> names = Arrays.asList(fieldNames);
        return row -> names.stream()
                .map(name -> name + "=" + render(row, name, maxChars))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    static String render(Row row, String field, int maxChars) {
        if (!row.getSchema().hasField(field)) {
            return MISSING_FIELD;
        }
        Object value = row.getValue(field);
        if (value == null) {
            return NULL_VALUE;
        }
        String text = String.valueOf(value);
        return maxChars > 0 && text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }

    private static final class LogRowFn extends DoFn<Row, Void> {
        private final String loggerName;
        private final String jobId;
        private final SerializableFunction<Row, String> formatter;
        private transient Logger logger;

        LogRowFn(String loggerName, String jobId, SerializableFunction<Row, String> formatter) {
            this.loggerName = loggerName;
            this.jobId = jobId;
            this.formatter = formatter;
        }

        @Setup
        public void setup() {
            logger = LoggerFactory.getLogger(loggerName);
        }

        @ProcessElement
        public void process(@Element Row row) {
            // runner threads start without the caller's MDC
            try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", jobId)) {
                logger.info("Sampled row {}", formatter.apply(row));
            }
        }
    }
}
