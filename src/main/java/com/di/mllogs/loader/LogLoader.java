package com.di.mllogs.loader;

import com.di.mllogs.schema.TableSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Component;

/**
 * Loads training-run log records from newline-delimited JSON.
 *
 * <p>The schema is fixed ({@link TableSchemas#LOG}), never inferred. Bad fields and bad lines
 * degrade to nulls; only an unusable path is an error.
 */
@Slf4j
@Component
public class LogLoader {

    /**
     * @param pipeline pipeline to attach the read to
     * @param path     JSON lines file or glob
     * @throws com.di.mllogs.exception.DataSourceException if the path matches no file
     */
    public PCollection<Row> loadLogs(Pipeline pipeline, String path) {
        InputPaths.requireMatch(path, "Logs");
        log.info("Loading logs from {}", path);
        return pipeline
                .apply("ReadLogLines", TextIO.read().from(path))
                .apply("ParseLogJson", ParDo.of(new ParseLogLineFn()))
                .setRowSchema(TableSchemas.LOG);
    }

    static class ParseLogLineFn extends DoFn<String, Row> {
        private final Counter malformed = Metrics.counter("mllogs", "malformed_log_lines");
        private transient JsonLogParser parser;

        @Setup
        public void setup() {
            parser = new JsonLogParser(new ObjectMapper());
        }

        @ProcessElement
        public void process(@Element String line, OutputReceiver<Row> out) {
            if (line.isBlank()) {
                return;
            }
            JsonNode root = parser.readObject(line);
            if (root == null) {
                malformed.inc();
            }
            out.output(parser.toRow(root));
        }
    }
}
