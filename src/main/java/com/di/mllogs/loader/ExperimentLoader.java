package com.di.mllogs.loader;

import com.di.mllogs.exception.DataSourceException;
import com.di.mllogs.schema.TableSchemas;
import com.opencsv.CSVParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;

/**
 * Loads the experiment id to name mapping from a CSV file with a header row.
 * Columns are taken by position: {@code expId, expName}.
 */
@Slf4j
@Component
public class ExperimentLoader {

    /**
     * @param pipeline pipeline to attach the read to
     * @param path     CSV file or glob; every matched file starts with a header line
     * @throws DataSourceException if the path matches no file
     */
    public PCollection<Row> loadExperiments(Pipeline pipeline, String path) {
        InputPaths.requireMatch(path, "Experiments");
        log.info("Loading experiments from {}", path);
        return pipeline
                .apply("MatchExperimentFiles", FileIO.match().filepattern(path))
                .apply("OpenExperimentFiles", FileIO.readMatches())
                .apply("ParseExperimentCsv", ParDo.of(new ReadExperimentCsvFn()))
                .setRowSchema(TableSchemas.EXPERIMENT);
    }

    static class ReadExperimentCsvFn extends DoFn<FileIO.ReadableFile, Row> {
        private final Counter malformed = Metrics.counter("mllogs", "malformed_experiment_lines");
        private transient CSVParser parser;

        @Setup
        public void setup() {
            parser = CsvLineParser.newParser();
        }

        @ProcessElement
        public void process(@Element FileIO.ReadableFile file, OutputReceiver<Row> out) {
            String name = file.getMetadata().resourceId().toString();
            try (BufferedReader reader = new BufferedReader(
                    Channels.newReader(file.open(), StandardCharsets.UTF_8))) {
                // header
                if (reader.readLine() == null) {
                    return;
                }
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    Row row = toRow(parser, line);
                    if (row == null) {
                        malformed.inc();
                        log.warn("Unparseable line in experiments file {}: {}", name, line);
                        row = Row.nullRow(TableSchemas.EXPERIMENT);
                    }
                    out.output(row);
                }
            } catch (IOException e) {
                throw new DataSourceException("Cannot read experiments file: " + name, e);
            }
        }

        /** @return the experiment row, or null if the line is not valid CSV (e.g. an unclosed quote) */
        static Row toRow(CSVParser parser, String line) {
            String[] fields;
            try {
                fields = parser.parseLine(line);
            } catch (IOException e) {
                return null;
            }
            Integer expId = fields.length > 0 ? CsvLineParser.toInteger(fields[0]) : null;
            String expName = fields.length > 1 ? CsvLineParser.toText(fields[1]) : null;
            return Row.withSchema(TableSchemas.EXPERIMENT).addValues(expId, expName).build();
        }
    }
}
