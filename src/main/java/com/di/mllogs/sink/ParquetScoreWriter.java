package com.di.mllogs.sink;

import com.di.mllogs.exception.WriteException;
import com.di.mllogs.schema.TableSchemas;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.parquet.ParquetIO;
import org.apache.beam.sdk.transforms.Contextful;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

/**
 * Persists experiment scores as Parquet, one {@code metricId=<value>} directory per metric.
 *
 * <p>The partition column lives in the directory name only; data files hold
 * {@code expId, maxValue, minValue}. Rows with a null {@code metricId} go to
 * {@code metricId=__HIVE_DEFAULT_PARTITION__}. Output goes to a local directory.
 */
@Slf4j
@Component
public class ParquetScoreWriter {

    public static final String FILE_SUFFIX = ".parquet";

    /** Schema of the data files inside each partition directory. */
    public static final Schema FILE_SCHEMA = SchemaBuilder.record("ExperimentScore")
            .namespace("com.di.mllogs")
            .fields()
            .optionalInt(TableSchemas.EXP_ID)
            .optionalFloat(TableSchemas.MAX_VALUE)
            .optionalFloat(TableSchemas.MIN_VALUE)
            .endRecord();

    public void save(PCollection<Row> scores, String outputPath) {
        save(scores, outputPath, SaveMode.ERROR_IF_EXISTS);
    }

    /**
     * Checks the destination now and attaches the partitioned write to the pipeline;
     * files appear when the pipeline runs.
     *
     * @throws WriteException if the destination already holds data and cannot be overwritten
     */
    public void save(PCollection<Row> scores, String outputPath, SaveMode mode) {
        prepareDestination(outputPath, mode);
        log.info("Writing scores to {} partitioned by {}", outputPath, TableSchemas.METRIC_ID);

        scores.apply("WritePartitionedParquet", FileIO.<String, Row>writeDynamic()
                .by((SerializableFunction<Row, String>) row -> PartitionFileNaming.partitionDirectory(
                        TableSchemas.METRIC_ID, row.getInt32(TableSchemas.METRIC_ID)))
                .withDestinationCoder(StringUtf8Coder.of())
                .via(Contextful.fn(new ToFileRecordFn(FILE_SCHEMA.toString())), ParquetIO.sink(FILE_SCHEMA))
                .to(outputPath)
                .withNaming((SerializableFunction<String, FileIO.Write.FileNaming>) PartitionFileNaming::new));
    }

    static void prepareDestination(String outputPath, SaveMode mode) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new WriteException("Output path cannot be null or blank");
        }
        Path target = Paths.get(outputPath);
        if (!Files.exists(target) || isEmptyDirectory(target)) {
            return;
        }
        if (mode != SaveMode.OVERWRITE) {
            throw new WriteException("Output path already exists and is not empty: " + outputPath);
        }
        log.warn("Overwriting existing output path {}", outputPath);
        try {
            FileSystemUtils.deleteRecursively(target);
        } catch (IOException e) {
            throw new WriteException("Cannot clear output path: " + outputPath, e);
        }
    }

    private static boolean isEmptyDirectory(Path path) {
        if (!Files.isDirectory(path)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(path)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            throw new WriteException("Cannot inspect output path: " + path, e);
        }
    }

    /** Drops the partition column and converts the rest of a score row to an Avro record. */
    static class ToFileRecordFn implements SerializableFunction<Row, GenericRecord> {
        private final String schemaJson;
        private transient Schema schema;

        ToFileRecordFn(String schemaJson) {
            this.schemaJson = schemaJson;
        }

        @Override
        public GenericRecord apply(Row row) {
            if (schema == null) {
                schema = new Schema.Parser().parse(schemaJson);
            }
            GenericRecord record = new GenericData.Record(schema);
            record.put(TableSchemas.EXP_ID, row.getInt32(TableSchemas.EXP_ID));
            record.put(TableSchemas.MAX_VALUE, row.getFloat(TableSchemas.MAX_VALUE));
            record.put(TableSchemas.MIN_VALUE, row.getFloat(TableSchemas.MIN_VALUE));
            return record;
        }
    }
}
