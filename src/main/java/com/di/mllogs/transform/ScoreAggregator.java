package com.di.mllogs.transform;

import com.di.mllogs.schema.TableSchemas;
import lombok.Data;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.FloatCoder;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.NullableCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.VarIntCoder;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.Filter;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.springframework.stereotype.Component;

import java.io.Serializable;

/**
 * Computes the final score of every experiment and metric: the maximum and minimum
 * observed value among the rows it is given.
 *
 * <p>Null values are skipped. A group whose values are all null produces no row. A null
 * {@code expId} or {@code metricId} is a key like any other.
 */
@Component
public class ScoreAggregator {

    // null expId / metricId form groups of their own
    static final KvCoder<KV<Integer, Integer>, Float> KEYED_VALUE_CODER = KvCoder.of(
            KvCoder.of(NullableCoder.of(VarIntCoder.of()), NullableCoder.of(VarIntCoder.of())),
            FloatCoder.of());

    /**
     * @param rows rows carrying {@code expId}, {@code metricId} and {@code value}
     * @return one {@link TableSchemas#SCORE} row per (expId, metricId) with at least one non-null value
     */
    public PCollection<Row> aggregate(PCollection<Row> rows) {
        SerializableFunction<Row, Boolean> hasValue = row -> row.getFloat(TableSchemas.VALUE) != null;
        return rows
                .apply("DropNullValues", Filter.by(hasValue))
                .apply("KeyByExperimentMetric", MapElements
                        .into(TypeDescriptors.kvs(
                                TypeDescriptors.kvs(TypeDescriptors.integers(), TypeDescriptors.integers()),
                                TypeDescriptors.floats()))
                        .via((SerializableFunction<Row, KV<KV<Integer, Integer>, Float>>) row -> KV.of(
                                KV.of(row.getInt32(TableSchemas.EXP_ID), row.getInt32(TableSchemas.METRIC_ID)),
                                row.getFloat(TableSchemas.VALUE))))
                .setCoder(KEYED_VALUE_CODER)
                .apply("MinMaxPerKey", Combine.perKey(new MinMaxFn()))
                .apply("ToScoreRow", MapElements.into(TypeDescriptors.rows())
                        .via((SerializableFunction<KV<KV<Integer, Integer>, MinMax>, Row>) kv -> Row
                                .withSchema(TableSchemas.SCORE)
                                .addValues(kv.getKey().getKey(), kv.getKey().getValue(),
                                        kv.getValue().getMax(), kv.getValue().getMin())
                                .build()))
                .setRowSchema(TableSchemas.SCORE);
    }

    /** Running extrema. Ordering follows {@link Float#compare}, so NaN wins max and loses min. */
    @Data
    @DefaultCoder(SerializableCoder.class)
    public static class MinMax implements Serializable {
        private Float max;
        private Float min;

        MinMax accept(float value) {
            if (max == null || Float.compare(value, max) > 0) {
                max = value;
            }
            if (min == null || Float.compare(value, min) < 0) {
                min = value;
            }
            return this;
        }

        MinMax merge(MinMax other) {
            if (other.max != null) {
                accept(other.max);
            }
            if (other.min != null) {
                accept(other.min);
            }
            return this;
        }
    }

    static class MinMaxFn extends Combine.CombineFn<Float, MinMax, MinMax> {

        @Override
        public MinMax createAccumulator() {
            return new MinMax();
        }

        @Override
        public MinMax addInput(MinMax accumulator, Float input) {
            return accumulator.accept(input);
        }

        @Override
        public MinMax mergeAccumulators(Iterable<MinMax> accumulators) {
            MinMax merged = new MinMax();
            for (MinMax accumulator : accumulators) {
                merged.merge(accumulator);
            }
            return merged;
        }

        @Override
        public MinMax extractOutput(MinMax accumulator) {
            return accumulator;
        }
    }
}
