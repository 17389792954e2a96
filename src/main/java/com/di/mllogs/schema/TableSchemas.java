package com.di.mllogs.schema;

import org.apache.beam.sdk.schemas.Schema;

/**
 * Beam schemas of every table flowing through the logs pipeline.
 *
 * <p>All fields are nullable: loaders degrade malformed values to null instead of failing,
 * and the joins/filter decide later whether such rows survive.
 */
public final class TableSchemas {

    private TableSchemas() {}

    public static final String LOG_ID = "logId";
    public static final String EXP_ID = "expId";
    public static final String EXP_NAME = "expName";
    public static final String METRIC_ID = "metricId";
    public static final String METRIC_NAME = "metricName";
    public static final String VALID = "valid";
    public static final String CREATED_AT = "createdAt";
    public static final String INGESTED_AT = "ingestedAt";
    public static final String STEP = "step";
    public static final String VALUE = "value";
    public static final String CREATED_AT_TS = "createdAtTs";
    public static final String INGESTED_AT_TS = "ingestedAtTs";
    public static final String TIME_DIFF_HOURS = "timeDiffHours";
    public static final String MAX_VALUE = "maxValue";
    public static final String MIN_VALUE = "minValue";

    /** One observation emitted during a training run, as read from the JSON lines input. */
    public static final Schema LOG = Schema.builder()
            .addNullableField(LOG_ID, Schema.FieldType.STRING)
            .addNullableField(EXP_ID, Schema.FieldType.INT32)
            .addNullableField(METRIC_ID, Schema.FieldType.INT32)
            .addNullableField(VALID, Schema.FieldType.BOOLEAN)
            .addNullableField(CREATED_AT, Schema.FieldType.STRING)
            .addNullableField(INGESTED_AT, Schema.FieldType.STRING)
            .addNullableField(STEP, Schema.FieldType.INT32)
            .addNullableField(VALUE, Schema.FieldType.FLOAT)
            .build();

    public static final Schema EXPERIMENT = Schema.builder()
            .addNullableField(EXP_ID, Schema.FieldType.INT32)
            .addNullableField(EXP_NAME, Schema.FieldType.STRING)
            .build();

    public static final Schema METRIC = Schema.builder()
            .addNullableField(METRIC_ID, Schema.FieldType.INT32)
            .addNullableField(METRIC_NAME, Schema.FieldType.STRING)
            .build();

    /** Intermediate result of the first join: log columns followed by the experiment name. */
    public static final Schema LOG_WITH_EXPERIMENT = Schema.builder()
            .addFields(LOG.getFields())
            .addNullableField(EXP_NAME, Schema.FieldType.STRING)
            .build();

    /** Denormalized log row; column order is part of the contract. */
    public static final Schema JOINED = Schema.builder()
            .addNullableField(LOG_ID, Schema.FieldType.STRING)
            .addNullableField(EXP_ID, Schema.FieldType.INT32)
            .addNullableField(EXP_NAME, Schema.FieldType.STRING)
            .addNullableField(METRIC_ID, Schema.FieldType.INT32)
            .addNullableField(METRIC_NAME, Schema.FieldType.STRING)
            .addNullableField(VALID, Schema.FieldType.BOOLEAN)
            .addNullableField(CREATED_AT, Schema.FieldType.STRING)
            .addNullableField(INGESTED_AT, Schema.FieldType.STRING)
            .addNullableField(STEP, Schema.FieldType.INT32)
            .addNullableField(VALUE, Schema.FieldType.FLOAT)
            .build();

    public static final Schema FILTERED = Schema.builder()
            .addFields(JOINED.getFields())
            .addNullableField(CREATED_AT_TS, Schema.FieldType.DATETIME)
            .addNullableField(INGESTED_AT_TS, Schema.FieldType.DATETIME)
            .addNullableField(TIME_DIFF_HOURS, Schema.FieldType.DOUBLE)
            .build();

    public static final Schema SCORE = Schema.builder()
            .addNullableField(EXP_ID, Schema.FieldType.INT32)
            .addNullableField(METRIC_ID, Schema.FieldType.INT32)
            .addNullableField(MAX_VALUE, Schema.FieldType.FLOAT)
            .addNullableField(MIN_VALUE, Schema.FieldType.FLOAT)
            .build();
}
