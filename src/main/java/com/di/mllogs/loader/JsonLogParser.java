package com.di.mllogs.loader;

import com.di.mllogs.schema.TableSchemas;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one JSON line into a LogRecord row under the fixed log schema.
 *
 * <p>Conversion is permissive: a field that is absent, JSON null or of the wrong type becomes
 * null on its own, and a line that is not a JSON object becomes a row of nulls. Nothing here
 * throws on bad data.
 * <ul>
 *   <li>STRING - any scalar as text; objects and arrays as their JSON text</li>
 *   <li>INT32 - integral numbers within int range only</li>
 *   <li>BOOLEAN - JSON true/false only</li>
 *   <li>FLOAT - any number, plus the strings NaN, Infinity and -Infinity</li>
 * </ul>
 */
public final class JsonLogParser {

    private final ObjectMapper mapper;
    private final Schema schema;

    public JsonLogParser(ObjectMapper mapper) {
        this.mapper = mapper;
        this.schema = TableSchemas.LOG;
    }

    /**
     * @return the parsed row, never null
     */
    public Row parse(String line) {
        return toRow(readObject(line));
    }

    /**
     * Builds a row from an already parsed JSON object.
     *
     * @param root JSON object, or null for a malformed line (gives a row of nulls)
     */
    public Row toRow(JsonNode root) {
        List<Object> values = new ArrayList<>(schema.getFieldCount());
        for (Schema.Field field : schema.getFields()) {
            JsonNode node = root == null ? null : root.get(field.getName());
            values.add(convert(node, field.getType().getTypeName()));
        }
        return Row.withSchema(schema).addValues(values).build();
    }

    /**
     * @return the line as a JSON object, or null if it is not valid JSON or not an object
     */
    public JsonNode readObject(String line) {
        if (line == null) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(line);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static Object convert(JsonNode node, Schema.TypeName type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        switch (type) {
            case STRING:
                return node.isValueNode() ? node.asText() : node.toString();
            case INT32:
                return node.isIntegralNumber() && node.canConvertToInt() ? node.intValue() : null;
            case BOOLEAN:
                return node.isBoolean() ? node.booleanValue() : null;
            case FLOAT:
                return toFloat(node);
            default:
                throw new IllegalArgumentException("Unsupported log field type: " + type);
        }
    }

    private static Float toFloat(JsonNode node) {
        if (node.isNumber()) {
            return node.floatValue();
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN":
                    return Float.NaN;
                case "Infinity":
                    return Float.POSITIVE_INFINITY;
                case "-Infinity":
                    return Float.NEGATIVE_INFINITY;
                default:
                    return null;
            }
        }
        return null;
    }
}
