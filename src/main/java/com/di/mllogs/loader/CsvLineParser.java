package com.di.mllogs.loader;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;

/**
 * CSV settings and field coercion for the experiments file.
 */
public final class CsvLineParser {

    private CsvLineParser() {}

    /**
     * Comma separated, {@code "} quotes a field and {@code ""} inside a quoted field is a literal
     * quote. Backslash has no special meaning.
     */
    public static CSVParser newParser() {
        return new CSVParserBuilder()
                .withSeparator(ICSVParser.DEFAULT_SEPARATOR)
                .withQuoteChar(ICSVParser.DEFAULT_QUOTE_CHARACTER)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .withIgnoreLeadingWhiteSpace(false)
                .build();
    }

    /** Integer value of a CSV field, or null when it is empty or not an int. */
    public static Integer toInteger(String field) {
        if (field == null || field.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(field.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Text value of a CSV field; an empty field reads as null. */
    public static String toText(String field) {
        return field == null || field.isEmpty() ? null : field;
    }
}
