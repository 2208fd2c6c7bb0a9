package org.iceforge.quarry.query;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw engine error text into a short explanation a user can act on.
 * <p>
 * Rules are tried in order and the first match wins. A translated message keeps the raw text
 * after a {@code "Technical details: "} line; unrecognized, null or blank input comes back as is.
 */
public final class ErrorTranslator {

    static final String DETAILS_SEPARATOR = "\n\nTechnical details: ";

    private static final Pattern MISSING_COLUMN = Pattern.compile(
            "column\\s+\"([^\"]+)\"\\s+not\\s+found|unable\\s+to\\s+find\\s+column\\s+\"([^\"]+)\"",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MISSING_TABLE = Pattern.compile(
            "(?:table|relation)\\s.*(?:not\\s+found|does\\s+not\\s+exist)");
    private static final Pattern MISSING_FUNCTION = Pattern.compile(
            "function\\s.*(?:not\\s+found|does\\s+not\\s+exist)|unsupported\\s+function|unknown\\s+function");
    private static final Pattern GROUP_BY = Pattern.compile("must\\s+appear\\s+in\\s+(?:the\\s+)?group\\s+by");

    private ErrorTranslator() {}

    public static String translate(String raw) {
        return translate(raw, null);
    }

    /**
     * @param availableColumns listed in the message for unknown-column errors; may be null
     */
    public static String translate(String raw, List<String> availableColumns) {
        if (raw == null || raw.isBlank()) {
            return raw;
        }
        String friendly = explain(raw, availableColumns);
        return friendly == null ? raw : friendly + DETAILS_SEPARATOR + raw;
    }

    static String explain(String raw, List<String> availableColumns) {
        String lower = raw.toLowerCase(Locale.ROOT);

        Matcher column = MISSING_COLUMN.matcher(raw);
        if (column.find()) {
            String name = column.group(1) != null ? column.group(1) : column.group(2);
            String msg = "Column '" + name + "' doesn't exist in this dataset.";
            if (availableColumns != null && !availableColumns.isEmpty()) {
                msg += " Available columns: " + String.join(", ", availableColumns);
            }
            return msg;
        }
        if (lower.contains("ilike")) {
            return "ILIKE is not supported here. Use LOWER(column) LIKE LOWER('%pattern%') instead.";
        }
        if (lower.contains("cannot compare") || lower.contains("type mismatch")) {
            return "Type mismatch error. Try using CAST() to convert columns to matching types.";
        }
        if (MISSING_TABLE.matcher(lower).find()) {
            return "Table not found. Make sure to use the dataset name as shown in the schema.";
        }
        if (lower.contains("syntax error") || lower.contains("parser error")) {
            return "SQL syntax error. Check for missing commas, parentheses, or keywords.";
        }
        if (lower.contains("division by zero") || lower.contains("divide by zero")) {
            return "Division by zero encountered. Add a CASE WHEN to handle zero values.";
        }
        if (MISSING_FUNCTION.matcher(lower).find()) {
            return "Function not supported. Check the function name and its arguments.";
        }
        if (GROUP_BY.matcher(lower).find()) {
            return "Columns in SELECT must appear in GROUP BY clause or be used with an aggregate function.";
        }
        if (lower.contains("ambiguous")) {
            return "Ambiguous column reference. Prefix the column with the table name "
                    + "(e.g., table1.column_name) to resolve.";
        }
        if (lower.contains("duplicate column")) {
            return "Duplicate column names in the result. Give each selected column a unique alias, "
                    + "e.g. SELECT a.id AS a_id, b.id AS b_id.";
        }
        if (lower.contains("overflow")) {
            return "Numeric overflow occurred. Try casting the column to a larger type with "
                    + "CAST(col AS BIGINT) or CAST(col AS DOUBLE).";
        }
        if (lower.contains("could not convert string") || lower.contains("could not parse")
                || (lower.contains("conversion") && lower.contains("string"))) {
            return "Could not convert string to number. Use CAST(column AS DOUBLE) or "
                    + "CAST(column AS INTEGER) to convert explicitly.";
        }
        if (lower.contains("statement type is not supported")
                || lower.contains("can only be used with queries that return a resultset")) {
            return "Only SELECT queries are supported. Datasets are read-only.";
        }
        if (lower.contains("permission error") || lower.contains("disabled by configuration")
                || lower.contains("disabled through configuration")) {
            return "Queries can only read the datasets they name. Reading or writing other files is not allowed.";
        }
        return null;
    }
}
