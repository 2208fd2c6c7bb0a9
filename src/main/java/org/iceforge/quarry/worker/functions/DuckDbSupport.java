package org.iceforge.quarry.worker.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.dataset.DatasetFormat;
import org.iceforge.quarry.worker.WorkerTaskException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDB helpers shared by the worker functions. Each task gets its own in-memory database.
 */
final class DuckDbSupport {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DuckDbSupport() {}

    static Connection open() throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:");
    }

    static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    static String scan(String path, DatasetFormat format) {
        return format.scanExpression(quoteLiteral(path));
    }

    /**
     * Exposes a local file as a view. Unreadable or mislabeled files fail here, before any user SQL
     * runs.
     */
    static void registerView(Statement st, String viewName, String path, DatasetFormat format) {
        try {
            st.execute("CREATE VIEW " + quoteIdentifier(viewName) + " AS SELECT * FROM " + scan(path, format));
            describe(st, quoteIdentifier(viewName));
        } catch (SQLException e) {
            throw new WorkerTaskException(ErrorType.VALIDATION,
                    "Failed to read dataset '" + viewName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Copies a local file into an in-memory table, so that it stays queryable after
     * {@link #lockDown} cuts off file access.
     */
    static void loadTable(Statement st, String tableName, String path, DatasetFormat format) {
        try {
            st.execute("CREATE TABLE " + quoteIdentifier(tableName) + " AS SELECT * FROM " + scan(path, format));
        } catch (SQLException e) {
            throw new WorkerTaskException(ErrorType.VALIDATION,
                    "Failed to read dataset '" + tableName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Disables every file, network and extension access of the connection and freezes its
     * settings. Only what is already loaded remains visible to later statements.
     */
    static void lockDown(Statement st) {
        try {
            st.execute("SET enable_external_access = false");
            st.execute("SET lock_configuration = true");
        } catch (SQLException e) {
            throw new WorkerTaskException(ErrorType.INTERNAL, "Could not restrict the query engine: " + e.getMessage(), e);
        }
    }

    /** Column names and DuckDB type names of a relation, in order. */
    static List<String[]> describe(Statement st, String relation) throws SQLException {
        List<String[]> cols = new ArrayList<>();
        try (ResultSet rs = st.executeQuery("DESCRIBE " + relation)) {
            while (rs.next()) {
                cols.add(new String[]{rs.getString("column_name"), rs.getString("column_type")});
            }
        }
        return cols;
    }

    static DatasetFormat format(JsonNode node) {
        String f = node == null || node.isNull() ? null : node.asText();
        if (f == null || f.isBlank()) {
            return DatasetFormat.PARQUET;
        }
        return DatasetFormat.valueOf(f);
    }

    static String requireText(JsonNode args, String field) {
        JsonNode n = args.get(field);
        if (n == null || !n.isTextual() || n.asText().isBlank()) {
            throw new WorkerTaskException(ErrorType.INTERNAL, "Missing argument: " + field, null, null);
        }
        return n.asText();
    }

    static ObjectNode object() {
        return NODES.objectNode();
    }

    /** JSON form of a JDBC value. Temporal and nested values become their text rendering. */
    static JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? NODES.textNode(d.toString()) : NODES.numberNode(d);
        }
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite() ? NODES.textNode(f.toString()) : NODES.numberNode(f);
        }
        if (value instanceof BigDecimal bd) {
            return NODES.numberNode(bd);
        }
        if (value instanceof BigInteger bi) {
            return NODES.numberNode(bi);
        }
        return NODES.textNode(value.toString());
    }
}
