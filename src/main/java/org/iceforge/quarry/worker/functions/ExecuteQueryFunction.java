package org.iceforge.quarry.worker.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.worker.WorkerFunction;
import org.iceforge.quarry.worker.WorkerTaskException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one SQL statement over local dataset files.
 * <p>
 * Args: {@code {"sql": "...", "datasets": [{"tableName": "t", "path": "/abs/file", "format": "PARQUET"}]}}.
 * Result: {@code {"columns": [...], "rows": [{...}], "totalRows": n, "executionTimeMs": x, "limitApplied": b}}
 * with at most {@link SqlLimits#MAX_RESULT_ROWS} rows. SQL failures are reported with
 * {@code errorType = sql} and the available column names under {@code context.availableColumns}.
 * <p>
 * Only SELECT and WITH statements run. Datasets are loaded into the task's database before the
 * statement, after which the connection can no longer touch files: the statement sees its
 * datasets and nothing else on disk. Result column names must be unique.
 */
public class ExecuteQueryFunction implements WorkerFunction {

    @Override
    public JsonNode apply(JsonNode args, ObjectMapper mapper) throws SQLException {
        long start = System.nanoTime();
        String sql = DuckDbSupport.requireText(args, "sql");
        if (!SqlLimits.isSelect(sql)) {
            String raw = "Statement type is not supported: only SELECT and WITH queries can run";
            throw new WorkerTaskException(ErrorType.SQL, "SQL execution error: " + raw, raw, null);
        }
        String effectiveSql = SqlLimits.applyAutoLimit(sql, SqlLimits.AUTO_LIMIT);
        boolean limitApplied = !effectiveSql.equals(sql);

        try (Connection conn = DuckDbSupport.open(); Statement st = conn.createStatement()) {
            List<String> tables = new ArrayList<>();
            for (JsonNode ds : args.path("datasets")) {
                String table = DuckDbSupport.requireText(ds, "tableName");
                DuckDbSupport.loadTable(st, table, DuckDbSupport.requireText(ds, "path"), DuckDbSupport.format(ds.get("format")));
                tables.add(table);
            }
            DuckDbSupport.lockDown(st);

            ObjectNode out = mapper.createObjectNode();
            try (ResultSet rs = st.executeQuery(effectiveSql)) {
                ResultSetMetaData md = rs.getMetaData();
                int n = md.getColumnCount();
                ArrayNode columns = out.putArray("columns");
                Set<String> seen = new HashSet<>();
                for (int i = 1; i <= n; i++) {
                    String label = md.getColumnLabel(i);
                    if (!seen.add(label)) {
                        String raw = "Duplicate column name \"" + label + "\" in query result";
                        throw new WorkerTaskException(ErrorType.SQL, "SQL execution error: " + raw, raw, null);
                    }
                    columns.add(label);
                }
                ArrayNode rows = out.putArray("rows");
                long total = 0;
                while (rs.next()) {
                    if (total < SqlLimits.MAX_RESULT_ROWS) {
                        ObjectNode row = rows.addObject();
                        for (int i = 1; i <= n; i++) {
                            row.set(md.getColumnLabel(i), DuckDbSupport.toJson(rs.getObject(i)));
                        }
                    }
                    total++;
                }
                out.put("totalRows", total);
            } catch (SQLException e) {
                ObjectNode context = mapper.createObjectNode();
                ArrayNode available = context.putArray("availableColumns");
                try {
                    availableColumns(st, tables).forEach(available::add);
                } catch (SQLException describeFailure) {
                    e.addSuppressed(describeFailure);
                }
                context.put("executionTimeMs", elapsedMs(start));
                WorkerTaskException failure = new WorkerTaskException(ErrorType.SQL, "SQL execution error: " + e.getMessage(), e.getMessage(), context);
                failure.initCause(e);
                throw failure;
            }
            out.put("executionTimeMs", elapsedMs(start));
            out.put("limitApplied", limitApplied);
            return out;
        }
    }

    private static List<String> availableColumns(Statement st, List<String> tables) throws SQLException {
        List<String> names = new ArrayList<>();
        for (String t : tables) {
            for (String[] col : DuckDbSupport.describe(st, DuckDbSupport.quoteIdentifier(t))) {
                names.add(col[0]);
            }
        }
        return names;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
