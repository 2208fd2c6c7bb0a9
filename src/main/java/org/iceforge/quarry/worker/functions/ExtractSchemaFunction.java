package org.iceforge.quarry.worker.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.worker.WorkerFunction;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Column names, DuckDB types and row count of one local dataset file.
 * <p>
 * Args: {@code {"path": "...", "format": "PARQUET"}}. Result: {@code {"columns": [{"name", "type"}], "rowCount": n}}.
 */
public class ExtractSchemaFunction implements WorkerFunction {

    @Override
    public JsonNode apply(JsonNode args, ObjectMapper mapper) throws SQLException {
        String path = DuckDbSupport.requireText(args, "path");
        try (Connection conn = DuckDbSupport.open(); Statement st = conn.createStatement()) {
            DuckDbSupport.registerView(st, "dataset_view", path, DuckDbSupport.format(args.get("format")));

            ObjectNode out = mapper.createObjectNode();
            ArrayNode columns = out.putArray("columns");
            for (String[] col : DuckDbSupport.describe(st, "dataset_view")) {
                columns.addObject().put("name", col[0]).put("type", col[1]);
            }
            try (ResultSet rs = st.executeQuery("SELECT count(*) FROM dataset_view")) {
                rs.next();
                out.put("rowCount", rs.getLong(1));
            }
            return out;
        }
    }
}
