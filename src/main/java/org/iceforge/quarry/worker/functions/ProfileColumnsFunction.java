package org.iceforge.quarry.worker.functions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.worker.WorkerFunction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;

/**
 * Per-column statistics over the first {@value #SAMPLE_ROWS} rows of a dataset.
 * <p>
 * Every column gets {@code nullCount}, {@code nullPercent} (one decimal) and {@code uniqueCount}
 * (distinct non-null values). Numeric columns add {@code min}, {@code max}, {@code mean} (two
 * decimals); text columns add {@code minLength} and {@code maxLength}.
 */
public class ProfileColumnsFunction implements WorkerFunction {
    static final int SAMPLE_ROWS = 100_000;

    private static final List<String> NUMERIC_PREFIXES = List.of(
            "TINYINT", "SMALLINT", "INTEGER", "BIGINT", "HUGEINT",
            "UTINYINT", "USMALLINT", "UINTEGER", "UBIGINT",
            "FLOAT", "REAL", "DOUBLE", "DECIMAL");

    @Override
    public JsonNode apply(JsonNode args, ObjectMapper mapper) throws SQLException {
        String path = DuckDbSupport.requireText(args, "path");
        try (Connection conn = DuckDbSupport.open(); Statement st = conn.createStatement()) {
            DuckDbSupport.registerView(st, "dataset_view", path, DuckDbSupport.format(args.get("format")));
            st.execute("CREATE TEMP TABLE sampled_rows AS SELECT * FROM dataset_view LIMIT " + SAMPLE_ROWS);

            ObjectNode out = mapper.createObjectNode();
            long sampled;
            try (ResultSet rs = st.executeQuery("SELECT count(*) FROM sampled_rows")) {
                rs.next();
                sampled = rs.getLong(1);
            }
            out.put("sampledRows", sampled);
            ArrayNode profiles = out.putArray("profiles");
            for (String[] col : DuckDbSupport.describe(st, "sampled_rows")) {
                profiles.add(profile(st, col[0], col[1], sampled, mapper));
            }
            return out;
        }
    }

    private static ObjectNode profile(Statement st, String name, String type, long total, ObjectMapper mapper) throws SQLException {
        String c = DuckDbSupport.quoteIdentifier(name);
        String upper = type.toUpperCase(Locale.ROOT);
        boolean numeric = NUMERIC_PREFIXES.stream().anyMatch(upper::startsWith);
        boolean text = upper.startsWith("VARCHAR");

        StringBuilder sql = new StringBuilder("SELECT count(*) - count(").append(c).append("), count(DISTINCT ").append(c).append(")");
        if (numeric) {
            sql.append(", min(").append(c).append("), max(").append(c).append("), avg(").append(c).append(")");
        } else if (text) {
            sql.append(", min(length(").append(c).append(")), max(length(").append(c).append("))");
        }
        sql.append(" FROM sampled_rows");

        ObjectNode p = mapper.createObjectNode();
        p.put("name", name);
        p.put("type", type);
        try (ResultSet rs = st.executeQuery(sql.toString())) {
            rs.next();
            long nulls = rs.getLong(1);
            p.put("nullCount", nulls);
            p.put("nullPercent", total == 0 ? 0.0 : round(nulls * 100.0 / total, 1));
            p.put("uniqueCount", rs.getLong(2));
            if (numeric) {
                p.set("min", DuckDbSupport.toJson(rs.getObject(3)));
                p.set("max", DuckDbSupport.toJson(rs.getObject(4)));
                double mean = rs.getDouble(5);
                if (rs.wasNull()) {
                    p.putNull("mean");
                } else {
                    p.set("mean", DuckDbSupport.toJson(round(mean, 2)));
                }
            } else if (text) {
                p.set("minLength", DuckDbSupport.toJson(rs.getObject(3)));
                p.set("maxLength", DuckDbSupport.toJson(rs.getObject(4)));
            }
        }
        return p;
    }

    private static double round(double v, int scale) {
        if (!Double.isFinite(v)) {
            return v;
        }
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
