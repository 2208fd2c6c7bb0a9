package org.iceforge.quarry.support;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/** Writes small dataset files with DuckDB. */
public final class DuckDbFixtures {
    private DuckDbFixtures() {}

    public static Path parquet(Path target, String selectSql) throws SQLException {
        return copy(target, selectSql, "(FORMAT PARQUET)");
    }

    public static Path csv(Path target, String selectSql) throws SQLException {
        return copy(target, selectSql, "(FORMAT CSV, HEADER)");
    }

    private static Path copy(Path target, String selectSql, String options) throws SQLException {
        try (Connection c = DriverManager.getConnection("jdbc:duckdb:"); Statement st = c.createStatement()) {
            st.execute("COPY (" + selectSql + ") TO '" + target.toString().replace("'", "''") + "' " + options);
        }
        return target;
    }

    /** 25 rows: id 1..25, city cycling through three names, fare = id * 1.5, tip null on every fifth row. */
    public static String tripsSelect() {
        return "SELECT i AS id, "
                + "CASE i % 3 WHEN 0 THEN 'Oslo' WHEN 1 THEN 'Lima' ELSE 'Kyoto' END AS city, "
                + "CAST(i * 1.5 AS DOUBLE) AS fare, "
                + "CASE WHEN i % 5 = 0 THEN NULL ELSE i % 4 END AS tip "
                + "FROM range(1, 26) t(i)";
    }
}
