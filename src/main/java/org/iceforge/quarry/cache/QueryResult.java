package org.iceforge.quarry.cache;

import java.util.List;
import java.util.Map;

/**
 * Successful query payload: the column names in select order, up to the row cap as
 * column-to-value maps, and the number of rows the statement actually produced.
 *
 * @param cached true when served from either cache tier rather than executed
 */
public record QueryResult(
        List<String> columns,
        List<Map<String, Object>> rows,
        long totalRows,
        double executionTimeMs,
        boolean limitApplied,
        boolean cached
) {
    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public QueryResult withCached(boolean cached) {
        return cached == this.cached ? this : new QueryResult(columns, rows, totalRows, executionTimeMs, limitApplied, cached);
    }

    public int rowCount() {
        return rows.size();
    }
}
