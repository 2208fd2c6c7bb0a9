package org.iceforge.quarry.dataset;

import org.iceforge.quarry.filecache.CacheFileNames;

/**
 * Container formats understood by the query engine, inferred from the URL path suffix.
 */
public enum DatasetFormat {
    PARQUET(".parquet"),
    CSV(".csv"),
    CSV_GZ(".csv.gz"),
    TSV(".tsv");

    private final String suffix;

    DatasetFormat(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static DatasetFormat fromUrl(String url) {
        return fromSuffix(CacheFileNames.suffixFor(url));
    }

    public static DatasetFormat fromSuffix(String suffix) {
        for (DatasetFormat f : values()) {
            if (f.suffix.equalsIgnoreCase(suffix)) {
                return f;
            }
        }
        return PARQUET;
    }

    /**
     * DuckDB table function reading {@code path}. The path must already be a quoted SQL literal.
     */
    public String scanExpression(String quotedPath) {
        return switch (this) {
            case PARQUET -> "read_parquet(" + quotedPath + ")";
            case CSV, CSV_GZ -> "read_csv_auto(" + quotedPath + ")";
            case TSV -> "read_csv_auto(" + quotedPath + ", delim='\\t')";
        };
    }
}
