package org.iceforge.quarry.query;

import org.iceforge.quarry.ErrorType;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Request and response models of {@link QueryService}.
 */
public final class QueryModels {
    private QueryModels() {}

    /**
     * A dataset referenced by a query. The SQL addresses it as {@code tableName}.
     */
    public record DatasetRef(String url, String tableName) {

        /** A reference whose table name is derived from the file name in {@code url}. */
        public static DatasetRef of(String url) {
            return new DatasetRef(url, defaultTableName(url));
        }

        public String effectiveTableName() {
            return tableName == null || tableName.isBlank() ? defaultTableName(url) : tableName;
        }

        static String defaultTableName(String url) {
            String path;
            try {
                path = URI.create(url).getPath();
            } catch (IllegalArgumentException e) {
                path = url;
            }
            if (path == null || path.isEmpty()) {
                path = url;
            }
            String name = path.substring(path.lastIndexOf('/') + 1);
            int dot = name.indexOf('.');
            if (dot > 0) {
                name = name.substring(0, dot);
            }
            name = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
            if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
                name = "t_" + name;
            }
            return name;
        }
    }

    /**
     * @param userId  quota owner; usage is charged to this id
     * @param timeout null for the configured worker task timeout
     */
    public record QueryRequest(
            String sql,
            List<DatasetRef> datasets,
            String userId,
            Duration timeout
    ) {
        public QueryRequest {
            datasets = datasets == null ? List.of() : List.copyOf(datasets);
        }

        public List<String> datasetUrls() {
            return datasets.stream().map(DatasetRef::url).toList();
        }
    }

    /** One dataset that could not be made available to a query. */
    public record DatasetFailure(String url, ErrorType errorType, String message) {}

    public record ColumnSchema(String name, String type) {}

    public record DatasetSchema(String url, List<ColumnSchema> columns, long rowCount) {}

    /**
     * Statistics of one column. Numeric columns carry {@code min/max/mean}, text columns
     * {@code minLength/maxLength}; the other pair is null.
     */
    public record ColumnProfile(
            String name,
            String type,
            long nullCount,
            double nullPercent,
            long uniqueCount,
            Double min,
            Double max,
            Double mean,
            Long minLength,
            Long maxLength
    ) {}

    public record DatasetProfile(String url, long sampledRows, List<ColumnProfile> profiles) {}
}
