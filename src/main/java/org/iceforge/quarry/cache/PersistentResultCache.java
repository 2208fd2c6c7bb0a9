package org.iceforge.quarry.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tier 2: query results kept in the {@code query_results_cache} table so they outlive the
 * process. Timestamps are epoch milliseconds.
 * <p>
 * This tier never fails a query: read errors count as a miss, write errors are logged and
 * dropped.
 */
public class PersistentResultCache {
    private static final Logger logger = LoggerFactory.getLogger(PersistentResultCache.class);

    static final String TABLE = "query_results_cache";

    private static final String DDL = "CREATE TABLE IF NOT EXISTS query_results_cache ("
            + "cache_key VARCHAR(64) PRIMARY KEY, "
            + "sql_query CLOB NOT NULL, "
            + "dataset_urls CLOB NOT NULL, "
            + "result_json CLOB NOT NULL, "
            + "row_count BIGINT, "
            + "created_at BIGINT NOT NULL, "
            + "expires_at BIGINT NOT NULL)";
    private static final String INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_query_results_cache_created ON query_results_cache(created_at)";

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public PersistentResultCache(DataSource dataSource, ObjectMapper mapper, Duration ttl, int maxEntries, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Creates the table if it does not exist yet. */
    public void initializeSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(DDL);
            st.execute(INDEX_DDL);
            logger.info("Persistent result cache ready (ttl={}, maxEntries={})", ttl, maxEntries);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create table " + TABLE + ": " + e.getMessage(), e);
        }
    }

    /** Returns the stored result, deleting it instead when it has expired. */
    public Optional<QueryResult> get(CacheKey key) {
        long now = clock.millis();
        try (Connection conn = dataSource.getConnection()) {
            String json;
            long expiresAt;
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT result_json, expires_at FROM query_results_cache WHERE cache_key = ?")) {
                ps.setString(1, key.value());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    json = rs.getString(1);
                    expiresAt = rs.getLong(2);
                }
            }
            if (expiresAt <= now) {
                delete(conn, key);
                logger.debug("Persistent cache entry {} expired", key);
                return Optional.empty();
            }
            try {
                return Optional.of(mapper.readValue(json, QueryResult.class));
            } catch (JsonProcessingException e) {
                logger.warn("Dropping unreadable persistent cache entry {}: {}", key, e.getOriginalMessage());
                delete(conn, key);
                return Optional.empty();
            }
        } catch (SQLException e) {
            logger.warn("Persistent cache read failed for {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Upserts a successful outcome, then trims the table to {@code maxEntries} by dropping the
     * oldest rows. Failures are skipped.
     */
    public void put(CacheKey key, String sql, Collection<String> datasetUrls, QueryOutcome outcome) {
        Objects.requireNonNull(key, "key");
        if (outcome == null || !outcome.isSuccess()) {
            return;
        }
        try {
            write(key, sql, datasetUrls, outcome.result().withCached(false));
        } catch (CacheWriteException e) {
            logger.warn("Skipped persistent cache write for {}: {}", key, e.getMessage(), e.getCause());
        }
    }

    private void write(CacheKey key, String sql, Collection<String> datasetUrls, QueryResult result) {
        String json;
        try {
            json = mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new CacheWriteException("result is not serializable", e);
        }
        long now = clock.millis();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("MERGE INTO query_results_cache "
                    + "(cache_key, sql_query, dataset_urls, result_json, row_count, created_at, expires_at) "
                    + "KEY (cache_key) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, key.value());
                ps.setString(2, sql == null ? "" : sql.trim());
                ps.setString(3, String.join("|", CacheKey.sortedUrls(datasetUrls)));
                ps.setString(4, json);
                ps.setLong(5, result.totalRows());
                ps.setLong(6, now);
                ps.setLong(7, now + ttl.toMillis());
                ps.executeUpdate();
            }
            int evicted = evictOverflow(conn);
            if (evicted > 0) {
                logger.info("Persistent cache over capacity; evicted {} oldest entries", evicted);
            }
        } catch (SQLException e) {
            throw new CacheWriteException("database write failed: " + e.getMessage(), e);
        }
    }

    private int evictOverflow(Connection conn) throws SQLException {
        long count = count(conn);
        if (count <= maxEntries) {
            return 0;
        }
        List<String> oldest = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT cache_key FROM query_results_cache ORDER BY created_at, cache_key FETCH FIRST ? ROWS ONLY")) {
            ps.setLong(1, count - maxEntries);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    oldest.add(rs.getString(1));
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM query_results_cache WHERE cache_key = ?")) {
            for (String k : oldest) {
                ps.setString(1, k);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return oldest.size();
    }

    /**
     * Deletes every expired row.
     *
     * @return number of rows removed, 0 when the store is unavailable
     */
    public int cleanup() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM query_results_cache WHERE expires_at <= ?")) {
            ps.setLong(1, clock.millis());
            int removed = ps.executeUpdate();
            if (removed > 0) {
                logger.info("Removed {} expired persistent cache entries", removed);
            }
            return removed;
        } catch (SQLException e) {
            logger.warn("Persistent cache cleanup failed", e);
            return 0;
        }
    }

    public PersistentCacheStats stats() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT COUNT(*), MIN(created_at), MAX(created_at) FROM query_results_cache")) {
            rs.next();
            long size = rs.getLong(1);
            if (size == 0) {
                return new PersistentCacheStats(0, null, null);
            }
            return new PersistentCacheStats(size, Instant.ofEpochMilli(rs.getLong(2)), Instant.ofEpochMilli(rs.getLong(3)));
        } catch (SQLException e) {
            logger.warn("Persistent cache stats unavailable", e);
            return new PersistentCacheStats(0, null, null);
        }
    }

    /** Removes every row. */
    public void clear() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM query_results_cache");
        } catch (SQLException e) {
            logger.warn("Persistent cache clear failed", e);
        }
    }

    private static long count(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM query_results_cache")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void delete(Connection conn, CacheKey key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM query_results_cache WHERE cache_key = ?")) {
            ps.setString(1, key.value());
            ps.executeUpdate();
        }
    }
}
