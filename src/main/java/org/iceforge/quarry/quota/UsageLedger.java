package org.iceforge.quarry.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only {@code token_usage} table. Rows are never updated; the quota window is applied
 * at read time.
 */
public class UsageLedger {
    private static final Logger logger = LoggerFactory.getLogger(UsageLedger.class);

    private static final String DDL = "CREATE TABLE IF NOT EXISTS token_usage ("
            + "id VARCHAR(36) PRIMARY KEY, "
            + "user_id VARCHAR(255) NOT NULL, "
            + "input_tokens BIGINT NOT NULL, "
            + "output_tokens BIGINT NOT NULL, "
            + "recorded_at BIGINT NOT NULL)";
    private static final String INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_token_usage_user_time ON token_usage(user_id, recorded_at)";

    private final DataSource dataSource;

    public UsageLedger(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public void initializeSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(DDL);
            st.execute(INDEX_DDL);
            logger.info("Token usage ledger ready");
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create table token_usage: " + e.getMessage(), e);
        }
    }

    public UsageRecord append(String userId, long inputTokens, long outputTokens, Instant at) {
        UsageRecord record = new UsageRecord(UUID.randomUUID().toString(), userId, inputTokens, outputTokens, at);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT INTO token_usage (id, user_id, input_tokens, output_tokens, recorded_at) VALUES (?, ?, ?, ?, ?)")) {
            ps.setString(1, record.id());
            ps.setString(2, userId);
            ps.setLong(3, inputTokens);
            ps.setLong(4, outputTokens);
            ps.setLong(5, at.toEpochMilli());
            ps.executeUpdate();
            return record;
        } catch (SQLException e) {
            throw new UsageLedgerException("Failed to record usage for " + userId, e);
        }
    }

    /** Sums tokens recorded strictly after {@code since}. */
    public WindowUsage usageSince(String userId, Instant since) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT COALESCE(SUM(input_tokens + output_tokens), 0), MIN(recorded_at) "
                             + "FROM token_usage WHERE user_id = ? AND recorded_at > ?")) {
            ps.setString(1, userId);
            ps.setLong(2, since.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return WindowUsage.NONE;
                }
                long tokens = rs.getLong(1);
                long oldest = rs.getLong(2);
                return rs.wasNull() ? WindowUsage.NONE : new WindowUsage(tokens, Instant.ofEpochMilli(oldest));
            }
        } catch (SQLException e) {
            throw new UsageLedgerException("Failed to read usage for " + userId, e);
        }
    }

    /** Records of {@code userId} after {@code since}, oldest first. */
    public List<UsageRecord> recordsSince(String userId, Instant since) {
        List<UsageRecord> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT id, input_tokens, output_tokens, recorded_at FROM token_usage "
                             + "WHERE user_id = ? AND recorded_at > ? ORDER BY recorded_at, id")) {
            ps.setString(1, userId);
            ps.setLong(2, since.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new UsageRecord(rs.getString(1), userId, rs.getLong(2), rs.getLong(3),
                            Instant.ofEpochMilli(rs.getLong(4))));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new UsageLedgerException("Failed to list usage for " + userId, e);
        }
    }
}
