package com.roundpilot.core.persistence;

import com.roundpilot.core.model.Earnings;
import com.roundpilot.core.model.RoundRecord;
import com.roundpilot.core.model.RoundSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC {@link RoundStore} over three tables: {@code rounds}, {@code round_snapshots}
 * and {@code round_earnings}.
 * <p>
 * Rows are keyed by the client-generated round id, so a group is written with plain
 * JDBC batches and no generated-key round trips. Each group runs under its own
 * savepoint inside the flush transaction: a failing group is rolled back to its
 * savepoint and retried one record at a time.
 * <p>
 * The SQL sticks to what H2 and PostgreSQL both accept. Tables are created by
 * {@link #createTables()}.
 */
public class JdbcRoundStore implements RoundStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRoundStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS rounds (
                round_id      VARCHAR(36) PRIMARY KEY,
                source_id     VARCHAR(100) NOT NULL,
                final_score   DOUBLE PRECISION NOT NULL,
                total_win     DOUBLE PRECISION,
                total_players INTEGER,
                ended_at      TIMESTAMP NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT chk_rounds_score CHECK (final_score >= 1.0),
                CONSTRAINT chk_rounds_players CHECK (total_players >= 0)
            )
            """,
            """
            CREATE INDEX IF NOT EXISTS idx_rounds_source ON rounds (source_id, ended_at)
            """,
            """
            CREATE TABLE IF NOT EXISTS round_snapshots (
                round_id    VARCHAR(36) NOT NULL REFERENCES rounds (round_id),
                seq         INTEGER NOT NULL,
                score       DOUBLE PRECISION NOT NULL,
                players     INTEGER,
                players_win DOUBLE PRECISION,
                captured_at TIMESTAMP NOT NULL,
                PRIMARY KEY (round_id, seq)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS round_earnings (
                round_id  VARCHAR(36) PRIMARY KEY REFERENCES rounds (round_id),
                stake     DOUBLE PRECISION NOT NULL,
                auto_stop DOUBLE PRECISION NOT NULL,
                balance   DOUBLE PRECISION
            )
            """);

    private static final String INSERT_ROUND_SQL = """
            INSERT INTO rounds (round_id, source_id, final_score, total_win, total_players, ended_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_SNAPSHOT_SQL = """
            INSERT INTO round_snapshots (round_id, seq, score, players, players_win, captured_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_EARNINGS_SQL = """
            INSERT INTO round_earnings (round_id, stake, auto_stop, balance)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SUMMARY_SQL = """
            SELECT r.source_id,
                   COUNT(*) AS rounds,
                   SUM(CASE WHEN r.final_score > e.auto_stop THEN 1 ELSE 0 END) AS wins
            FROM rounds r
            JOIN round_earnings e ON e.round_id = r.round_id
            GROUP BY r.source_id
            ORDER BY r.source_id
            """;

    private static final String LAST_BALANCE_SQL = """
            SELECT e.balance
            FROM rounds r
            JOIN round_earnings e ON e.round_id = r.round_id
            WHERE r.source_id = ?
            ORDER BY r.ended_at DESC
            LIMIT 1
            """;

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM %s";

    private final DataSource dataSource;
    private volatile boolean closed;

    public JdbcRoundStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the round tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Round tables ensured");
        }
    }

    @Override
    public WriteResult write(Map<String, List<RoundRecord>> groups) {
        if (closed) {
            throw new PersistenceWriteException("Round store is closed");
        }
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int stored = 0;
                int failed = 0;
                for (var group : groups.entrySet()) {
                    WriteResult result = writeGroup(conn, group.getKey(), group.getValue());
                    stored += result.stored();
                    failed += result.failed();
                }
                conn.commit();
                return new WriteResult(stored, failed);
            } catch (SQLException e) {
                conn.rollback();
                throw new PersistenceWriteException("Flush transaction failed: " + e.getMessage(), e);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceWriteException("Database unavailable: " + e.getMessage(), e);
        }
    }

    private WriteResult writeGroup(Connection conn, String sourceId, List<RoundRecord> records) throws SQLException {
        Savepoint group = conn.setSavepoint();
        try {
            insert(conn, records);
            return new WriteResult(records.size(), 0);
        } catch (SQLException e) {
            conn.rollback(group);
            log.warn("Bulk write of {} rounds for {} failed ({}), retrying individually",
                    records.size(), sourceId, e.getMessage());
        }

        int stored = 0;
        int failed = 0;
        for (RoundRecord record : records) {
            Savepoint single = conn.setSavepoint();
            try {
                insert(conn, List.of(record));
                stored++;
            } catch (SQLException e) {
                conn.rollback(single);
                failed++;
                log.error("Dropping round {} for {}: {}", record.roundId(), sourceId, e.getMessage());
            }
        }
        return new WriteResult(stored, failed);
    }

    private void insert(Connection conn, List<RoundRecord> records) throws SQLException {
        try (PreparedStatement rounds = conn.prepareStatement(INSERT_ROUND_SQL);
             PreparedStatement snapshots = conn.prepareStatement(INSERT_SNAPSHOT_SQL);
             PreparedStatement earnings = conn.prepareStatement(INSERT_EARNINGS_SQL)) {
            int snapshotRows = 0;
            for (RoundRecord record : records) {
                rounds.setString(1, record.roundId());
                rounds.setString(2, record.sourceId());
                rounds.setDouble(3, record.finalScore());
                rounds.setDouble(4, record.totalWin());
                rounds.setInt(5, record.totalPlayerCount());
                rounds.setTimestamp(6, Timestamp.from(record.endedAt()));
                rounds.addBatch();

                int seq = 0;
                for (RoundSnapshot snapshot : record.snapshots()) {
                    snapshots.setString(1, record.roundId());
                    snapshots.setInt(2, seq++);
                    snapshots.setDouble(3, snapshot.score());
                    snapshots.setInt(4, snapshot.players());
                    snapshots.setDouble(5, snapshot.playersWin());
                    snapshots.setTimestamp(6, Timestamp.from(snapshot.capturedAt()));
                    snapshots.addBatch();
                    snapshotRows++;
                }

                Earnings e = record.earnings();
                earnings.setString(1, record.roundId());
                earnings.setDouble(2, e.stake());
                earnings.setDouble(3, e.autoStop());
                earnings.setDouble(4, e.balance());
                earnings.addBatch();
            }
            rounds.executeBatch();
            if (snapshotRows > 0) {
                snapshots.executeBatch();
            }
            earnings.executeBatch();
        }
    }

    @Override
    public List<SourceSummary> summarize() {
        var summaries = new ArrayList<SourceSummary>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SUMMARY_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String sourceId = rs.getString("source_id");
                summaries.add(new SourceSummary(
                        sourceId,
                        rs.getLong("rounds"),
                        rs.getLong("wins"),
                        lastBalance(conn, sourceId)));
            }
        } catch (SQLException e) {
            throw new PersistenceWriteException("Failed to summarize rounds: " + e.getMessage(), e);
        }
        return summaries;
    }

    private double lastBalance(Connection conn, String sourceId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LAST_BALANCE_SQL)) {
            stmt.setString(1, sourceId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : 0.0;
            }
        }
    }

    /**
     * Row count of one of the round tables.
     */
    public long count(String table) {
        if (!List.of("rounds", "round_snapshots", "round_earnings").contains(table)) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL.formatted(table));
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PersistenceWriteException("Failed to count " + table + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks that a connection can be obtained and is valid.
     */
    public boolean isReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.debug("Database not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Round store closed");
        }
    }
}
