package com.roundpilot.core.persistence;

import com.roundpilot.core.model.Earnings;
import com.roundpilot.core.model.RoundRecord;
import com.roundpilot.core.model.RoundSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store against an in-memory H2 database.
 */
class JdbcRoundStoreTest {

    private JdbcRoundStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:rounds-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        store = new JdbcRoundStore(dataSource);
        store.createTables();
    }

    private static RoundRecord record(String sourceId, double finalScore, double balance, Instant endedAt) {
        var snapshots = List.of(
                new RoundSnapshot(1.1, 40, 120.0, endedAt.minusSeconds(3)),
                new RoundSnapshot(1.6, 31, 480.0, endedAt.minusSeconds(1)));
        return new RoundRecord(UUID.randomUUID().toString(), sourceId, finalScore, 900.0, 40,
                snapshots, new Earnings(25, 2.0, balance), endedAt);
    }

    private static Map<String, List<RoundRecord>> groups(RoundRecord... records) {
        var groups = new LinkedHashMap<String, List<RoundRecord>>();
        for (RoundRecord r : records) {
            groups.computeIfAbsent(r.sourceId(), k -> new java.util.ArrayList<>()).add(r);
        }
        return groups;
    }

    @Nested
    @DisplayName("write")
    class WriteTests {

        @Test
        @DisplayName("stores rounds, snapshots and earnings")
        void storesAllTables() {
            Instant now = Instant.now();
            var result = store.write(groups(
                    record("Alpha", 1.5, 975, now),
                    record("Beta", 3.2, 1100, now),
                    record("Alpha", 2.4, 1025, now.plusSeconds(10))));

            assertEquals(new RoundStore.WriteResult(3, 0), result);
            assertEquals(3, store.count("rounds"));
            assertEquals(6, store.count("round_snapshots"));
            assertEquals(3, store.count("round_earnings"));
        }

        @Test
        @DisplayName("a bad record is dropped while the rest of its group is stored")
        void individualRetry() {
            Instant now = Instant.now();
            var result = store.write(groups(
                    record("Alpha", 1.5, 975, now),
                    record("Alpha", 0.5, 975, now),
                    record("Alpha", 4.0, 1050, now),
                    record("Beta", 1.9, 990, now)));

            assertEquals(new RoundStore.WriteResult(3, 1), result);
            assertEquals(3, store.count("rounds"));
            assertEquals(3, store.count("round_earnings"));
            assertEquals(6, store.count("round_snapshots"));
        }

        @Test
        @DisplayName("a duplicate round id is dropped")
        void duplicateId() {
            var r = record("Alpha", 1.5, 975, Instant.now());
            store.write(groups(r));
            var result = store.write(groups(r));
            assertEquals(new RoundStore.WriteResult(0, 1), result);
            assertEquals(1, store.count("rounds"));
        }

        @Test
        @DisplayName("writing after close fails")
        void closed() {
            store.close();
            assertThrows(PersistenceWriteException.class,
                    () -> store.write(groups(record("Alpha", 1.5, 975, Instant.now()))));
        }
    }

    @Nested
    @DisplayName("summarize")
    class SummarizeTests {

        @Test
        @DisplayName("counts rounds and wins per source with the latest balance")
        void summary() {
            Instant now = Instant.now();
            store.write(groups(
                    record("Alpha", 1.5, 975, now),
                    record("Alpha", 2.4, 1025, now.plusSeconds(10)),
                    record("Alpha", 2.0, 1000, now.plusSeconds(20)),
                    record("Beta", 3.2, 1100, now)));

            var summaries = store.summarize();

            assertEquals(List.of(
                    new RoundStore.SourceSummary("Alpha", 3, 1, 1000.0),
                    new RoundStore.SourceSummary("Beta", 1, 1, 1100.0)), summaries);
        }

        @Test
        @DisplayName("empty store yields no summaries")
        void empty() {
            assertTrue(store.summarize().isEmpty());
        }
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws Exception {
        store.createTables();
        assertEquals(0, store.count("rounds"));
    }

    @Test
    @DisplayName("count rejects unknown tables")
    void countWhitelist() {
        assertThrows(IllegalArgumentException.class, () -> store.count("rounds; DROP TABLE rounds"));
    }

    @Test
    @DisplayName("reports the database as reachable")
    void reachable() {
        assertTrue(store.isReachable());
    }
}
