package com.boxmeout.market.repo;

import com.boxmeout.ledger.reliability.DeadLetterEntry;
import com.boxmeout.ledger.reliability.DeadLetterStatus;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.boxmeout.market.MarketTestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcDeadLetterQueueTest {

    private static final LedgerOperation BUY = new LedgerOperation("amm", "buy_shares",
            Map.of("marketId", "m-1", "outcome", 1));

    private MarketTestDatabase db;
    private JdbcDeadLetterQueue queue;

    @BeforeEach
    void setUp() {
        db = new MarketTestDatabase();
        queue = new JdbcDeadLetterQueue(db.jdbcTemplate, new ObjectMapper(), db.clock);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void shouldKeepOneEntryPerHashWithLatestError() {
        queue.upsert("hash-1", BUY, "timeout");
        queue.upsert("hash-1", BUY, "rejected: tx_bad_seq");

        DeadLetterEntry entry = queue.find("hash-1").orElseThrow();
        assertThat(entry.error()).isEqualTo("rejected: tx_bad_seq");
        assertThat(entry.status()).isEqualTo(DeadLetterStatus.FAILED);
        assertThat(entry.serviceName()).isEqualTo("amm");
        assertThat(entry.functionName()).isEqualTo("buy_shares");
        assertThat(entry.params()).contains("\"marketId\":\"m-1\"");
        assertThat(queue.listFailed(10)).hasSize(1);
    }

    @Test
    void shouldTruncateLongErrors() {
        queue.upsert("hash-2", BUY, "x".repeat(5000));

        assertThat(queue.find("hash-2").orElseThrow().error()).hasSize(2000);
    }

    @Test
    void shouldDropResolvedEntriesFromFailedList() {
        queue.upsert("hash-3", BUY, "timeout");
        queue.upsert("hash-4", BUY, "timeout");

        assertThat(queue.markResolved("hash-3")).isTrue();
        assertThat(queue.markResolved("unknown")).isFalse();

        assertThat(queue.listFailed(10)).extracting(DeadLetterEntry::txHash).containsExactly("hash-4");
        assertThat(queue.find("hash-3").orElseThrow().status()).isEqualTo(DeadLetterStatus.RESOLVED);
    }
}
