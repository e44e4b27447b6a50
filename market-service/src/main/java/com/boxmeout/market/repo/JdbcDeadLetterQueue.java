package com.boxmeout.market.repo;

import com.boxmeout.ledger.reliability.DeadLetterEntry;
import com.boxmeout.ledger.reliability.DeadLetterQueue;
import com.boxmeout.ledger.reliability.DeadLetterStatus;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.boxmeout.market.repo.JdbcTimes.instant;
import static com.boxmeout.market.repo.JdbcTimes.ts;

/**
 * {@link DeadLetterQueue} on the {@code ledger_dead_letters} table, keyed by transaction hash.
 * Runs outside any caller transaction (auto-commit), so an entry survives the caller's rollback.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcDeadLetterQueue implements DeadLetterQueue {

    private static final int MAX_ERROR_LENGTH = 2000;

    private static final RowMapper<DeadLetterEntry> MAPPER = (rs, i) -> new DeadLetterEntry(
            rs.getString("tx_hash"),
            rs.getString("service_name"),
            rs.getString("function_name"),
            rs.getString("params"),
            rs.getString("error"),
            DeadLetterStatus.valueOf(rs.getString("status")),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;
    private final @NonNull ObjectMapper objectMapper;
    private final @NonNull Clock clock;

    @Override
    public void upsert(@NonNull String txHash, @NonNull LedgerOperation operation, String error) {
        Instant now = clock.instant();
        String trimmed = error != null && error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
        if (update(txHash, trimmed, now)) {
            return;
        }
        try {
            jdbcTemplate.update("""
                            INSERT INTO ledger_dead_letters (tx_hash, service_name, function_name, params, error, status,
                                                             created_at, updated_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                            """,
                    txHash, operation.serviceName(), operation.functionName(), paramsJson(operation), trimmed,
                    DeadLetterStatus.FAILED.name(), ts(now), ts(now));
        } catch (DuplicateKeyException e) {
            log.debug("dead letter {} inserted concurrently, updating instead", txHash);
            update(txHash, trimmed, now);
        }
    }

    @Override
    public Optional<DeadLetterEntry> find(String txHash) {
        return jdbcTemplate.query("SELECT * FROM ledger_dead_letters WHERE tx_hash = ?", MAPPER, txHash)
                .stream().findFirst();
    }

    @Override
    public List<DeadLetterEntry> listFailed(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM ledger_dead_letters WHERE status = ? ORDER BY updated_at DESC LIMIT ?",
                MAPPER, DeadLetterStatus.FAILED.name(), Math.max(0, limit));
    }

    @Override
    public boolean markResolved(String txHash) {
        return jdbcTemplate.update("UPDATE ledger_dead_letters SET status = ?, updated_at = ? WHERE tx_hash = ?",
                DeadLetterStatus.RESOLVED.name(), ts(clock.instant()), txHash) == 1;
    }

    private boolean update(String txHash, String error, Instant now) {
        return jdbcTemplate.update("UPDATE ledger_dead_letters SET error = ?, status = ?, updated_at = ? WHERE tx_hash = ?",
                error, DeadLetterStatus.FAILED.name(), ts(now), txHash) == 1;
    }

    private String paramsJson(LedgerOperation operation) {
        try {
            return objectMapper.writeValueAsString(operation.params());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("operation params are not serialisable: " + operation, e);
        }
    }
}
