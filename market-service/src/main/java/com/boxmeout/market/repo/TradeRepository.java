package com.boxmeout.market.repo;

import com.boxmeout.market.model.Trade;
import com.boxmeout.market.model.TradeStatus;
import com.boxmeout.market.model.TradeType;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.boxmeout.market.repo.JdbcTimes.instant;
import static com.boxmeout.market.repo.JdbcTimes.ts;

/**
 * Trades are never deleted. Status leaves PENDING exactly once, through {@link #confirm} or {@link #markFailed}.
 */
@RequiredArgsConstructor
public class TradeRepository {

    private static final int MAX_REASON_LENGTH = 1000;

    private static final RowMapper<Trade> MAPPER = (rs, i) -> new Trade(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("market_id"),
            TradeType.valueOf(rs.getString("trade_type")),
            rs.getInt("outcome"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("price_per_unit"),
            rs.getBigDecimal("total_amount"),
            rs.getBigDecimal("fee_amount"),
            rs.getString("tx_hash"),
            TradeStatus.valueOf(rs.getString("status")),
            rs.getString("failure_reason"),
            instant(rs, "created_at"),
            instant(rs, "confirmed_at")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;

    public void insert(@NonNull Trade t) {
        jdbcTemplate.update("""
                INSERT INTO trades (id, user_id, market_id, trade_type, outcome, quantity, price_per_unit, total_amount,
                                    fee_amount, tx_hash, status, failure_reason, created_at, confirmed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                t.id(), t.userId(), t.marketId(), t.type().name(), t.outcome(), t.quantity(), t.pricePerUnit(),
                t.totalAmount(), t.feeAmount(), t.txHash(), t.status().name(), t.failureReason(),
                ts(t.createdAt()), ts(t.confirmedAt()));
    }

    public Optional<Trade> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM trades WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public Optional<Trade> findByTxHash(String txHash) {
        return jdbcTemplate.query("SELECT * FROM trades WHERE tx_hash = ?", MAPPER, txHash).stream().findFirst();
    }

    public List<Trade> findByUserAndMarket(String userId, String marketId) {
        return jdbcTemplate.query(
                "SELECT * FROM trades WHERE user_id = ? AND market_id = ? ORDER BY created_at",
                MAPPER, userId, marketId);
    }

    public List<Trade> findPendingCreatedBefore(Instant cutoff, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM trades WHERE status = ? AND tx_hash IS NOT NULL AND created_at <= ? ORDER BY created_at LIMIT ?",
                MAPPER, TradeStatus.PENDING.name(), ts(cutoff), limit);
    }

    /**
     * PENDING to CONFIRMED with the ledger-reported figures. Returns false if the trade was not PENDING.
     */
    public boolean confirm(String id, BigDecimal quantity, BigDecimal pricePerUnit, BigDecimal totalAmount,
                           BigDecimal feeAmount, Instant at) {
        return jdbcTemplate.update("""
                        UPDATE trades SET status = ?, quantity = ?, price_per_unit = ?, total_amount = ?, fee_amount = ?,
                                          confirmed_at = ?
                        WHERE id = ? AND status = ?
                        """,
                TradeStatus.CONFIRMED.name(), quantity, pricePerUnit, totalAmount, feeAmount, ts(at),
                id, TradeStatus.PENDING.name()) == 1;
    }

    public boolean markFailed(String id, String reason) {
        String trimmed = reason != null && reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
        return jdbcTemplate.update("UPDATE trades SET status = ?, failure_reason = ? WHERE id = ? AND status = ?",
                TradeStatus.FAILED.name(), trimmed, id, TradeStatus.PENDING.name()) == 1;
    }
}
