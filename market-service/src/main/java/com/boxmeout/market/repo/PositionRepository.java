package com.boxmeout.market.repo;

import com.boxmeout.market.model.Position;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.boxmeout.market.repo.JdbcTimes.instant;
import static com.boxmeout.market.repo.JdbcTimes.ts;

@RequiredArgsConstructor
public class PositionRepository {

    private static final RowMapper<Position> MAPPER = (rs, i) -> new Position(
            rs.getString("id"),
            rs.getString("user_id"),
            rs.getString("market_id"),
            rs.getInt("outcome"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("cost_basis"),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("current_value"),
            rs.getBigDecimal("unrealized_pnl"),
            rs.getBigDecimal("realized_pnl"),
            rs.getBigDecimal("sold_quantity"),
            instant(rs, "sold_at"),
            rs.getObject("is_winner", Boolean.class),
            rs.getBigDecimal("settlement_pnl"),
            instant(rs, "settled_at"),
            instant(rs, "claimed_at")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;
    private final @NonNull Clock clock;

    public Optional<Position> find(String userId, String marketId, int outcome) {
        return jdbcTemplate.query(
                "SELECT * FROM positions WHERE user_id = ? AND market_id = ? AND outcome = ?",
                MAPPER, userId, marketId, outcome).stream().findFirst();
    }

    /**
     * Row-locks the position for the rest of the current transaction.
     */
    public Optional<Position> lock(String userId, String marketId, int outcome) {
        return jdbcTemplate.query(
                "SELECT * FROM positions WHERE user_id = ? AND market_id = ? AND outcome = ? FOR UPDATE",
                MAPPER, userId, marketId, outcome).stream().findFirst();
    }

    public List<Position> findByUserAndMarket(String userId, String marketId) {
        return jdbcTemplate.query(
                "SELECT * FROM positions WHERE user_id = ? AND market_id = ? ORDER BY outcome",
                MAPPER, userId, marketId);
    }

    /**
     * Positions still holding shares that have not been through settlement.
     */
    public List<Position> findUnsettledByMarket(String marketId) {
        return jdbcTemplate.query(
                "SELECT * FROM positions WHERE market_id = ? AND settled_at IS NULL AND quantity > 0 ORDER BY user_id, outcome",
                MAPPER, marketId);
    }

    public void insert(@NonNull Position p) {
        Instant now = clock.instant();
        jdbcTemplate.update("""
                INSERT INTO positions (id, user_id, market_id, outcome, quantity, cost_basis, entry_price, current_value,
                                       unrealized_pnl, realized_pnl, sold_quantity, sold_at, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                p.id(), p.userId(), p.marketId(), p.outcome(), p.quantity(), p.costBasis(), p.entryPrice(),
                p.currentValue(), p.unrealizedPnl(), p.realizedPnl(), p.soldQuantity(), ts(p.soldAt()), ts(now), ts(now));
    }

    /**
     * Writes the holding columns (quantity, cost, value, PnL, sold figures) of an existing position.
     */
    public void updateHolding(@NonNull Position p) {
        jdbcTemplate.update("""
                UPDATE positions SET quantity = ?, cost_basis = ?, entry_price = ?, current_value = ?, unrealized_pnl = ?,
                                     realized_pnl = ?, sold_quantity = ?, sold_at = ?, updated_at = ?
                WHERE id = ?
                """,
                p.quantity(), p.costBasis(), p.entryPrice(), p.currentValue(), p.unrealizedPnl(),
                p.realizedPnl(), p.soldQuantity(), ts(p.soldAt()), ts(clock.instant()), p.id());
    }

    /**
     * Stamps settlement once. Returns false if the position was already settled.
     */
    public boolean markSettled(String id, boolean winner, BigDecimal settlementPnl, BigDecimal finalValue, Instant at) {
        return jdbcTemplate.update("""
                        UPDATE positions SET is_winner = ?, settlement_pnl = ?, current_value = ?, unrealized_pnl = 0,
                                             realized_pnl = realized_pnl + ?, settled_at = ?, updated_at = ?
                        WHERE id = ? AND settled_at IS NULL
                        """,
                winner, settlementPnl, finalValue, settlementPnl, ts(at), ts(clock.instant()), id) == 1;
    }

    public boolean markClaimed(String id, Instant at) {
        return jdbcTemplate.update(
                "UPDATE positions SET claimed_at = ?, updated_at = ? WHERE id = ? AND claimed_at IS NULL",
                ts(at), ts(clock.instant()), id) == 1;
    }
}
