package com.boxmeout.market.repo;

import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
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

/**
 * Status changes are compare-and-set on the current status, so two racing transitions cannot both win.
 */
@RequiredArgsConstructor
public class MarketRepository {

    private static final RowMapper<Market> MAPPER = (rs, i) -> new Market(
            rs.getString("id"),
            rs.getString("contract_address"),
            rs.getString("title"),
            rs.getString("description"),
            rs.getString("category"),
            rs.getString("creator_id"),
            rs.getString("outcome_a"),
            rs.getString("outcome_b"),
            MarketStatus.valueOf(rs.getString("status")),
            rs.getBigDecimal("yes_liquidity"),
            rs.getBigDecimal("no_liquidity"),
            rs.getBigDecimal("total_volume"),
            rs.getString("pool_tx_hash"),
            rs.getString("creation_tx_hash"),
            instant(rs, "closing_at"),
            instant(rs, "resolution_time"),
            instant(rs, "closed_at"),
            instant(rs, "resolved_at"),
            instant(rs, "cancelled_at"),
            rs.getObject("winning_outcome", Integer.class),
            rs.getString("resolution_source"),
            instant(rs, "created_at")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;
    private final @NonNull Clock clock;

    public void insert(@NonNull Market market) {
        Instant now = clock.instant();
        jdbcTemplate.update("""
                INSERT INTO markets (id, contract_address, title, description, category, creator_id, outcome_a, outcome_b,
                                     status, yes_liquidity, no_liquidity, total_volume, creation_tx_hash,
                                     closing_at, resolution_time, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                market.id(), market.contractAddress(), market.title(), market.description(), market.category(),
                market.creatorId(), market.outcomeA(), market.outcomeB(), market.status().name(),
                market.yesLiquidity(), market.noLiquidity(), market.totalVolume(), market.creationTxHash(),
                ts(market.closingAt()), ts(market.resolutionTime()), ts(now), ts(now));
    }

    public Optional<Market> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM markets WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public void updatePool(String id, BigDecimal yesLiquidity, BigDecimal noLiquidity, String poolTxHash) {
        jdbcTemplate.update(
                "UPDATE markets SET yes_liquidity = ?, no_liquidity = ?, pool_tx_hash = ?, updated_at = ? WHERE id = ?",
                yesLiquidity, noLiquidity, poolTxHash, ts(clock.instant()), id);
    }

    public void addVolume(String id, BigDecimal amount) {
        jdbcTemplate.update("UPDATE markets SET total_volume = total_volume + ?, updated_at = ? WHERE id = ?",
                amount, ts(clock.instant()), id);
    }

    /**
     * @return true if the market was in {@code from} and is now CLOSED
     */
    public boolean markClosed(String id, MarketStatus from, Instant at) {
        return jdbcTemplate.update(
                "UPDATE markets SET status = ?, closed_at = ?, updated_at = ? WHERE id = ? AND status = ?",
                MarketStatus.CLOSED.name(), ts(at), ts(clock.instant()), id, from.name()) == 1;
    }

    public boolean markResolved(String id, MarketStatus from, int winningOutcome, String source, Instant at) {
        return jdbcTemplate.update("""
                        UPDATE markets SET status = ?, winning_outcome = ?, resolution_source = ?, resolved_at = ?, updated_at = ?
                        WHERE id = ? AND status = ?
                        """,
                MarketStatus.RESOLVED.name(), winningOutcome, source, ts(at), ts(clock.instant()), id, from.name()) == 1;
    }

    public boolean markCancelled(String id, MarketStatus from, Instant at) {
        return jdbcTemplate.update(
                "UPDATE markets SET status = ?, cancelled_at = ?, updated_at = ? WHERE id = ? AND status = ?",
                MarketStatus.CANCELLED.name(), ts(at), ts(clock.instant()), id, from.name()) == 1;
    }

    public List<Market> findOpenClosingBefore(Instant cutoff, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM markets WHERE status = ? AND closing_at <= ? ORDER BY closing_at LIMIT ?",
                MAPPER, MarketStatus.OPEN.name(), ts(cutoff), limit);
    }

    public List<Market> findClosedResolvableBefore(Instant cutoff, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM markets WHERE status = ? AND resolution_time <= ? ORDER BY resolution_time LIMIT ?",
                MAPPER, MarketStatus.CLOSED.name(), ts(cutoff), limit);
    }
}
