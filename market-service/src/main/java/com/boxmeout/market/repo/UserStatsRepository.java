package com.boxmeout.market.repo;

import com.boxmeout.market.model.UserStats;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

import static com.boxmeout.market.repo.JdbcTimes.ts;

@RequiredArgsConstructor
public class UserStatsRepository {

    private static final RowMapper<UserStats> MAPPER = (rs, i) -> new UserStats(
            rs.getString("user_id"),
            rs.getInt("markets_settled"),
            rs.getInt("wins"),
            rs.getInt("losses"),
            rs.getBigDecimal("total_pnl")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;
    private final @NonNull Clock clock;

    public Optional<UserStats> find(String userId) {
        return jdbcTemplate.query("SELECT * FROM user_stats WHERE user_id = ?", MAPPER, userId).stream().findFirst();
    }

    /**
     * Adds one settled market to the user's aggregate. A concurrent first insert for the same user surfaces as
     * {@link org.springframework.dao.DuplicateKeyException} and rolls back the caller's transaction.
     */
    public void recordSettlement(String userId, int wins, int losses, BigDecimal pnl) {
        if (increment(userId, wins, losses, pnl)) {
            return;
        }
        jdbcTemplate.update("""
                        INSERT INTO user_stats (user_id, markets_settled, wins, losses, total_pnl, updated_at)
                        VALUES (?, 1, ?, ?, ?, ?)
                        """,
                userId, wins, losses, pnl, ts(clock.instant()));
    }

    private boolean increment(String userId, int wins, int losses, BigDecimal pnl) {
        return jdbcTemplate.update("""
                        UPDATE user_stats SET markets_settled = markets_settled + 1, wins = wins + ?, losses = losses + ?,
                                              total_pnl = total_pnl + ?, updated_at = ?
                        WHERE user_id = ?
                        """,
                wins, losses, pnl, ts(clock.instant()), userId) == 1;
    }
}
