package com.boxmeout.market.repo;

import com.boxmeout.market.model.UserAccount;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static com.boxmeout.market.repo.JdbcTimes.ts;

@RequiredArgsConstructor
public class UserAccountRepository {

    private static final RowMapper<UserAccount> MAPPER = (rs, i) -> new UserAccount(
            rs.getString("id"),
            rs.getString("public_key"),
            rs.getBigDecimal("usdc_balance")
    );

    private final @NonNull JdbcTemplate jdbcTemplate;
    private final @NonNull Clock clock;

    public UserAccount create(String publicKey, @NonNull BigDecimal initialBalance) {
        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        jdbcTemplate.update(
                "INSERT INTO user_accounts (id, public_key, usdc_balance, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                id, publicKey, initialBalance, ts(now), ts(now));
        return new UserAccount(id, publicKey, initialBalance);
    }

    public Optional<UserAccount> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM user_accounts WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    /**
     * Row-locks the account for the rest of the current transaction.
     */
    public Optional<UserAccount> lockById(String id) {
        return jdbcTemplate.query("SELECT * FROM user_accounts WHERE id = ? FOR UPDATE", MAPPER, id).stream().findFirst();
    }

    public void registerPublicKey(String id, String publicKey) {
        jdbcTemplate.update("UPDATE user_accounts SET public_key = ?, updated_at = ? WHERE id = ?",
                publicKey, ts(clock.instant()), id);
    }

    /**
     * Debits only if the balance covers the amount. Returns false when it does not.
     */
    public boolean debit(String id, BigDecimal amount) {
        int updated = jdbcTemplate.update(
                "UPDATE user_accounts SET usdc_balance = usdc_balance - ?, updated_at = ? WHERE id = ? AND usdc_balance >= ?",
                amount, ts(clock.instant()), id, amount);
        return updated == 1;
    }

    public void credit(String id, BigDecimal amount) {
        int updated = jdbcTemplate.update(
                "UPDATE user_accounts SET usdc_balance = usdc_balance + ?, updated_at = ? WHERE id = ?",
                amount, ts(clock.instant()), id);
        if (updated != 1) {
            throw new IllegalStateException("user account not found: " + id);
        }
    }
}
