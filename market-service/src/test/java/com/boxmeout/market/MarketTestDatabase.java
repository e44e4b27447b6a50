package com.boxmeout.market;

import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.UserAccount;
import com.boxmeout.market.repo.MarketRepository;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.TradeRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import com.boxmeout.market.repo.UserStatsRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

/**
 * In-memory H2 database with the production schema and every repository wired to a fixed clock.
 */
public final class MarketTestDatabase {

    public static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    public final Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
    public final EmbeddedDatabase dataSource;
    public final JdbcTemplate jdbcTemplate;
    public final TransactionTemplate transactionTemplate;
    public final UserAccountRepository users;
    public final MarketRepository markets;
    public final PositionRepository positions;
    public final TradeRepository trades;
    public final UserStatsRepository stats;

    public MarketTestDatabase() {
        dataSource = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        users = new UserAccountRepository(jdbcTemplate, clock);
        markets = new MarketRepository(jdbcTemplate, clock);
        positions = new PositionRepository(jdbcTemplate, clock);
        trades = new TradeRepository(jdbcTemplate);
        stats = new UserStatsRepository(jdbcTemplate, clock);
    }

    public void shutdown() {
        dataSource.shutdown();
    }

    public UserAccount user(String balance) {
        return users.create(null, new BigDecimal(balance));
    }

    public UserAccount user(String publicKey, String balance) {
        return users.create(publicKey, new BigDecimal(balance));
    }

    public Market market(String creatorId, MarketStatus status) {
        return market(creatorId, status, "contract-" + UUID.randomUUID());
    }

    public Market market(String creatorId, MarketStatus status, String contractAddress) {
        return insertMarket(creatorId, status, contractAddress, new BigDecimal("500"));
    }

    /**
     * OPEN market whose AMM pool has not been seeded yet.
     */
    public Market marketWithoutPool(String creatorId) {
        return insertMarket(creatorId, MarketStatus.OPEN, "contract-" + UUID.randomUUID(), BigDecimal.ZERO);
    }

    private Market insertMarket(String creatorId, MarketStatus status, String contractAddress, BigDecimal reserve) {
        Market market = new Market(
                "market-" + UUID.randomUUID(),
                contractAddress,
                "Will it rain tomorrow?",
                "Resolves YES if measurable rain falls in the city.",
                "WEATHER",
                creatorId,
                "YES",
                "NO",
                status,
                reserve,
                reserve,
                BigDecimal.ZERO,
                reserve.signum() == 0 ? null : "pool-tx",
                "create-tx",
                NOW.plus(Duration.ofDays(1)),
                NOW.plus(Duration.ofDays(2)),
                null, null, null, null, null,
                NOW);
        markets.insert(market);
        return market;
    }

    /**
     * Open position as a confirmed buy of {@code quantity} shares for {@code cost} USDC would leave it.
     */
    public Position position(String userId, String marketId, int outcome, String quantity, String cost) {
        BigDecimal qty = new BigDecimal(quantity);
        BigDecimal costBasis = new BigDecimal(cost);
        BigDecimal price = costBasis.divide(qty, 6, RoundingMode.HALF_UP);
        Position position = new Position(UUID.randomUUID().toString(), userId, marketId, outcome,
                qty, costBasis, price, costBasis, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                null, null, null, null, null);
        positions.insert(position);
        return position;
    }

    public BigDecimal balance(String userId) {
        return users.findById(userId).orElseThrow().usdcBalance();
    }
}
