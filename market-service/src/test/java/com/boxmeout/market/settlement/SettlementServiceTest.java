package com.boxmeout.market.settlement;

import com.boxmeout.market.MarketTestDatabase;
import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.UserAccount;
import com.boxmeout.market.model.UserStats;
import com.boxmeout.market.repo.UserAccountRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.spy;

class SettlementServiceTest {

    private MarketTestDatabase db;
    private SimpleMeterRegistry meterRegistry;
    private UserAccount alice;
    private UserAccount bob;
    private UserAccount carol;
    private Market market;

    @BeforeEach
    void setUp() {
        db = new MarketTestDatabase();
        meterRegistry = new SimpleMeterRegistry();
        alice = db.user("1000");
        bob = db.user("1000");
        carol = db.user("1000");
        market = db.market(alice.id(), MarketStatus.RESOLVED);

        db.position(alice.id(), market.id(), 1, "100", "60");
        db.position(bob.id(), market.id(), 0, "100", "40");
        db.position(carol.id(), market.id(), 1, "10", "5");
        db.position(carol.id(), market.id(), 0, "10", "5");
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void shouldCreditWinnersAndRecordLosses() {
        // When: YES wins
        SettlementSummary summary = service(db.users).settle(market.id(), 1);

        // Then
        assertThat(summary.complete()).isTrue();
        assertThat(summary.usersSettled()).isEqualTo(3);
        assertThat(summary.positionsSettled()).isEqualTo(4);
        assertThat(summary.winners()).isEqualTo(2);
        assertThat(summary.losers()).isEqualTo(2);
        assertThat(summary.totalCredited()).isEqualByComparingTo("123.5");

        // cost basis plus 90% of it
        assertThat(db.balance(alice.id())).isEqualByComparingTo("1114");
        assertThat(db.balance(bob.id())).isEqualByComparingTo("1000");
        assertThat(db.balance(carol.id())).isEqualByComparingTo("1009.5");

        Position winner = db.positions.find(alice.id(), market.id(), 1).orElseThrow();
        assertThat(winner.winner()).isTrue();
        assertThat(winner.settlementPnl()).isEqualByComparingTo("54");
        assertThat(winner.currentValue()).isEqualByComparingTo("114");
        assertThat(winner.settledAt()).isEqualTo(MarketTestDatabase.NOW);

        Position loser = db.positions.find(bob.id(), market.id(), 0).orElseThrow();
        assertThat(loser.winner()).isFalse();
        assertThat(loser.settlementPnl()).isEqualByComparingTo("-40");
        assertThat(loser.currentValue()).isEqualByComparingTo("0");
    }

    @Test
    void shouldAggregateUserStatsPerMarket() {
        service(db.users).settle(market.id(), 1);

        UserStats carolStats = db.stats.find(carol.id()).orElseThrow();
        assertThat(carolStats.marketsSettled()).isEqualTo(1);
        assertThat(carolStats.wins()).isEqualTo(1);
        assertThat(carolStats.losses()).isZero();
        assertThat(carolStats.totalPnl()).isEqualByComparingTo("-0.5");

        UserStats bobStats = db.stats.find(bob.id()).orElseThrow();
        assertThat(bobStats.losses()).isEqualTo(1);
        assertThat(bobStats.totalPnl()).isEqualByComparingTo("-40");
    }

    @Test
    void shouldNotSettleTwice() {
        SettlementService service = service(db.users);
        service.settle(market.id(), 1);

        SettlementSummary rerun = service.settle(market.id(), 1);

        assertThat(rerun.usersSettled()).isZero();
        assertThat(rerun.positionsSettled()).isZero();
        assertThat(db.balance(alice.id())).isEqualByComparingTo("1114");
        assertThat(db.stats.find(alice.id()).orElseThrow().marketsSettled()).isEqualTo(1);
    }

    @Test
    void shouldIsolateFailingUserAndSettleThemOnRetry() {
        // Given: crediting alice fails
        UserAccountRepository users = spy(db.users);
        doThrow(new DataIntegrityViolationException("balance row locked out"))
                .when(users).credit(eq(alice.id()), any(BigDecimal.class));

        // When
        SettlementSummary summary = service(users).settle(market.id(), 1);

        // Then: others are settled, alice rolled back completely
        assertThat(summary.complete()).isFalse();
        assertThat(summary.failedUsers()).containsExactly(alice.id());
        assertThat(summary.usersSettled()).isEqualTo(2);
        assertThat(db.balance(carol.id())).isEqualByComparingTo("1009.5");
        assertThat(db.balance(alice.id())).isEqualByComparingTo("1000");
        assertThat(db.positions.find(alice.id(), market.id(), 1).orElseThrow().settledAt()).isNull();
        assertThat(db.stats.find(alice.id())).isEmpty();
        assertThat(meterRegistry.counter("market.settlement.failures").count()).isEqualTo(1.0);

        // When: settlement runs again once the fault is gone
        reset(users);
        SettlementSummary retry = service(users).settle(market.id(), 1);

        // Then
        assertThat(retry.usersSettled()).isEqualTo(1);
        assertThat(retry.failedUsers()).isEmpty();
        assertThat(db.balance(alice.id())).isEqualByComparingTo("1114");
    }

    @Test
    void shouldComputeSettlementPnlFromCostBasis() {
        Position yes = db.positions.find(carol.id(), market.id(), 1).orElseThrow();

        assertThat(service(db.users).settlementPnl(yes, 1)).isEqualByComparingTo("4.5");
        assertThat(service(db.users).settlementPnl(yes, 0)).isEqualByComparingTo("-5");
    }

    private SettlementService service(UserAccountRepository users) {
        return new SettlementService(db.positions, users, db.stats, db.transactionTemplate, Runnable::run,
                new BigDecimal("0.9"), db.clock, meterRegistry);
    }
}
