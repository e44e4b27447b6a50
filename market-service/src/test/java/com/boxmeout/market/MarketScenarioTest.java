package com.boxmeout.market;

import com.boxmeout.ledger.config.ExecutionMode;
import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.FactoryContractClient;
import com.boxmeout.ledger.contract.LedgerTransactionSubmitter;
import com.boxmeout.ledger.contract.MarketContractClient;
import com.boxmeout.ledger.contract.OracleContractClient;
import com.boxmeout.ledger.contract.PreparedTransaction;
import com.boxmeout.ledger.contract.TokenAmounts;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.boxmeout.ledger.signature.SignatureGate;
import com.boxmeout.market.config.MarketProperties;
import com.boxmeout.market.error.ErrorCode;
import com.boxmeout.market.lifecycle.MarketLifecycleService;
import com.boxmeout.market.lifecycle.Resolution;
import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.UserAccount;
import com.boxmeout.market.model.UserStats;
import com.boxmeout.market.settlement.SettlementService;
import com.boxmeout.market.trading.BuyOrder;
import com.boxmeout.market.trading.MarketOdds;
import com.boxmeout.market.trading.TradeCommitter;
import com.boxmeout.market.trading.TradeOrchestrator;
import com.boxmeout.market.trading.TradeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Pool, trade, close, resolve and settle against the relational projection, with the ledger stubbed at the
 * transaction submitter.
 */
@ExtendWith(MockitoExtension.class)
class MarketScenarioTest {

    @Mock
    private LedgerTransactionSubmitter submitter;

    @Mock
    private SignatureGate signatureGate;

    @Mock
    private FactoryContractClient factory;

    @Mock
    private MarketContractClient marketContract;

    @Mock
    private OracleContractClient oracle;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MarketTestDatabase db;
    private MarketLifecycleService lifecycle;
    private TradeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        db = new MarketTestDatabase();
        MarketProperties properties = new MarketProperties(null, null, null, null, null, null, null);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        AmmContractClient amm = new AmmContractClient(submitter, new TokenAmounts(6), "amm-contract");
        SettlementService settlement = new SettlementService(db.positions, db.users, db.stats, db.transactionTemplate,
                Runnable::run, properties.winnerReturnRate(), db.clock, meterRegistry);
        lifecycle = new MarketLifecycleService(db.markets, db.users, db.positions, factory, amm, marketContract,
                oracle, submitter, settlement, properties, db.clock);
        TradeCommitter committer = new TradeCommitter(db.transactionTemplate, db.trades, db.positions, db.users,
                db.markets, db.clock);
        orchestrator = new TradeOrchestrator(db.markets, db.users, db.positions, db.trades, amm, submitter,
                signatureGate, committer, properties, ExecutionMode.CUSTODIAL, db.clock, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void shouldCarryWinningBuyThroughResolution() {
        // Given: a market with an evenly seeded 1000 USDC pool
        UserAccount creator = db.user("0");
        UserAccount trader = db.user("1000");
        Market market = db.marketWithoutPool(creator.id());
        when(submitter.execute(any(ContractCall.class), any(LedgerOperation.class)))
                .thenReturn(new ConfirmedTransaction("tx-pool", objectMapper.createObjectNode(), 1));
        when(submitter.read(any())).thenReturn(objectMapper.createObjectNode()
                .put("yes_reserve", 500_000_000L)
                .put("no_reserve", 500_000_000L)
                .put("yes_odds", 0.5)
                .put("no_odds", 0.5));
        lifecycle.createPool(market.id(), new BigDecimal("1000"));

        MarketOdds odds = orchestrator.getOdds(market.id());
        assertThat(odds.yesPercentage()).isEqualTo(50);
        assertThat(odds.totalLiquidity()).isEqualByComparingTo("1000");

        // When: the trader buys 100 YES shares at 1.00 with a 1 USDC fee
        when(submitter.adminAccount()).thenReturn("admin");
        when(submitter.prepare(any(ContractCall.class), any(LedgerOperation.class)))
                .thenAnswer(inv -> new PreparedTransaction(null, "tx-buy", inv.getArgument(1)));
        when(submitter.submit(any())).thenReturn(new ConfirmedTransaction("tx-buy", objectMapper.createObjectNode()
                .put("shares_out", 100_000_000L)
                .put("total_cost", 100_000_000L)
                .put("fee", 1_000_000L), 1));
        TradeResult buy = orchestrator.buy(BuyOrder.custodial(trader.id(), market.id(), 1, new BigDecimal("100")));
        assertThat(buy.shares()).isEqualByComparingTo("100");
        assertThat(db.balance(trader.id())).isEqualByComparingTo("900");

        // and the market closes and resolves YES
        when(marketContract.resolveMarket(market.contractAddress())).thenReturn("tx-resolve");
        lifecycle.closeMarket(market.id());
        assertThatThrownBy(() -> orchestrator.buy(BuyOrder.custodial(trader.id(), market.id(), 1, BigDecimal.ONE)))
                .extracting("code").isEqualTo(ErrorCode.MARKET_NOT_OPEN);
        Resolution resolution = lifecycle.resolveMarket(market.id(), 1, "admin");

        // Then: cost basis back plus 90% of it
        assertThat(resolution.market().status()).isEqualTo(MarketStatus.RESOLVED);
        assertThat(resolution.settlement().totalCredited()).isEqualByComparingTo("190");
        assertThat(db.balance(trader.id())).isEqualByComparingTo("1090");

        Position position = db.positions.find(trader.id(), market.id(), 1).orElseThrow();
        assertThat(position.winner()).isTrue();
        assertThat(position.settlementPnl()).isEqualByComparingTo("90");

        UserStats stats = db.stats.find(trader.id()).orElseThrow();
        assertThat(stats.wins()).isEqualTo(1);
        assertThat(stats.totalPnl()).isEqualByComparingTo("90");
        assertThat(db.markets.findById(market.id()).orElseThrow().totalVolume()).isEqualByComparingTo("100");
    }
}
