package com.boxmeout.market.config;

import com.boxmeout.ledger.config.LedgerProperties;
import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.FactoryContractClient;
import com.boxmeout.ledger.contract.LedgerTransactionSubmitter;
import com.boxmeout.ledger.contract.MarketContractClient;
import com.boxmeout.ledger.contract.OracleContractClient;
import com.boxmeout.ledger.gateway.LedgerGateway;
import com.boxmeout.ledger.reliability.DeadLetterQueue;
import com.boxmeout.ledger.signature.SignatureGate;
import com.boxmeout.market.lifecycle.MarketLifecycleService;
import com.boxmeout.market.odds.ApplicationEventOddsChangeSink;
import com.boxmeout.market.odds.OddsChangeSink;
import com.boxmeout.market.odds.RealtimeOddsBroadcaster;
import com.boxmeout.market.repo.JdbcDeadLetterQueue;
import com.boxmeout.market.repo.MarketRepository;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.TradeRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import com.boxmeout.market.repo.UserStatsRepository;
import com.boxmeout.market.settlement.SettlementService;
import com.boxmeout.market.trading.PendingTradeReconciler;
import com.boxmeout.market.trading.TradeCommitter;
import com.boxmeout.market.trading.TradeOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the relational projection, trading, lifecycle, settlement and odds components on top of the ledger
 * pipeline from ledger-core.
 */
@Slf4j
@Configuration
public class MarketServiceConfiguration {

    @Bean
    public UserAccountRepository userAccountRepository(JdbcTemplate jdbcTemplate) {
        return new UserAccountRepository(jdbcTemplate, Clock.systemUTC());
    }

    @Bean
    public MarketRepository marketRepository(JdbcTemplate jdbcTemplate) {
        return new MarketRepository(jdbcTemplate, Clock.systemUTC());
    }

    @Bean
    public PositionRepository positionRepository(JdbcTemplate jdbcTemplate) {
        return new PositionRepository(jdbcTemplate, Clock.systemUTC());
    }

    @Bean
    public TradeRepository tradeRepository(JdbcTemplate jdbcTemplate) {
        return new TradeRepository(jdbcTemplate);
    }

    @Bean
    public UserStatsRepository userStatsRepository(JdbcTemplate jdbcTemplate) {
        return new UserStatsRepository(jdbcTemplate, Clock.systemUTC());
    }

    @Bean
    public DeadLetterQueue deadLetterQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDeadLetterQueue(jdbcTemplate, objectMapper, Clock.systemUTC());
    }

    @Bean
    public TradeCommitter tradeCommitter(
            TransactionTemplate transactionTemplate,
            TradeRepository trades,
            PositionRepository positions,
            UserAccountRepository users,
            MarketRepository markets
    ) {
        return new TradeCommitter(transactionTemplate, trades, positions, users, markets, Clock.systemUTC());
    }

    @Bean
    public TradeOrchestrator tradeOrchestrator(
            MarketRepository markets,
            UserAccountRepository users,
            PositionRepository positions,
            TradeRepository trades,
            AmmContractClient amm,
            LedgerTransactionSubmitter submitter,
            SignatureGate signatureGate,
            TradeCommitter committer,
            MarketProperties marketProperties,
            LedgerProperties ledgerProperties,
            MeterRegistry meterRegistry
    ) {
        log.info("Trade execution mode: {}", ledgerProperties.executionMode());
        return new TradeOrchestrator(
                markets,
                users,
                positions,
                trades,
                amm,
                submitter,
                signatureGate,
                committer,
                marketProperties,
                ledgerProperties.executionMode(),
                Clock.systemUTC(),
                meterRegistry
        );
    }

    @Bean
    public PendingTradeReconciler pendingTradeReconciler(
            TradeRepository trades,
            TradeCommitter committer,
            LedgerGateway gateway,
            AmmContractClient amm,
            MarketProperties properties
    ) {
        return new PendingTradeReconciler(trades, committer, gateway, amm, properties.reconciliation(), Clock.systemUTC());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService settlementExecutor(MarketProperties properties) {
        return Executors.newFixedThreadPool(properties.settlementThreads(), daemonThreads("settlement-"));
    }

    @Bean
    public SettlementService settlementService(
            PositionRepository positions,
            UserAccountRepository users,
            UserStatsRepository stats,
            TransactionTemplate transactionTemplate,
            @Qualifier("settlementExecutor") ExecutorService settlementExecutor,
            MarketProperties properties,
            MeterRegistry meterRegistry
    ) {
        return new SettlementService(positions, users, stats, transactionTemplate, settlementExecutor,
                properties.winnerReturnRate(), Clock.systemUTC(), meterRegistry);
    }

    @Bean
    public MarketLifecycleService marketLifecycleService(
            MarketRepository markets,
            UserAccountRepository users,
            PositionRepository positions,
            FactoryContractClient factory,
            AmmContractClient amm,
            MarketContractClient marketContract,
            OracleContractClient oracle,
            LedgerTransactionSubmitter submitter,
            SettlementService settlement,
            MarketProperties properties
    ) {
        return new MarketLifecycleService(markets, users, positions, factory, amm, marketContract, oracle, submitter,
                settlement, properties, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public OddsChangeSink oddsChangeSink(ApplicationEventPublisher publisher) {
        return new ApplicationEventOddsChangeSink(publisher);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService oddsTimer() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("odds-timer-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService oddsPollers(MarketProperties properties) {
        return Executors.newFixedThreadPool(properties.odds().pollerThreads(), daemonThreads("odds-poll-"));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RealtimeOddsBroadcaster realtimeOddsBroadcaster(
            TradeOrchestrator orchestrator,
            OddsChangeSink sink,
            @Qualifier("oddsTimer") ScheduledExecutorService oddsTimer,
            @Qualifier("oddsPollers") ExecutorService oddsPollers,
            MarketProperties properties
    ) {
        return new RealtimeOddsBroadcaster(
                orchestrator::getOdds,
                sink,
                oddsTimer,
                oddsPollers,
                properties.odds().pollIntervalMillis(),
                properties.odds().changeThresholdPercent(),
                Clock.systemUTC()
        );
    }

    /**
     * Separate beans so that @Scheduled is processed; it is not on objects created with new in @Bean methods.
     */
    @Bean
    @ConditionalOnProperty(prefix = "market.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReconciliationPoller reconciliationPoller(PendingTradeReconciler reconciler) {
        return new ReconciliationPoller(reconciler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "market.lifecycle", name = "enabled", havingValue = "true")
    public LifecyclePoller lifecyclePoller(MarketLifecycleService lifecycle) {
        return new LifecyclePoller(lifecycle);
    }

    @Slf4j
    public static class ReconciliationPoller {
        private final PendingTradeReconciler reconciler;

        public ReconciliationPoller(PendingTradeReconciler reconciler) {
            this.reconciler = reconciler;
        }

        @Scheduled(fixedDelayString = "${market.reconciliation.interval-millis:30000}")
        public void reconcile() {
            try {
                reconciler.reconcile();
            } catch (Exception e) {
                log.warn("Error reconciling pending trades: {}", e.getMessage());
            }
        }
    }

    @Slf4j
    public static class LifecyclePoller {
        private final MarketLifecycleService lifecycle;

        public LifecyclePoller(MarketLifecycleService lifecycle) {
            this.lifecycle = lifecycle;
            log.info("LifecyclePoller initialized - closing expired markets and resolving from oracle consensus");
        }

        @Scheduled(fixedDelayString = "${market.lifecycle.poll-interval-millis:60000}")
        public void advance() {
            try {
                int closed = lifecycle.closeExpiredMarkets();
                int resolved = lifecycle.resolveDueMarkets();
                if (closed > 0 || resolved > 0) {
                    log.info("lifecycle tick: closed={} resolved={}", closed, resolved);
                }
            } catch (Exception e) {
                log.warn("Error advancing market lifecycle: {}", e.getMessage());
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
