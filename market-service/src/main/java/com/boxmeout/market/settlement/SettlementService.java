package com.boxmeout.market.settlement;

import com.boxmeout.market.model.Position;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import com.boxmeout.market.repo.UserStatsRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settles every open position of a resolved market.
 *
 * <p>Winner iff the position's outcome is the winning outcome. Winner PnL is cost basis times the configured
 * return rate and the user is credited cost basis plus PnL; a loser's PnL is minus its cost basis.
 *
 * <p>Each user is settled in a separate transaction on the settlement executor. A failing user is logged and
 * reported in the summary without affecting the others; positions are stamped once, so running settlement again
 * only picks up what is still unsettled.
 */
@Slf4j
public class SettlementService {

    private final PositionRepository positions;
    private final UserAccountRepository users;
    private final UserStatsRepository stats;
    private final TransactionTemplate transactionTemplate;
    private final Executor executor;
    private final BigDecimal winnerReturnRate;
    private final Clock clock;
    private final Counter failureCounter;

    public SettlementService(
            PositionRepository positions,
            UserAccountRepository users,
            UserStatsRepository stats,
            TransactionTemplate transactionTemplate,
            Executor executor,
            BigDecimal winnerReturnRate,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.positions = positions;
        this.users = users;
        this.stats = stats;
        this.transactionTemplate = transactionTemplate;
        this.executor = executor;
        this.winnerReturnRate = winnerReturnRate;
        this.clock = clock;
        this.failureCounter = Counter.builder("market.settlement.failures")
                .description("User settlements that rolled back")
                .register(meterRegistry);
    }

    public SettlementSummary settle(String marketId, int winningOutcome) {
        Map<String, List<Position>> byUser = new LinkedHashMap<>();
        for (Position p : positions.findUnsettledByMarket(marketId)) {
            byUser.computeIfAbsent(p.userId(), k -> new ArrayList<>()).add(p);
        }
        log.info("settling market {} (winningOutcome={}, users={})", marketId, winningOutcome, byUser.size());

        List<String> failed = Collections.synchronizedList(new ArrayList<>());
        List<UserSettlement> applied = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger usersSettled = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>(byUser.size());
        for (Map.Entry<String, List<Position>> entry : byUser.entrySet()) {
            String userId = entry.getKey();
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    UserSettlement result = transactionTemplate.execute(
                            status -> settleUser(userId, entry.getValue(), winningOutcome));
                    if (result != null && result.positions() > 0) {
                        applied.add(result);
                        usersSettled.incrementAndGet();
                    }
                } catch (RuntimeException e) {
                    failed.add(userId);
                    failureCounter.increment();
                    log.error("settlement failed for user {} on market {}: {}", userId, marketId, e.getMessage(), e);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int positionCount = 0;
        int winners = 0;
        int losers = 0;
        BigDecimal credited = BigDecimal.ZERO;
        for (UserSettlement s : applied) {
            positionCount += s.positions();
            winners += s.winners();
            losers += s.losers();
            credited = credited.add(s.credited());
        }
        SettlementSummary summary = new SettlementSummary(marketId, winningOutcome, usersSettled.get(), positionCount,
                winners, losers, credited, List.copyOf(failed));
        if (summary.complete()) {
            log.info("market {} settled: users={} positions={} winners={} losers={} credited={}",
                    marketId, summary.usersSettled(), positionCount, winners, losers, credited);
        } else {
            log.warn("market {} settled with {} failed users: {}", marketId, failed.size(), summary.failedUsers());
        }
        return summary;
    }

    /**
     * Settlement PnL of one position.
     */
    public BigDecimal settlementPnl(Position position, int winningOutcome) {
        return position.outcome() == winningOutcome
                ? position.costBasis().multiply(winnerReturnRate).setScale(6, RoundingMode.HALF_UP)
                : position.costBasis().negate();
    }

    private UserSettlement settleUser(String userId, List<Position> userPositions, int winningOutcome) {
        Instant now = clock.instant();
        int count = 0;
        int wins = 0;
        int losses = 0;
        BigDecimal pnlTotal = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        for (Position p : userPositions) {
            boolean winner = p.outcome() == winningOutcome;
            BigDecimal pnl = settlementPnl(p, winningOutcome);
            BigDecimal finalValue = winner ? p.costBasis().add(pnl) : BigDecimal.ZERO;
            if (!positions.markSettled(p.id(), winner, pnl, finalValue, now)) {
                continue;
            }
            count++;
            pnlTotal = pnlTotal.add(pnl);
            if (winner) {
                wins++;
                credit = credit.add(finalValue);
            } else {
                losses++;
            }
        }
        if (count == 0) {
            return UserSettlement.NOTHING;
        }
        if (credit.signum() > 0) {
            users.credit(userId, credit);
        }
        stats.recordSettlement(userId, wins > 0 ? 1 : 0, wins > 0 ? 0 : 1, pnlTotal);
        return new UserSettlement(count, wins, losses, credit);
    }
}
