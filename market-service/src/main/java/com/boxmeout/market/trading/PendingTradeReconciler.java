package com.boxmeout.market.trading;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.TradeExecution;
import com.boxmeout.ledger.gateway.LedgerGateway;
import com.boxmeout.ledger.gateway.PollResponse;
import com.boxmeout.market.config.MarketProperties;
import com.boxmeout.market.error.ErrorCode;
import com.boxmeout.market.error.MarketException;
import com.boxmeout.market.model.Trade;
import com.boxmeout.market.model.TradeType;
import com.boxmeout.market.repo.TradeRepository;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Settles trades left PENDING by a request that died between submission and commit. Each one is looked up on
 * the ledger by its hash: SUCCESS is applied through {@link TradeCommitter}, FAILED is recorded, and a hash the
 * ledger still does not know after the expiry window is given up on.
 */
@Slf4j
@RequiredArgsConstructor
public class PendingTradeReconciler {

    public record Summary(int scanned, int confirmed, int failed, int stillPending) {
    }

    private final @NonNull TradeRepository trades;
    private final @NonNull TradeCommitter committer;
    private final @NonNull LedgerGateway gateway;
    private final @NonNull AmmContractClient amm;
    private final @NonNull MarketProperties.Reconciliation config;
    private final @NonNull Clock clock;

    public Summary reconcile() {
        Instant now = clock.instant();
        List<Trade> pending = trades.findPendingCreatedBefore(now.minus(config.grace()), config.batchSize());
        int confirmed = 0;
        int failed = 0;
        for (Trade trade : pending) {
            try {
                switch (reconcileOne(trade, now)) {
                    case CONFIRMED -> confirmed++;
                    case FAILED -> failed++;
                    default -> {
                    }
                }
            } catch (LedgerException e) {
                log.warn("reconcile: ledger lookup failed (trade={}, txHash={}): {}", trade.id(), trade.txHash(), e.getMessage());
            } catch (MarketException e) {
                log.error("reconcile: confirmed trade could not be applied (trade={}, txHash={}): {}",
                        trade.id(), trade.txHash(), e.getMessage());
                if (trades.markFailed(trade.id(), "confirmed on ledger but not applied: " + e.getMessage())) {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("reconcile: unexpected failure, trade left pending (trade={}, txHash={})",
                        trade.id(), trade.txHash(), e);
            }
        }
        Summary summary = new Summary(pending.size(), confirmed, failed, pending.size() - confirmed - failed);
        if (!pending.isEmpty()) {
            log.info("reconcile: scanned={} confirmed={} failed={} stillPending={}",
                    summary.scanned(), summary.confirmed(), summary.failed(), summary.stillPending());
        }
        return summary;
    }

    private enum Outcome { CONFIRMED, FAILED, PENDING }

    private Outcome reconcileOne(Trade trade, Instant now) {
        PollResponse response = gateway.poll(trade.txHash());
        return switch (response.status()) {
            case SUCCESS -> {
                TradeExecution execution = readResult(trade, response);
                yield committer.commit(trade, execution).isPresent() ? Outcome.CONFIRMED : Outcome.PENDING;
            }
            case FAILED -> trades.markFailed(trade.id(), "Transaction failed on ledger"
                    + (response.resultCode() == null ? "" : " (" + response.resultCode() + ")"))
                    ? Outcome.FAILED : Outcome.PENDING;
            case NOT_FOUND -> {
                if (trade.createdAt().plus(config.expireAfter()).isAfter(now)) {
                    yield Outcome.PENDING;
                }
                log.warn("reconcile: giving up on trade unknown to the ledger (trade={}, txHash={}, createdAt={})",
                        trade.id(), trade.txHash(), trade.createdAt());
                yield trades.markFailed(trade.id(), "Transaction never reached the ledger") ? Outcome.FAILED : Outcome.PENDING;
            }
        };
    }

    private TradeExecution readResult(Trade trade, PollResponse response) {
        try {
            return trade.type() == TradeType.BUY
                    ? amm.parseBuy(trade.txHash(), response.returnValue(), trade.totalAmount())
                    : amm.parseSell(trade.txHash(), response.returnValue(), trade.quantity());
        } catch (LedgerException e) {
            throw new MarketException(ErrorCode.BLOCKCHAIN_ERROR, "unreadable ledger result: " + e.getMessage(), e);
        }
    }
}
