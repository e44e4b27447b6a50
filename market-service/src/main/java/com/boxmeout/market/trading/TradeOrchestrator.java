package com.boxmeout.market.trading;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.config.ExecutionMode;
import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.LedgerTransactionSubmitter;
import com.boxmeout.ledger.contract.PoolState;
import com.boxmeout.ledger.contract.PreparedTransaction;
import com.boxmeout.ledger.contract.TradeExecution;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerEnvelope;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.boxmeout.ledger.signature.SignatureGate;
import com.boxmeout.ledger.signature.SubmitResult;
import com.boxmeout.market.config.MarketProperties;
import com.boxmeout.market.error.ErrorCode;
import com.boxmeout.market.error.MarketException;
import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.Trade;
import com.boxmeout.market.model.TradeStatus;
import com.boxmeout.market.model.TradeType;
import com.boxmeout.market.model.UserAccount;
import com.boxmeout.market.repo.MarketRepository;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.TradeRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Buys and sells outcome shares through the AMM contract and mirrors the confirmed result locally.
 *
 * <p>Flow per trade: preconditions (no ledger call if any fails), sign or verify the envelope, record a PENDING
 * trade under the envelope hash, submit and wait for finality, then apply balance, position and volume in one
 * transaction. A ledger failure leaves the PENDING trade FAILED and nothing else changed.
 */
@Slf4j
public class TradeOrchestrator {

    private final MarketRepository markets;
    private final UserAccountRepository users;
    private final PositionRepository positions;
    private final TradeRepository trades;
    private final AmmContractClient amm;
    private final LedgerTransactionSubmitter submitter;
    private final SignatureGate signatureGate;
    private final TradeCommitter committer;
    private final MarketProperties properties;
    private final ExecutionMode executionMode;
    private final Clock clock;

    private final Counter confirmedCounter;
    private final Counter failedCounter;

    public TradeOrchestrator(
            MarketRepository markets,
            UserAccountRepository users,
            PositionRepository positions,
            TradeRepository trades,
            AmmContractClient amm,
            LedgerTransactionSubmitter submitter,
            SignatureGate signatureGate,
            TradeCommitter committer,
            MarketProperties properties,
            ExecutionMode executionMode,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.markets = markets;
        this.users = users;
        this.positions = positions;
        this.trades = trades;
        this.amm = amm;
        this.submitter = submitter;
        this.signatureGate = signatureGate;
        this.committer = committer;
        this.properties = properties;
        this.executionMode = executionMode;
        this.clock = clock;
        this.confirmedCounter = Counter.builder("market.trades")
                .description("Trades by final outcome")
                .tag("outcome", "confirmed")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("market.trades")
                .description("Trades by final outcome")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    public TradeResult buy(BuyOrder order) {
        validateOutcome(order.outcome());
        requirePositive(order.amountUsdc(), "Amount");
        requireOpenMarket(order.marketId());
        UserAccount user = requireUser(order.userId());
        if (user.usdcBalance().compareTo(order.amountUsdc()) < 0) {
            throw new MarketException(ErrorCode.INSUFFICIENT_BALANCE, "Insufficient balance. Available: "
                    + user.usdcBalance() + " USDC, Required: " + order.amountUsdc() + " USDC");
        }
        BigDecimal minShares = order.minShares() != null ? order.minShares() : floor(order.amountUsdc());
        LedgerOperation operation = amm.buyOperation(order.marketId(), order.outcome(), order.amountUsdc(), minShares);

        Submission submission = executionMode == ExecutionMode.CUSTODIAL
                ? custodial(order.signedEnvelope(),
                        () -> amm.prepareBuy(order.marketId(), order.outcome(), order.amountUsdc(), minShares))
                : userSigned(order.signedEnvelope(), user, operation,
                        amm.buyCall(user.publicKey(), order.marketId(), order.outcome(), order.amountUsdc(), minShares));

        Trade pending = recordPending(order.userId(), order.marketId(), TradeType.BUY, order.outcome(),
                BigDecimal.ZERO, order.amountUsdc(), submission.txHash());
        JsonNode returnValue = submitOrFail(pending, submission, "Buy");
        TradeExecution execution = readResult(pending, "Buy",
                () -> amm.parseBuy(pending.txHash(), returnValue, order.amountUsdc()));

        if (execution.shares().compareTo(minShares) < 0) {
            failSlippage(pending, "Slippage exceeded. Expected at least " + minShares + " shares, got " + execution.shares());
        }
        return commit(pending, execution);
    }

    public TradeResult sell(SellOrder order) {
        validateOutcome(order.outcome());
        requirePositive(order.shares(), "Shares");
        requireOpenMarket(order.marketId());
        UserAccount user = requireUser(order.userId());
        BigDecimal available = positions.find(order.userId(), order.marketId(), order.outcome())
                .map(Position::quantity)
                .orElse(BigDecimal.ZERO);
        if (available.compareTo(order.shares()) < 0) {
            throw new MarketException(ErrorCode.INSUFFICIENT_SHARES,
                    "Insufficient shares. Available: " + available + ", Requested: " + order.shares());
        }
        BigDecimal minPayout = order.minPayout() != null ? order.minPayout() : floor(order.shares());
        LedgerOperation operation = amm.sellOperation(order.marketId(), order.outcome(), order.shares(), minPayout);

        Submission submission = executionMode == ExecutionMode.CUSTODIAL
                ? custodial(order.signedEnvelope(),
                        () -> amm.prepareSell(order.marketId(), order.outcome(), order.shares(), minPayout))
                : userSigned(order.signedEnvelope(), user, operation,
                        amm.sellCall(user.publicKey(), order.marketId(), order.outcome(), order.shares(), minPayout));

        Trade pending = recordPending(order.userId(), order.marketId(), TradeType.SELL, order.outcome(),
                order.shares(), BigDecimal.ZERO, submission.txHash());
        JsonNode returnValue = submitOrFail(pending, submission, "Sell");
        TradeExecution execution = readResult(pending, "Sell",
                () -> amm.parseSell(pending.txHash(), returnValue, order.shares()));

        if (execution.usdcAmount().compareTo(minPayout) < 0) {
            failSlippage(pending, "Slippage exceeded. Expected at least " + minPayout + " USDC, got " + execution.usdcAmount() + " USDC");
        }
        return commit(pending, execution);
    }

    /**
     * Unsigned buy envelope for the user's registered key. Same preconditions as {@link #buy}.
     */
    public UnsignedTrade prepareBuy(String userId, String marketId, int outcome, BigDecimal amountUsdc, BigDecimal minShares) {
        validateOutcome(outcome);
        requirePositive(amountUsdc, "Amount");
        requireOpenMarket(marketId);
        UserAccount user = requireRegisteredKey(requireUser(userId));
        if (user.usdcBalance().compareTo(amountUsdc) < 0) {
            throw new MarketException(ErrorCode.INSUFFICIENT_BALANCE, "Insufficient balance. Available: "
                    + user.usdcBalance() + " USDC, Required: " + amountUsdc + " USDC");
        }
        BigDecimal floor = minShares != null ? minShares : floor(amountUsdc);
        return new UnsignedTrade(ledgerCall(() -> amm.buildUnsignedBuy(user.publicKey(), marketId, outcome, amountUsdc, floor)), floor);
    }

    public UnsignedTrade prepareSell(String userId, String marketId, int outcome, BigDecimal shares, BigDecimal minPayout) {
        validateOutcome(outcome);
        requirePositive(shares, "Shares");
        requireOpenMarket(marketId);
        UserAccount user = requireRegisteredKey(requireUser(userId));
        BigDecimal floor = minPayout != null ? minPayout : floor(shares);
        return new UnsignedTrade(ledgerCall(() -> amm.buildUnsignedSell(user.publicKey(), marketId, outcome, shares, floor)), floor);
    }

    public MarketOdds getOdds(String marketId) {
        requireMarket(marketId);
        PoolState pool = ledgerCall(() -> amm.getPool(marketId));
        double yesOdds = pool.yesOdds();
        double noOdds = pool.noOdds();
        int yesPercentage;
        if (yesOdds == 0 && noOdds == 0) {
            yesPercentage = 50;
        } else {
            yesPercentage = BigDecimal.valueOf(yesOdds).movePointRight(2).setScale(0, RoundingMode.HALF_UP).intValue();
            yesPercentage = Math.max(0, Math.min(100, yesPercentage));
        }
        return new MarketOdds(marketId, yesOdds, noOdds, yesPercentage, 100 - yesPercentage,
                pool.yesReserve(), pool.noReserve(), pool.totalLiquidity());
    }

    private record Submission(String txHash, PreparedTransaction prepared, LedgerEnvelope userEnvelope,
                              LedgerOperation operation) {
    }

    private Submission custodial(String signedEnvelope, Supplier<PreparedTransaction> prepare) {
        if (signedEnvelope != null) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "Signed envelopes are not accepted in custodial mode");
        }
        PreparedTransaction prepared = ledgerCall(prepare);
        return new Submission(prepared.txHash(), prepared, null, prepared.operation());
    }

    private Submission userSigned(String signedEnvelope, UserAccount user, LedgerOperation operation, ContractCall expected) {
        if (signedEnvelope == null || signedEnvelope.isBlank()) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "A signed envelope is required in non-custodial mode");
        }
        requireRegisteredKey(user);
        LedgerEnvelope envelope = ledgerCall(() -> signatureGate.authorize(signedEnvelope, user.publicKey(), operation));
        if (!expected.equals(envelope.call())) {
            log.warn("rejected signed envelope whose call does not match the requested trade (user={}, op={})",
                    user.id(), operation);
            throw new MarketException(ErrorCode.INVALID_SIGNATURE, "Signed envelope does not match the requested trade");
        }
        return new Submission(signatureGate.hashOf(envelope), null, envelope, operation);
    }

    private Trade recordPending(String userId, String marketId, TradeType type, int outcome,
                                BigDecimal quantity, BigDecimal totalAmount, String txHash) {
        if (trades.findByTxHash(txHash).isPresent()) {
            throw new MarketException(ErrorCode.DUPLICATE_TRANSACTION, "Transaction already recorded: " + txHash);
        }
        Trade trade = new Trade(UUID.randomUUID().toString(), userId, marketId, type, outcome,
                quantity, BigDecimal.ZERO, totalAmount, BigDecimal.ZERO, txHash, TradeStatus.PENDING, null,
                clock.instant(), null);
        trades.insert(trade);
        return trade;
    }

    private JsonNode submitOrFail(Trade pending, Submission submission, String action) {
        try {
            if (submission.prepared() != null) {
                ConfirmedTransaction confirmed = submitter.submit(submission.prepared());
                return confirmed.returnValue();
            }
            SubmitResult result = signatureGate.submitAuthorized(submission.userEnvelope(), submission.operation());
            return result.returnValue();
        } catch (LedgerException e) {
            trades.markFailed(pending.id(), e.getMessage());
            failedCounter.increment();
            log.warn("{} failed on ledger (trade={}, txHash={}): {}", action, pending.id(), pending.txHash(), e.getMessage());
            throw MarketException.fromLedger(action, e);
        }
    }

    private TradeExecution readResult(Trade pending, String action, Supplier<TradeExecution> parse) {
        try {
            return parse.get();
        } catch (LedgerException e) {
            trades.markFailed(pending.id(), "confirmed on ledger but not applied: " + e.getMessage());
            failedCounter.increment();
            log.error("{} confirmed on ledger with an unreadable result (trade={}, txHash={}): {}",
                    action, pending.id(), pending.txHash(), e.getMessage());
            throw MarketException.fromLedger(action, e);
        }
    }

    private void failSlippage(Trade pending, String message) {
        trades.markFailed(pending.id(), ErrorCode.SLIPPAGE_EXCEEDED.name() + ": " + message);
        failedCounter.increment();
        log.error("ledger fill below slippage floor (trade={}, txHash={}): {}", pending.id(), pending.txHash(), message);
        throw new MarketException(ErrorCode.SLIPPAGE_EXCEEDED, message);
    }

    private TradeResult commit(Trade pending, TradeExecution execution) {
        Position position;
        try {
            position = committer.commit(pending, execution)
                    .orElseThrow(() -> new MarketException(ErrorCode.DUPLICATE_TRANSACTION,
                            "Trade " + pending.id() + " was already applied"));
        } catch (MarketException e) {
            if (e.getCode() == ErrorCode.INSUFFICIENT_BALANCE || e.getCode() == ErrorCode.INSUFFICIENT_SHARES) {
                trades.markFailed(pending.id(), "confirmed on ledger but not applied: " + e.getMessage());
                failedCounter.increment();
                log.error("trade confirmed on ledger but rejected by local projection (trade={}, txHash={}): {}",
                        pending.id(), pending.txHash(), e.getMessage());
            }
            throw e;
        }
        confirmedCounter.increment();
        log.info("{} confirmed (trade={}, user={}, market={}, outcome={}, shares={}, usdc={}, txHash={})",
                pending.type(), pending.id(), pending.userId(), pending.marketId(), pending.outcome(),
                execution.shares(), execution.usdcAmount(), pending.txHash());
        return new TradeResult(pending.id(), pending.txHash(), pending.type(), pending.outcome(),
                execution.shares(), execution.usdcAmount(), execution.feeAmount(), execution.pricePerUnit(),
                position.quantity(), TradeCommitter.averagePrice(position.costBasis(), position.quantity()));
    }

    private BigDecimal floor(BigDecimal amount) {
        return amount.multiply(properties.slippageFactor()).setScale(TradeCommitter.SCALE, RoundingMode.DOWN);
    }

    private static void validateOutcome(int outcome) {
        if (outcome != 0 && outcome != 1) {
            throw new MarketException(ErrorCode.INVALID_OUTCOME, "Invalid outcome. Must be 0 (NO) or 1 (YES)");
        }
    }

    private static void requirePositive(BigDecimal value, String what) {
        if (value == null || value.signum() <= 0) {
            throw new MarketException(ErrorCode.INVALID_AMOUNT, what + " must be greater than 0");
        }
    }

    private Market requireMarket(String marketId) {
        return markets.findById(marketId).orElseThrow(() -> MarketException.notFound("Market", marketId));
    }

    private Market requireOpenMarket(String marketId) {
        Market market = requireMarket(marketId);
        if (market.status() != MarketStatus.OPEN) {
            throw new MarketException(ErrorCode.MARKET_NOT_OPEN,
                    "Market is " + market.status() + ". Trading is only allowed for OPEN markets.");
        }
        return market;
    }

    private UserAccount requireUser(String userId) {
        return users.findById(userId)
                .orElseThrow(() -> new MarketException(ErrorCode.USER_NOT_FOUND, "User not found: " + userId));
    }

    private static UserAccount requireRegisteredKey(UserAccount user) {
        if (user.publicKey() == null || user.publicKey().isBlank()) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "User " + user.id() + " has no registered wallet key");
        }
        return user;
    }

    private static <T> T ledgerCall(Supplier<T> call) {
        try {
            return call.get();
        } catch (LedgerException e) {
            throw MarketException.fromLedger("Ledger call", e);
        } catch (IllegalArgumentException e) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, e.getMessage(), e);
        }
    }
}
