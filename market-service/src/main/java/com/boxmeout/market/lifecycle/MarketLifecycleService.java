package com.boxmeout.market.lifecycle;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.FactoryContractClient;
import com.boxmeout.ledger.contract.LedgerTransactionSubmitter;
import com.boxmeout.ledger.contract.MarketContractClient;
import com.boxmeout.ledger.contract.MarketCreation;
import com.boxmeout.ledger.contract.OracleContractClient;
import com.boxmeout.ledger.contract.PoolCreation;
import com.boxmeout.market.config.MarketProperties;
import com.boxmeout.market.error.ErrorCode;
import com.boxmeout.market.error.MarketException;
import com.boxmeout.market.model.Market;
import com.boxmeout.market.model.MarketStatus;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.UserAccount;
import com.boxmeout.market.repo.MarketRepository;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import com.boxmeout.market.settlement.SettlementService;
import com.boxmeout.market.settlement.SettlementSummary;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Market state machine: OPEN to CLOSED to RESOLVED, OPEN or CLOSED to CANCELLED, and early OPEN to RESOLVED.
 * Every transition is a compare-and-set on the stored status.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketLifecycleService {

    public static final String ORACLE_SOURCE = "oracle-consensus";

    private static final int TITLE_MIN = 5;
    private static final int TITLE_MAX = 200;
    private static final int DESCRIPTION_MIN = 10;
    private static final int DESCRIPTION_MAX = 5000;

    private final @NonNull MarketRepository markets;
    private final @NonNull UserAccountRepository users;
    private final @NonNull PositionRepository positions;
    private final @NonNull FactoryContractClient factory;
    private final @NonNull AmmContractClient amm;
    private final @NonNull MarketContractClient marketContract;
    private final @NonNull OracleContractClient oracle;
    private final @NonNull LedgerTransactionSubmitter submitter;
    private final @NonNull SettlementService settlement;
    private final @NonNull MarketProperties properties;
    private final @NonNull Clock clock;

    public Market createMarket(@NonNull CreateMarketRequest request) {
        Instant now = clock.instant();
        String title = request.title() == null ? "" : request.title().trim();
        String description = request.description() == null ? "" : request.description().trim();
        if (request.closingAt() == null || !request.closingAt().isAfter(now)) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "Closing time must be in the future");
        }
        if (title.length() < TITLE_MIN || title.length() > TITLE_MAX) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR,
                    "Title must be between " + TITLE_MIN + " and " + TITLE_MAX + " characters");
        }
        if (description.length() < DESCRIPTION_MIN || description.length() > DESCRIPTION_MAX) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR,
                    "Description must be between " + DESCRIPTION_MIN + " and " + DESCRIPTION_MAX + " characters");
        }
        Instant resolutionTime = request.resolutionTime() != null
                ? request.resolutionTime()
                : request.closingAt().plus(properties.defaultResolutionDelay());
        if (!resolutionTime.isAfter(request.closingAt())) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "Resolution time must be after closing time");
        }
        UserAccount creator = users.findById(request.creatorId())
                .orElseThrow(() -> new MarketException(ErrorCode.USER_NOT_FOUND, "User not found: " + request.creatorId()));
        String category = request.category() == null || request.category().isBlank() ? "GENERAL" : request.category();

        MarketCreation created = ledger("Market creation", () -> factory.createMarket(
                creator.publicKey(), title, description, category, request.closingAt(), resolutionTime));

        Market market = new Market(
                created.marketId(),
                created.contractAddress(),
                title,
                description,
                category,
                creator.id(),
                request.outcomeA() == null ? "YES" : request.outcomeA(),
                request.outcomeB() == null ? "NO" : request.outcomeB(),
                MarketStatus.OPEN,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                null,
                created.txHash(),
                request.closingAt(),
                resolutionTime,
                null, null, null, null, null,
                now);
        markets.insert(market);
        log.info("market {} created by {} (txHash={}, closingAt={})", market.id(), creator.id(), created.txHash(), market.closingAt());
        return market;
    }

    /**
     * Seeds the AMM pool once. Reserves come back from the contract and are stored with the pool tx hash.
     */
    public PoolCreation createPool(String marketId, BigDecimal initialLiquidity) {
        if (initialLiquidity == null || initialLiquidity.signum() <= 0) {
            throw new MarketException(ErrorCode.INVALID_AMOUNT, "Initial liquidity must be greater than 0");
        }
        Market market = requireMarket(marketId);
        if (market.status() != MarketStatus.OPEN) {
            throw new MarketException(ErrorCode.MARKET_NOT_OPEN, "Market is " + market.status() + ", pools can only be created for OPEN markets");
        }
        if (market.hasPool()) {
            throw new MarketException(ErrorCode.DUPLICATE_POOL, "Pool already exists for market " + marketId);
        }
        PoolCreation pool = ledger("Pool creation", () -> amm.createPool(market.id(), initialLiquidity));
        markets.updatePool(market.id(), pool.pool().yesReserve(), pool.pool().noReserve(), pool.txHash());
        log.info("pool created for market {} (yes={}, no={}, txHash={})",
                marketId, pool.pool().yesReserve(), pool.pool().noReserve(), pool.txHash());
        return pool;
    }

    public Market closeMarket(String marketId) {
        Market market = requireMarket(marketId);
        requireTransition(market, MarketStatus.CLOSED);
        if (!markets.markClosed(marketId, market.status(), clock.instant())) {
            throw raced(marketId, MarketStatus.CLOSED);
        }
        log.info("market {} closed", marketId);
        return requireMarket(marketId);
    }

    /**
     * Resolves on the ledger first, then locally, then settles every open position.
     */
    public Resolution resolveMarket(String marketId, int winningOutcome, String source) {
        if (winningOutcome != 0 && winningOutcome != 1) {
            throw new MarketException(ErrorCode.INVALID_OUTCOME, "Winning outcome must be 0 or 1");
        }
        Market market = requireMarket(marketId);
        requireTransition(market, MarketStatus.RESOLVED);

        String txHash = market.contractAddress() == null
                ? null
                : ledger("Market resolution", () -> marketContract.resolveMarket(market.contractAddress()));
        if (!markets.markResolved(marketId, market.status(), winningOutcome, source, clock.instant())) {
            throw raced(marketId, MarketStatus.RESOLVED);
        }
        log.info("market {} resolved: winningOutcome={} source={} txHash={}", marketId, winningOutcome, source, txHash);

        SettlementSummary summary = settlement.settle(marketId, winningOutcome);
        return new Resolution(requireMarket(marketId), txHash, summary);
    }

    /**
     * Settles positions a previous resolution left unsettled.
     */
    public SettlementSummary settleMarket(String marketId) {
        Market market = requireMarket(marketId);
        if (market.status() != MarketStatus.RESOLVED || market.winningOutcome() == null) {
            throw new MarketException(ErrorCode.INVALID_TRANSITION, "Market " + marketId + " is " + market.status() + ", not RESOLVED");
        }
        return settlement.settle(marketId, market.winningOutcome());
    }

    public Market cancelMarket(String marketId, String requesterId) {
        Market market = requireMarket(marketId);
        if (!market.creatorId().equals(requesterId)) {
            throw new MarketException(ErrorCode.NOT_MARKET_CREATOR, "Only the market creator can cancel");
        }
        if (market.status() == MarketStatus.RESOLVED) {
            throw new MarketException(ErrorCode.CANNOT_CANCEL_RESOLVED, "Cannot cancel resolved market");
        }
        requireTransition(market, MarketStatus.CANCELLED);
        if (!markets.markCancelled(marketId, market.status(), clock.instant())) {
            throw raced(marketId, MarketStatus.CANCELLED);
        }
        log.info("market {} cancelled by {}", marketId, requesterId);
        return requireMarket(marketId);
    }

    /**
     * Resolves from oracle consensus when the oracles agree; empty while they do not.
     */
    public Optional<Resolution> resolveFromOracle(String marketId) {
        Market market = requireMarket(marketId);
        requireTransition(market, MarketStatus.RESOLVED);
        Optional<Integer> outcome = ledger("Oracle consensus", () -> oracle.checkConsensus(market.id()));
        if (outcome.isEmpty()) {
            log.debug("no oracle consensus yet for market {}", marketId);
            return Optional.empty();
        }
        return Optional.of(resolveMarket(marketId, outcome.get(), ORACLE_SOURCE));
    }

    public OracleContractClient.Attestation submitAttestation(String marketId, int outcome, int oracleIndex) {
        if (outcome != 0 && outcome != 1) {
            throw new MarketException(ErrorCode.INVALID_OUTCOME, "Outcome must be 0 or 1");
        }
        Market market = requireMarket(marketId);
        if (market.status().isTerminal()) {
            throw new MarketException(ErrorCode.INVALID_TRANSITION, "Market " + marketId + " is already " + market.status());
        }
        return ledger("Attestation", () -> oracle.submitAttestation(market.id(), outcome, oracleIndex));
    }

    /**
     * Claims the user's settled winnings on the ledger and stamps the positions as claimed.
     */
    public Claim claimWinnings(String userId, String marketId) {
        Market market = requireMarket(marketId);
        if (market.status() != MarketStatus.RESOLVED) {
            throw new MarketException(ErrorCode.INVALID_TRANSITION, "Market " + marketId + " is not resolved");
        }
        UserAccount user = users.findById(userId)
                .orElseThrow(() -> new MarketException(ErrorCode.USER_NOT_FOUND, "User not found: " + userId));
        List<Position> claimable = positions.findByUserAndMarket(userId, marketId).stream()
                .filter(p -> Boolean.TRUE.equals(p.winner()) && p.settledAt() != null && p.claimedAt() == null)
                .toList();
        if (claimable.isEmpty()) {
            throw new MarketException(ErrorCode.NOTHING_TO_CLAIM, "Nothing to claim on market " + marketId);
        }
        if (market.contractAddress() == null) {
            throw new MarketException(ErrorCode.VALIDATION_ERROR, "Market " + marketId + " has no ledger contract");
        }
        String claimant = user.publicKey() != null ? user.publicKey() : ledger("Claim", submitter::adminAccount);
        String txHash = ledger("Claim", () -> marketContract.claimWinnings(market.contractAddress(), claimant));

        Instant now = clock.instant();
        BigDecimal amount = BigDecimal.ZERO;
        for (Position p : claimable) {
            if (positions.markClaimed(p.id(), now)) {
                amount = amount.add(p.costBasis().add(p.settlementPnl()));
            }
        }
        log.info("winnings claimed: user={} market={} amount={} txHash={}", userId, marketId, amount, txHash);
        return new Claim(marketId, userId, txHash, amount);
    }

    /**
     * Closes OPEN markets whose closing time has passed. Returns how many were closed.
     */
    public int closeExpiredMarkets() {
        int closed = 0;
        for (Market market : markets.findOpenClosingBefore(clock.instant(), properties.lifecycle().batchSize())) {
            try {
                closeMarket(market.id());
                closed++;
            } catch (MarketException e) {
                log.warn("could not close expired market {}: {}", market.id(), e.getMessage());
            }
        }
        return closed;
    }

    /**
     * Tries oracle resolution for CLOSED markets past their resolution time. Returns how many resolved.
     */
    public int resolveDueMarkets() {
        int resolved = 0;
        for (Market market : markets.findClosedResolvableBefore(clock.instant(), properties.lifecycle().batchSize())) {
            try {
                if (resolveFromOracle(market.id()).isPresent()) {
                    resolved++;
                }
            } catch (MarketException e) {
                log.warn("oracle resolution failed for market {}: {}", market.id(), e.getMessage());
            }
        }
        return resolved;
    }

    private Market requireMarket(String marketId) {
        return markets.findById(marketId).orElseThrow(() -> MarketException.notFound("Market", marketId));
    }

    private static void requireTransition(Market market, MarketStatus next) {
        if (!market.status().canTransitionTo(next)) {
            throw new MarketException(ErrorCode.INVALID_TRANSITION,
                    "Cannot move market " + market.id() + " from " + market.status() + " to " + next);
        }
    }

    private static MarketException raced(String marketId, MarketStatus next) {
        return new MarketException(ErrorCode.INVALID_TRANSITION,
                "Market " + marketId + " changed status concurrently, not moved to " + next);
    }

    private static <T> T ledger(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (LedgerException e) {
            throw MarketException.fromLedger(action, e);
        }
    }
}
