package com.boxmeout.market.trading;

import com.boxmeout.ledger.contract.TradeExecution;
import com.boxmeout.market.error.ErrorCode;
import com.boxmeout.market.error.MarketException;
import com.boxmeout.market.model.Position;
import com.boxmeout.market.model.Trade;
import com.boxmeout.market.model.TradeType;
import com.boxmeout.market.repo.MarketRepository;
import com.boxmeout.market.repo.PositionRepository;
import com.boxmeout.market.repo.TradeRepository;
import com.boxmeout.market.repo.UserAccountRepository;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a ledger-confirmed trade to the local projection in one database transaction: trade PENDING to
 * CONFIRMED, user balance, position and market volume.
 *
 * <p>The PENDING to CONFIRMED update is conditional, so whichever caller gets there first (the request or the
 * reconciler) applies the effects and every later attempt is a no-op.
 */
@RequiredArgsConstructor
public class TradeCommitter {

    static final int SCALE = 6;

    private final @NonNull TransactionTemplate transactionTemplate;
    private final @NonNull TradeRepository trades;
    private final @NonNull PositionRepository positions;
    private final @NonNull UserAccountRepository users;
    private final @NonNull MarketRepository markets;
    private final @NonNull Clock clock;

    /**
     * @return the position after the trade, or empty if the trade had already left PENDING
     * @throws MarketException INSUFFICIENT_BALANCE / INSUFFICIENT_SHARES if the projection cannot absorb the trade;
     *                         nothing is written in that case
     */
    public Optional<Position> commit(@NonNull Trade pending, @NonNull TradeExecution execution) {
        return transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            if (!trades.confirm(pending.id(), execution.shares(), execution.pricePerUnit(), execution.usdcAmount(),
                    execution.feeAmount(), now)) {
                return Optional.<Position>empty();
            }
            users.lockById(pending.userId())
                    .orElseThrow(() -> new MarketException(ErrorCode.USER_NOT_FOUND, "User not found: " + pending.userId()));
            Position position = pending.type() == TradeType.BUY
                    ? applyBuy(pending, execution)
                    : applySell(pending, execution, now);
            markets.addVolume(pending.marketId(), execution.usdcAmount());
            return Optional.of(position);
        });
    }

    private Position applyBuy(Trade trade, TradeExecution execution) {
        BigDecimal cost = execution.usdcAmount();
        if (!users.debit(trade.userId(), cost)) {
            throw new MarketException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Insufficient balance to settle confirmed buy of " + cost + " USDC");
        }

        Optional<Position> existing = positions.lock(trade.userId(), trade.marketId(), trade.outcome());
        if (existing.isEmpty()) {
            Position created = new Position(
                    UUID.randomUUID().toString(),
                    trade.userId(),
                    trade.marketId(),
                    trade.outcome(),
                    execution.shares(),
                    cost,
                    execution.pricePerUnit(),
                    execution.shares().multiply(execution.pricePerUnit()).setScale(SCALE, RoundingMode.HALF_UP),
                    BigDecimal.ZERO,
                    BigDecimal.ZERO,
                    BigDecimal.ZERO,
                    null, null, null, null, null);
            positions.insert(created);
            return created;
        }

        Position p = existing.get();
        BigDecimal quantity = p.quantity().add(execution.shares());
        BigDecimal costBasis = p.costBasis().add(cost);
        BigDecimal currentValue = quantity.multiply(execution.pricePerUnit()).setScale(SCALE, RoundingMode.HALF_UP);
        Position updated = new Position(
                p.id(), p.userId(), p.marketId(), p.outcome(),
                quantity,
                costBasis,
                averagePrice(costBasis, quantity),
                currentValue,
                currentValue.subtract(costBasis),
                p.realizedPnl(),
                p.soldQuantity(),
                p.soldAt(),
                p.winner(), p.settlementPnl(), p.settledAt(), p.claimedAt());
        positions.updateHolding(updated);
        return updated;
    }

    private Position applySell(Trade trade, TradeExecution execution, Instant now) {
        BigDecimal sold = execution.shares();
        Position p = positions.lock(trade.userId(), trade.marketId(), trade.outcome())
                .filter(pos -> pos.quantity().compareTo(sold) >= 0)
                .orElseThrow(() -> new MarketException(ErrorCode.INSUFFICIENT_SHARES,
                        "Insufficient shares to settle confirmed sell of " + sold));

        BigDecimal proportionSold = sold.divide(p.quantity(), 18, RoundingMode.HALF_UP);
        BigDecimal costOfSold = p.costBasis().multiply(proportionSold).setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal quantity = p.quantity().subtract(sold);
        BigDecimal costBasis = quantity.signum() == 0 ? BigDecimal.ZERO : p.costBasis().subtract(costOfSold);
        BigDecimal currentValue = quantity.multiply(p.entryPrice()).setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal realizedPnl = p.realizedPnl().add(execution.usdcAmount()).subtract(costOfSold);

        Position updated = new Position(
                p.id(), p.userId(), p.marketId(), p.outcome(),
                quantity,
                costBasis,
                p.entryPrice(),
                currentValue,
                currentValue.subtract(costBasis),
                realizedPnl,
                p.soldQuantity().add(sold),
                now,
                p.winner(), p.settlementPnl(), p.settledAt(), p.claimedAt());
        positions.updateHolding(updated);
        users.credit(trade.userId(), execution.usdcAmount());
        return updated;
    }

    static BigDecimal averagePrice(BigDecimal costBasis, BigDecimal quantity) {
        if (quantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return costBasis.divide(quantity, SCALE, RoundingMode.HALF_UP);
    }
}
