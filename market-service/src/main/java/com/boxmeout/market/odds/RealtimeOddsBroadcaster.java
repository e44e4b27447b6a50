package com.boxmeout.market.odds;

import com.boxmeout.market.trading.MarketOdds;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls odds for every market that has subscribers and publishes an {@link OddsChangedEvent} when either side
 * moves by more than the threshold, relative to the last published value.
 *
 * <p>The first observation of a market only records its baseline. The baseline moves on each broadcast, so small
 * drifts accumulate until they cross the threshold. When the last subscriber leaves, the baseline is dropped.
 */
@Slf4j
public class RealtimeOddsBroadcaster {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    record Snapshot(double yesOdds, double noOdds) {
    }

    private final OddsSource source;
    private final OddsChangeSink sink;
    private final ScheduledExecutorService timer;
    private final Executor pollers;
    private final long pollIntervalMillis;
    private final double thresholdPercent;
    private final Clock clock;

    private final Map<String, Set<String>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, Snapshot> baselines = new ConcurrentHashMap<>();
    private final AtomicBoolean pollInProgress = new AtomicBoolean();
    private ScheduledFuture<?> task;

    public RealtimeOddsBroadcaster(
            OddsSource source,
            OddsChangeSink sink,
            ScheduledExecutorService timer,
            Executor pollers,
            long pollIntervalMillis,
            double thresholdPercent,
            Clock clock
    ) {
        this.source = source;
        this.sink = sink;
        this.timer = timer;
        this.pollers = pollers;
        this.pollIntervalMillis = pollIntervalMillis;
        this.thresholdPercent = thresholdPercent;
        this.clock = clock;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = timer.scheduleAtFixedRate(this::tick, pollIntervalMillis, pollIntervalMillis, TimeUnit.MILLISECONDS);
        log.info("odds broadcaster started (interval={}ms, threshold={}%)", pollIntervalMillis, thresholdPercent);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        log.info("odds broadcaster stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    public void subscribe(String marketId, String subscriberId) {
        subscribers.computeIfAbsent(marketId, k -> ConcurrentHashMap.newKeySet()).add(subscriberId);
    }

    public void unsubscribe(String marketId, String subscriberId) {
        subscribers.computeIfPresent(marketId, (k, set) -> {
            set.remove(subscriberId);
            if (set.isEmpty()) {
                baselines.remove(marketId);
                return null;
            }
            return set;
        });
    }

    public int getSubscriberCount(String marketId) {
        Set<String> set = subscribers.get(marketId);
        return set == null ? 0 : set.size();
    }

    /**
     * One poll cycle over all subscribed markets, each polled concurrently.
     *
     * @return number of events published, or -1 if a previous cycle was still running and this one was skipped
     */
    public int pollSubscribedMarkets() {
        if (!pollInProgress.compareAndSet(false, true)) {
            log.debug("odds poll still in progress, skipping tick");
            return -1;
        }
        try {
            AtomicInteger published = new AtomicInteger();
            List<CompletableFuture<Void>> polls = new ArrayList<>();
            for (String marketId : subscribers.keySet()) {
                polls.add(CompletableFuture.runAsync(() -> {
                    if (pollMarket(marketId)) {
                        published.incrementAndGet();
                    }
                }, pollers));
            }
            CompletableFuture.allOf(polls.toArray(new CompletableFuture[0])).join();
            return published.get();
        } finally {
            pollInProgress.set(false);
        }
    }

    private void tick() {
        try {
            pollSubscribedMarkets();
        } catch (RuntimeException e) {
            log.warn("odds poll cycle failed: {}", e.getMessage());
        }
    }

    private boolean pollMarket(String marketId) {
        try {
            MarketOdds odds = source.currentOdds(marketId);
            Snapshot current = new Snapshot(odds.yesOdds(), odds.noOdds());
            Snapshot previous = baselines.get(marketId);
            if (previous == null) {
                storeBaseline(marketId, current);
                return false;
            }
            if (!isSignificant(previous, current, thresholdPercent)) {
                return false;
            }
            OddsDirection direction = direction(previous, current);
            if (direction == OddsDirection.UNCHANGED) {
                return false;
            }
            storeBaseline(marketId, current);
            sink.publish(OddsChangedEvent.of(marketId, current.yesOdds(), current.noOdds(), direction, clock.instant()));
            return true;
        } catch (RuntimeException e) {
            log.warn("odds poll failed for market {}: {}", marketId, e.getMessage());
            return false;
        }
    }

    /**
     * Stores the baseline only while the market still has subscribers. Runs under the same per-key lock as
     * {@link #unsubscribe}, so an eviction cannot be undone by a poll that read the odds before it.
     */
    private void storeBaseline(String marketId, Snapshot snapshot) {
        subscribers.computeIfPresent(marketId, (k, set) -> {
            baselines.put(k, snapshot);
            return set;
        });
    }

    /**
     * Relative change in percent. From zero, any move is infinite and no move is zero.
     */
    static double relativeChangePercent(double previous, double current) {
        if (previous == 0) {
            return current == 0 ? 0 : Double.POSITIVE_INFINITY;
        }
        return BigDecimal.valueOf(current).subtract(BigDecimal.valueOf(previous)).abs()
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(previous).abs(), MathContext.DECIMAL64)
                .doubleValue();
    }

    static boolean isSignificant(Snapshot previous, Snapshot current, double thresholdPercent) {
        double change = Math.max(
                relativeChangePercent(previous.yesOdds(), current.yesOdds()),
                relativeChangePercent(previous.noOdds(), current.noOdds()));
        return change > thresholdPercent;
    }

    static OddsDirection direction(Snapshot previous, Snapshot current) {
        int cmp = Double.compare(current.yesOdds(), previous.yesOdds());
        return cmp > 0 ? OddsDirection.YES : cmp < 0 ? OddsDirection.NO : OddsDirection.UNCHANGED;
    }
}
