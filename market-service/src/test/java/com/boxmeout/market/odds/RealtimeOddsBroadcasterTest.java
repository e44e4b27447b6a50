package com.boxmeout.market.odds;

import com.boxmeout.market.MarketTestDatabase;
import com.boxmeout.market.trading.MarketOdds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeOddsBroadcasterTest {

    private final Clock clock = Clock.fixed(MarketTestDatabase.NOW, ZoneId.of("UTC"));
    private final Map<String, double[]> pools = new ConcurrentHashMap<>();
    private final List<OddsChangedEvent> published = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService timer;
    private RealtimeOddsBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        broadcaster = new RealtimeOddsBroadcaster(this::odds, published::add, timer, Runnable::run, 5_000L, 1.0, clock);
    }

    @AfterEach
    void tearDown() {
        broadcaster.stop();
        timer.shutdownNow();
    }

    @Test
    void shouldRecordBaselineOnFirstObservation() {
        pools.put("m1", new double[]{0.50, 0.50});
        broadcaster.subscribe("m1", "s1");

        assertThat(broadcaster.pollSubscribedMarkets()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void shouldIgnoreMoveAtThreshold() {
        // Given: baseline 50/50
        pools.put("m1", new double[]{0.50, 0.50});
        broadcaster.subscribe("m1", "s1");
        broadcaster.pollSubscribedMarkets();

        // When: both sides move by exactly 1%
        pools.put("m1", new double[]{0.505, 0.495});

        // Then
        assertThat(broadcaster.pollSubscribedMarkets()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void shouldBroadcastSignificantMoveOnce() {
        // Given
        pools.put("m1", new double[]{0.50, 0.50});
        broadcaster.subscribe("m1", "s1");
        broadcaster.subscribe("m1", "s2");
        broadcaster.pollSubscribedMarkets();

        // When: YES gains 2.2%
        pools.put("m1", new double[]{0.511, 0.489});
        int first = broadcaster.pollSubscribedMarkets();
        int second = broadcaster.pollSubscribedMarkets();

        // Then: one event per change, not per subscriber or per poll
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(published).hasSize(1);
        OddsChangedEvent event = published.get(0);
        assertThat(event.type()).isEqualTo(OddsChangedEvent.TYPE);
        assertThat(event.marketId()).isEqualTo("m1");
        assertThat(event.yesOdds()).isEqualTo(0.511);
        assertThat(event.noOdds()).isEqualTo(0.489);
        assertThat(event.direction()).isEqualTo(OddsDirection.YES);
        assertThat(event.timestamp()).isEqualTo(MarketTestDatabase.NOW);
    }

    @Test
    void shouldAccumulateDriftAgainstLastBroadcast() {
        pools.put("m1", new double[]{0.50, 0.50});
        broadcaster.subscribe("m1", "s1");
        broadcaster.pollSubscribedMarkets();

        // each step is under 1% but together they cross it
        pools.put("m1", new double[]{0.496, 0.504});
        broadcaster.pollSubscribedMarkets();
        pools.put("m1", new double[]{0.492, 0.508});
        broadcaster.pollSubscribedMarkets();

        assertThat(published).hasSize(1);
        assertThat(published.get(0).direction()).isEqualTo(OddsDirection.NO);
    }

    @Test
    void shouldForgetMarketWhenLastSubscriberLeaves() {
        // Given
        pools.put("m1", new double[]{0.50, 0.50});
        broadcaster.subscribe("m1", "s1");
        broadcaster.subscribe("m1", "s2");
        broadcaster.pollSubscribedMarkets();

        // When
        broadcaster.unsubscribe("m1", "s1");
        assertThat(broadcaster.getSubscriberCount("m1")).isEqualTo(1);
        broadcaster.unsubscribe("m1", "s2");

        // Then: no polling, and a new subscriber starts from a fresh baseline
        assertThat(broadcaster.getSubscriberCount("m1")).isZero();
        pools.put("m1", new double[]{0.70, 0.30});
        assertThat(broadcaster.pollSubscribedMarkets()).isZero();
        broadcaster.subscribe("m1", "s3");
        assertThat(broadcaster.pollSubscribedMarkets()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void shouldNotRestoreBaselineWhenLastSubscriberLeavesMidPoll() {
        // Given: a baseline of 50/50, and a source during whose read the only subscriber leaves
        RealtimeOddsBroadcaster[] self = new RealtimeOddsBroadcaster[1];
        self[0] = new RealtimeOddsBroadcaster(marketId -> {
            MarketOdds odds = odds(marketId);
            if (odds.yesOdds() == 0.60) {
                self[0].unsubscribe(marketId, "s1");
            }
            return odds;
        }, published::add, timer, Runnable::run, 5_000L, 1.0, clock);
        pools.put("m1", new double[]{0.50, 0.50});
        self[0].subscribe("m1", "s1");
        self[0].pollSubscribedMarkets();

        // When: the odds move while the subscriber is leaving
        pools.put("m1", new double[]{0.60, 0.40});
        self[0].pollSubscribedMarkets();

        // Then: a new subscriber starts from a fresh baseline instead of the 60/40 read in flight
        published.clear();
        pools.put("m1", new double[]{0.50, 0.50});
        self[0].subscribe("m1", "s2");
        assertThat(self[0].pollSubscribedMarkets()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void shouldSkipOverlappingPollCycle() {
        List<Integer> nested = new ArrayList<>();
        RealtimeOddsBroadcaster[] self = new RealtimeOddsBroadcaster[1];
        self[0] = new RealtimeOddsBroadcaster(marketId -> {
            nested.add(self[0].pollSubscribedMarkets());
            return snapshot(marketId, 0.5, 0.5);
        }, published::add, timer, Runnable::run, 5_000L, 1.0, clock);
        self[0].subscribe("m1", "s1");

        self[0].pollSubscribedMarkets();

        assertThat(nested).containsExactly(-1);
    }

    @Test
    void shouldContainFailureToOneMarket() {
        pools.put("ok", new double[]{0.50, 0.50});
        broadcaster.subscribe("ok", "s1");
        broadcaster.subscribe("broken", "s1");
        broadcaster.pollSubscribedMarkets();

        pools.put("ok", new double[]{0.60, 0.40});

        assertThat(broadcaster.pollSubscribedMarkets()).isEqualTo(1);
        assertThat(published).extracting(OddsChangedEvent::marketId).containsExactly("ok");
    }

    @Test
    void shouldStartAndStopIdempotently() {
        broadcaster.start();
        broadcaster.start();
        assertThat(broadcaster.isRunning()).isTrue();

        broadcaster.stop();
        broadcaster.stop();
        assertThat(broadcaster.isRunning()).isFalse();
    }

    @Test
    void shouldMeasureRelativeChangeExactly() {
        assertThat(RealtimeOddsBroadcaster.relativeChangePercent(0.5, 0.505)).isEqualTo(1.0);
        assertThat(RealtimeOddsBroadcaster.relativeChangePercent(0.0, 0.0)).isZero();
        assertThat(RealtimeOddsBroadcaster.relativeChangePercent(0.0, 0.1)).isInfinite();
        assertThat(RealtimeOddsBroadcaster.direction(
                new RealtimeOddsBroadcaster.Snapshot(0.5, 0.5),
                new RealtimeOddsBroadcaster.Snapshot(0.5, 0.5))).isEqualTo(OddsDirection.UNCHANGED);
    }

    private MarketOdds odds(String marketId) {
        double[] pool = pools.get(marketId);
        if (pool == null) {
            throw new IllegalStateException("pool unavailable for " + marketId);
        }
        return snapshot(marketId, pool[0], pool[1]);
    }

    private static MarketOdds snapshot(String marketId, double yes, double no) {
        int yesPct = (int) Math.round(yes * 100);
        return new MarketOdds(marketId, yes, no, yesPct, 100 - yesPct, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
