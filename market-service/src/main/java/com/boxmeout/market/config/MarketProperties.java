package com.boxmeout.market.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "market")
public record MarketProperties(
        /**
         * Fraction of the quoted amount a trade must return at least: min shares for a buy,
         * min payout for a sell.
         */
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal slippageFactor,
        /**
         * Resolution time used when a market is created without one, counted from its closing time.
         */
        @NotNull Duration defaultResolutionDelay,
        /**
         * Settlement PnL of a winning position as a multiple of its cost basis.
         */
        @NotNull @DecimalMin("0.0") BigDecimal winnerReturnRate,
        /**
         * Parallel per-user settlement transactions when a market resolves.
         */
        @NotNull @Min(1) Integer settlementThreads,
        @Valid Odds odds,
        @Valid Lifecycle lifecycle,
        @Valid Reconciliation reconciliation
) {

    public MarketProperties {
        if (slippageFactor == null) {
            slippageFactor = new BigDecimal("0.95");
        }
        if (defaultResolutionDelay == null) {
            defaultResolutionDelay = Duration.ofHours(24);
        }
        if (winnerReturnRate == null) {
            winnerReturnRate = new BigDecimal("0.9");
        }
        if (settlementThreads == null) {
            settlementThreads = 4;
        }
        if (odds == null) {
            odds = new Odds(null, null, null);
        }
        if (lifecycle == null) {
            lifecycle = new Lifecycle(null, null, null);
        }
        if (reconciliation == null) {
            reconciliation = new Reconciliation(null, null, null, null, null);
        }
    }

    public record Odds(
            /**
             * Period of the odds polling timer.
             */
            @NotNull @Min(1) Long pollIntervalMillis,
            /**
             * Minimum relative move, in percent, of either side's odds before subscribers are notified.
             */
            @NotNull @DecimalMin("0.0") Double changeThresholdPercent,
            @NotNull @Min(1) Integer pollerThreads
    ) {
        public Odds {
            if (pollIntervalMillis == null) {
                pollIntervalMillis = 5_000L;
            }
            if (changeThresholdPercent == null) {
                changeThresholdPercent = 1.0;
            }
            if (pollerThreads == null) {
                pollerThreads = 4;
            }
        }
    }

    public record Lifecycle(
            /**
             * Closes expired markets and tries oracle resolution on a timer.
             */
            Boolean enabled,
            @NotNull @Min(1) Long pollIntervalMillis,
            @NotNull @Min(1) Integer batchSize
    ) {
        public Lifecycle {
            if (enabled == null) {
                enabled = false;
            }
            if (pollIntervalMillis == null) {
                pollIntervalMillis = 60_000L;
            }
            if (batchSize == null) {
                batchSize = 100;
            }
        }
    }

    public record Reconciliation(
            Boolean enabled,
            /**
             * Age before a PENDING trade is looked at; leaves room for the request that created it to finish.
             */
            @NotNull Duration grace,
            /**
             * Age after which a PENDING trade the ledger has never seen is marked FAILED.
             */
            @NotNull Duration expireAfter,
            @NotNull @Min(1) Integer batchSize,
            @NotNull @Min(1) Long intervalMillis
    ) {
        public Reconciliation {
            if (enabled == null) {
                enabled = true;
            }
            if (grace == null) {
                grace = Duration.ofMinutes(2);
            }
            if (expireAfter == null) {
                expireAfter = Duration.ofMinutes(10);
            }
            if (batchSize == null) {
                batchSize = 50;
            }
            if (intervalMillis == null) {
                intervalMillis = 30_000L;
            }
        }
    }
}
