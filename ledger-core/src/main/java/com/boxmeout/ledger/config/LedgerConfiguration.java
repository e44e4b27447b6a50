package com.boxmeout.ledger.config;

import com.boxmeout.ledger.contract.AmmContractClient;
import com.boxmeout.ledger.contract.FactoryContractClient;
import com.boxmeout.ledger.contract.LedgerTransactionSubmitter;
import com.boxmeout.ledger.contract.MarketContractClient;
import com.boxmeout.ledger.contract.OracleContractClient;
import com.boxmeout.ledger.contract.TokenAmounts;
import com.boxmeout.ledger.contract.TreasuryContractClient;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.EnvelopeSigner;
import com.boxmeout.ledger.gateway.JsonRpcLedgerGateway;
import com.boxmeout.ledger.gateway.LedgerGateway;
import com.boxmeout.ledger.reliability.DeadLetterQueue;
import com.boxmeout.ledger.reliability.ExecutorPollScheduler;
import com.boxmeout.ledger.reliability.LedgerAlerter;
import com.boxmeout.ledger.reliability.LoggingLedgerAlerter;
import com.boxmeout.ledger.reliability.PollScheduler;
import com.boxmeout.ledger.reliability.TransactionReliabilityLayer;
import com.boxmeout.ledger.signature.SignatureGate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the ledger pipeline: RPC transport, gateway, reliability layer, signature gate and contract clients.
 *
 * The {@link DeadLetterQueue} is supplied by the hosting application.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  public EnvelopeCodec envelopeCodec(LedgerProperties properties) {
    return new EnvelopeCodec(properties.networkPassphrase());
  }

  @Bean
  public EnvelopeSigner envelopeSigner(EnvelopeCodec codec) {
    return new EnvelopeSigner(codec);
  }

  @Bean
  public Web3jService ledgerRpcService(LedgerProperties properties) {
    log.info("Ledger RPC endpoint: {} (mode={})", properties.rpcUrl(), properties.executionMode());
    return new HttpService(properties.rpcUrl().toString());
  }

  @Bean
  public LedgerGateway ledgerGateway(Web3jService ledgerRpcService, EnvelopeCodec codec, LedgerProperties properties) {
    return new JsonRpcLedgerGateway(ledgerRpcService, codec, properties, Clock.systemUTC());
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService ledgerPollExecutor(LedgerProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newScheduledThreadPool(properties.reliability().schedulerThreads(), r -> {
      Thread t = new Thread(r, "ledger-poll-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService ledgerIoExecutor(LedgerProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(properties.reliability().ioThreads(), r -> {
      Thread t = new Thread(r, "ledger-io-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public PollScheduler pollScheduler(
      @Qualifier("ledgerPollExecutor") ScheduledExecutorService ledgerPollExecutor,
      @Qualifier("ledgerIoExecutor") ExecutorService ledgerIoExecutor
  ) {
    return new ExecutorPollScheduler(ledgerPollExecutor, ledgerIoExecutor);
  }

  @Bean
  public LedgerAlerter ledgerAlerter(MeterRegistry meterRegistry) {
    return new LoggingLedgerAlerter(meterRegistry);
  }

  @Bean
  public TransactionReliabilityLayer transactionReliabilityLayer(
      LedgerGateway gateway,
      EnvelopeCodec codec,
      DeadLetterQueue deadLetterQueue,
      LedgerAlerter alerter,
      PollScheduler pollScheduler,
      LedgerProperties properties,
      MeterRegistry meterRegistry
  ) {
    return new TransactionReliabilityLayer(
        gateway,
        codec,
        deadLetterQueue,
        alerter,
        pollScheduler,
        properties.reliability(),
        meterRegistry
    );
  }

  @Bean
  public SignatureGate signatureGate(EnvelopeCodec codec, TransactionReliabilityLayer reliability) {
    return new SignatureGate(codec, reliability);
  }

  @Bean
  public TokenAmounts usdcAmounts(LedgerProperties properties) {
    return new TokenAmounts(properties.usdcDecimals());
  }

  @Bean
  public LedgerTransactionSubmitter ledgerTransactionSubmitter(
      LedgerGateway gateway,
      EnvelopeCodec codec,
      EnvelopeSigner signer,
      TransactionReliabilityLayer reliability,
      LedgerProperties properties
  ) {
    return new LedgerTransactionSubmitter(gateway, codec, signer, reliability, properties.adminSecretKey());
  }

  @Bean
  public AmmContractClient ammContractClient(LedgerTransactionSubmitter submitter, TokenAmounts usdcAmounts, LedgerProperties properties) {
    return new AmmContractClient(submitter, usdcAmounts, properties.contracts().amm());
  }

  @Bean
  public FactoryContractClient factoryContractClient(LedgerTransactionSubmitter submitter, LedgerProperties properties) {
    return new FactoryContractClient(submitter, properties.contracts().factory());
  }

  @Bean
  public MarketContractClient marketContractClient(LedgerTransactionSubmitter submitter) {
    return new MarketContractClient(submitter);
  }

  @Bean
  public OracleContractClient oracleContractClient(LedgerTransactionSubmitter submitter, LedgerProperties properties) {
    return new OracleContractClient(submitter, properties.contracts().oracle(), properties.oracleSecretKeys());
  }

  @Bean
  public TreasuryContractClient treasuryContractClient(LedgerTransactionSubmitter submitter, TokenAmounts usdcAmounts,
                                                       LedgerProperties properties) {
    return new TreasuryContractClient(submitter, usdcAmounts, properties.contracts().treasury());
  }
}
