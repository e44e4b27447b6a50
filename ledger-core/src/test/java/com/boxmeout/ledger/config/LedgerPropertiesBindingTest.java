package com.boxmeout.ledger.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "ledger.rpc-url=http://ledger.internal:8000/rpc",
        "ledger.execution-mode=NON_CUSTODIAL",
        "ledger.contracts.amm=CAMM",
        "ledger.oracle-secret-keys=0x01, ,0x02",
        "ledger.reliability.max-polling-attempts=5",
        "ledger.reliability.network-retry-delay-millis=250"
    ).run(context -> {
      LedgerProperties properties = context.getBean(LedgerProperties.class);

      assertThat(properties.rpcUrl().getHost()).isEqualTo("ledger.internal");
      assertThat(properties.executionMode()).isEqualTo(ExecutionMode.NON_CUSTODIAL);
      assertThat(properties.contracts().amm()).isEqualTo("CAMM");
      assertThat(properties.oracleSecretKeys()).containsExactly("0x01", "0x02");
      assertThat(properties.reliability().maxPollingAttempts()).isEqualTo(5);
      assertThat(properties.reliability().networkRetryDelayMillis()).isEqualTo(250L);
      assertThat(properties.reliability().maxBackoffMillis()).isEqualTo(8_000L);
    });
  }

  @Test
  void defaultsMatchConfirmationPolicy() {
    runner.run(context -> {
      LedgerProperties properties = context.getBean(LedgerProperties.class);

      assertThat(properties.executionMode()).isEqualTo(ExecutionMode.CUSTODIAL);
      assertThat(properties.usdcDecimals()).isEqualTo(6);
      assertThat(properties.reliability().maxPollingAttempts()).isEqualTo(10);
      assertThat(properties.reliability().initialBackoffMillis()).isEqualTo(1_000L);
      assertThat(properties.reliability().maxNetworkRetries()).isEqualTo(3);
      assertThat(properties.reliability().networkRetryDelayMillis()).isEqualTo(2_000L);
      assertThat(properties.reliability().ioThreads()).isEqualTo(16);
    });
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(LedgerProperties.class)
  static class TestConfig {
  }
}
