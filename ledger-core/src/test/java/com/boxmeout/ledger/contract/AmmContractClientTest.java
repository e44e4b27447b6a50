package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.config.LedgerConfigurationException;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.gateway.LedgerRejectedException;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AmmContractClientTest {

  @Mock
  private LedgerTransactionSubmitter submitter;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final TokenAmounts usdc = new TokenAmounts(6);
  private AmmContractClient client;

  @BeforeEach
  void setUp() {
    client = new AmmContractClient(submitter, usdc, "CAMM");
  }

  @Test
  void buyCallCarriesSlippageFloorInTokenUnits() {
    ContractCall call = client.buyCall("buyer", "market-1", 1, new BigDecimal("100"), new BigDecimal("95"));

    assertThat(call.contractId()).isEqualTo("CAMM");
    assertThat(call.function()).isEqualTo("buy_shares");
    assertThat(call.args().get(2).asLong()).isEqualTo(1L);
    assertThat(call.args().get(3).asBigInteger()).isEqualTo(BigInteger.valueOf(100_000_000L));
    assertThat(call.args().get(4).asBigInteger()).isEqualTo(BigInteger.valueOf(95_000_000L));
  }

  @Test
  void parsesBuyResultAndDerivesPrice() {
    ObjectNode rv = objectMapper.createObjectNode()
        .put("shares_out", "180000000")
        .put("total_cost", 100_000_000L)
        .put("fee", "500000");

    TradeExecution execution = client.parseBuy("hash-1", rv, new BigDecimal("100"));

    assertThat(execution.shares()).isEqualByComparingTo("180");
    assertThat(execution.usdcAmount()).isEqualByComparingTo("100");
    assertThat(execution.feeAmount()).isEqualByComparingTo("0.5");
    assertThat(execution.pricePerUnit()).isEqualByComparingTo("0.555556");
  }

  @Test
  void buyWithoutReportedCostFallsBackToAmountSent() {
    ObjectNode rv = objectMapper.createObjectNode().put("shares_out", "0");

    TradeExecution execution = client.parseBuy("hash-1", rv, new BigDecimal("25"));

    assertThat(execution.usdcAmount()).isEqualByComparingTo("25");
    assertThat(execution.pricePerUnit()).isEqualByComparingTo("0");
  }

  @Test
  void rejectsNonNumericAmountInTradeResult() {
    ObjectNode rv = objectMapper.createObjectNode().put("shares_out", "n/a").put("fee", "1000000");

    assertThatThrownBy(() -> client.parseBuy("hash-1", rv, new BigDecimal("100")))
        .isInstanceOf(LedgerRejectedException.class)
        .hasMessageContaining("n/a");
  }

  @Test
  void readsPoolStateWithOddsDefaults() {
    ObjectNode pool = objectMapper.createObjectNode().put("r_yes", "500000000").put("r_no", "500000000");
    when(submitter.read(any())).thenReturn(pool);

    PoolState state = client.getPool("market-1");

    assertThat(state.totalLiquidity()).isEqualByComparingTo("1000");
    assertThat(state.yesOdds()).isEqualTo(0.5);
    assertThat(state.noOdds()).isEqualTo(0.5);
  }

  @Test
  void createPoolSubmitsAndReadsBackReserves() {
    when(submitter.execute(any(), any())).thenReturn(new ConfirmedTransaction("pool-hash", null, 1));
    when(submitter.read(any())).thenReturn(objectMapper.createObjectNode()
        .put("yes_reserve", "500000000").put("no_reserve", "500000000").put("yes_odds", 0.5).put("no_odds", 0.5));

    PoolCreation creation = client.createPool("market-1", new BigDecimal("1000"));

    assertThat(creation.txHash()).isEqualTo("pool-hash");
    assertThat(creation.pool().yesReserve()).isEqualByComparingTo("500");
    ArgumentCaptor<LedgerOperation> op = ArgumentCaptor.forClass(LedgerOperation.class);
    verify(submitter).execute(any(), op.capture());
    assertThat(op.getValue().functionName()).isEqualTo("create_pool");
  }

  @Test
  void refusesCallsWhenContractNotConfigured() {
    AmmContractClient unconfigured = new AmmContractClient(submitter, usdc, " ");

    assertThatThrownBy(() -> unconfigured.getPool("market-1"))
        .isInstanceOf(LedgerConfigurationException.class)
        .hasMessageContaining("ledger.contracts.amm");
  }
}
