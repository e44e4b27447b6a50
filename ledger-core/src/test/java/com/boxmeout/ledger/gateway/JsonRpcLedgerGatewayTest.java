package com.boxmeout.ledger.gateway;

import com.boxmeout.ledger.LedgerFixtures;
import com.boxmeout.ledger.config.LedgerProperties;
import com.boxmeout.ledger.envelope.EnvelopeCodec;
import com.boxmeout.ledger.envelope.LedgerKeys;
import com.boxmeout.ledger.envelope.TransactionEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JsonRpcLedgerGatewayTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  @Mock
  private Web3jService rpc;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final EnvelopeCodec codec = new EnvelopeCodec(LedgerFixtures.PASSPHRASE);
  private JsonRpcLedgerGateway gateway;

  @BeforeEach
  void setUp() {
    LedgerProperties properties = new LedgerProperties(null, LedgerFixtures.PASSPHRASE, null, null, null,
        null, null, null, null, null);
    gateway = new JsonRpcLedgerGateway(rpc, codec, properties, Clock.fixed(NOW, ZoneId.of("UTC")));
  }

  @Test
  void buildUnsignedUsesNextSequenceAndTimeout() throws IOException {
    String alice = LedgerKeys.publicKeyHex(LedgerFixtures.ALICE);
    ObjectNode account = objectMapper.createObjectNode().put("id", alice).put("sequence", "41");
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenReturn(result(account));

    TransactionEnvelope envelope = gateway.buildUnsigned(LedgerFixtures.buyCall(LedgerFixtures.ALICE, 1_000L), alice);

    assertThat(envelope.transaction().sequence()).isEqualTo(BigInteger.valueOf(42));
    assertThat(envelope.transaction().maxTime()).isEqualTo(NOW.getEpochSecond() + 30);
    assertThat(envelope.transaction().fee()).isEqualTo(100L);
    assertThat(envelope.signatures()).isEmpty();
  }

  @Test
  void pollParsesStatusAndReturnValue() throws IOException {
    ObjectNode tx = objectMapper.createObjectNode().put("status", "SUCCESS");
    tx.putObject("returnValue").put("shares_out", "10000000");
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenReturn(result(tx));

    PollResponse response = gateway.poll("abc");

    assertThat(response.status()).isEqualTo(TransactionStatus.SUCCESS);
    assertThat(response.returnValue().path("shares_out").asText()).isEqualTo("10000000");
    ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
    verify(rpc).send(request.capture(), eq(LedgerRpcResponse.class));
    assertThat(request.getValue().getMethod()).isEqualTo("getTransaction");
    assertThat(request.getValue().getParams()).containsExactly("abc");
  }

  @Test
  void submitMapsStatus() throws IOException {
    ObjectNode sent = objectMapper.createObjectNode().put("hash", "abc").put("status", "try_again_later");
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenReturn(result(sent));

    SubmitResponse response = gateway.submit(LedgerFixtures.unsignedBuy(LedgerFixtures.ALICE, 1L));

    assertThat(response.status()).isEqualTo(SubmitStatus.TRY_AGAIN_LATER);
    assertThat(response.hash()).isEqualTo("abc");
  }

  @Test
  void transportFailureIsNetworkException() throws IOException {
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenThrow(new IOException("connection refused"));

    assertThatThrownBy(() -> gateway.poll("abc"))
        .isInstanceOf(LedgerNetworkException.class)
        .hasMessageContaining("connection refused");
  }

  @Test
  void rpcErrorIsRejection() throws IOException {
    LedgerRpcResponse error = new LedgerRpcResponse();
    error.setError(new Response.Error(-32602, "invalid params"));
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenReturn(error);

    assertThatThrownBy(() -> gateway.poll("abc"))
        .isInstanceOf(LedgerRejectedException.class)
        .hasMessageContaining("invalid params");
  }

  @Test
  void simulationErrorIsRejection() throws IOException {
    ObjectNode sim = objectMapper.createObjectNode().put("error", "HostError: contract panicked");
    when(rpc.send(any(Request.class), eq(LedgerRpcResponse.class))).thenReturn(result(sim));

    assertThatThrownBy(() -> gateway.simulate(LedgerFixtures.buyCall(LedgerFixtures.ALICE, 1L), "reader"))
        .isInstanceOf(LedgerRejectedException.class)
        .hasMessageContaining("panicked");
  }

  private static LedgerRpcResponse result(ObjectNode node) {
    LedgerRpcResponse response = new LedgerRpcResponse();
    response.setResult(node);
    return response;
  }
}
