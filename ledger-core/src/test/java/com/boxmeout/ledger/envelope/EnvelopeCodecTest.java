package com.boxmeout.ledger.envelope;

import com.boxmeout.ledger.LedgerFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

  private final EnvelopeCodec codec = new EnvelopeCodec(LedgerFixtures.PASSPHRASE);
  private final EnvelopeSigner signer = new EnvelopeSigner(codec);

  @Test
  void decodesSignedTransactionEnvelopeWithAllFields() {
    TransactionEnvelope signed = signer.sign(LedgerFixtures.unsignedBuy(LedgerFixtures.ALICE, 100_000_000L), LedgerFixtures.ALICE);

    LedgerEnvelope decoded = codec.decode(codec.encode(signed));

    assertThat(decoded).isInstanceOf(TransactionEnvelope.class).isEqualTo(signed);
    assertThat(decoded.call().function()).isEqualTo("buy_shares");
    assertThat(decoded.call().args().get(3).asBigInteger()).isEqualTo(BigInteger.valueOf(100_000_000L));
    assertThat(decoded.signatures()).hasSize(1);
  }

  @Test
  void fallsBackToFeeBumpEnvelope() {
    TransactionEnvelope inner = signer.sign(LedgerFixtures.unsignedBuy(LedgerFixtures.ALICE, 5_000_000L), LedgerFixtures.ALICE);
    FeeBumpEnvelope bump = signer.sign(
        new FeeBumpEnvelope(LedgerKeys.publicKeyHex(LedgerFixtures.BOB), 10_000L, inner, null), LedgerFixtures.BOB);

    LedgerEnvelope decoded = codec.decode(codec.encode(bump));

    assertThat(decoded).isInstanceOf(FeeBumpEnvelope.class);
    FeeBumpEnvelope feeBump = (FeeBumpEnvelope) decoded;
    assertThat(feeBump.inner()).isEqualTo(inner);
    assertThat(feeBump.call()).isEqualTo(inner.call());
    assertThat(feeBump.signingAccount()).isEqualTo(LedgerKeys.publicKeyHex(LedgerFixtures.BOB));
  }

  @Test
  void rejectsInputThatIsNeitherEnvelopeType() {
    String notBase64 = "%%% not base64 %%%";
    String notRlp = Base64.getEncoder().encodeToString("hello world".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> codec.decode(notBase64)).isInstanceOf(MalformedEnvelopeException.class);
    assertThatThrownBy(() -> codec.decode(notRlp)).isInstanceOf(MalformedEnvelopeException.class);
    assertThatThrownBy(() -> codec.decode("")).isInstanceOf(MalformedEnvelopeException.class);
    assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(MalformedEnvelopeException.class);
  }

  @Test
  void hashIgnoresSignaturesButBindsNetworkAndContent() {
    TransactionEnvelope unsigned = LedgerFixtures.unsignedBuy(LedgerFixtures.ALICE, 1_000_000L);
    TransactionEnvelope signed = signer.sign(unsigned, LedgerFixtures.ALICE);

    assertThat(codec.hashHex(signed)).isEqualTo(codec.hashHex(unsigned)).hasSize(64);
    assertThat(new EnvelopeCodec("Other Network").hashHex(unsigned)).isNotEqualTo(codec.hashHex(unsigned));
    assertThat(codec.hashHex(LedgerFixtures.unsignedBuy(LedgerFixtures.ALICE, 1_000_001L)))
        .isNotEqualTo(codec.hashHex(unsigned));
  }
}
