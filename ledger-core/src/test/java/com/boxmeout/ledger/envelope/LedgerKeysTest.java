package com.boxmeout.ledger.envelope;

import com.boxmeout.ledger.LedgerFixtures;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerKeysTest {

  @Test
  void recoversSignerFromSignature() {
    byte[] hash = Hash.sha3("payload".getBytes(StandardCharsets.UTF_8));
    byte[] signature = LedgerKeys.signHash(hash, LedgerFixtures.ALICE);

    assertThat(signature).hasSize(DecoratedSignature.SIGNATURE_LENGTH);
    assertThat(LedgerKeys.recover(hash, signature)).contains(LedgerKeys.publicKeyHex(LedgerFixtures.ALICE));
    assertThat(LedgerKeys.recover(hash, new byte[10])).isEmpty();
  }

  @Test
  void normalizesPrefixAndCase() {
    String key = LedgerKeys.publicKeyHex(LedgerFixtures.BOB);

    assertThat(LedgerKeys.normalize("0x" + key.toUpperCase())).isEqualTo(key);
    assertThatThrownBy(() -> LedgerKeys.normalize("0x1234")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void hintIsLastFourBytesOfPublicKey() {
    String key = LedgerKeys.publicKeyHex(LedgerFixtures.ALICE);

    byte[] hint = LedgerKeys.hint(key);

    assertThat(Numeric.toHexStringNoPrefix(hint)).isEqualTo(key.substring(key.length() - 8));
  }
}
