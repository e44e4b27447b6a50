package com.boxmeout.ledger.envelope;

import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * A signature plus the 4-byte hint identifying which key produced it.
 */
public record DecoratedSignature(byte[] hint, byte[] signature) {

  public static final int HINT_LENGTH = 4;
  public static final int SIGNATURE_LENGTH = 65;

  public DecoratedSignature {
    if (hint == null || hint.length != HINT_LENGTH) {
      throw new IllegalArgumentException("signature hint must be " + HINT_LENGTH + " bytes");
    }
    if (signature == null || signature.length != SIGNATURE_LENGTH) {
      throw new IllegalArgumentException("signature must be " + SIGNATURE_LENGTH + " bytes");
    }
    hint = hint.clone();
    signature = signature.clone();
  }

  @Override
  public byte[] hint() {
    return hint.clone();
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  public boolean hintMatches(byte[] expectedHint) {
    return Arrays.equals(hint, expectedHint);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DecoratedSignature other
        && Arrays.equals(hint, other.hint)
        && Arrays.equals(signature, other.signature);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(hint) + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "DecoratedSignature[hint=" + Numeric.toHexString(hint) + "]";
  }
}
