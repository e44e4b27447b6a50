package com.boxmeout.ledger.envelope;

import lombok.NonNull;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Account identities are uncompressed secp256k1 public keys (64 bytes, lower-case hex, no prefix).
 */
public final class LedgerKeys {

  private static final int PUBLIC_KEY_HEX_LENGTH = 128;

  private LedgerKeys() {
  }

  public static ECKeyPair keyPairFromSecret(@NonNull String secretHex) {
    return ECKeyPair.create(Numeric.toBigInt(secretHex.trim()));
  }

  public static String publicKeyHex(@NonNull ECKeyPair keyPair) {
    return publicKeyHex(keyPair.getPublicKey());
  }

  public static String publicKeyHex(@NonNull BigInteger publicKey) {
    return Numeric.toHexStringNoPrefixZeroPadded(publicKey, PUBLIC_KEY_HEX_LENGTH);
  }

  /**
   * Canonical form of a caller-supplied public key; rejects anything that is not 64 bytes of hex.
   */
  public static String normalize(@NonNull String publicKeyHex) {
    String clean = Numeric.cleanHexPrefix(publicKeyHex.trim()).toLowerCase(Locale.ROOT);
    if (clean.length() != PUBLIC_KEY_HEX_LENGTH || !clean.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
      throw new IllegalArgumentException("not a 64-byte hex public key");
    }
    return clean;
  }

  /**
   * Last four bytes of the public key, carried next to each signature so verifiers can skip unrelated signers.
   */
  public static byte[] hint(@NonNull String publicKeyHex) {
    byte[] key = Numeric.hexStringToByteArray(normalize(publicKeyHex));
    return Arrays.copyOfRange(key, key.length - DecoratedSignature.HINT_LENGTH, key.length);
  }

  public static byte[] signHash(byte[] hash, ECKeyPair keyPair) {
    Sign.SignatureData data = Sign.signMessage(hash, keyPair, false);
    byte[] out = new byte[DecoratedSignature.SIGNATURE_LENGTH];
    System.arraycopy(data.getR(), 0, out, 0, 32);
    System.arraycopy(data.getS(), 0, out, 32, 32);
    out[64] = data.getV()[0];
    return out;
  }

  /**
   * Public key that produced {@code signature} over {@code hash}, or empty if the signature is not recoverable.
   */
  public static Optional<String> recover(byte[] hash, byte[] signature) {
    if (signature == null || signature.length != DecoratedSignature.SIGNATURE_LENGTH) {
      return Optional.empty();
    }
    Sign.SignatureData data = new Sign.SignatureData(
        signature[64],
        Arrays.copyOfRange(signature, 0, 32),
        Arrays.copyOfRange(signature, 32, 64)
    );
    try {
      return Optional.of(publicKeyHex(Sign.signedMessageHashToKey(hash, data)));
    } catch (SignatureException | RuntimeException e) {
      return Optional.empty();
    }
  }
}
