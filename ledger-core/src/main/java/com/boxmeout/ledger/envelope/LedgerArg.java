package com.boxmeout.ledger.envelope;

import lombok.NonNull;

import java.math.BigInteger;

/**
 * A typed contract-call argument. Values are kept in canonical string form so the encoded
 * envelope is stable regardless of how the caller produced the value.
 */
public record LedgerArg(@NonNull ArgType type, @NonNull String value) {

  public enum ArgType {
    ADDRESS(1),
    U32(2),
    U64(3),
    I128(4),
    STRING(5),
    BOOL(6);

    private final int code;

    ArgType(int code) {
      this.code = code;
    }

    public int code() {
      return code;
    }

    public static ArgType fromCode(int code) {
      for (ArgType t : values()) {
        if (t.code == code) {
          return t;
        }
      }
      throw new IllegalArgumentException("unknown argument type code " + code);
    }
  }

  public static LedgerArg address(String accountOrContract) {
    return new LedgerArg(ArgType.ADDRESS, accountOrContract);
  }

  public static LedgerArg u32(long value) {
    if (value < 0 || value > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("u32 out of range: " + value);
    }
    return new LedgerArg(ArgType.U32, Long.toString(value));
  }

  public static LedgerArg u64(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("u64 must be non-negative: " + value);
    }
    return new LedgerArg(ArgType.U64, Long.toString(value));
  }

  public static LedgerArg i128(BigInteger value) {
    if (value.bitLength() > 127) {
      throw new IllegalArgumentException("i128 out of range: " + value);
    }
    return new LedgerArg(ArgType.I128, value.toString());
  }

  public static LedgerArg string(String value) {
    return new LedgerArg(ArgType.STRING, value);
  }

  public static LedgerArg bool(boolean value) {
    return new LedgerArg(ArgType.BOOL, Boolean.toString(value));
  }

  public long asLong() {
    return Long.parseLong(value);
  }

  public BigInteger asBigInteger() {
    return new BigInteger(value);
  }

  public boolean asBoolean() {
    return Boolean.parseBoolean(value);
  }
}
