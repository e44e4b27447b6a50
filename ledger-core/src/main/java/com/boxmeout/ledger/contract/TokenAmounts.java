package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.gateway.LedgerRejectedException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts between decimal token amounts and the integer units the contracts work in.
 */
public class TokenAmounts {

  private final int decimals;

  public TokenAmounts(int decimals) {
    if (decimals < 0) {
      throw new IllegalArgumentException("decimals must be >= 0");
    }
    this.decimals = decimals;
  }

  public int decimals() {
    return decimals;
  }

  /**
   * Truncates below the smallest unit; the ledger never sees more precision than it can hold.
   */
  public BigInteger toUnits(BigDecimal amount) {
    return amount.setScale(decimals, RoundingMode.DOWN).unscaledValue();
  }

  public BigDecimal fromUnits(BigInteger units) {
    return new BigDecimal(units, decimals);
  }

  /**
   * Reads an integer unit amount that the node may encode as a JSON number or a decimal string.
   * Missing values read as zero.
   *
   * @throws LedgerRejectedException if the value is not an integer
   */
  public BigDecimal fromJson(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return BigDecimal.ZERO.setScale(decimals);
    }
    String raw = node.isNumber() ? node.bigIntegerValue().toString() : node.asText().trim();
    if (raw.isEmpty()) {
      return BigDecimal.ZERO.setScale(decimals);
    }
    try {
      return fromUnits(new BigInteger(raw));
    } catch (NumberFormatException e) {
      throw new LedgerRejectedException("ledger returned a non-integer token amount: " + raw, e);
    }
  }
}
