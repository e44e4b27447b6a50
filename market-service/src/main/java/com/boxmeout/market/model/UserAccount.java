package com.boxmeout.market.model;

import java.math.BigDecimal;

/**
 * @param publicKey ledger public key registered for the user (hex); null until a wallet is connected
 */
public record UserAccount(
        String id,
        String publicKey,
        BigDecimal usdcBalance
) {
}
