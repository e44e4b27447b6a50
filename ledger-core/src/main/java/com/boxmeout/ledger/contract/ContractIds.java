package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.config.LedgerConfigurationException;

final class ContractIds {

  private ContractIds() {
  }

  static String require(String contractId, String property) {
    if (contractId == null || contractId.isBlank()) {
      throw new LedgerConfigurationException("ledger.contracts." + property + " is not configured");
    }
    return contractId.trim();
  }
}
