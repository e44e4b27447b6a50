package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerArg;
import com.boxmeout.ledger.gateway.LedgerRejectedException;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RequiredArgsConstructor
public class FactoryContractClient {

  public static final String SERVICE = "factory";

  private final @NonNull LedgerTransactionSubmitter submitter;
  private final String contractId;

  /**
   * Registers a market on the factory, signed by the admin account on behalf of {@code creatorPublicKey}.
   */
  public MarketCreation createMarket(String creatorPublicKey, String title, String description, String category,
                                     @NonNull Instant closingTime, @NonNull Instant resolutionTime) {
    String factory = ContractIds.require(contractId, "factory");
    ContractCall call = ContractCall.of(factory, "create_market",
        LedgerArg.address(creatorPublicKey == null ? submitter.adminAccount() : creatorPublicKey),
        LedgerArg.string(title),
        LedgerArg.string(description),
        LedgerArg.string(category),
        LedgerArg.u64(closingTime.getEpochSecond()),
        LedgerArg.u64(resolutionTime.getEpochSecond()));

    Map<String, Object> params = new LinkedHashMap<>();
    params.put("title", title);
    params.put("category", category);
    params.put("closingTime", closingTime.toString());
    params.put("resolutionTime", resolutionTime.toString());
    ConfirmedTransaction confirmed = submitter.execute(call, new LedgerOperation(SERVICE, "create_market", params));

    JsonNode rv = confirmed.returnValue();
    if (rv == null || rv.isMissingNode() || rv.isNull()) {
      throw new LedgerRejectedException("create_market returned no market id (hash=" + confirmed.txHash() + ")");
    }
    if (rv.isTextual()) {
      return new MarketCreation(rv.asText(), confirmed.txHash(), factory);
    }
    String marketId = rv.path("market_id").asText(null);
    if (marketId == null || marketId.isBlank()) {
      throw new LedgerRejectedException("create_market returned no market id (hash=" + confirmed.txHash() + ")");
    }
    return new MarketCreation(marketId, confirmed.txHash(), rv.path("contract").asText(factory));
  }
}
