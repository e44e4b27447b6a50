package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.config.LedgerConfigurationException;
import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerArg;
import com.boxmeout.ledger.envelope.LedgerKeys;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.ECKeyPair;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class OracleContractClient {

  public static final String SERVICE = "oracle";

  private final LedgerTransactionSubmitter submitter;
  private final String contractId;
  private final List<ECKeyPair> oracleKeys;

  public OracleContractClient(@NonNull LedgerTransactionSubmitter submitter, String contractId, @NonNull List<String> oracleSecretKeys) {
    this.submitter = submitter;
    this.contractId = contractId;
    this.oracleKeys = oracleSecretKeys.stream().map(LedgerKeys::keyPairFromSecret).toList();
  }

  public record Attestation(String txHash, String oraclePublicKey) {
  }

  /**
   * Attests {@code outcome} with the oracle signer at {@code oracleIndex} (wrapping around the configured signers).
   */
  public Attestation submitAttestation(@NonNull String marketId, int outcome, int oracleIndex) {
    if (oracleKeys.isEmpty()) {
      throw new LedgerConfigurationException("ledger.oracle-secret-keys is empty, cannot attest");
    }
    ECKeyPair signer = oracleKeys.get(Math.floorMod(oracleIndex, oracleKeys.size()));
    String oracle = LedgerKeys.publicKeyHex(signer);
    ContractCall call = ContractCall.of(ContractIds.require(contractId, "oracle"), "submit_attestation",
        LedgerArg.address(oracle),
        LedgerArg.string(marketId),
        LedgerArg.u32(outcome));
    LedgerOperation operation = new LedgerOperation(SERVICE, "submit_attestation",
        Map.of("marketId", marketId, "outcome", outcome, "oracle", oracle));
    String txHash = submitter.submit(submitter.prepare(call, operation, signer)).txHash();
    return new Attestation(txHash, oracle);
  }

  /**
   * Winning outcome once enough oracles agree; empty while consensus is pending or the read fails.
   */
  public Optional<Integer> checkConsensus(@NonNull String marketId) {
    ContractCall call = ContractCall.of(ContractIds.require(contractId, "oracle"), "check_consensus", LedgerArg.string(marketId));
    JsonNode result;
    try {
      result = submitter.read(call);
    } catch (LedgerException e) {
      log.warn("oracle consensus check failed (marketId={}): {}", marketId, e.getMessage());
      return Optional.empty();
    }
    if (result == null || result.isMissingNode() || result.isNull() || !result.canConvertToInt()) {
      return Optional.empty();
    }
    return Optional.of(result.asInt());
  }
}
