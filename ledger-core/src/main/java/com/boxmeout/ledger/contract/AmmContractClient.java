package com.boxmeout.ledger.contract;

import com.boxmeout.ledger.envelope.ContractCall;
import com.boxmeout.ledger.envelope.LedgerArg;
import com.boxmeout.ledger.reliability.ConfirmedTransaction;
import com.boxmeout.ledger.reliability.LedgerOperation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.NonNull;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed access to the AMM contract: {@code get_pool}, {@code create_pool}, {@code buy_shares}, {@code sell_shares}.
 *
 * <p>Trades are always sent with their slippage floor ({@code min_shares} / {@code min_payout}) so the
 * ledger itself refuses a fill below it, whichever party signs.
 */
public class AmmContractClient {

  public static final String SERVICE = "amm";
  public static final String BUY_SHARES = "buy_shares";
  public static final String SELL_SHARES = "sell_shares";

  private final LedgerTransactionSubmitter submitter;
  private final TokenAmounts amounts;
  private final String contractId;

  public AmmContractClient(@NonNull LedgerTransactionSubmitter submitter, @NonNull TokenAmounts amounts, String contractId) {
    this.submitter = submitter;
    this.amounts = amounts;
    this.contractId = contractId;
  }

  public PoolState getPool(@NonNull String marketId) {
    JsonNode pool = submitter.read(ContractCall.of(contractId(), "get_pool", LedgerArg.string(marketId)));
    BigDecimal yes = amounts.fromJson(first(pool, "yes_reserve", "r_yes"));
    BigDecimal no = amounts.fromJson(first(pool, "no_reserve", "r_no"));
    double yesOdds = first(pool, "yes_odds", "odds_yes").asDouble(0.5);
    double noOdds = first(pool, "no_odds", "odds_no").asDouble(0.5);
    return new PoolState(yes, no, yesOdds, noOdds);
  }

  /**
   * Seeds the pool (split evenly between both outcomes by the contract) and returns its state afterwards.
   */
  public PoolCreation createPool(@NonNull String marketId, @NonNull BigDecimal initialLiquidity) {
    ContractCall call = ContractCall.of(contractId(), "create_pool",
        LedgerArg.string(marketId),
        LedgerArg.i128(amounts.toUnits(initialLiquidity)));
    ConfirmedTransaction confirmed = submitter.execute(call, operation("create_pool", Map.of(
        "marketId", marketId,
        "initialLiquidity", initialLiquidity.toPlainString())));
    return new PoolCreation(confirmed.txHash(), getPool(marketId));
  }

  public ContractCall buyCall(String buyer, String marketId, int outcome, BigDecimal amountUsdc, BigDecimal minShares) {
    return ContractCall.of(contractId(), BUY_SHARES,
        LedgerArg.address(buyer),
        LedgerArg.string(marketId),
        LedgerArg.u32(outcome),
        LedgerArg.i128(amounts.toUnits(amountUsdc)),
        LedgerArg.i128(amounts.toUnits(minShares)));
  }

  public ContractCall sellCall(String seller, String marketId, int outcome, BigDecimal shares, BigDecimal minPayout) {
    return ContractCall.of(contractId(), SELL_SHARES,
        LedgerArg.address(seller),
        LedgerArg.string(marketId),
        LedgerArg.u32(outcome),
        LedgerArg.i128(amounts.toUnits(shares)),
        LedgerArg.i128(amounts.toUnits(minPayout)));
  }

  /**
   * Admin-signed buy. The admin account is the on-ledger buyer; the user is tracked in the local projection.
   */
  public PreparedTransaction prepareBuy(String marketId, int outcome, BigDecimal amountUsdc, BigDecimal minShares) {
    return submitter.prepare(
        buyCall(submitter.adminAccount(), marketId, outcome, amountUsdc, minShares),
        buyOperation(marketId, outcome, amountUsdc, minShares));
  }

  public PreparedTransaction prepareSell(String marketId, int outcome, BigDecimal shares, BigDecimal minPayout) {
    return submitter.prepare(
        sellCall(submitter.adminAccount(), marketId, outcome, shares, minPayout),
        sellOperation(marketId, outcome, shares, minPayout));
  }

  /**
   * Unsigned buy envelope naming {@code userPublicKey} as buyer, for the user's wallet to sign.
   */
  public String buildUnsignedBuy(String userPublicKey, String marketId, int outcome, BigDecimal amountUsdc, BigDecimal minShares) {
    return submitter.buildUnsigned(buyCall(userPublicKey, marketId, outcome, amountUsdc, minShares), userPublicKey);
  }

  public String buildUnsignedSell(String userPublicKey, String marketId, int outcome, BigDecimal shares, BigDecimal minPayout) {
    return submitter.buildUnsigned(sellCall(userPublicKey, marketId, outcome, shares, minPayout), userPublicKey);
  }

  public LedgerOperation buyOperation(String marketId, int outcome, BigDecimal amountUsdc, BigDecimal minShares) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("marketId", marketId);
    params.put("outcome", outcome);
    params.put("amountUsdc", amountUsdc.toPlainString());
    params.put("minShares", minShares.toPlainString());
    return operation(BUY_SHARES, params);
  }

  public LedgerOperation sellOperation(String marketId, int outcome, BigDecimal shares, BigDecimal minPayout) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("marketId", marketId);
    params.put("outcome", outcome);
    params.put("shares", shares.toPlainString());
    params.put("minPayout", minPayout.toPlainString());
    return operation(SELL_SHARES, params);
  }

  /**
   * Reads a {@code buy_shares} return value: {@code {shares_out, total_cost, fee}} in token units.
   * A missing {@code total_cost} falls back to the amount sent.
   */
  public TradeExecution parseBuy(String txHash, JsonNode returnValue, BigDecimal amountSent) {
    JsonNode rv = returnValue == null ? MissingNode.getInstance() : returnValue;
    BigDecimal shares = amounts.fromJson(first(rv, "shares_out", "shares"));
    JsonNode costNode = first(rv, "total_cost", "cost");
    BigDecimal totalCost = costNode.isMissingNode() || costNode.isNull() ? amountSent : amounts.fromJson(costNode);
    BigDecimal fee = amounts.fromJson(first(rv, "fee", "fee_amount"));
    return new TradeExecution(txHash, shares, totalCost, fee, price(totalCost, shares));
  }

  /**
   * Reads a {@code sell_shares} return value: {@code {payout, fee}} in token units.
   */
  public TradeExecution parseSell(String txHash, JsonNode returnValue, BigDecimal sharesSold) {
    JsonNode rv = returnValue == null ? MissingNode.getInstance() : returnValue;
    BigDecimal payout = amounts.fromJson(first(rv, "payout", "usdc_out"));
    BigDecimal fee = amounts.fromJson(first(rv, "fee", "fee_amount"));
    return new TradeExecution(txHash, sharesSold, payout, fee, price(payout, sharesSold));
  }

  private BigDecimal price(BigDecimal usdc, BigDecimal shares) {
    if (shares.signum() == 0) {
      return BigDecimal.ZERO.setScale(amounts.decimals());
    }
    return usdc.divide(shares, amounts.decimals(), RoundingMode.HALF_UP);
  }

  private LedgerOperation operation(String function, Map<String, Object> params) {
    return new LedgerOperation(SERVICE, function, params);
  }

  private String contractId() {
    return ContractIds.require(contractId, "amm");
  }

  private static JsonNode first(JsonNode node, String name, String alias) {
    JsonNode value = node.path(name);
    return value.isMissingNode() ? node.path(alias) : value;
  }
}
