package com.boxmeout.ledger.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.protocol.core.Response;

public class LedgerRpcResponse extends Response<JsonNode> {
}
