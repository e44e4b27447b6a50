package com.boxmeout.market.error;

import com.boxmeout.ledger.LedgerException;
import com.boxmeout.ledger.envelope.MalformedEnvelopeException;
import com.boxmeout.ledger.signature.InvalidSignatureException;
import lombok.Getter;

/**
 * Business-level failure of a market or trading operation. The {@link ErrorCode} is what callers map to a response.
 */
@Getter
public class MarketException extends RuntimeException {

    private final ErrorCode code;

    public MarketException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MarketException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCategory category() {
        return code.category();
    }

    public static MarketException notFound(String what, String id) {
        return new MarketException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    /**
     * Maps a failure from the ledger pipeline onto the business taxonomy.
     */
    public static MarketException fromLedger(String action, LedgerException e) {
        if (e instanceof InvalidSignatureException) {
            return new MarketException(ErrorCode.INVALID_SIGNATURE, e.getMessage(), e);
        }
        if (e instanceof MalformedEnvelopeException) {
            return new MarketException(ErrorCode.MALFORMED_ENVELOPE, e.getMessage(), e);
        }
        return new MarketException(ErrorCode.BLOCKCHAIN_ERROR, action + " failed on ledger: " + e.getMessage(), e);
    }
}
