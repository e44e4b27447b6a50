package com.boxmeout.ledger.envelope;

import lombok.NonNull;
import org.web3j.crypto.Hash;
import org.web3j.rlp.RlpDecoder;
import org.web3j.rlp.RlpEncoder;
import org.web3j.rlp.RlpList;
import org.web3j.rlp.RlpString;
import org.web3j.rlp.RlpType;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Wire codec for ledger envelopes: base64 over an RLP structure.
 *
 * <pre>
 * transaction envelope: [0x02, [source, sequence, fee, maxTime, [contractId, function, [[type, value]...]]], [[hint, sig]...]]
 * fee-bump envelope:    [0x05, feeSource, maxFee, transactionEnvelope, [[hint, sig]...]]
 * </pre>
 *
 * The hash that signatures cover is {@code keccak256(keccak256(passphrase) || type || rlp(body))}, where the body
 * of a fee-bump envelope embeds the complete inner envelope including its signatures.
 */
public class EnvelopeCodec {

  private final byte[] networkId;

  public EnvelopeCodec(@NonNull String networkPassphrase) {
    this.networkId = Hash.sha3(networkPassphrase.getBytes(StandardCharsets.UTF_8));
  }

  public String encode(@NonNull LedgerEnvelope envelope) {
    return Base64.getEncoder().encodeToString(RlpEncoder.encode(toRlp(envelope)));
  }

  /**
   * Decodes a transaction envelope first, then a fee-bump envelope.
   *
   * @throws MalformedEnvelopeException when the input is neither
   */
  public LedgerEnvelope decode(String envelopeBase64) {
    if (envelopeBase64 == null || envelopeBase64.isBlank()) {
      throw new MalformedEnvelopeException("envelope is empty");
    }
    RlpList root;
    try {
      byte[] raw = Base64.getDecoder().decode(envelopeBase64.trim());
      RlpList decoded = RlpDecoder.decode(raw);
      if (decoded.getValues().size() != 1 || !(decoded.getValues().get(0) instanceof RlpList list)) {
        throw new MalformedEnvelopeException("envelope is not a single RLP list");
      }
      root = list;
    } catch (MalformedEnvelopeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MalformedEnvelopeException("envelope is not valid base64 RLP", e);
    }

    try {
      return decodeTransactionEnvelope(root);
    } catch (RuntimeException txError) {
      try {
        return decodeFeeBumpEnvelope(root);
      } catch (RuntimeException feeBumpError) {
        MalformedEnvelopeException ex = new MalformedEnvelopeException(
            "envelope is neither a transaction nor a fee-bump envelope", txError);
        ex.addSuppressed(feeBumpError);
        throw ex;
      }
    }
  }

  public byte[] hash(@NonNull LedgerEnvelope envelope) {
    RlpType body;
    if (envelope instanceof TransactionEnvelope tx) {
      body = transactionRlp(tx.transaction());
    } else if (envelope instanceof FeeBumpEnvelope feeBump) {
      body = new RlpList(
          utf8(feeBump.feeSource()),
          RlpString.create(feeBump.maxFee()),
          toRlp(feeBump.inner())
      );
    } else {
      throw new IllegalArgumentException("unsupported envelope " + envelope.getClass().getName());
    }
    ByteArrayOutputStream payload = new ByteArrayOutputStream();
    payload.writeBytes(networkId);
    payload.write(envelope.envelopeType());
    payload.writeBytes(RlpEncoder.encode(body));
    return Hash.sha3(payload.toByteArray());
  }

  /**
   * Transaction hash as it is reported by the ledger: lower-case hex without prefix.
   */
  public String hashHex(LedgerEnvelope envelope) {
    return Numeric.toHexStringNoPrefix(hash(envelope));
  }

  private RlpList toRlp(LedgerEnvelope envelope) {
    if (envelope instanceof TransactionEnvelope tx) {
      return new RlpList(
          RlpString.create((byte) TransactionEnvelope.TYPE_TRANSACTION),
          transactionRlp(tx.transaction()),
          signaturesRlp(tx.signatures())
      );
    }
    if (envelope instanceof FeeBumpEnvelope feeBump) {
      return new RlpList(
          RlpString.create((byte) FeeBumpEnvelope.TYPE_FEE_BUMP),
          utf8(feeBump.feeSource()),
          RlpString.create(feeBump.maxFee()),
          toRlp(feeBump.inner()),
          signaturesRlp(feeBump.signatures())
      );
    }
    throw new IllegalArgumentException("unsupported envelope " + envelope.getClass().getName());
  }

  private static RlpList transactionRlp(LedgerTransaction tx) {
    ContractCall call = tx.call();
    List<RlpType> args = new ArrayList<>(call.args().size());
    for (LedgerArg arg : call.args()) {
      args.add(new RlpList(RlpString.create(arg.type().code()), utf8(arg.value())));
    }
    return new RlpList(
        utf8(tx.sourceAccount()),
        RlpString.create(tx.sequence()),
        RlpString.create(tx.fee()),
        RlpString.create(tx.maxTime()),
        new RlpList(utf8(call.contractId()), utf8(call.function()), new RlpList(args))
    );
  }

  private static RlpList signaturesRlp(List<DecoratedSignature> signatures) {
    List<RlpType> items = new ArrayList<>(signatures.size());
    for (DecoratedSignature sig : signatures) {
      items.add(new RlpList(RlpString.create(sig.hint()), RlpString.create(sig.signature())));
    }
    return new RlpList(items);
  }

  private static TransactionEnvelope decodeTransactionEnvelope(RlpList root) {
    List<RlpType> values = root.getValues();
    requireType(values, TransactionEnvelope.TYPE_TRANSACTION, 3);
    RlpList txList = (RlpList) values.get(1);
    List<RlpType> tx = txList.getValues();
    if (tx.size() != 5) {
      throw new IllegalArgumentException("transaction body must have 5 fields");
    }
    List<RlpType> call = ((RlpList) tx.get(4)).getValues();
    if (call.size() != 3) {
      throw new IllegalArgumentException("contract call must have 3 fields");
    }
    List<LedgerArg> args = new ArrayList<>();
    for (RlpType item : ((RlpList) call.get(2)).getValues()) {
      List<RlpType> pair = ((RlpList) item).getValues();
      int code = ((RlpString) pair.get(0)).asPositiveBigInteger().intValueExact();
      args.add(new LedgerArg(LedgerArg.ArgType.fromCode(code), text(pair.get(1))));
    }
    LedgerTransaction transaction = new LedgerTransaction(
        text(tx.get(0)),
        ((RlpString) tx.get(1)).asPositiveBigInteger(),
        ((RlpString) tx.get(2)).asPositiveBigInteger().longValueExact(),
        ((RlpString) tx.get(3)).asPositiveBigInteger().longValueExact(),
        new ContractCall(text(call.get(0)), text(call.get(1)), args)
    );
    return new TransactionEnvelope(transaction, decodeSignatures((RlpList) values.get(2)));
  }

  private static FeeBumpEnvelope decodeFeeBumpEnvelope(RlpList root) {
    List<RlpType> values = root.getValues();
    requireType(values, FeeBumpEnvelope.TYPE_FEE_BUMP, 5);
    return new FeeBumpEnvelope(
        text(values.get(1)),
        ((RlpString) values.get(2)).asPositiveBigInteger().longValueExact(),
        decodeTransactionEnvelope((RlpList) values.get(3)),
        decodeSignatures((RlpList) values.get(4))
    );
  }

  private static void requireType(List<RlpType> values, int expectedType, int expectedSize) {
    if (values.size() != expectedSize) {
      throw new IllegalArgumentException("expected " + expectedSize + " fields, got " + values.size());
    }
    byte[] tag = ((RlpString) values.get(0)).getBytes();
    if (tag.length != 1 || tag[0] != expectedType) {
      throw new IllegalArgumentException("envelope type mismatch, expected " + expectedType);
    }
  }

  private static List<DecoratedSignature> decodeSignatures(RlpList list) {
    List<DecoratedSignature> out = new ArrayList<>();
    for (RlpType item : list.getValues()) {
      List<RlpType> pair = ((RlpList) item).getValues();
      out.add(new DecoratedSignature(((RlpString) pair.get(0)).getBytes(), ((RlpString) pair.get(1)).getBytes()));
    }
    return out;
  }

  private static RlpString utf8(String value) {
    return RlpString.create(value.getBytes(StandardCharsets.UTF_8));
  }

  private static String text(RlpType item) {
    return new String(((RlpString) item).getBytes(), StandardCharsets.UTF_8);
  }
}
