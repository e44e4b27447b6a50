package com.boxmeout.ledger.reliability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link DeadLetterQueue}. Entries do not survive a restart; intended for tooling and tests.
 */
@RequiredArgsConstructor
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull Clock clock;

  private final Map<String, DeadLetterEntry> entries = new ConcurrentHashMap<>();

  @Override
  public void upsert(@NonNull String txHash, @NonNull LedgerOperation operation, String error) {
    Instant now = clock.instant();
    entries.compute(txHash, (hash, existing) -> existing == null
        ? new DeadLetterEntry(hash, operation.serviceName(), operation.functionName(), paramsJson(operation),
            error, DeadLetterStatus.FAILED, now, now)
        : new DeadLetterEntry(hash, existing.serviceName(), existing.functionName(), existing.params(),
            error, DeadLetterStatus.FAILED, existing.createdAt(), now));
  }

  @Override
  public Optional<DeadLetterEntry> find(String txHash) {
    return Optional.ofNullable(entries.get(txHash));
  }

  @Override
  public List<DeadLetterEntry> listFailed(int limit) {
    return entries.values().stream()
        .filter(e -> e.status() == DeadLetterStatus.FAILED)
        .sorted(Comparator.comparing(DeadLetterEntry::updatedAt).reversed())
        .limit(Math.max(0, limit))
        .toList();
  }

  @Override
  public boolean markResolved(String txHash) {
    DeadLetterEntry updated = entries.computeIfPresent(txHash, (hash, e) -> new DeadLetterEntry(
        hash, e.serviceName(), e.functionName(), e.params(), e.error(), DeadLetterStatus.RESOLVED,
        e.createdAt(), clock.instant()));
    return updated != null;
  }

  private String paramsJson(LedgerOperation operation) {
    try {
      return objectMapper.writeValueAsString(operation.params());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("operation params are not serialisable: " + operation, e);
    }
  }
}
