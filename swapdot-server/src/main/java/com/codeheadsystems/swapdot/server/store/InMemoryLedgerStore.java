package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.InternalException;
import com.codeheadsystems.swapdot.server.exception.SwapDotException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.PendingState;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.StagedState;
import com.codeheadsystems.swapdot.server.model.StagedTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TransferEvent;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.TransferSessionState;
import com.codeheadsystems.swapdot.server.model.UserStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link LedgerStore} with optimistic concurrency control.
 * <p>
 * Every document carries a version. An attempt records the version of each document it reads
 * (zero for absent ones) and of each collection it queries; commit re-checks them under a single
 * lock and either applies all buffered writes or discards the attempt. Tokens are held as JSON
 * {@link TokenDocument}s so that legacy document shapes go through the same normalization a
 * real document store would need.
 * <p>
 * All data is lost on restart. Suitable for development and testing only.
 */
public class InMemoryLedgerStore implements LedgerStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerStore.class);

  enum Collection {
    TOKENS,
    PENDING_TRANSFERS,
    TRANSFER_SESSIONS,
    STAGED_TRANSFERS,
    USER_STATS
  }

  private record Key(Collection collection, String id) {
  }

  private record Versioned(Object value, long version) {
  }

  private final Map<Collection, ConcurrentHashMap<String, Versioned>> collections = new EnumMap<>(Collection.class);
  private final Map<Collection, AtomicLong> collectionVersions = new EnumMap<>(Collection.class);
  private final List<TransferEvent> events = new ArrayList<>();
  private final List<AuditEntry> auditLog = new ArrayList<>();
  private final AtomicLong versionSequence = new AtomicLong();
  private final Object commitLock = new Object();
  private final ObjectMapper objectMapper;
  private final int maxAttempts;

  public InMemoryLedgerStore(ObjectMapper objectMapper, int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.objectMapper = objectMapper;
    this.maxAttempts = maxAttempts;
    for (Collection c : Collection.values()) {
      collections.put(c, new ConcurrentHashMap<>());
      collectionVersions.put(c, new AtomicLong());
    }
    log.warn("InMemoryLedgerStore in use: ledger state is lost on restart. Do not use in production.");
  }

  @Override
  public <T> T runInTransaction(Function<LedgerTransaction, T> work) {
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      InMemoryTransaction tx = new InMemoryTransaction();
      T result;
      try {
        result = work.apply(tx);
      } catch (RuntimeException e) {
        if (tx.isStale()) {
          log.debug("Attempt {} failed on a stale read, retrying: {}", attempt, e.getMessage());
          continue;
        }
        throw e;
      }
      if (tx.commit()) {
        if (tx.deferredFailure != null) {
          throw tx.deferredFailure;
        }
        return result;
      }
      log.debug("Attempt {} aborted on conflict", attempt);
    }
    throw new ConflictException("Transaction aborted after " + maxAttempts + " attempts due to concurrent updates");
  }

  /**
   * Writes a raw token document, bypassing normalization. Used to load documents written by
   * older clients.
   *
   * @param tokenId the token id
   * @param json    the document
   */
  public void putRawTokenDocument(String tokenId, String json) {
    synchronized (commitLock) {
      collections.get(Collection.TOKENS).put(tokenId, new Versioned(json, versionSequence.incrementAndGet()));
      collectionVersions.get(Collection.TOKENS).incrementAndGet();
    }
  }

  /**
   * Reads the raw JSON of a token document.
   *
   * @param tokenId the token id
   * @return the document, or empty
   */
  public Optional<String> rawTokenDocument(String tokenId) {
    return Optional.ofNullable(collections.get(Collection.TOKENS).get(tokenId)).map(v -> (String) v.value());
  }

  @Override
  public List<String> findExpiredOpenPendings(Instant now, int limit) {
    return find(Collection.PENDING_TRANSFERS, PendingTransfer.class,
        p -> p.state() == PendingState.OPEN && p.isExpired(now), limit);
  }

  @Override
  public List<String> findCommittedPendings(int limit) {
    return find(Collection.PENDING_TRANSFERS, PendingTransfer.class,
        p -> p.state() == PendingState.COMMITTED, limit);
  }

  @Override
  public List<String> findExpiredPendingSessions(Instant now, int limit) {
    return find(Collection.TRANSFER_SESSIONS, TransferSession.class,
        s -> s.state() == TransferSessionState.PENDING && s.isExpired(now), limit);
  }

  @Override
  public List<String> findExpiredStagedTransfers(Instant now, int limit) {
    return find(Collection.STAGED_TRANSFERS, StagedTransfer.class,
        s -> s.state() == StagedState.STAGED && s.isExpired(now), limit);
  }

  @Override
  public List<TransferEvent> events(String tokenId) {
    synchronized (commitLock) {
      return events.stream().filter(e -> e.tokenId().equals(tokenId)).toList();
    }
  }

  @Override
  public List<AuditEntry> auditEntries(String tokenId) {
    synchronized (commitLock) {
      return auditLog.stream().filter(e -> e.tokenId().equals(tokenId)).toList();
    }
  }

  @Override
  public boolean isHealthy() {
    return true;
  }

  private <V> List<String> find(Collection collection, Class<V> type, Predicate<V> filter, int limit) {
    List<String> ids = new ArrayList<>();
    for (Map.Entry<String, Versioned> entry : collections.get(collection).entrySet()) {
      if (ids.size() >= limit) {
        break;
      }
      if (filter.test(type.cast(entry.getValue().value()))) {
        ids.add(entry.getKey());
      }
    }
    return ids;
  }

  private long currentVersion(Key key) {
    Versioned v = collections.get(key.collection()).get(key.id());
    return v == null ? 0L : v.version();
  }

  private String serialize(Token token) {
    try {
      return objectMapper.writeValueAsString(TokenDocument.fromToken(token));
    } catch (JsonProcessingException e) {
      throw new InternalException("Unable to serialize token " + token.tokenId(), e);
    }
  }

  private Token deserialize(String tokenId, String json) {
    try {
      return objectMapper.readValue(json, TokenDocument.class).toToken(tokenId);
    } catch (JsonProcessingException e) {
      throw new InternalException("Unreadable token document " + tokenId, e);
    }
  }

  private class InMemoryTransaction implements LedgerTransaction {

    private final Map<Key, Long> readVersions = new HashMap<>();
    private final Map<Collection, Long> queryVersions = new EnumMap<>(Collection.class);
    // null value marks a delete
    private final Map<Key, Object> writes = new LinkedHashMap<>();
    private final List<TransferEvent> newEvents = new ArrayList<>();
    private final List<AuditEntry> newAudits = new ArrayList<>();
    private SwapDotException deferredFailure;

    private Optional<Object> read(Collection collection, String id) {
      Key key = new Key(collection, id);
      if (writes.containsKey(key)) {
        return Optional.ofNullable(writes.get(key));
      }
      Versioned v = collections.get(collection).get(id);
      readVersions.putIfAbsent(key, v == null ? 0L : v.version());
      return v == null ? Optional.empty() : Optional.of(v.value());
    }

    private void write(Collection collection, String id, Object value) {
      writes.put(new Key(collection, id), value);
    }

    @Override
    public Optional<Token> token(String tokenId) {
      return read(Collection.TOKENS, tokenId).map(json -> deserialize(tokenId, (String) json));
    }

    @Override
    public void putToken(Token token) {
      write(Collection.TOKENS, token.tokenId(), serialize(token));
    }

    @Override
    public Optional<PendingTransfer> pendingTransfer(String tokenId) {
      return read(Collection.PENDING_TRANSFERS, tokenId).map(PendingTransfer.class::cast);
    }

    @Override
    public void putPendingTransfer(PendingTransfer pending) {
      write(Collection.PENDING_TRANSFERS, pending.tokenId(), pending);
    }

    @Override
    public void deletePendingTransfer(String tokenId) {
      write(Collection.PENDING_TRANSFERS, tokenId, null);
    }

    @Override
    public Optional<TransferSession> transferSession(String sessionId) {
      return read(Collection.TRANSFER_SESSIONS, sessionId).map(TransferSession.class::cast);
    }

    @Override
    public void putTransferSession(TransferSession session) {
      write(Collection.TRANSFER_SESSIONS, session.sessionId(), session);
    }

    @Override
    public List<TransferSession> transferSessionsForToken(String tokenId) {
      queryVersions.putIfAbsent(Collection.TRANSFER_SESSIONS,
          collectionVersions.get(Collection.TRANSFER_SESSIONS).get());
      Map<String, TransferSession> result = new LinkedHashMap<>();
      for (String id : collections.get(Collection.TRANSFER_SESSIONS).keySet()) {
        read(Collection.TRANSFER_SESSIONS, id)
            .map(TransferSession.class::cast)
            .filter(s -> s.tokenId().equals(tokenId))
            .ifPresent(s -> result.put(s.sessionId(), s));
      }
      writes.forEach((key, value) -> {
        if (key.collection() == Collection.TRANSFER_SESSIONS && value instanceof TransferSession s
            && s.tokenId().equals(tokenId)) {
          result.put(s.sessionId(), s);
        }
      });
      return List.copyOf(result.values());
    }

    @Override
    public Optional<StagedTransfer> stagedTransfer(String stagedId) {
      return read(Collection.STAGED_TRANSFERS, stagedId).map(StagedTransfer.class::cast);
    }

    @Override
    public void putStagedTransfer(StagedTransfer staged) {
      write(Collection.STAGED_TRANSFERS, staged.stagedId(), staged);
    }

    @Override
    public UserStats userStats(String uid) {
      return read(Collection.USER_STATS, uid).map(UserStats.class::cast).orElseGet(() -> UserStats.empty(uid));
    }

    @Override
    public void putUserStats(UserStats stats) {
      write(Collection.USER_STATS, stats.uid(), stats);
    }

    @Override
    public void appendEvent(TransferEvent event) {
      newEvents.add(event);
    }

    @Override
    public void appendAudit(AuditEntry entry) {
      newAudits.add(entry);
    }

    @Override
    public <T> T failAfterCommit(SwapDotException failure) {
      this.deferredFailure = failure;
      return null;
    }

    boolean isStale() {
      synchronized (commitLock) {
        return !readsStillValid();
      }
    }

    private boolean readsStillValid() {
      for (Map.Entry<Key, Long> read : readVersions.entrySet()) {
        if (currentVersion(read.getKey()) != read.getValue()) {
          return false;
        }
      }
      for (Map.Entry<Collection, Long> query : queryVersions.entrySet()) {
        if (collectionVersions.get(query.getKey()).get() != query.getValue()) {
          return false;
        }
      }
      return true;
    }

    boolean commit() {
      synchronized (commitLock) {
        if (!readsStillValid()) {
          return false;
        }
        for (Map.Entry<Key, Object> write : writes.entrySet()) {
          Map<String, Versioned> collection = collections.get(write.getKey().collection());
          if (write.getValue() == null) {
            collection.remove(write.getKey().id());
          } else {
            collection.put(write.getKey().id(), new Versioned(write.getValue(), versionSequence.incrementAndGet()));
          }
          collectionVersions.get(write.getKey().collection()).incrementAndGet();
        }
        events.addAll(newEvents);
        auditLog.addAll(newAudits);
        return true;
      }
    }
  }
}
