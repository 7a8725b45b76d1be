package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.domain.match.MatchKey;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Append-only, concurrently writable map of discovered matches.
 * <p><strong>Concurrency:</strong> many writers (workers) insert while the pool runs; one reader (the collector)
 * reads after the orchestrator has {@linkplain #freeze() frozen} the store. Inserts are atomic per key and need
 * no external locking.</p>
 * <p><strong>Invariants:</strong> entries are never replaced or removed.</p>
 *
 * @since 0.1.0
 */
public final class ResultStore {
  private final ConcurrentMap<MatchKey, MatchResult> entries = new ConcurrentHashMap<>();
  private volatile boolean frozen;

  /**
   * Inserts a result under its {@link MatchResult#key()} if the key is unused.
   *
   * @param result match to record
   * @return {@code true} when inserted; {@code false} when the key already existed (the existing entry is kept)
   * @throws IllegalStateException if the store has been frozen
   */
  public boolean insert(MatchResult result) {
    Objects.requireNonNull(result, "result");
    if (frozen) {
      throw new IllegalStateException("Result store is frozen; rejecting " + result.key());
    }
    return entries.putIfAbsent(result.key(), result) == null;
  }

  /** Rejects any further insert. Called once every worker has terminated. */
  public void freeze() {
    frozen = true;
  }

  /**
   * Indicates whether the store accepts inserts.
   *
   * @return {@code true} after {@link #freeze()}
   */
  public boolean isFrozen() {
    return frozen;
  }

  /**
   * Returns the number of stored matches.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  /**
   * Copies all stored matches in no particular order.
   *
   * @return mutable copy of the entries
   */
  public List<MatchResult> snapshot() {
    return new ArrayList<>(entries.values());
  }
}
