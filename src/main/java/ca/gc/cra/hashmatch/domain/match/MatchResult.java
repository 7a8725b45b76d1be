package ca.gc.cra.hashmatch.domain.match;

import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import java.util.Objects;

/**
 * <strong>What:</strong> A candidate whose digest equals the target.
 * <p><strong>Role:</strong> Created by a worker on a successful comparison, written once to the result
 * store, and read once by the collector.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param workerId identity of the worker that found the match
 * @param original candidate text as read from the source
 * @param hash digest computed for {@code original}
 * @param algorithm algorithm used to compute {@code hash}
 * @param sequence per-worker discovery sequence number
 * @since 0.1.0
 */
public record MatchResult(
    int workerId, String original, String hash, HashAlgorithm algorithm, long sequence) {

  /** Rejects missing fields. */
  public MatchResult {
    Objects.requireNonNull(original, "original");
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(algorithm, "algorithm");
  }

  /**
   * Derives the globally unique store key for this result.
   *
   * @return key built from the worker identity and discovery sequence
   */
  public MatchKey key() {
    return new MatchKey(workerId, sequence);
  }
}
