package ca.gc.cra.hashmatch.domain.match;

/**
 * Store key for a discovered match, unique across workers by construction.
 *
 * @param workerId owning worker identity
 * @param sequence per-worker discovery sequence, starting at 1
 * @since 0.1.0
 */
public record MatchKey(int workerId, long sequence) {

  /**
   * Validates key components.
   *
   * @throws IllegalArgumentException if {@code workerId} is negative or {@code sequence} is not positive
   */
  public MatchKey {
    if (workerId < 0) {
      throw new IllegalArgumentException("workerId must be >= 0 (was " + workerId + ")");
    }
    if (sequence < 1) {
      throw new IllegalArgumentException("sequence must be >= 1 (was " + sequence + ")");
    }
  }

  @Override
  public String toString() {
    return "match_" + workerId + "_" + sequence;
  }
}
