package ca.gc.cra.hashmatch.domain.work;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Bounded, ordered batch of candidate values dispatched to a worker as one unit.
 * <p><strong>Why:</strong> Amortizes channel hand-off cost across many digest computations.</p>
 * <p><strong>Role:</strong> Payload of {@link Task.Work}; produced by the chunker, consumed exactly once.</p>
 * <p><strong>Thread-safety:</strong> Immutable record holding an unmodifiable copy of the candidates.</p>
 *
 * @param index zero-based position of this chunk in the chunk sequence
 * @param candidates candidate values in their original order; never empty
 * @since 0.1.0
 */
public record Chunk(int index, List<String> candidates) {

  /**
   * Validates the chunk and freezes its candidate list.
   *
   * @throws IllegalArgumentException if {@code index} is negative or {@code candidates} is empty
   */
  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
    }
    candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("chunk must contain at least one candidate");
    }
  }

  /**
   * Returns the number of candidates carried by this chunk.
   *
   * @return candidate count, always positive
   */
  public int size() {
    return candidates.size();
  }
}
