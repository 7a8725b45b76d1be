package ca.gc.cra.hashmatch.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Upstream provider of the ordered candidate sequence.
 * <p><strong>Why:</strong> Separates record parsing and validation from the matching pipeline.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code CsvCandidateSource}.</p>
 * <p><strong>Error handling:</strong> Malformed records are skipped and counted; unreadable sources fail the
 * whole read with {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public interface CandidateSource {
  /**
   * Reads every valid candidate in source order.
   *
   * @return candidates plus read statistics
   * @throws IOException if the source cannot be opened or decoded
   */
  CandidateBatch read() throws IOException;

  /**
   * Result of a full read.
   *
   * @param candidates valid candidates in source order
   * @param totalRecords records encountered
   * @param validRecords records accepted as candidates
   * @param invalidRecords records skipped as empty or blank
   */
  record CandidateBatch(
      List<String> candidates, long totalRecords, long validRecords, long invalidRecords) {
    /** Freezes the candidate list. */
    public CandidateBatch {
      candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
    }

    /**
     * Wraps an in-memory list in which every entry is valid.
     *
     * @param candidates candidates
     * @return batch with no invalid records
     */
    public static CandidateBatch of(List<String> candidates) {
      return new CandidateBatch(candidates, candidates.size(), candidates.size(), 0);
    }
  }
}
