package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.domain.work.Chunk;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits an ordered candidate list into bounded chunks without reordering.
 *
 * <p>The returned {@link Iterable} is lazy: chunks are materialized one at a time as the iterator advances, and
 * each call to {@link Iterable#iterator()} starts again from the first candidate.</p>
 *
 * @since 0.1.0
 */
public final class Chunker {
  private Chunker() {}

  /**
   * Produces ⌈N/C⌉ chunks; all but the last hold exactly {@code chunkSize} candidates.
   *
   * @param candidates ordered candidates; an empty list yields no chunks
   * @param chunkSize maximum chunk length
   * @return lazy, restartable chunk sequence
   * @throws IllegalArgumentException if {@code chunkSize} is less than 1
   */
  public static Iterable<Chunk> chunk(List<String> candidates, int chunkSize) {
    Objects.requireNonNull(candidates, "candidates");
    if (chunkSize < 1) {
      throw new IllegalArgumentException("chunkSize must be >= 1 (was " + chunkSize + ")");
    }
    return () -> new ChunkIterator(candidates, chunkSize);
  }

  /**
   * Returns the number of chunks {@link #chunk(List, int)} yields for {@code candidateCount} candidates.
   *
   * @param candidateCount number of candidates, {@code >= 0}
   * @param chunkSize maximum chunk length, {@code >= 1}
   * @return ceiling of {@code candidateCount / chunkSize}
   */
  public static int chunkCount(int candidateCount, int chunkSize) {
    if (candidateCount < 0 || chunkSize < 1) {
      throw new IllegalArgumentException("candidateCount must be >= 0 and chunkSize >= 1");
    }
    return (candidateCount + chunkSize - 1) / chunkSize;
  }

  private static final class ChunkIterator implements Iterator<Chunk> {
    private final List<String> candidates;
    private final int chunkSize;
    private int offset;
    private int index;

    private ChunkIterator(List<String> candidates, int chunkSize) {
      this.candidates = candidates;
      this.chunkSize = chunkSize;
    }

    @Override
    public boolean hasNext() {
      return offset < candidates.size();
    }

    @Override
    public Chunk next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int end = Math.min(offset + chunkSize, candidates.size());
      Chunk chunk = new Chunk(index++, candidates.subList(offset, end));
      offset = end;
      return chunk;
    }
  }
}
