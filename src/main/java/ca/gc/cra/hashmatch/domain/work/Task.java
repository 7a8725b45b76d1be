package ca.gc.cra.hashmatch.domain.work;

import java.util.Objects;

/**
 * <strong>What:</strong> Unit carried on the task channel: either a chunk of work or a shutdown marker.
 * <p><strong>Why:</strong> Distinguishes termination from payload by type, so no payload value can ever be
 * mistaken for the end of work.</p>
 * <p><strong>Role:</strong> Opaque to the channel; interpreted only by digest workers.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface Task permits Task.Work, Task.Shutdown {

  /**
   * Wraps a chunk for delivery to a worker.
   *
   * @param chunk chunk to process; must not be {@code null}
   * @return work task
   */
  static Task work(Chunk chunk) {
    return new Work(chunk);
  }

  /**
   * Returns a shutdown marker.
   *
   * @return marker instructing the receiving worker to stop after this take
   */
  static Task shutdown() {
    return Shutdown.INSTANCE;
  }

  /**
   * Chunk of candidates to digest.
   *
   * @param chunk payload; never {@code null}
   */
  record Work(Chunk chunk) implements Task {
    /** Rejects {@code null} payloads. */
    public Work {
      Objects.requireNonNull(chunk, "chunk");
    }
  }

  /** Payload-free marker consumed once by exactly one worker before it exits. */
  record Shutdown() implements Task {
    private static final Shutdown INSTANCE = new Shutdown();
  }
}
