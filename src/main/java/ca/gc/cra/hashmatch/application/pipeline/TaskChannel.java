package ca.gc.cra.hashmatch.application.pipeline;

import ca.gc.cra.hashmatch.domain.work.Task;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> Unbounded FIFO hand-off of {@link Task}s from the orchestrator to digest workers.
 * <p><strong>Ordering:</strong> tasks from a single producer are delivered in submission order. Shutdown markers
 * are ordinary tasks queued behind all chunks, so a worker can only see its marker after every chunk has been
 * handed to some worker.</p>
 * <p><strong>Thread-safety:</strong> Safe for any number of producers and consumers.</p>
 * <p><strong>Performance:</strong> {@link #submit(Task)} never blocks; memory is the only bound.</p>
 *
 * @since 0.1.0
 */
public final class TaskChannel {
  private final BlockingQueue<Task> queue = new LinkedBlockingQueue<>();
  private final LongAdder submitted = new LongAdder();
  private final LongAdder taken = new LongAdder();

  /**
   * Enqueues a task.
   *
   * @param task chunk or shutdown marker; must not be {@code null}
   */
  public void submit(Task task) {
    Objects.requireNonNull(task, "task");
    // Unbounded queue: offer always succeeds.
    queue.offer(task);
    submitted.increment();
  }

  /**
   * Waits up to {@code timeout} for the next task.
   *
   * @param timeout maximum wait; zero or negative polls without waiting
   * @return the next task, or {@link Optional#empty()} when none arrived in time
   * @throws TaskChannelException if the calling thread is interrupted while waiting; the interrupt flag is
   *     restored before throwing
   */
  public Optional<Task> take(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    Task task;
    try {
      task = queue.poll(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TaskChannelException("Interrupted while waiting for a task", ex);
    }
    if (task == null) {
      return Optional.empty();
    }
    taken.increment();
    return Optional.of(task);
  }

  /**
   * Enqueues one shutdown marker per worker.
   *
   * @param workers number of workers that must stop; must be positive
   */
  public void broadcastShutdown(int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
    }
    for (int i = 0; i < workers; i++) {
      submit(Task.shutdown());
    }
  }

  /**
   * Returns the current queue depth. Not exact under concurrent access.
   *
   * @return best-effort number of queued tasks
   */
  public int approximateSize() {
    return queue.size();
  }

  /**
   * Returns how many tasks have been submitted, markers included.
   *
   * @return submitted task count
   */
  public long submittedCount() {
    return submitted.sum();
  }

  /**
   * Returns how many tasks have been taken, markers included.
   *
   * @return taken task count
   */
  public long takenCount() {
    return taken.sum();
  }
}
