package ca.gc.cra.hashmatch.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors backing the digest worker pool.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor with exactly one thread per digest worker.
   *
   * <p>The executor has no task queue: submitting more than {@code size} long-running workers is rejected
   * rather than silently queued behind a worker that only exits on its shutdown marker.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix; the thread name is the process tag in log records
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "hashmatch-worker" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
