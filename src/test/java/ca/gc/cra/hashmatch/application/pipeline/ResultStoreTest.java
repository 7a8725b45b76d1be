package ca.gc.cra.hashmatch.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hashmatch.domain.digest.HashAlgorithm;
import ca.gc.cra.hashmatch.domain.match.MatchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ResultStoreTest {

  @Test
  void concurrentInsertsWithDistinctKeysAreAllRetained() throws Exception {
    ResultStore store = new ResultStore();
    int writers = 8;
    int perWriter = 500;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Integer>> futures = new ArrayList<>();
    for (int w = 0; w < writers; w++) {
      int workerId = w;
      futures.add(executor.submit(() -> {
        start.await();
        int inserted = 0;
        for (int seq = 1; seq <= perWriter; seq++) {
          if (store.insert(result(workerId, "v" + seq, seq))) {
            inserted++;
          }
        }
        return inserted;
      }));
    }
    start.countDown();
    int total = 0;
    for (Future<Integer> future : futures) {
      total += future.get(10, TimeUnit.SECONDS);
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(writers * perWriter, total);
    assertEquals(writers * perWriter, store.size());
  }

  @Test
  void collidingKeyIsRejectedAndOriginalKept() {
    ResultStore store = new ResultStore();
    MatchResult original = result(0, "first", 1);

    assertTrue(store.insert(original));
    assertFalse(store.insert(result(0, "second", 1)));

    assertEquals(1, store.size());
    assertEquals("first", store.snapshot().get(0).original());
  }

  @Test
  void frozenStoreRejectsInserts() {
    ResultStore store = new ResultStore();
    store.insert(result(1, "a", 1));
    store.freeze();

    assertTrue(store.isFrozen());
    assertThrows(IllegalStateException.class, () -> store.insert(result(1, "b", 2)));
    assertEquals(1, store.size());
  }

  private static MatchResult result(int workerId, String original, long sequence) {
    return new MatchResult(workerId, original, "00", HashAlgorithm.SHA256, sequence);
  }
}
