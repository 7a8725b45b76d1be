package ca.gc.cra.hashmatch.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hashmatch.domain.work.Chunk;
import ca.gc.cra.hashmatch.domain.work.Task;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TaskChannelTest {

  @Test
  void deliversTasksInSubmissionOrder() {
    TaskChannel channel = new TaskChannel();
    channel.submit(Task.work(new Chunk(0, List.of("a"))));
    channel.submit(Task.work(new Chunk(1, List.of("b"))));
    channel.broadcastShutdown(1);

    Task first = channel.take(Duration.ofMillis(10)).orElseThrow();
    Task second = channel.take(Duration.ofMillis(10)).orElseThrow();
    Task third = channel.take(Duration.ofMillis(10)).orElseThrow();

    assertEquals(0, ((Task.Work) first).chunk().index());
    assertEquals(1, ((Task.Work) second).chunk().index());
    assertInstanceOf(Task.Shutdown.class, third);
    assertEquals(3, channel.submittedCount());
    assertEquals(3, channel.takenCount());
  }

  @Test
  void takeReturnsEmptyWhenNothingArrivesBeforeTimeout() {
    TaskChannel channel = new TaskChannel();

    Optional<Task> task = channel.take(Duration.ofMillis(20));

    assertTrue(task.isEmpty());
    assertEquals(0, channel.takenCount());
  }

  @Test
  void broadcastShutdownQueuesOneMarkerPerWorker() {
    TaskChannel channel = new TaskChannel();

    channel.broadcastShutdown(4);

    assertEquals(4, channel.approximateSize());
    for (int i = 0; i < 4; i++) {
      assertInstanceOf(Task.Shutdown.class, channel.take(Duration.ofMillis(10)).orElseThrow());
    }
    assertThrows(IllegalArgumentException.class, () -> channel.broadcastShutdown(0));
  }

  @Test
  void interruptedTakeRaisesChannelExceptionAndKeepsInterruptFlag() {
    TaskChannel channel = new TaskChannel();
    Thread.currentThread().interrupt();
    try {
      assertThrows(TaskChannelException.class, () -> channel.take(Duration.ofSeconds(1)));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void rejectsNullTask() {
    assertThrows(NullPointerException.class, () -> new TaskChannel().submit(null));
  }
}
