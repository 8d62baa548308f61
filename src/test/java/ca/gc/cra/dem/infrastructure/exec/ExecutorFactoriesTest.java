package ca.gc.cra.dem.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void workersAreNamedAndNonDaemon() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "dem-test", null);
    AtomicReference<Thread> seen = new AtomicReference<>();

    pool.submit(() -> seen.set(Thread.currentThread())).get(5, TimeUnit.SECONDS);

    assertTrue(seen.get().getName().startsWith("dem-test-"));
    assertFalse(seen.get().isDaemon());
    assertTrue(ExecutorFactories.shutdownAndAwait(pool, Duration.ofSeconds(5)));
  }

  @Test
  void blankPrefixFallsBackAndHandlerSeesFailures() throws Exception {
    AtomicReference<Throwable> failure = new AtomicReference<>();
    CountDownLatch handled = new CountDownLatch(1);
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, " ", (t, ex) -> {
      failure.set(ex);
      handled.countDown();
    });
    AtomicReference<String> name = new AtomicReference<>();

    pool.execute(() -> {
      name.set(Thread.currentThread().getName());
      throw new IllegalStateException("boom");
    });

    assertTrue(handled.await(5, TimeUnit.SECONDS));
    assertEquals("boom", failure.get().getMessage());
    assertTrue(name.get().startsWith("dem-worker-"));
    ExecutorFactories.shutdownAndAwait(pool, Duration.ofSeconds(5));
  }

  @Test
  void stuckTasksAreInterruptedAfterTheTimeout() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "dem-stuck", null);
    CountDownLatch started = new CountDownLatch(1);
    pool.submit(() -> {
      started.countDown();
      Thread.sleep(60_000);
      return null;
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    assertFalse(ExecutorFactories.shutdownAndAwait(pool, Duration.ofMillis(50)));
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void sizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
