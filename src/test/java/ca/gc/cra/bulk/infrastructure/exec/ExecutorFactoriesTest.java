package ca.gc.cra.bulk.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  private static final UncaughtExceptionHandler HANDLER = (thread, error) -> { throw new AssertionError(error); };

  @Test
  void namesThreadsWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newDispatchPool(2, "test-dispatch", HANDLER);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("test-dispatch-"), name);
      boolean daemon = pool.submit(() -> Thread.currentThread().isDaemon()).get(5, TimeUnit.SECONDS);
      assertFalse(daemon);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newDispatchPool(1, " ", HANDLER);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertEquals(ExecutorFactories.DEFAULT_DISPATCH_PREFIX + "-0", name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newDispatchPool(0, "x", HANDLER));
    assertThrows(NullPointerException.class, () -> ExecutorFactories.newDispatchPool(1, "x", null));
  }
}
