package ca.gc.cra.bulk.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BulkSessionsTest {
  private final Map<Long, RecordingConsumer> consumers = new ConcurrentHashMap<>();
  private ExecutorService pool;
  private BulkSessions sessions;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
    sessions = new BulkSessions(handle -> {
      RecordingConsumer consumer = new RecordingConsumer(handle.label());
      consumers.put(handle.id(), consumer);
      return List.of(consumer);
    }, pool, UnbalancedBlockPolicy.IGNORE, () -> 0L, null);
    logger = (Logger) LoggerFactory.getLogger(BulkSessions.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() throws Exception {
    logger.detachAppender(appender);
    sessions.close();
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void sessionsBatchIndependently() {
    SessionHandle first = sessions.connect(2);
    SessionHandle second = sessions.connect(3);
    assertNotEquals(first, second);

    sessions.receive(first, "a\nb\nc\n");
    sessions.receive(second, "x\ny\n");
    sessions.disconnect(first);
    sessions.disconnect(second);

    assertEquals(List.of(List.of("a", "b"), List.of("c")), consumers.get(first.id()).processed());
    assertEquals(List.of(List.of("x", "y")), consumers.get(second.id()).processed());
    assertEquals(1, consumers.get(first.id()).closes.get());
    assertEquals(0, sessions.activeSessions());
  }

  @Test
  void blocksMaySpanReceiveCalls() {
    SessionHandle handle = sessions.connect(10);

    sessions.receive(handle, "{\na\n");
    sessions.receive(handle, "b\n}\n");

    assertEquals(List.of(List.of("a", "b")), consumers.get(handle.id()).processed());
    sessions.disconnect(handle);
  }

  @Test
  void concurrentReceiversOnOneSessionAreSerialized() throws Exception {
    SessionHandle handle = sessions.connect(5);
    ExecutorService callers = Executors.newFixedThreadPool(4);
    List<Future<Integer>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < 4; t++) {
        futures.add(callers.submit(() -> {
          int routed = 0;
          for (int i = 0; i < 25; i++) {
            routed += sessions.receive(handle, "cmd");
          }
          return routed;
        }));
      }
      int total = 0;
      for (Future<Integer> future : futures) {
        total += future.get(10, TimeUnit.SECONDS);
      }
      assertEquals(100, total);
    } finally {
      callers.shutdown();
    }
    sessions.disconnect(handle);

    List<List<String>> bulks = consumers.get(handle.id()).processed();
    assertEquals(20, bulks.size());
    assertTrue(bulks.stream().allMatch(bulk -> bulk.size() == 5));
  }

  @Test
  void unknownHandleIsRejectedOnReceive() {
    assertThrows(IllegalArgumentException.class, () -> sessions.receive(new SessionHandle(999), "a"));
  }

  @Test
  void receiveAfterDisconnectIsRejected() {
    SessionHandle handle = sessions.connect(1);
    sessions.disconnect(handle);

    assertThrows(IllegalArgumentException.class, () -> sessions.receive(handle, "a"));
  }

  @Test
  void unknownHandleDisconnectIsLoggedNoOp() {
    sessions.disconnect(new SessionHandle(12345));

    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("session-12345")));
  }

  @Test
  void consumerCloseFailureIsLogged() {
    BulkSessions failing = new BulkSessions(handle -> List.<BulkConsumer>of(new RecordingConsumer() {
      @Override
      public void close() {
        throw new IllegalStateException("cannot close");
      }
    }), pool, null, null, null);

    SessionHandle handle = failing.connect(1);
    failing.disconnect(handle);

    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Failed to close bulk consumer")));
  }

  @Test
  void closeRejectsNewSessions() {
    sessions.connect(1);
    sessions.close();

    assertEquals(0, sessions.activeSessions());
    assertThrows(IllegalStateException.class, () -> sessions.connect(1));
  }

  @Test
  void closeDisconnectsEverySessionWhenFinalFlushFails() {
    ExecutorService stopped = Executors.newFixedThreadPool(2);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    Map<Long, RecordingConsumer> opened = new ConcurrentHashMap<>();
    BulkSessions facade = new BulkSessions(handle -> {
      RecordingConsumer consumer = new RecordingConsumer(handle.label());
      opened.put(handle.id(), consumer);
      return List.of(consumer);
    }, stopped, null, () -> 0L, metrics);
    SessionHandle first = facade.connect(5);
    SessionHandle second = facade.connect(5);
    facade.receive(first, "a");
    facade.receive(second, "b");
    stopped.shutdown();

    IllegalStateException ex = assertThrows(IllegalStateException.class, facade::close);

    assertEquals(0, facade.activeSessions());
    assertEquals(1, opened.get(first.id()).closes.get());
    assertEquals(1, opened.get(second.id()).closes.get());
    assertEquals(1, ex.getSuppressed().length);
    assertEquals(2, metrics.count("bulk.session.close.failure"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Failed to disconnect")));
  }

  @Test
  void consumersAreClosedWhenConnectFails() {
    RecordingConsumer built = new RecordingConsumer();
    BulkSessions facade = new BulkSessions(
        handle -> Arrays.<BulkConsumer>asList(built, null), pool, null, null, null);

    assertThrows(NullPointerException.class, () -> facade.connect(2));

    assertEquals(1, built.closes.get());
    assertEquals(0, facade.activeSessions());
    facade.close();
  }
}
