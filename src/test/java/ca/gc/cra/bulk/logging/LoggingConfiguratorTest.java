package ca.gc.cra.bulk.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final Logger bulkLogger = (Logger) LoggerFactory.getLogger("ca.gc.cra.bulk");
  private final Level previous = bulkLogger.getLevel();

  @AfterEach
  void restore() {
    bulkLogger.setLevel(previous);
  }

  @Test
  void verboseRaisesBulkLoggerToDebug() {
    bulkLogger.setLevel(Level.INFO);

    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, bulkLogger.getLevel());
  }
}
