package ca.gc.cra.relay.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Level previous;

  @BeforeEach
  void rememberLevel() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    previous = root.getLevel();
  }

  @AfterEach
  void restoreLevel() {
    root.setLevel(previous);
  }

  @Test
  void verboseRaisesRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();
    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void unknownLevelFallsBackToInfo() {
    assertTrue(LoggingConfigurator.setRootLevel("chatty"));
    assertEquals(Level.INFO, root.getLevel());
    assertTrue(LoggingConfigurator.setRootLevel("error"));
    assertEquals(Level.ERROR, root.getLevel());
  }
}
