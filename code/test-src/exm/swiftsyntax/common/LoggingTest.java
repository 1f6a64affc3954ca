package exm.swiftsyntax.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testAddEmittedOnce() {
    String msg = "LoggingTest: first and only warning";
    assertTrue(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    // Tracked separately per level
    assertTrue(Logging.addEmitted(Level.INFO, msg));
  }

  @Test
  public void testUniqueWarnRepeated() {
    String msg = "LoggingTest: repeated warning";
    Logging.uniqueWarn(msg);
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
  }

  @Test
  public void testNoLogFileKeepsWarnings() {
    Logger logger = Logging.setupLogging(null, true);
    assertEquals(Level.WARN, logger.getLevel());
    assertEquals(logger, Logging.getLogger());
  }

  @Test
  public void testLogFileLevel() throws Exception {
    assertEquals(Level.TRACE,
                 Logging.setupLogging("LoggingTest.log", true).getLevel());
    assertEquals(Level.DEBUG,
                 Logging.setupLogging("LoggingTest.log", false).getLevel());
    Logging.setupLogging(null, false);
  }

  @Test
  public void testSetupFromSettings() throws Exception {
    // Defaults name no log file
    assertEquals(Level.WARN, Logging.setupLogging().getLevel());
  }
}
