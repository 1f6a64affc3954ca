package exm.swiftsyntax.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.swiftsyntax.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals(4, Settings.getInt(Settings.PRINTER_INDENT_WIDTH));
    assertEquals(2, Settings.getInt(Settings.JSON_INDENT));
    assertTrue(Settings.getBoolean(Settings.WALK_CHECK_OWNERSHIP));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertEquals(1000, Settings.getInt(Settings.MAX_DEPTH));
  }

  @Test
  public void testSetAndReset() throws Exception {
    Settings.set(Settings.JSON_INDENT, " 7 ");
    assertEquals(7, Settings.getInt(Settings.JSON_INDENT));
    Settings.reset();
    assertEquals(2, Settings.getInt(Settings.JSON_INDENT));
  }

  @Test
  public void testKeysSorted() {
    assertEquals(Settings.JSON_INDENT, Settings.getKeys().get(0));
    assertEquals(6, Settings.getKeys().size());
  }

  @Test
  public void testBadBoolean() throws Exception {
    Settings.set(Settings.WALK_CHECK_OWNERSHIP, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.WALK_CHECK_OWNERSHIP);
  }

  @Test
  public void testBadInt() throws Exception {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "four");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.PRINTER_INDENT_WIDTH);
    Settings.getInt(Settings.PRINTER_INDENT_WIDTH);
  }

  @Test
  public void testUnknownKey() throws Exception {
    exception.expect(InvalidOptionException.class);
    Settings.getLong("swiftsyntax.no-such-key");
  }

  @Test
  public void testSystemPropertyOverride() throws Exception {
    System.setProperty(Settings.JSON_INDENT, "0");
    try {
      Settings.initProperties();
      assertEquals(0, Settings.getInt(Settings.JSON_INDENT));
    } finally {
      System.clearProperty(Settings.JSON_INDENT);
    }
  }

  @Test
  public void testNegativeIndentRejected() throws Exception {
    System.setProperty(Settings.PRINTER_INDENT_WIDTH, "-1");
    try {
      exception.expect(InvalidOptionException.class);
      exception.expectMessage("must not be negative");
      Settings.initProperties();
    } finally {
      System.clearProperty(Settings.PRINTER_INDENT_WIDTH);
    }
  }

  @Test
  public void testZeroDepthRejected() throws Exception {
    System.setProperty(Settings.MAX_DEPTH, "0");
    try {
      exception.expect(InvalidOptionException.class);
      exception.expectMessage("must be positive");
      Settings.initProperties();
    } finally {
      System.clearProperty(Settings.MAX_DEPTH);
    }
  }
}
