package exm.mct.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.mct.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings settings = Settings.defaults();
    assertEquals(4, settings.getInt(Settings.CODEGEN_INDENT_WIDTH));
    assertTrue(settings.getBoolean(Settings.CODEGEN_MAIN_GUARD));
    assertTrue(settings.getBoolean(Settings.CODEGEN_HEADER));
    assertFalse(settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", settings.get(Settings.LOG_FILE));
    assertEquals(Settings.OUTPUT_PYTHON, settings.get(Settings.OUTPUT_MODE));
  }

  @Test
  public void testKeys() {
    assertEquals(6, Settings.defaults().getKeys().size());
    assertEquals("Keys should be sorted", Settings.CODEGEN_HEADER,
                 Settings.defaults().getKeys().get(0));
  }

  @Test
  public void testWithLeavesOriginalUnchanged()
      throws InvalidOptionException {
    Settings base = Settings.defaults();
    Settings changed = base.with(Settings.CODEGEN_INDENT_WIDTH, "2");
    assertEquals(2, changed.getInt(Settings.CODEGEN_INDENT_WIDTH));
    assertEquals(4, base.getInt(Settings.CODEGEN_INDENT_WIDTH));
    assertTrue("Other keys carried over",
               changed.getBoolean(Settings.CODEGEN_HEADER));
  }

  @Test
  public void testBooleanCaseInsensitive() throws InvalidOptionException {
    Settings s = Settings.defaults().with(Settings.CODEGEN_HEADER, " FALSE ");
    assertFalse(s.getBoolean(Settings.CODEGEN_HEADER));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.CODEGEN_MAIN_GUARD, "yes");
  }

  @Test
  public void testBadInteger() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.CODEGEN_INDENT_WIDTH, "four");
  }

  @Test
  public void testIndentOutOfRange() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.CODEGEN_INDENT_WIDTH, "0");
  }

  @Test
  public void testOutputMode() throws InvalidOptionException {
    Settings s = Settings.defaults().with(Settings.OUTPUT_MODE,
                                          Settings.OUTPUT_NONE);
    assertEquals(Settings.OUTPUT_NONE, s.get(Settings.OUTPUT_MODE));
    exception.expect(InvalidOptionException.class);
    Settings.defaults().with(Settings.OUTPUT_MODE, "java");
  }

  @Test
  public void testLoadSystemPropertyOverride() throws InvalidOptionException {
    String old = System.getProperty(Settings.CODEGEN_INDENT_WIDTH);
    System.setProperty(Settings.CODEGEN_INDENT_WIDTH, "8");
    try {
      Settings s = Settings.load();
      assertEquals(8, s.getInt(Settings.CODEGEN_INDENT_WIDTH));
      assertTrue(s.getBoolean(Settings.CODEGEN_MAIN_GUARD));
    } finally {
      if (old == null) {
        System.clearProperty(Settings.CODEGEN_INDENT_WIDTH);
      } else {
        System.setProperty(Settings.CODEGEN_INDENT_WIDTH, old);
      }
    }
  }

  @Test
  public void testLoadRejectsBadSystemProperty()
      throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "maybe");
    try {
      exception.expect(InvalidOptionException.class);
      Settings.load();
    } finally {
      System.clearProperty(Settings.LOG_TRACE);
    }
  }
}
