package kara.karac.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import kara.karac.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void reset() {
    Settings.reset(Settings.THREADS);
    Settings.reset(Settings.WARN_UNUSED);
    System.clearProperty(Settings.THREADS);
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals(1, Settings.getInt(Settings.THREADS));
    assertTrue(Settings.getBoolean(Settings.WARN_UNUSED));
    assertFalse(Settings.getBoolean(Settings.DUMP_GRAPHS));
    assertEquals("", Settings.get(Settings.BUILTINS_FILE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testOverrideAndReset() throws Exception {
    Settings.set(Settings.WARN_UNUSED, " False ");
    assertFalse(Settings.getBoolean(Settings.WARN_UNUSED));
    Settings.reset(Settings.WARN_UNUSED);
    assertTrue(Settings.getBoolean(Settings.WARN_UNUSED));
  }

  @Test
  public void testSystemProperty() throws Exception {
    System.setProperty(Settings.THREADS, "3");
    Settings.initKaracProperties();
    assertEquals(3, Settings.getInt(Settings.THREADS));
  }

  @Test
  public void testBadBoolean() throws Exception {
    Settings.set(Settings.WARN_UNUSED, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.WARN_UNUSED);
  }

  @Test
  public void testThreadsValidated() throws Exception {
    System.setProperty(Settings.THREADS, "0");
    exception.expect(InvalidOptionException.class);
    Settings.initKaracProperties();
  }
}
