package exm.sct.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.lang.Dialect;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Properties props(String... keyVals) {
    Properties p = new Properties();
    for (int i = 0; i < keyVals.length; i += 2) {
      p.setProperty(keyVals[i], keyVals[i + 1]);
    }
    return p;
  }

  @Test
  public void testDefaults() throws Exception {
    Settings s = Settings.defaultSettings();
    assertEquals(Dialect.GENERIC, s.getDialect());
    assertEquals("fortran", s.getBackend());
    assertTrue(s.getBoolean(Settings.VALIDATE_IR));
    assertFalse(s.isDistributedMemoryActive());
    assertEquals(32, s.getInt(Settings.TRANS_BLOCKSIZE));
    assertEquals("profile", s.get(Settings.PROFILE_PREFIX));
    assertTrue(s.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testOverrides() throws Exception {
    Settings s = Settings.create(props(Settings.BACKEND, "C",
                                       Settings.TRANS_TILESIZE, " 16 "));
    assertEquals("c", s.getBackend());
    assertEquals(16, s.getInt(Settings.TRANS_TILESIZE));
    assertEquals("Untouched keys keep their defaults", "extract",
                 s.get(Settings.EXTRACT_PREFIX));
  }

  @Test
  public void testWithLeavesOriginal() throws Exception {
    Settings base = Settings.defaultSettings();
    Settings nemo = base.with(Settings.DIALECT, "NEMO");
    assertEquals(Dialect.NEMO, nemo.getDialect());
    assertEquals(Dialect.GENERIC, base.getDialect());
  }

  @Test
  public void testDistributedMemoryNeedsDialect() throws Exception {
    Settings dm = Settings.defaultSettings()
                          .with(Settings.DISTRIBUTED_MEMORY, "true");
    assertFalse("Generic dialect has no distributed memory",
                dm.isDistributedMemoryActive());
    assertFalse(dm.with(Settings.DIALECT, "nemo")
                  .isDistributedMemoryActive());
    assertTrue(dm.with(Settings.DIALECT, "lfric")
                 .isDistributedMemoryActive());
    assertTrue(dm.with(Settings.DIALECT, "gocean")
                 .isDistributedMemoryActive());
    assertFalse(Settings.defaultSettings().with(Settings.DIALECT, "lfric")
                        .isDistributedMemoryActive());
  }

  @Test
  public void testUnknownDialect() throws Exception {
    assertNull(Dialect.fromString("fortran77"));
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Expected property sct.dialect to be one of: " +
        "'generic', 'nemo', 'lfric', 'gocean' but was 'fortran77'");
    Settings.create(props(Settings.DIALECT, "fortran77"));
  }

  @Test
  public void testUnknownBackend() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("sct.backend");
    Settings.create(props(Settings.BACKEND, "python"));
  }

  @Test
  public void testBadBoolean() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must be true or false, but was 'yes'");
    Settings.create(props(Settings.VALIDATE_IR, "yes"));
  }

  @Test
  public void testBadInteger() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Invalid integral value for option " +
                            Settings.TRANS_BLOCKSIZE);
    Settings.create(props(Settings.TRANS_BLOCKSIZE, "big"));
  }

  @Test
  public void testNonPositive() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must be a positive integer, but was -4");
    Settings.defaultSettings().with(Settings.TRANS_TILESIZE, "-4");
  }

  @Test
  public void testSystemProperties() throws Exception {
    System.setProperty(Settings.PROFILE_PREFIX, "timing");
    try {
      Settings s = Settings.fromSystemProperties(
          props(Settings.EXTRACT_PREFIX, "dump"));
      assertEquals("timing", s.get(Settings.PROFILE_PREFIX));
      assertEquals("dump", s.get(Settings.EXTRACT_PREFIX));

      s = Settings.fromSystemProperties(
          props(Settings.PROFILE_PREFIX, "cli"));
      assertEquals("Explicit overrides win", "cli",
                   s.get(Settings.PROFILE_PREFIX));
    } finally {
      System.clearProperty(Settings.PROFILE_PREFIX);
    }
  }
}
