package kara.karac.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import kara.karac.common.Logging;
import kara.karac.common.Settings;
import kara.karac.common.exceptions.KaracFatal;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging(null, false);
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.DUMP_GRAPHS);
    Settings.reset(Settings.BUILTINS_FILE);
    Settings.reset(Settings.THREADS);
  }

  private int run(String src) throws Exception {
    File input = tmp.newFile("input.kara");
    FileUtils.writeStringToFile(input, src, StandardCharsets.UTF_8);
    Main.Args args = new Main.Args(input.getPath(), false);
    return Main.run(logger, args, new PrintStream(out, true, "UTF-8"),
                    new PrintStream(err, true, "UTF-8"));
  }

  private String text(ByteArrayOutputStream stream) throws Exception {
    return stream.toString("UTF-8");
  }

  @Test
  public void testCleanProgram() throws Exception {
    int code = run("fn inc(x: i64) -> i64 { x + 1 }\n" +
                   "flow main(a: i64) { a -> inc -> _b; }\n");
    assertEquals(ExitCode.SUCCESS.code(), code);
    assertEquals("", text(err));
    assertEquals("Graphs only printed on request", "", text(out));
  }

  @Test
  public void testGraphDump() throws Exception {
    Settings.set(Settings.DUMP_GRAPHS, "true");
    int code = run("fn inc(x: i64) -> i64 { x + 1 }\n" +
                   "flow main(a: i64) { a -> inc -> b; b -> inc -> _c; }\n");
    assertEquals(ExitCode.SUCCESS.code(), code);
    String dump = text(out);
    assertTrue(dump, dump.startsWith("graph main[a]"));
    assertTrue(dump, dump.contains("-> [1]"));
  }

  @Test
  public void testErrorsReported() throws Exception {
    int code = run("flow main(a: i64) {\n  a -> nothing -> b;\n}\n");
    assertEquals(ExitCode.ERROR_USER.code(), code);
    String msgs = text(err);
    assertTrue(msgs, msgs.contains("input.kara:2:"));
    assertTrue(msgs, msgs.contains("1 errors"));
  }

  @Test
  public void testMissingInputFile() throws Exception {
    Main.Args args = new Main.Args(
            new File(tmp.getRoot(), "absent.kara").getPath(), false);
    try {
      Main.run(logger, args, new PrintStream(out), new PrintStream(err));
    } catch (KaracFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
      return;
    }
    throw new AssertionError("Expected KaracFatal");
  }

  @Test
  public void testCustomBuiltinTable() throws Exception {
    File table = tmp.newFile("builtins.txt");
    FileUtils.writeStringToFile(table, "Emit(value: i64) -> ()\n",
                                StandardCharsets.UTF_8);
    Settings.set(Settings.BUILTINS_FILE, table.getPath());
    int code = run("flow main(a: i64) { a -> Emit -> (); }\n");
    assertEquals(text(err), ExitCode.SUCCESS.code(), code);
  }

  @Test
  public void testInvalidThreadSetting() throws Exception {
    Settings.set(Settings.THREADS, "0");
    try {
      run("flow main() { }\n");
    } catch (KaracFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
      return;
    }
    throw new AssertionError("Expected KaracFatal");
  }
}
