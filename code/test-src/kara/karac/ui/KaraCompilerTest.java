package kara.karac.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.lang.Builtins;

public class KaraCompilerTest {

  /** Errors spread over several definitions, out of position order */
  private static final String MANY_ERRORS =
      "type UserId i64;\n" +
      "fn f(u: UserId) -> i64 { missing }\n" +
      "fn g(x: i64) -> UserId { x }\n" +
      "flow main(a: i64) {\n" +
      "  a -> f -> b;\n" +
      "  Print(\"ok\");\n" +
      "}\n" +
      "fn h() -> bool { 1 + true }\n" +
      "fn f(x: i64) -> i64 { x }\n";

  private static final String GOOD =
      "fn inc(x: i64) -> i64 { x + 1 }\n" +
      "flow main(a: i64) {\n" +
      "  a -> inc -> b;\n" +
      "  a -> inc -> c;\n" +
      "  b -> inc -> _d;\n" +
      "  c -> inc -> _e;\n" +
      "}\n" +
      "flow other(s: string) { s -> Print -> (); }\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static CompilationResult compile(String src, int threads) {
    KaraCompiler compiler = new KaraCompiler(Logging.getKaracLogger(),
                                      Builtins.loadDefault(), threads, true);
    return compiler.compile("test.kara",
                            src.getBytes(StandardCharsets.UTF_8));
  }

  private static List<String> render(List<Diagnostic> diags) {
    List<String> result = new ArrayList<String>();
    for (Diagnostic d: diags) {
      result.add(d.toString());
    }
    return result;
  }

  @Test
  public void testDiagnosticsSortedByPosition() {
    CompilationResult r = compile(MANY_ERRORS, 1);
    assertFalse(r.isSuccess());
    List<Diagnostic> diags = r.getDiagnostics();
    assertTrue(diags.size() >= 4);
    for (int i = 1; i < diags.size(); i++) {
      assertTrue(diags.get(i - 1) + " before " + diags.get(i),
          Diagnostic.BY_POSITION.compare(diags.get(i - 1), diags.get(i)) <= 0);
    }
    assertEquals(DiagnosticKind.DUPLICATE_DEFINITION,
                 diags.get(diags.size() - 1).getKind());
    assertEquals(diags.size(), r.errorCount());
  }

  @Test
  public void testThreadCountDoesNotChangeOutput() {
    CompilationResult serial = compile(MANY_ERRORS, 1);
    CompilationResult parallel = compile(MANY_ERRORS, 4);
    assertEquals(render(serial.getDiagnostics()),
                 render(parallel.getDiagnostics()));

    CompilationResult good1 = compile(GOOD, 1);
    CompilationResult good4 = compile(GOOD, 4);
    assertTrue(good4.isSuccess());
    assertEquals(new ArrayList<String>(good1.getGraphs().keySet()),
                 new ArrayList<String>(good4.getGraphs().keySet()));
    assertEquals(good1.getGraphs().get("main").toString(),
                 good4.getGraphs().get("main").toString());
    assertEquals(good1.getPurity(), good4.getPurity());
  }

  @Test
  public void testGraphsForEveryFlow() {
    CompilationResult r = compile(GOOD, 2);
    assertTrue(r.getDiagnostics().toString(), r.isSuccess());
    assertEquals(2, r.getGraphs().size());
    assertEquals(4, r.getGraphs().get("main").size());
    assertEquals(2, r.getGraphs().get("main").edgeCount());
    assertFalse("fns get no graph", r.getGraphs().containsKey("inc"));
  }

  @Test
  public void testGraphsUnavailableAfterErrors() {
    CompilationResult r = compile(MANY_ERRORS, 1);
    exception.expect(KaracRuntimeError.class);
    r.getGraphs();
  }

  @Test
  public void testProgramUnavailableAfterErrors() {
    CompilationResult r = compile(MANY_ERRORS, 1);
    assertFalse(r.getDiagnostics().isEmpty());
    exception.expect(KaracRuntimeError.class);
    r.getProgram();
  }

  @Test
  public void testTypesUnavailableAfterErrors() {
    CompilationResult r = compile(MANY_ERRORS, 1);
    exception.expect(KaracRuntimeError.class);
    r.getTypes();
  }

  @Test
  public void testFatalLexicalErrorStops() {
    CompilationResult r = compile("flow main() {\n  let s = \"open;\n}\n",
                                  1);
    assertFalse(r.isSuccess());
    assertNull(r.getGlobals());
    assertEquals(1, r.errorCount());
    assertEquals(DiagnosticKind.UNTERMINATED_STRING,
                 r.getDiagnostics().get(0).getKind());
  }

  @Test
  public void testRecoverableLexicalErrorContinues() {
    CompilationResult r = compile("fn f() -> i64 { 1 }\n$\n" +
                                  "fn g() -> bool { 2 }\n", 1);
    List<DiagnosticKind> kinds = new ArrayList<DiagnosticKind>();
    for (Diagnostic d: r.getDiagnostics()) {
      kinds.add(d.getKind());
    }
    assertTrue(kinds.toString(), kinds.contains(DiagnosticKind.INVALID_BYTE));
    assertTrue("Checking carries on past the bad byte",
        kinds.contains(DiagnosticKind.BOUNDARY_TYPE_MISMATCH));
  }

  @Test
  public void testThreadsMustBePositive() {
    exception.expect(IllegalArgumentException.class);
    new KaraCompiler(Logging.getKaracLogger(), Builtins.loadDefault(), 0,
                     true);
  }
}
