package kara.karac.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import kara.karac.ast.Stmt;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.lang.Builtins;
import kara.karac.common.lang.Types;
import kara.karac.ui.CompilationResult;
import kara.karac.ui.KaraCompiler;

public class ASTWalkerTest {

  private static final String ID_TYPES =
      "type UserId i64;\n" +
      "type ProductId i64;\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static CompilationResult compile(String src) {
    KaraCompiler compiler = new KaraCompiler(Logging.getKaracLogger(),
                                      Builtins.loadDefault(), 1, true);
    return compiler.compile("test.kara",
                            src.getBytes(StandardCharsets.UTF_8));
  }

  private static List<Diagnostic> errors(CompilationResult r) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: r.getDiagnostics()) {
      if (d.isError()) {
        result.add(d);
      }
    }
    return result;
  }

  private static List<DiagnosticKind> errorKinds(CompilationResult r) {
    List<DiagnosticKind> kinds = new ArrayList<DiagnosticKind>();
    for (Diagnostic d: errors(r)) {
      kinds.add(d.getKind());
    }
    return kinds;
  }

  private static void assertClean(CompilationResult r) {
    assertTrue("Unexpected errors: " + errors(r), r.isSuccess());
  }

  @Test
  public void testSwappedSemanticArgumentsBothReported() {
    CompilationResult r = compile(ID_TYPES +
        "fn f(u: UserId, p: ProductId) -> i64 { 0 }\n" +
        "flow main(userValue: UserId, productValue: ProductId) {\n" +
        "  let _r = f(productValue, userValue);\n" +
        "}\n");
    List<Diagnostic> errs = errors(r);
    assertEquals(Arrays.asList(DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.BOUNDARY_TYPE_MISMATCH),
                 errorKinds(r));
    assertEquals(5, errs.get(0).getPosition().line);
    assertTrue("Positions of the two arguments",
        errs.get(0).getPosition().col < errs.get(1).getPosition().col);
  }

  @Test
  public void testPrimitiveNeedsConversion() {
    CompilationResult r = compile(ID_TYPES +
        "fn lookup(u: UserId) -> i64 { u as i64 }\n" +
        "flow main(raw: i64) {\n" +
        "  let _bad = lookup(raw);\n" +
        "  let _good = lookup(raw as UserId);\n" +
        "  let _lit = lookup(42 as UserId);\n" +
        "}\n");
    assertEquals(Collections.singletonList(
                   DiagnosticKind.BOUNDARY_TYPE_MISMATCH), errorKinds(r));
    assertTrue(errors(r).get(0).getMessage().contains("as UserId"));
  }

  @Test
  public void testLetBindingsAreStructural() {
    CompilationResult r = compile(ID_TYPES +
        "fn next(u: UserId) -> UserId {\n" +
        "  let bumped = u + 1;\n" +
        "  bumped\n" +
        "}\n");
    assertClean(r);
  }

  @Test
  public void testReturnTypeChecked() {
    CompilationResult r = compile(ID_TYPES +
        "fn leak(u: UserId) -> i64 { u }\n" +
        "fn nothing() -> i64 { }\n" +
        "fn extra() { 1 }\n");
    assertEquals(Arrays.asList(DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.BOUNDARY_TYPE_MISMATCH),
                 errorKinds(r));
  }

  @Test
  public void testRecordLiteralFields() {
    CompilationResult r = compile(ID_TYPES +
        "record Order { id: UserId, qty: i32 }\n" +
        "fn ok(u: UserId) -> Order { Order { id: u, qty: 2 } }\n" +
        "fn missing(u: UserId) -> Order { Order { id: u } }\n" +
        "fn wrong(q: i64) -> Order { Order { id: q as UserId, qty: q } }\n" +
        "fn unknown() -> i32 { let o = Nope { a: 1 }; 1 }\n");
    assertEquals(Arrays.asList(DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.UNDEFINED_NAME),
                 errorKinds(r));
  }

  @Test
  public void testFieldAccessTypes() {
    CompilationResult r = compile(
        "record Point { x: f64, y: f64 }\n" +
        "fn sum(p: Point) -> f64 { p.x + p.y }\n" +
        "fn first(t: (i64, string)) -> string { t.1 }\n" +
        "fn bad(p: Point) -> f64 { p.z }\n");
    assertEquals(Collections.singletonList(DiagnosticKind.UNDEFINED_NAME),
                 errorKinds(r));
    assertEquals(4, errors(r).get(0).getPosition().line);
  }

  @Test
  public void testUndefinedNames() {
    CompilationResult r = compile(
        "fn helper() -> i64 { 1 }\n" +
        "fn a() -> i64 { missing }\n" +
        "fn b() -> i64 { helper }\n" +
        "fn c() -> i64 { nowhere() }\n" +
        "fn d(x: Unknown) -> i64 { 1 }\n");
    assertEquals(Arrays.asList(DiagnosticKind.UNDEFINED_NAME,
                               DiagnosticKind.UNDEFINED_NAME,
                               DiagnosticKind.UNDEFINED_NAME,
                               DiagnosticKind.UNDEFINED_NAME),
                 errorKinds(r));
  }

  @Test
  public void testTopLevelForwardReferencesAllowed() {
    CompilationResult r = compile(
        "fn a(n: i64) -> Count { b(n) }\n" +
        "fn b(n: i64) -> Count { n as Count }\n" +
        "type Count i64;\n");
    assertClean(r);
  }

  @Test
  public void testRebindingInSameScope() {
    CompilationResult r = compile(
        "flow main() {\n" +
        "  let x = 1;\n" +
        "  let x = 2;\n" +
        "  Print(\"done\");\n" +
        "}\n");
    assertEquals(Collections.singletonList(
                   DiagnosticKind.IMMUTABLE_REBINDING), errorKinds(r));
    assertEquals(3, errors(r).get(0).getPosition().line);
  }

  @Test
  public void testShadowingInNestedScope() {
    CompilationResult r = compile(
        "flow main() {\n" +
        "  let x = 1;\n" +
        "  if true { let x = 2; }\n" +
        "  if x > 0 { Print(\"positive\"); }\n" +
        "}\n");
    assertClean(r);
  }

  @Test
  public void testDestinationRebindingRejected() {
    CompilationResult r = compile(
        "flow main() {\n" +
        "  let line = \"a\";\n" +
        "  () -> ReadLine -> line;\n" +
        "  line -> Print -> ();\n" +
        "}\n");
    assertEquals(Collections.singletonList(
                   DiagnosticKind.IMMUTABLE_REBINDING), errorKinds(r));
  }

  @Test
  public void testForwardReferenceInFn() {
    CompilationResult r = compile(
        "fn g() -> i64 {\n" +
        "  let a = b;\n" +
        "  let b = 1;\n" +
        "  a\n" +
        "}\n");
    assertEquals(Collections.singletonList(
                   DiagnosticKind.FORWARD_REFERENCE), errorKinds(r));
    assertEquals(2, errors(r).get(0).getPosition().line);
  }

  @Test
  public void testConditionMustBeBool() {
    CompilationResult r = compile(
        "flow main(a: i64) {\n" +
        "  if a { Print(\"x\"); }\n" +
        "}\n");
    assertEquals(Collections.singletonList(DiagnosticKind.INVALID_OPERAND),
                 errorKinds(r));
  }

  @Test
  public void testOperandTypes() {
    CompilationResult r = compile(
        "fn a() -> i64 { 1 + 2 }\n" +
        "fn b(x: i64, y: f64) -> bool { x < y }\n" +
        "fn c(s: string) -> bool { !s }\n");
    assertEquals(Arrays.asList(DiagnosticKind.INVALID_OPERAND,
                               DiagnosticKind.INVALID_OPERAND),
                 errorKinds(r));
  }

  @Test
  public void testPipelineInputsAndDestinations() {
    CompilationResult r = compile(
        "record Pair { lo: i64, hi: i64 }\n" +
        "fn add(x: i64, y: i64) -> i64 { x + y }\n" +
        "fn split(n: i64) -> Pair { Pair { lo: n, hi: n } }\n" +
        "fn both(n: i64) -> (i64, string) { (n, \"n\") }\n" +
        "flow main(a: i64) {\n" +
        "  (x: a, y: 1) -> add -> sum;\n" +
        "  sum -> split -> (lo, hi: top);\n" +
        "  a -> both -> (num, label);\n" +
        "  label -> Print -> ();\n" +
        "  (x: lo, y: top) -> add -> _total;\n" +
        "  (x: num) -> add -> _partial;\n" +
        "  a -> add -> _wrong;\n" +
        "  a -> split -> (nope);\n" +
        "}\n");
    assertEquals(Arrays.asList(DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.BOUNDARY_TYPE_MISMATCH,
                               DiagnosticKind.UNDEFINED_NAME),
                 errorKinds(r));
  }

  @Test
  public void testTypeTableRecordsBindings() {
    CompilationResult r = compile(ID_TYPES +
        "fn wrap(n: i64) -> UserId { let u = n as UserId; u }\n");
    assertClean(r);
    TypeTable types = r.getTypes();
    Stmt let = r.getProgram().getFunctions().get(0)
                               .getBody().getStatements().get(0);
    assertEquals("UserId", types.getBindings(let).get("u").typeName());
    assertEquals(Types.I64, r.getGlobals().lookupType("UserId")
                              .underlyingPrim());
  }
}
