package kara.karac.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import kara.karac.ast.Block;
import kara.karac.ast.Expr;
import kara.karac.ast.Expr.BinaryOp;
import kara.karac.ast.Expr.Call;
import kara.karac.ast.Expr.Conversion;
import kara.karac.ast.Expr.FieldAccess;
import kara.karac.ast.Expr.RecordLiteral;
import kara.karac.ast.Expr.UnaryOp;
import kara.karac.ast.Operator;
import kara.karac.ast.Program;
import kara.karac.ast.Stmt;
import kara.karac.ast.Stmt.Conditional;
import kara.karac.ast.Stmt.Destination;
import kara.karac.ast.Stmt.LetBinding;
import kara.karac.ast.Stmt.PipelineCall;
import kara.karac.ast.TopLevelDef;
import kara.karac.ast.TopLevelDef.FunctionDef;
import kara.karac.ast.TopLevelDef.RecordDef;
import kara.karac.ast.TopLevelDef.SemanticTypeDef;
import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.lang.Purity;

public class ParserTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Parser parser(String src) {
    Lexer lexer = new Lexer("test.kara", src.getBytes(StandardCharsets.UTF_8));
    return new Parser("test.kara", lexer.tokenize());
  }

  private static Program parseClean(String src) {
    Parser p = parser(src);
    Program prog = p.parseProgram();
    assertTrue("Unexpected errors: " + p.getDiagnostics().getAll(),
               p.getDiagnostics().isEmpty());
    return prog;
  }

  private static List<Stmt> flowBody(String body) {
    Program prog = parseClean("flow main(a: i64) {\n" + body + "\n}");
    return prog.getFunctions().get(0).getBody().getStatements();
  }

  @Test
  public void testTopLevelDefinitions() {
    Program prog = parseClean(
        "record Point { x: f64, y: f64 }\n" +
        "type UserId i64;\n" +
        "fn norm(p: Point) -> f64 { p.x * p.x + p.y * p.y }\n" +
        "flow main { }\n");
    List<TopLevelDef> defs = prog.getDefinitions();
    assertEquals(4, defs.size());
    RecordDef point = (RecordDef)defs.get(0);
    assertEquals("Point", point.getName());
    assertEquals(2, point.getFields().size());
    SemanticTypeDef userId = (SemanticTypeDef)defs.get(1);
    assertEquals("i64", userId.getUnderlying().getName());
    FunctionDef norm = (FunctionDef)defs.get(2);
    assertEquals(Purity.PURE, norm.getPurity());
    assertEquals("f64", norm.getReturnType().getName());
    assertTrue(norm.getBody().hasResult());
    FunctionDef main = (FunctionDef)defs.get(3);
    assertTrue("flow without parameter list", main.isFlow());
    assertTrue(main.getParams().isEmpty());
    assertNull(main.getReturnType());
  }

  @Test
  public void testPrecedence() {
    Program prog = parseClean("fn f(a: i64, b: i64) -> bool " +
                              "{ a + b * 2 < -a - 1 }");
    Expr result = prog.getFunctions().get(0).getBody().getResult();
    BinaryOp cmp = (BinaryOp)result;
    assertEquals(Operator.LT, cmp.getOp());
    BinaryOp sum = (BinaryOp)cmp.getLeft();
    assertEquals(Operator.PLUS, sum.getOp());
    assertEquals(Operator.MULT, ((BinaryOp)sum.getRight()).getOp());
    BinaryOp diff = (BinaryOp)cmp.getRight();
    assertEquals(Operator.MINUS, diff.getOp());
    assertTrue(diff.getLeft() instanceof UnaryOp);
  }

  @Test
  public void testFieldAccessAndConversion() {
    Program prog = parseClean("fn f(p: (i64, Point)) -> UserId " +
                              "{ p.1.id.0 as UserId }");
    Conversion conv = (Conversion)
                      prog.getFunctions().get(0).getBody().getResult();
    assertEquals("UserId", conv.getTarget().getName());
    FieldAccess outer = (FieldAccess)conv.getExpr();
    assertEquals("0", outer.getField());
    assertTrue(outer.isIndex());
    FieldAccess mid = (FieldAccess)outer.getTarget();
    assertEquals("id", mid.getField());
    FieldAccess inner = (FieldAccess)mid.getTarget();
    assertEquals("1", inner.getField());
  }

  @Test
  public void testDensePipelineForms() {
    List<Stmt> stmts = flowBody(
        "a -> compute -> b;\n" +
        "(x: a, y: 2) -> combine -> (lo, hi: top);\n" +
        "b -> Print -> ();");
    PipelineCall first = (PipelineCall)stmts.get(0);
    assertEquals("compute", first.getCallee());
    assertEquals(1, first.getInputs().size());
    assertFalse(first.getInputs().get(0).isNamed());
    assertEquals(Destination.Kind.WHOLE, first.getDestination().getKind());
    assertEquals(Arrays.asList("b"), first.getDestination().boundNames());

    PipelineCall second = (PipelineCall)stmts.get(1);
    assertEquals("x", second.getInputs().get(0).getParamName());
    assertEquals("y", second.getInputs().get(1).getParamName());
    Destination dest = second.getDestination();
    assertEquals(Destination.Kind.DESTRUCTURE, dest.getKind());
    assertEquals(Arrays.asList("lo", "top"), dest.boundNames());
    assertEquals("hi", dest.getBindings().get(1).getOutputName());
    assertTrue(dest.hasFieldSelectors());

    PipelineCall third = (PipelineCall)stmts.get(2);
    assertEquals(Destination.Kind.NONE, third.getDestination().getKind());
  }

  @Test
  public void testVerboseFormMatchesDense() {
    List<Stmt> stmts = flowBody(
        "(x: a, y: 2) -> combine -> (hi: top);\n" +
        "Action: combine From: x = a, y = 2 To: hi = top;");
    PipelineCall dense = (PipelineCall)stmts.get(0);
    PipelineCall verbose = (PipelineCall)stmts.get(1);
    assertEquals(PipelineCall.Form.DENSE, dense.getForm());
    assertEquals(PipelineCall.Form.VERBOSE, verbose.getForm());
    assertEquals(dense.getCallee(), verbose.getCallee());
    assertEquals(dense.getInputs().size(), verbose.getInputs().size());
    for (int i = 0; i < dense.getInputs().size(); i++) {
      assertEquals(dense.getInputs().get(i).toString(),
                   verbose.getInputs().get(i).toString());
    }
    assertEquals(dense.getDestination().toString(),
                 verbose.getDestination().toString());
  }

  @Test
  public void testVerboseSingleOutputBindsWhole() {
    List<Stmt> stmts = flowBody("Action: compute From: n = a To: result;");
    PipelineCall call = (PipelineCall)stmts.get(0);
    assertEquals(Destination.Kind.WHOLE, call.getDestination().getKind());
    assertEquals(Arrays.asList("result"),
                 call.getDestination().boundNames());
  }

  @Test
  public void testRecordLiteralOnlyInExpressionPosition() {
    List<Stmt> stmts = flowBody(
        "let p = Point { x: 1.0, y: 2.0 };\n" +
        "if ok { let q = p; }");
    LetBinding let = (LetBinding)stmts.get(0);
    RecordLiteral lit = (RecordLiteral)let.getValue();
    assertEquals("Point", lit.getTypeName());
    assertEquals(2, lit.getFields().size());

    // "ok {" is a condition followed by a block, not a literal
    Conditional cond = (Conditional)stmts.get(1);
    assertTrue(cond.getCondition() instanceof Expr.Identifier);
    assertEquals(1, cond.getThenBlock().getStatements().size());
  }

  @Test
  public void testElseIfNests() {
    List<Stmt> stmts = flowBody(
        "if a < 0 { a -> Print -> (); } else if a > 0 { } else { }");
    Conditional outer = (Conditional)stmts.get(0);
    Block elseBlock = outer.getElseBlock();
    assertEquals(1, elseBlock.getStatements().size());
    Conditional inner = (Conditional)elseBlock.getStatements().get(0);
    assertTrue(inner.hasElse());
  }

  @Test
  public void testCallExpressionStatement() {
    List<Stmt> stmts = flowBody("Print(\"hi\");");
    Stmt.ExprStatement s = (Stmt.ExprStatement)stmts.get(0);
    Call call = (Call)s.getExpr();
    assertEquals("Print", call.getCallee());
    assertEquals(1, call.getArgs().size());
  }

  @Test
  public void testRecoversAndReportsEachError() {
    Parser p = parser(
        "flow main(a: i64) {\n" +
        "  let = 1;\n" +
        "  let ok = 2;\n" +
        "  a -> -> b;\n" +
        "  let fine = 3;\n" +
        "}\n" +
        "fn good() -> i64 { 1 }\n");
    Program prog = p.parseProgram();
    List<Diagnostic> diags = p.getDiagnostics().getAll();
    assertEquals(2, diags.size());
    assertEquals(DiagnosticKind.UNEXPECTED_TOKEN, diags.get(0).getKind());
    assertEquals(2, diags.get(0).getPosition().line);
    assertEquals(DiagnosticKind.MALFORMED_PIPELINE, diags.get(1).getKind());
    assertEquals(4, diags.get(1).getPosition().line);

    // Both definitions survive; main is marked malformed
    assertEquals(2, prog.getDefinitions().size());
    FunctionDef main = prog.getFunctions().get(0);
    assertEquals(2, main.getBody().getStatements().size());
    assertTrue(p.getMalformedDefinitions().contains(main));
    assertFalse(p.getMalformedDefinitions().contains(
                                    prog.getFunctions().get(1)));
  }

  @Test
  public void testChainedPipelineRejected() {
    Parser p = parser("flow main(a: i64) { a -> f -> b -> g -> c; }");
    p.parseProgram();
    List<Diagnostic> diags = p.getDiagnostics().getAll();
    assertEquals(1, diags.size());
    assertEquals(DiagnosticKind.MALFORMED_PIPELINE, diags.get(0).getKind());
  }

  @Test
  public void testMissingBraceRecoversAtNextDefinition() {
    Parser p = parser("flow main(a: i64) { let x = 1;\n" +
                      "fn g() -> i64 { 2 }\n");
    Program prog = p.parseProgram();
    assertTrue(p.getDiagnostics().hasErrors());
    assertEquals("g", prog.getDefinitions().get(
                   prog.getDefinitions().size() - 1).getName());
  }
}
