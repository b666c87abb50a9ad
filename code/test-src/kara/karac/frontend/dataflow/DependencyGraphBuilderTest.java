package kara.karac.frontend.dataflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.BeforeClass;
import org.junit.Test;

import kara.karac.common.Logging;
import kara.karac.common.diagnostics.Diagnostic;
import kara.karac.common.diagnostics.DiagnosticKind;
import kara.karac.common.lang.Builtins;
import kara.karac.common.lang.Types;
import kara.karac.frontend.dataflow.DependencyGraph.NodePair;
import kara.karac.ui.CompilationResult;
import kara.karac.ui.KaraCompiler;

public class DependencyGraphBuilderTest {

  private static final String COMPUTE_FNS =
      "fn compute(x: i64) -> i64 { x + 1 }\n" +
      "fn compute2(x: i64) -> i64 { x * 2 }\n" +
      "fn compute3(x: i64) -> i64 { x - 3 }\n";

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

  private static DependencyGraph graphOf(String src, String flow) {
    CompilationResult r = compile(src);
    assertTrue("Unexpected errors: " + r.getDiagnostics(), r.isSuccess());
    DependencyGraph g = r.getGraphs().get(flow);
    assertTrue("No graph for " + flow, g != null);
    return g;
  }

  /**
   * Independent nodes of this graph and every nested branch graph must not
   * touch a common name.
   */
  private static void assertIndependentNodesDisjoint(DependencyGraph g) {
    for (NodePair pair: g.independentPairs()) {
      StatementNode a = pair.getFirst();
      StatementNode b = pair.getSecond();
      String where = g.getFlowName() + " " + pair + ": " + a + " / " + b;
      assertTrue(where, shared(a.getInputs(), b.getOutputs()).isEmpty());
      assertTrue(where, shared(b.getInputs(), a.getOutputs()).isEmpty());
      assertTrue(where, shared(a.getOutputs(), b.getOutputs()).isEmpty());
    }
    for (StatementNode n: g.getNodes()) {
      for (DependencyGraph branch: n.getNested()) {
        assertIndependentNodesDisjoint(branch);
      }
    }
  }

  private static Set<String> shared(Set<String> x, Set<String> y) {
    Set<String> result = new HashSet<String>(x);
    result.retainAll(y);
    return result;
  }

  private static List<Integer> indices(List<StatementNode> nodes) {
    List<Integer> result = new ArrayList<Integer>();
    for (StatementNode n: nodes) {
      result.add(n.getIndex());
    }
    return result;
  }

  @Test
  public void testIndependentPipelines() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow main(a: i64) {\n" +
        "  a -> compute -> b;\n" +
        "  b -> compute2 -> c;\n" +
        "  a -> compute3 -> d;\n" +
        "}\n", "main");
    assertEquals("main", g.getFlowName());
    assertEquals(Arrays.asList("a"), g.getParameters());
    assertEquals(3, g.size());
    assertEquals(1, g.edgeCount());

    StatementNode n0 = g.getNode(0);
    StatementNode n1 = g.getNode(1);
    StatementNode n2 = g.getNode(2);
    assertTrue(n0.getOutputs().contains("b"));
    assertEquals(Types.I64, n0.getOutputTypes().get("b"));
    assertEquals(Arrays.asList("compute"), n0.getCallees());
    assertTrue(g.hasEdge(n0, n1));
    assertFalse(g.hasEdge(n0, n2));

    assertFalse(g.areIndependent(n0, n1));
    assertTrue(g.areIndependent(n0, n2));
    assertTrue(g.areIndependent(n1, n2));
    assertFalse("A node is never independent of itself",
                g.areIndependent(n2, n2));

    List<NodePair> pairs = g.independentPairs();
    assertEquals(2, pairs.size());
    assertEquals("(0, 2)", pairs.get(0).toString());
    assertEquals("(1, 2)", pairs.get(1).toString());
    for (StatementNode n: g.getNodes()) {
      assertFalse(n.describe(), n.isImpure());
    }
  }

  @Test
  public void testTransitiveDependency() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow chain(a: i64) -> i64 {\n" +
        "  a -> compute -> b;\n" +
        "  let unrelated = compute3(a);\n" +
        "  b -> compute2 -> c;\n" +
        "  c + unrelated\n" +
        "}\n", "chain");
    assertEquals(4, g.size());
    StatementNode result = g.getNode(3);
    assertTrue(result.isResult());
    assertNull(result.getStatement());
    assertEquals(Arrays.asList(1, 2), indices(g.predecessors(result)));
    assertTrue(g.hasPath(g.getNode(0), result));
    assertFalse(g.hasEdge(g.getNode(0), result));
    assertEquals(Arrays.asList(2), indices(g.successors(g.getNode(0))));
    assertTrue(g.areIndependent(g.getNode(1), g.getNode(2)));
    assertFalse(g.areIndependent(g.getNode(0), result));
  }

  @Test
  public void testTopologicalOrderKeepsProgramOrder() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow main(a: i64) {\n" +
        "  a -> compute3 -> x;\n" +
        "  a -> compute -> y;\n" +
        "  y -> compute2 -> z;\n" +
        "  x -> compute -> w;\n" +
        "}\n", "main");
    List<StatementNode> order = g.topologicalOrder();
    assertEquals(Arrays.asList(0, 1, 2, 3), indices(order));
    for (int i = 0; i < order.size(); i++) {
      for (StatementNode pred: g.predecessors(order.get(i))) {
        assertTrue(order.indexOf(pred) < i);
      }
    }
  }

  @Test
  public void testForwardReferenceInFlow() {
    CompilationResult r = compile(COMPUTE_FNS +
        "flow main(a: i64) {\n" +
        "  b -> compute2 -> c;\n" +
        "  a -> compute -> b;\n" +
        "}\n");
    assertFalse(r.isSuccess());
    List<Diagnostic> errs = new ArrayList<Diagnostic>();
    for (Diagnostic d: r.getDiagnostics()) {
      if (d.isError()) {
        errs.add(d);
      }
    }
    assertEquals(errs.toString(), 1, errs.size());
    assertEquals(DiagnosticKind.FORWARD_REFERENCE, errs.get(0).getKind());
    assertEquals(5, errs.get(0).getPosition().line);
    assertEquals(3, errs.get(0).getPosition().col);
  }

  @Test
  public void testConditionalBranchGraphs() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow main(a: i64) {\n" +
        "  a -> compute -> b;\n" +
        "  if b > 0 {\n" +
        "    b -> compute2 -> c;\n" +
        "    c -> compute3 -> _d;\n" +
        "  } else {\n" +
        "    Print(\"negative\");\n" +
        "  }\n" +
        "}\n", "main");
    assertEquals(2, g.size());
    StatementNode cond = g.getNode(1);
    assertTrue(g.hasEdge(g.getNode(0), cond));
    assertTrue(cond.getInputs().contains("b"));
    assertTrue("Else branch prints", cond.isImpure());
    assertTrue("Branch bindings stay in the branch",
               cond.getOutputs().isEmpty());

    assertEquals(2, cond.getNested().size());
    DependencyGraph thenGraph = cond.getNested().get(0);
    assertEquals(Arrays.asList("b"), thenGraph.getParameters());
    assertEquals(2, thenGraph.size());
    assertTrue(thenGraph.hasEdge(thenGraph.getNode(0),
                                 thenGraph.getNode(1)));
    DependencyGraph elseGraph = cond.getNested().get(1);
    assertEquals(1, elseGraph.size());
    assertTrue(elseGraph.getNode(0).isImpure());
    assertTrue(elseGraph.getParameters().isEmpty());
  }

  @Test
  public void testImpureAndSelfRecursiveNodes() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow countdown(n: i64) {\n" +
        "  n -> compute3 -> m;\n" +
        "  Print(\"tick\");\n" +
        "  countdown(m);\n" +
        "}\n", "countdown");
    assertEquals(3, g.size());
    assertFalse(g.getNode(0).isImpure());
    assertTrue(g.getNode(1).isImpure());
    assertFalse(g.getNode(1).isSelfRecursive());
    StatementNode rec = g.getNode(2);
    assertTrue(rec.isSelfRecursive());
    assertTrue(rec.isImpure());
    assertTrue(g.hasEdge(g.getNode(0), rec));
    // Data independence only: ordering of effects is left to the caller
    assertTrue(g.areIndependent(g.getNode(1), rec));
  }

  @Test
  public void testUnusedLetWarning() {
    CompilationResult r = compile(COMPUTE_FNS +
        "flow main(a: i64) {\n" +
        "  let x = compute(a);\n" +
        "  let _ignored = compute2(a);\n" +
        "  let y = compute3(a);\n" +
        "  y -> compute -> _z;\n" +
        "}\n");
    assertTrue("Warnings don't fail compilation", r.isSuccess());
    List<Diagnostic> diags = r.getDiagnostics();
    assertEquals(diags.toString(), 1, diags.size());
    Diagnostic d = diags.get(0);
    assertEquals(DiagnosticKind.UNUSED_BINDING, d.getKind());
    assertFalse(d.isError());
    assertEquals(5, d.getPosition().line);
    assertTrue(d.getMessage(), d.getMessage().contains("x"));
    assertTrue(r.getGraphs().containsKey("main"));
  }

  @Test
  public void testShadowingBinderWaitsForOuterReaders() {
    DependencyGraph g = graphOf(
        "flow m(a: i64) {\n" +
        "  let x = a;\n" +
        "  if true {\n" +
        "    let y = x;\n" +
        "    let x = 2;\n" +
        "    Print(\"w\");\n" +
        "  }\n" +
        "}\n", "m");
    DependencyGraph branch = g.getNode(1).getNested().get(0);
    assertEquals(Arrays.asList("x"), branch.getParameters());
    StatementNode reader = branch.getNode(0);
    StatementNode binder = branch.getNode(1);
    assertTrue(reader.getInputs().contains("x"));
    assertTrue(binder.getOutputs().contains("x"));
    assertTrue(branch.hasEdge(reader, binder));
    assertFalse(branch.areIndependent(reader, binder));
    assertTrue(branch.areIndependent(binder, branch.getNode(2)));
    assertEquals(Arrays.asList(0, 1, 2), indices(branch.topologicalOrder()));
  }

  @Test
  public void testShadowAfterNestedRead() {
    DependencyGraph g = graphOf(COMPUTE_FNS +
        "flow s(a: i64) {\n" +
        "  let x = a;\n" +
        "  if x > 0 {\n" +
        "    if x > 1 { x -> compute -> _p; }\n" +
        "    let x = 5;\n" +
        "    x -> compute2 -> _q;\n" +
        "  }\n" +
        "}\n", "s");
    DependencyGraph branch = g.getNode(1).getNested().get(0);
    assertEquals(3, branch.size());
    assertTrue(branch.hasEdge(branch.getNode(0), branch.getNode(1)));
    assertTrue(branch.hasEdge(branch.getNode(1), branch.getNode(2)));
    assertTrue(branch.independentPairs().isEmpty());
  }

  @Test
  public void testIndependentNodesShareNoNames() {
    List<String> bodies = Arrays.asList(
        "flow main(a: i64) {\n" +
        "  a -> compute -> b;\n" +
        "  b -> compute2 -> c;\n" +
        "  a -> compute3 -> d;\n" +
        "}\n",
        "flow chain(a: i64) -> i64 {\n" +
        "  a -> compute -> b;\n" +
        "  let unrelated = compute3(a);\n" +
        "  b -> compute2 -> c;\n" +
        "  c + unrelated\n" +
        "}\n",
        "flow m(a: i64) {\n" +
        "  let x = a;\n" +
        "  if true { let y = x; let x = 2; Print(\"w\"); }\n" +
        "}\n",
        "flow main(a: i64) {\n" +
        "  a -> compute -> b;\n" +
        "  let c = compute2(a);\n" +
        "  if b > c {\n" +
        "    let a = compute3(b);\n" +
        "    a -> compute -> d;\n" +
        "    let e = d + c;\n" +
        "    e -> compute2 -> _f;\n" +
        "    Print(\"then\");\n" +
        "  } else {\n" +
        "    let b = 1;\n" +
        "    b -> compute -> _g;\n" +
        "    Print(\"else\");\n" +
        "  }\n" +
        "  c -> compute3 -> _h;\n" +
        "}\n",
        "flow s(a: i64) {\n" +
        "  let x = a;\n" +
        "  if x > 0 {\n" +
        "    if x > 1 { x -> compute -> _p; }\n" +
        "    let x = 5;\n" +
        "    x -> compute2 -> _q;\n" +
        "  }\n" +
        "}\n");
    for (String body: bodies) {
      CompilationResult r = compile(COMPUTE_FNS + body);
      assertTrue("Unexpected errors: " + r.getDiagnostics(), r.isSuccess());
      assertEquals(1, r.getGraphs().size());
      for (DependencyGraph g: r.getGraphs().values()) {
        assertIndependentNodesDisjoint(g);
      }
    }
  }
}
