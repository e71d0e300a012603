package exm.mct.frontend.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.google.common.collect.Multiset;

import exm.mct.common.lang.Types.Type;
import exm.mct.ui.CompileResult;
import exm.mct.ui.MCTCompiler;

public class TreeInspectorTest {

  private static final String ADD = "int add(int a, int b) { return a + b; }";

  private static Program compile(String source) {
    CompileResult result = new MCTCompiler().compile(source);
    assertTrue(result.toString(), result.isSuccess());
    return result.getProgram();
  }

  @Test
  public void testPrintEmptyFunction() {
    String expected =
        "Program\n" +
        "`-- body:\n" +
        "    `-- FunctionDef [f]\n" +
        "        `-- body:\n" +
        "            `-- Block\n";
    assertEquals(expected, TreeInspector.printTree(compile("void f() { }")));
  }

  @Test
  public void testPrintBranches() {
    String tree = TreeInspector.printTree(compile(ADD));
    String[] lines = tree.split("\n");
    assertEquals(13, lines.length);
    assertEquals("                            `-- BinaryOp [+]", lines[8]);
    assertEquals("                                |-- left:", lines[9]);
    assertEquals("                                |   `-- Identifier [a]",
                 lines[10]);
    assertEquals("                                `-- right:", lines[11]);
    assertEquals("                                    `-- Identifier [b]",
                 lines[12]);
  }

  @Test
  public void testIfFieldsLabelled() {
    String tree = TreeInspector.printTree(compile(
        "int f(int x) { if (x > 1) return 1; else return 0; }"));
    assertTrue(tree, tree.contains("|-- test:"));
    assertTrue(tree, tree.contains("|-- consequent:"));
    assertTrue(tree, tree.contains("`-- alternate:"));
  }

  @Test
  public void testLabels() {
    assertEquals("VarDecl [x: int]", TreeInspector.label(
        new VarDecl("x", Type.INT, null)));
    assertEquals("Literal [5]", TreeInspector.label(
        Literal.intLiteral(null, 5)));
    assertEquals("Literal [false]", TreeInspector.label(
        Literal.boolLiteral(null, false)));
    assertEquals("Identifier [x]", TreeInspector.label(new Identifier("x")));
    assertEquals("Call [g]", TreeInspector.label(
        new Call("g", Collections.<Expression>emptyList())));
    assertEquals("Assignment [y]", TreeInspector.label(
        new Assignment("y", new Identifier("x"))));
  }

  @Test
  public void testSignature() {
    Program p = compile(ADD + "\nvoid none() { }");
    assertEquals("int add(int a, int b)",
                 TreeInspector.signature(p.getBody().get(0)));
    assertEquals("void none()", TreeInspector.signature(p.getBody().get(1)));
    FunctionDef f = new FunctionDef("f", Type.BOOL,
        Arrays.asList(new Param("flag", Type.BOOL)),
        new Block(Collections.<Statement>emptyList()));
    assertEquals("bool f(bool flag)", TreeInspector.signature(f));
  }

  @Test
  public void testCountNodes() {
    Multiset<NodeKind> counts = TreeInspector.countNodes(compile(ADD));
    assertEquals(7, counts.size());
    assertEquals(2, counts.count(NodeKind.IDENTIFIER));
    assertEquals(1, counts.count(NodeKind.BINARY_OP));
    assertEquals(0, counts.count(NodeKind.LITERAL));
  }

  @Test
  public void testStats() {
    String stats = TreeInspector.stats(compile(ADD));
    assertTrue(stats, stats.startsWith("Nodes: 7 total, 6 kinds\n" +
                                       "  Identifier     2\n"));
    assertTrue(stats, stats.endsWith("Functions (1):\n" +
                                     "  int add(int a, int b)\n" +
                                     "    statements: 1\n"));
  }
}
