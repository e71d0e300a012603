package exm.mct.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.mct.common.Logging;
import exm.mct.common.exceptions.LexicalError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.common.exceptions.UserException;
import exm.mct.common.lang.Operators.Op;
import exm.mct.common.lang.Types.Type;
import exm.mct.frontend.tree.Assignment;
import exm.mct.frontend.tree.BinaryOp;
import exm.mct.frontend.tree.Block;
import exm.mct.frontend.tree.Call;
import exm.mct.frontend.tree.Expression;
import exm.mct.frontend.tree.FunctionDef;
import exm.mct.frontend.tree.Identifier;
import exm.mct.frontend.tree.If;
import exm.mct.frontend.tree.Literal;
import exm.mct.frontend.tree.Param;
import exm.mct.frontend.tree.Print;
import exm.mct.frontend.tree.Program;
import exm.mct.frontend.tree.Return;
import exm.mct.frontend.tree.Statement;
import exm.mct.frontend.tree.VarDecl;
import exm.mct.frontend.tree.While;

public class ParsedModuleTest {

  private static final String FILE = "test.c";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ParsedModuleTest.mct.log", true);
  }

  static Program parse(String source) throws UserException {
    ParsedModule module = ParsedModule.parse(FILE, source);
    return new TreeBuilder(Logging.getMCTLogger(), FILE).build(module);
  }

  private static List<Statement> mainBody(String body) throws UserException {
    Program p = parse("int main() { " + body + " }");
    return p.getBody().get(0).getBody().getBody();
  }

  private static Expression returned(String expr) throws UserException {
    Return ret = (Return) mainBody("return " + expr + ";").get(0);
    return ret.getValue();
  }

  private static Literal num(int i) {
    return Literal.intLiteral(null, i);
  }

  private static Identifier id(String name) {
    return new Identifier(name);
  }

  private static BinaryOp op(Op op, Expression left, Expression right) {
    return new BinaryOp(op, left, right);
  }

  @Test
  public void testFunctionDefinition() throws UserException {
    Program p = parse("int add(int a, bool b) { return a; }\n" +
                      "void f() { }");
    assertEquals(2, p.getBody().size());
    FunctionDef add = p.getBody().get(0);
    assertEquals("add", add.getName());
    assertEquals(Type.INT, add.getReturnType());
    assertEquals(Arrays.asList(new Param("a", Type.INT),
                               new Param("b", Type.BOOL)),
                 add.getParams());
    assertEquals("Function position is the name", 1,
                 add.getPosition().line);
    assertEquals(5, add.getPosition().column);
    assertEquals(FILE, add.getPosition().file);

    FunctionDef f = p.getBody().get(1);
    assertEquals(Type.VOID, f.getReturnType());
    assertTrue(f.getParams().isEmpty());
    assertTrue(f.getBody().getBody().isEmpty());
    assertEquals(2, f.getPosition().line);
  }

  @Test
  public void testPrecedence() throws UserException {
    assertEquals("* binds tighter than +",
        op(Op.PLUS, num(1), op(Op.MULT, num(2), num(3))),
        returned("1 + 2 * 3"));
    assertEquals("Parentheses override precedence",
        op(Op.MULT, op(Op.PLUS, num(1), num(2)), num(3)),
        returned("(1 + 2) * 3"));
    assertEquals("Relational binds tighter than equality",
        op(Op.EQ, op(Op.LT, id("a"), id("b")), op(Op.GT, id("c"), id("d"))),
        returned("a < b == c > d"));
    assertEquals("Arithmetic binds tighter than relational",
        op(Op.LTE, op(Op.MINUS, id("a"), num(1)), op(Op.MOD, id("b"), num(2))),
        returned("a - 1 <= b % 2"));
  }

  @Test
  public void testLeftAssociative() throws UserException {
    assertEquals(op(Op.MINUS, op(Op.MINUS, num(10), num(4)), num(3)),
                 returned("10 - 4 - 3"));
    assertEquals(op(Op.DIV, op(Op.DIV, num(100), num(10)), num(2)),
                 returned("100 / 10 / 2"));
  }

  @Test
  public void testDanglingElse() throws UserException {
    List<Statement> body = mainBody("if (a) if (b) x = 1; else x = 2;");
    assertEquals(1, body.size());
    If outer = (If) body.get(0);
    assertFalse("else should not bind to outer if", outer.hasElse());
    If inner = (If) outer.getConsequent();
    assertEquals(id("b"), inner.getTest());
    assertEquals(new Assignment("x", num(1)), inner.getConsequent());
    assertEquals(new Assignment("x", num(2)), inner.getAlternate());
  }

  @Test
  public void testElseIfChain() throws UserException {
    List<Statement> body = mainBody(
        "if (a) { x = 1; } else if (b) { x = 2; } else { x = 3; }");
    If first = (If) body.get(0);
    If second = (If) first.getAlternate();
    assertTrue(second.getAlternate() instanceof Block);
  }

  @Test
  public void testStatements() throws UserException {
    List<Statement> body = mainBody(
        "int x; bool b = true; x = f(1, x); while (x < 10) x = x + 1; " +
        "print(x); g(); ; { } return;");
    assertEquals(9, body.size());
    assertEquals(new VarDecl("x", Type.INT, null), body.get(0));
    assertEquals(new VarDecl("b", Type.BOOL, Literal.boolLiteral(null, true)),
                 body.get(1));
    assertEquals(new Assignment("x",
        new Call("f", Arrays.<Expression>asList(num(1), id("x")))),
        body.get(2));
    assertTrue(body.get(3) instanceof While);
    assertEquals(new Print(id("x")), body.get(4));
    assertEquals(new Call("g", Collections.<Expression>emptyList()),
                 body.get(5));
    assertEquals("Empty statement is an empty block",
        new Block(Collections.<Statement>emptyList()), body.get(6));
    assertEquals(new Block(Collections.<Statement>emptyList()), body.get(7));
    assertNull(((Return) body.get(8)).getValue());
  }

  @Test
  public void testCommentsIgnored() throws UserException {
    Program p = parse("/* header\n comment */\n" +
                      "int main() { // body\n return 0; }");
    FunctionDef main = p.getBody().get(0);
    assertEquals(3, main.getPosition().line);
    assertEquals(new Return(num(0)), main.getBody().getBody().get(0));
  }

  @Test
  public void testMissingSemicolon() throws UserException {
    try {
      parse("int main() { return 0 }");
      fail("Expected syntax error");
    } catch (SyntaxError e) {
      assertEquals(1, e.getPosition().line);
      assertEquals(23, e.getPosition().column);
      assertEquals("expected ';' but found '}'", e.getRawMessage());
    }
  }

  @Test
  public void testEmptyProgram() throws UserException {
    try {
      parse("  // nothing here\n");
      fail("Expected syntax error");
    } catch (SyntaxError e) {
      assertTrue(e.getRawMessage(),
                 e.getRawMessage().contains("end of input"));
    }
  }

  @Test
  public void testMissingFunctionName() throws UserException {
    try {
      parse("int (int a) { return a; }");
      fail("Expected syntax error");
    } catch (SyntaxError e) {
      assertEquals(5, e.getPosition().column);
      assertEquals("expected an identifier but found '('",
                   e.getRawMessage());
    }
  }

  @Test
  public void testStatementOutsideFunction() throws UserException {
    try {
      parse("x = 1;");
      fail("Expected syntax error");
    } catch (SyntaxError e) {
      assertEquals(1, e.getPosition().column);
    }
  }

  @Test
  public void testLexicalErrorBeforeSyntaxError() throws UserException {
    try {
      // Syntax error comes first in the text, but lexing is done first
      parse("int main( { return 0 # }");
      fail("Expected lexical error");
    } catch (LexicalError e) {
      assertEquals(22, e.getPosition().column);
    }
  }

  @Test
  public void testIntegerLiteralRange() throws UserException {
    assertEquals(num(2147483647), returned("2147483647"));
    try {
      returned("2147483648");
      fail("Expected syntax error");
    } catch (SyntaxError e) {
      assertEquals("integer literal 2147483648 is out of range",
                   e.getRawMessage());
    }
  }
}
