package exm.mct.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.mct.common.Logging;
import exm.mct.common.exceptions.ArityMismatchError;
import exm.mct.common.exceptions.RedeclarationError;
import exm.mct.common.exceptions.SemanticError;
import exm.mct.common.exceptions.TypeMismatchError;
import exm.mct.common.exceptions.UndeclaredIdentifierError;
import exm.mct.common.exceptions.UserException;
import exm.mct.frontend.tree.Program;

public class SemanticAnalyzerTest {

  private static final String ADD =
      "int add(int a, int b) { return a + b; }\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SemanticAnalyzerTest.mct.log", true);
  }

  private static List<SemanticError> analyze(String source)
      throws UserException {
    Program program = ParsedModuleTest.parse(source);
    return new SemanticAnalyzer(Logging.getMCTLogger(), "test.c")
                                                        .analyze(program);
  }

  private static void assertValid(String source) throws UserException {
    List<SemanticError> errors = analyze(source);
    assertTrue("Unexpected errors: " + errors, errors.isEmpty());
  }

  /**
   * Check that analysis finds exactly one error, of the given class
   */
  private static SemanticError assertOneError(
      Class<? extends SemanticError> expected, String source)
      throws UserException {
    List<SemanticError> errors = analyze(source);
    assertEquals("Errors: " + errors, 1, errors.size());
    SemanticError e = errors.get(0);
    assertEquals(e.toString(), expected, e.getClass());
    return e;
  }

  @Test
  public void testValidProgram() throws UserException {
    assertValid(ADD +
        "bool positive(int x) { return x > 0; }\n" +
        "void report(int x) { print(x); return; }\n" +
        "int main() {\n" +
        "  int total = 0;\n" +
        "  int i = 0;\n" +
        "  while (i < 10) {\n" +
        "    if (positive(i) == true) total = add(total, i);\n" +
        "    else { total = total - 1; }\n" +
        "    i = i + 1;\n" +
        "  }\n" +
        "  report(total);\n" +
        "  return total % 7;\n" +
        "}");
  }

  @Test
  public void testForwardCall() throws UserException {
    assertValid("int main() { return later(1); }\n" +
                "int later(int x) { return x * 2; }");
  }

  @Test
  public void testVariableNotVisibleInOtherFunction() throws UserException {
    SemanticError e = assertOneError(UndeclaredIdentifierError.class,
        "int f() { int x = 1; return x; }\n" +
        "int g() { return x; }");
    assertEquals(2, e.getPosition().line);
    assertEquals(18, e.getPosition().column);
  }

  @Test
  public void testRedeclarationSameScope() throws UserException {
    SemanticError e = assertOneError(RedeclarationError.class,
        "int main() {\n  int x = 1;\n  int x = 2;\n  return x;\n}");
    assertEquals(3, e.getPosition().line);
  }

  @Test
  public void testShadowingInnerScope() throws UserException {
    assertValid("int main() { int x = 1; { int x = 2; print(x); } " +
                "if (x) { bool x = true; print(x); } return x; }");
  }

  @Test
  public void testParameterRedeclared() throws UserException {
    assertOneError(RedeclarationError.class,
        "int f(int a) { int a = 1; return a; }");
    assertOneError(RedeclarationError.class,
        "int f(int a, bool a) { return 0; }");
  }

  @Test
  public void testDuplicateFunction() throws UserException {
    assertOneError(RedeclarationError.class,
        "int f() { return 1; }\nint f() { return 2; }");
  }

  @Test
  public void testOutOfScopeAfterBlock() throws UserException {
    assertOneError(UndeclaredIdentifierError.class,
        "int main() {\n" +
        "  if (1) {\n" +
        "    int y = 10;\n" +
        "  }\n" +
        "  y = 20;\n" +
        "  return 0;\n" +
        "}");
  }

  @Test
  public void testArity() throws UserException {
    assertOneError(ArityMismatchError.class,
        ADD + "int main() { return add(1); }");
    assertOneError(ArityMismatchError.class,
        ADD + "int main() { return add(1, 2, 3); }");
    assertValid(ADD + "int main() { return add(1, 2); }");
  }

  @Test
  public void testUndeclaredReturnReportedOnce() throws UserException {
    SemanticError e = assertOneError(UndeclaredIdentifierError.class,
        "int main() { return y; }");
    assertTrue(e.getMessage(), e.getMessage().contains("y"));
  }

  @Test
  public void testUndeclaredFunction() throws UserException {
    assertOneError(UndeclaredIdentifierError.class,
        "int main() { return missing(1); }");
  }

  @Test
  public void testInitializerTypeMismatch() throws UserException {
    assertOneError(TypeMismatchError.class,
        "int main() { bool b = 1; return 0; }");
    assertOneError(TypeMismatchError.class,
        "int main() { int x = true; return x; }");
  }

  @Test
  public void testOperandTypeMismatch() throws UserException {
    assertOneError(TypeMismatchError.class,
        "int main() { int x = true + 1; return x; }");
    assertOneError(TypeMismatchError.class,
        "int main() { bool b = 1 == false; return 0; }");
    assertValid("int main() { bool b = true != false; return 0; }");
  }

  @Test
  public void testAssignmentTypeMismatch() throws UserException {
    assertOneError(TypeMismatchError.class,
        "int main() { int x = 0; x = x < 1; return x; }");
  }

  @Test
  public void testArgumentTypeMismatch() throws UserException {
    assertOneError(TypeMismatchError.class,
        ADD + "int main() { return add(1, true); }");
  }

  @Test
  public void testReturnTypes() throws UserException {
    assertOneError(TypeMismatchError.class,
        "int main() { return true; }");
    assertOneError(TypeMismatchError.class,
        "void f() { return 1; }");
    assertOneError(TypeMismatchError.class,
        "int f() { return; }");
    assertValid("void f() { return; }");
  }

  @Test
  public void testVoidValues() throws UserException {
    String f = "void f() { }\n";
    assertOneError(TypeMismatchError.class,
        f + "int main() { print(f()); return 0; }");
    assertOneError(TypeMismatchError.class,
        f + "int main() { int x = f(); return x; }");
    assertOneError(TypeMismatchError.class,
        "int main() { void v; return 0; }");
    assertValid(f + "int main() { f(); return 0; }");
  }

  @Test
  public void testConditionTypes() throws UserException {
    assertValid("int main() { int i = 3; while (i) i = i - 1; " +
                "if (i == 0) return 1; return 0; }");
    assertOneError(TypeMismatchError.class,
        "void f() { }\nint main() { if (f()) return 1; return 0; }");
  }

  @Test
  public void testFunctionAndVariableNamesDistinct() throws UserException {
    assertOneError(TypeMismatchError.class,
        ADD + "int main() { return add; }");
    assertOneError(TypeMismatchError.class,
        "int main() { int x = 1; return x(); }");
    assertOneError(TypeMismatchError.class,
        ADD + "int main() { add = 1; return 0; }");
  }

  @Test
  public void testErrorsInSourceOrder() throws UserException {
    List<SemanticError> errors = analyze(
        "int main() {\n" +
        "  a = 1;\n" +
        "  bool b = 2;\n" +
        "  return c;\n" +
        "}\n" +
        "int main() { return 0; }");
    assertEquals("Errors: " + errors, 4, errors.size());
    assertEquals(UndeclaredIdentifierError.class, errors.get(0).getClass());
    assertEquals(TypeMismatchError.class, errors.get(1).getClass());
    assertEquals(UndeclaredIdentifierError.class, errors.get(2).getClass());
    assertEquals(RedeclarationError.class, errors.get(3).getClass());
    for (int i = 1; i < errors.size(); i++) {
      assertTrue(errors.get(i - 1).getPosition().line <=
                 errors.get(i).getPosition().line);
    }
  }

  /**
   * Keeps the text of WARN messages
   */
  private static class WarningCollector extends AppenderSkeleton {
    final List<String> warnings = new ArrayList<String>();

    @Override
    protected void append(LoggingEvent event) {
      if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
        warnings.add(event.getRenderedMessage());
      }
    }

    @Override
    public boolean requiresLayout() {
      return false;
    }

    @Override
    public void close() {
    }
  }

  @Test
  public void testShadowWarningEachCompile() throws UserException {
    String source = "int f() { int x = 1; { int x = 2; } return x; }";
    Logger logger = Logging.getMCTLogger();
    WarningCollector collector = new WarningCollector();
    logger.addAppender(collector);
    try {
      assertValid(source);
      assertEquals(collector.warnings.toString(), 1,
                   collector.warnings.size());
      assertTrue(collector.warnings.get(0),
                 collector.warnings.get(0).contains("variable x shadows"));

      assertValid(source);
      assertEquals("Warning repeated for a new compile: " +
                   collector.warnings, 2, collector.warnings.size());
      assertEquals(collector.warnings.get(0), collector.warnings.get(1));
    } finally {
      logger.removeAppender(collector);
    }
  }
}
