package exm.mct.pybackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.mct.common.Logging;
import exm.mct.common.Settings;
import exm.mct.common.exceptions.InvalidOptionException;
import exm.mct.common.lang.Operators.Op;
import exm.mct.frontend.tree.Program;
import exm.mct.ui.CompileResult;
import exm.mct.ui.MCTCompiler;

public class PythonGeneratorTest {

  private static final String HEADER =
      "# " + PythonGenerator.HEADER + "\n\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("PythonGeneratorTest.mct.log", true);
  }

  private static Program compile(String source) {
    CompileResult result = new MCTCompiler().compile(source);
    assertTrue(result.toString(), result.isSuccess());
    return result.getProgram();
  }

  private static String generate(String source) {
    PythonGenerator gen = new PythonGenerator(Logging.getMCTLogger(), 4,
                                              true, true);
    return gen.generate(compile(source));
  }

  @Test
  public void testAdd() {
    assertEquals(HEADER +
        "def add(a, b):\n" +
        "    return (a + b)\n",
        generate("int add(int a, int b) { return a + b; }"));
  }

  @Test
  public void testMainGuard() {
    assertEquals(HEADER +
        "def add(a, b):\n" +
        "    return (a + b)\n" +
        "\n" +
        "def main():\n" +
        "    print(add(1, 2))\n" +
        "    return 0\n" +
        "\n" +
        "if __name__ == '__main__':\n" +
        "    main()\n",
        generate("int add(int a, int b) { return a + b; }\n" +
                 "int main() { print(add(1, 2)); return 0; }"));
  }

  @Test
  public void testNoGuardForMainWithParams() {
    String code = generate("int main(int argc) { return argc; }");
    assertFalse(code, code.contains("__main__"));
  }

  @Test
  public void testDeterministic() {
    String source =
        "int fib(int n) { if (n < 2) return n; " +
        "return fib(n - 1) + fib(n - 2); }\n" +
        "int main() { int i = 0; while (i < 10) { print(fib(i)); " +
        "i = i + 1; } return 0; }";
    Program program = compile(source);
    PythonGenerator gen = new PythonGenerator(Logging.getMCTLogger(), 4,
                                              true, true);
    String first = gen.generate(program);
    assertEquals(first, gen.generate(program));
    assertEquals(first, generate(source));
  }

  @Test
  public void testElif() {
    assertEquals(HEADER +
        "def classify(x):\n" +
        "    if (x < 0):\n" +
        "        return 0\n" +
        "    elif (x == 0):\n" +
        "        return 1\n" +
        "    else:\n" +
        "        return 2\n",
        generate("int classify(int x) {\n" +
                 "  if (x < 0) { return 0; }\n" +
                 "  else if (x == 0) { return 1; }\n" +
                 "  else { return 2; }\n" +
                 "}"));
  }

  @Test
  public void testNestedIfInsideElseBlockWithOtherStatements() {
    String code = generate(
        "void f(int x) { if (x) print(1); else { print(2); " +
        "if (x > 2) print(3); } }");
    assertTrue(code, code.contains(
        "    else:\n" +
        "        print(2)\n" +
        "        if (x > 2):\n" +
        "            print(3)\n"));
  }

  @Test
  public void testWhileAndDivision() {
    assertEquals(HEADER +
        "def halve(n):\n" +
        "    steps = 0\n" +
        "    while (n > 1):\n" +
        "        n = (n // 2)\n" +
        "        steps = (steps + 1)\n" +
        "    return steps\n",
        generate("int halve(int n) { int steps = 0; " +
                 "while (n > 1) { n = n / 2; steps = steps + 1; } " +
                 "return steps; }"));
  }

  @Test
  public void testOperatorMapping() {
    assertEquals("//", PythonGenerator.pythonOperator(Op.DIV));
    assertEquals("%", PythonGenerator.pythonOperator(Op.MOD));
    assertEquals("!=", PythonGenerator.pythonOperator(Op.NEQ));
    assertEquals("<=", PythonGenerator.pythonOperator(Op.LTE));
  }

  @Test
  public void testEmptyBodiesGetPass() {
    assertEquals(HEADER +
        "def nothing():\n" +
        "    pass\n" +
        "\n" +
        "def loop(b):\n" +
        "    while b:\n" +
        "        pass\n" +
        "    if b:\n" +
        "        pass\n" +
        "    else:\n" +
        "        return\n",
        generate("void nothing() { }\n" +
                 "void loop(bool b) { while (b) { } if (b) ; else return; }"));
  }

  @Test
  public void testDefaultsAndLiterals() {
    assertEquals(HEADER +
        "def main():\n" +
        "    x = 0\n" +
        "    b = False\n" +
        "    t = True\n" +
        "    print(x)\n" +
        "    return 0\n" +
        "\n" +
        "if __name__ == '__main__':\n" +
        "    main()\n",
        generate("int main() { int x; bool b; bool t = true; print(x); " +
                 "return 0; }"));
  }

  @Test
  public void testBlocksFlattenedAndShadowingRenamed() {
    assertEquals(HEADER +
        "def f():\n" +
        "    x = 1\n" +
        "    x_1 = 2\n" +
        "    print(x_1)\n" +
        "    x_2 = True\n" +
        "    print(x_2)\n" +
        "    print(x)\n" +
        "    return x\n",
        generate("int f() { int x = 1; { int x = 2; print(x); } " +
                 "{ { bool x = true; print(x); } } print(x); return x; }"));
  }

  @Test
  public void testShadowingInitializerUsesOuterName() {
    String code = generate(
        "int f() { int x = 1; { int x = x + 1; print(x); } return x; }");
    assertTrue(code, code.contains("    x_1 = (x + 1)\n"));
  }

  @Test
  public void testReservedNamesEscaped() {
    assertEquals(HEADER +
        "def pass_(lambda_):\n" +
        "    None_ = (lambda_ * 2)\n" +
        "    return None_\n",
        generate("int pass(int lambda) { int None = lambda * 2; " +
                 "return None; }"));
  }

  @Test
  public void testLocalCollidingWithFunctionRenamed() {
    String code = generate("int total() { return 1; }\n" +
        "void show() { int total = total(); print(total); }");
    assertTrue(code, code.contains(
        "def show():\n" +
        "    total_1 = total()\n" +
        "    print(total_1)\n"));
  }

  @Test
  public void testExpressionStatement() {
    String code = generate("void f(int a) { print(a); }\n" +
                           "void g() { f(1); 2 + 3; }");
    assertTrue(code, code.contains("def g():\n    f(1)\n    (2 + 3)\n"));
  }

  @Test
  public void testSettings() throws InvalidOptionException {
    Settings settings = Settings.defaults()
        .with(Settings.CODEGEN_INDENT_WIDTH, "2")
        .with(Settings.CODEGEN_HEADER, "false")
        .with(Settings.CODEGEN_MAIN_GUARD, "false");
    MCTCompiler mct = new MCTCompiler(Logging.getMCTLogger(), settings);
    CompileResult result = mct.compile(
        "int main() { if (true) { return 1; } return 0; }");
    assertTrue(result.toString(), result.isSuccess());
    assertEquals(
        "def main():\n" +
        "  if True:\n" +
        "    return 1\n" +
        "  return 0\n",
        mct.generate(result.getProgram()));
  }
}
