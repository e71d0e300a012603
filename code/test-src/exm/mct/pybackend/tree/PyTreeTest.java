package exm.mct.pybackend.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

public class PyTreeTest {

  /**
   * def f(n):
   *   while n: if n: n = (n - 1) else: pass
   */
  private static Def countdown() {
    Sequence thenBlock = new Sequence();
    thenBlock.add(new SetVariable("n",
                    new BinaryExpr(new Token("n"), "-", new Token(1))));
    Sequence loopBody = new Sequence();
    loopBody.add(new If(new Token("n"), thenBlock, new Sequence()));
    Sequence body = new Sequence();
    body.add(new WhileLoop(new Token("n"), loopBody));
    body.add(Command.returnNothing());
    return new Def("f", new HashSet<String>(), Arrays.asList("n"), body);
  }

  @Test
  public void testNestedIndentation() {
    assertEquals(
        "def f(n):\n" +
        "    while n:\n" +
        "        if n:\n" +
        "            n = (n - 1)\n" +
        "        else:\n" +
        "            pass\n" +
        "    return\n",
        countdown().toString());
  }

  @Test
  public void testRenderWidthsIndependent() {
    Def def = countdown();
    String two = def.render(2);
    assertEquals(
        "def f(n):\n" +
        "  while n:\n" +
        "    if n:\n" +
        "      n = (n - 1)\n" +
        "    else:\n" +
        "      pass\n" +
        "  return\n", two);
    // Rendering leaves no state behind in the tree
    assertEquals(def.render(4), countdown().render(4));
    assertEquals(two, def.render(2));
  }

  @Test
  public void testStartDeeper() {
    StringBuilder sb = new StringBuilder();
    new Comment("a\nb").appendTo(sb, Indentation.top(4).deeper());
    assertEquals("    # a\n    # b\n", sb.toString());
  }

  @Test
  public void testElif() {
    Sequence inner = new Sequence();
    inner.add(new If(new Token("b"), new Sequence(), new Sequence()));
    If outer = new If(new Token("a"), new Sequence(), inner);
    assertEquals("if a:\n    pass\nelif b:\n    pass\nelse:\n    pass\n",
                 outer.toString());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testZeroWidth() {
    Indentation.top(0);
  }
}
