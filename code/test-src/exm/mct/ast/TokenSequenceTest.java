package exm.mct.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.mct.ast.SourceToken.TokenKind;
import exm.mct.common.exceptions.LexicalError;

public class TokenSequenceTest {

  private static List<String> texts(List<SourceToken> tokens) {
    List<String> result = new ArrayList<String>();
    for (SourceToken tok: tokens) {
      result.add(tok.getText());
    }
    return result;
  }

  @Test
  public void testDeclaration() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of("int x = 42;").toList();
    assertEquals(6, tokens.size());
    assertEquals(new SourceToken(TokenKind.KEYWORD, "int", 1, 1),
                 tokens.get(0));
    assertEquals(new SourceToken(TokenKind.IDENTIFIER, "x", 1, 5),
                 tokens.get(1));
    assertEquals(new SourceToken(TokenKind.OPERATOR, "=", 1, 7),
                 tokens.get(2));
    assertEquals(new SourceToken(TokenKind.INT_LITERAL, "42", 1, 9),
                 tokens.get(3));
    assertEquals(new SourceToken(TokenKind.PUNCTUATION, ";", 1, 11),
                 tokens.get(4));
    assertEquals("Sequence should end with end of input",
                 TokenKind.END_OF_INPUT, tokens.get(5).getKind());
    assertEquals("", tokens.get(5).getText());
  }

  @Test
  public void testCommentsAndWhitespaceSkipped() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of(
        "// leading comment\nint /* inline */ y").toList();
    assertEquals(3, tokens.size());
    assertEquals(new SourceToken(TokenKind.KEYWORD, "int", 2, 1),
                 tokens.get(0));
    assertEquals(new SourceToken(TokenKind.IDENTIFIER, "y", 2, 18),
                 tokens.get(1));
  }

  @Test
  public void testKeywordsVersusIdentifiers() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of(
        "while whilex intx bool void if else return print true false _a1")
        .toList();
    TokenKind[] expected = {
        TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER,
        TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.KEYWORD,
        TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.KEYWORD,
        TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.IDENTIFIER,
        TokenKind.END_OF_INPUT };
    assertEquals(expected.length, tokens.size());
    for (int i = 0; i < expected.length; i++) {
      assertEquals("Token " + i + " " + tokens.get(i),
                   expected[i], tokens.get(i).getKind());
    }
  }

  @Test
  public void testOperatorsLongestMatch() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of(
        "a<=b>=c==d!=e<f>g=h+i-j*k/l%m").toList();
    List<String> ops = new ArrayList<String>();
    for (SourceToken tok: tokens) {
      if (tok.getKind() == TokenKind.OPERATOR) {
        ops.add(tok.getText());
      }
    }
    assertEquals("[<=, >=, ==, !=, <, >, =, +, -, *, /, %]", ops.toString());
  }

  @Test
  public void testPunctuation() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of("f(a, b) { ; }").toList();
    assertEquals("[f, (, a, ,, b, ), {, ;, }, ]", texts(tokens).toString());
  }

  @Test
  public void testLinesCounted() throws LexicalError {
    List<SourceToken> tokens = TokenSequence.of("int\n  main\n\n{").toList();
    assertEquals(2, tokens.get(1).getLine());
    assertEquals(3, tokens.get(1).getColumn());
    assertEquals(4, tokens.get(2).getLine());
    assertEquals(1, tokens.get(2).getColumn());
  }

  @Test
  public void testUnrecognizedCharacter() {
    try {
      new TokenSequence("bad.c", "int main() { x = 1 @ 2; }").toList();
      fail("Expected lexical error");
    } catch (LexicalError e) {
      assertEquals("bad.c", e.getPosition().file);
      assertEquals(1, e.getPosition().line);
      assertEquals(20, e.getPosition().column);
      assertTrue(e.getMessage(),
                 e.getMessage().contains("unrecognized character '@'"));
    }
  }

  @Test
  public void testLoneBang() {
    try {
      TokenSequence.of("int a = !b;").toList();
      fail("Expected lexical error");
    } catch (LexicalError e) {
      assertEquals("Error should be at start of bad token",
                   9, e.getPosition().column);
      assertTrue(e.getMessage(),
                 e.getMessage().contains("unrecognized character '!'"));
    }
  }

  @Test
  public void testUnterminatedComment() {
    try {
      TokenSequence.of("int x; /* oops").toList();
      fail("Expected lexical error");
    } catch (LexicalError e) {
      assertEquals(8, e.getPosition().column);
      assertTrue(e.getMessage(),
                 e.getMessage().contains("unterminated comment"));
    }
  }

  @Test
  public void testIterationIsRepeatable() throws LexicalError {
    TokenSequence seq = TokenSequence.of("int x;");
    assertEquals(seq.toList(), seq.toList());
  }
}
