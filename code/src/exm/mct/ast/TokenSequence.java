/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.mct.ast;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.Token;

import com.google.common.base.Preconditions;

import exm.mct.ast.SourceToken.TokenKind;
import exm.mct.ast.antlr.MiniCLexer;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.LexicalError;
import exm.mct.common.exceptions.MCTRuntimeError;

/**
 * The tokens of a source text.  Each iterator runs a fresh lexer over the
 * text, so the sequence can be walked any number of times.  Tokens are
 * produced lazily; whitespace and comments are dropped and the last token
 * is always END_OF_INPUT.
 *
 * Iterators throw {@link UnrecognizedInputException} on bad input;
 * {@link #toList()} reports the same problem as a LexicalError.
 */
public class TokenSequence implements Iterable<SourceToken> {

  private final String inputFile;
  private final String source;

  public TokenSequence(String inputFile, String source) {
    Preconditions.checkNotNull(source);
    this.inputFile = inputFile;
    this.source = source;
  }

  public static TokenSequence of(String source) {
    return new TokenSequence(null, source);
  }

  @Override
  public Iterator<SourceToken> iterator() {
    return new TokenIterator(new MiniCLexer(new ANTLRStringStream(source)));
  }

  /**
   * Lex the whole input
   * @throws LexicalError at the first unrecognized input
   */
  public List<SourceToken> toList() throws LexicalError {
    List<SourceToken> result = new ArrayList<SourceToken>();
    try {
      for (SourceToken tok: this) {
        result.add(tok);
      }
    } catch (UnrecognizedInputException e) {
      throw lexicalError(inputFile, e);
    }
    return result;
  }

  public static LexicalError lexicalError(String inputFile,
                                          UnrecognizedInputException e) {
    return new LexicalError(new FilePosition(inputFile, e.getLine(),
                            e.getColumn()), e.describe());
  }

  /**
   * Classify a token from the generated lexer
   */
  public static TokenKind classify(int tokenType) {
    switch (tokenType) {
      case Token.EOF:
        return TokenKind.END_OF_INPUT;
      case MiniCLexer.INT_TYPE:
      case MiniCLexer.BOOL_TYPE:
      case MiniCLexer.VOID_TYPE:
      case MiniCLexer.IF:
      case MiniCLexer.ELSE:
      case MiniCLexer.WHILE:
      case MiniCLexer.RETURN:
      case MiniCLexer.PRINT:
      case MiniCLexer.TRUE:
      case MiniCLexer.FALSE:
        return TokenKind.KEYWORD;
      case MiniCLexer.ID:
        return TokenKind.IDENTIFIER;
      case MiniCLexer.NUMBER:
        return TokenKind.INT_LITERAL;
      case MiniCLexer.EQUALS:
      case MiniCLexer.NEQUALS:
      case MiniCLexer.LTE:
      case MiniCLexer.GTE:
      case MiniCLexer.LT:
      case MiniCLexer.GT:
      case MiniCLexer.ASSIGN:
      case MiniCLexer.PLUS:
      case MiniCLexer.MINUS:
      case MiniCLexer.MULT:
      case MiniCLexer.DIV:
      case MiniCLexer.MOD:
        return TokenKind.OPERATOR;
      case MiniCLexer.LPAREN:
      case MiniCLexer.RPAREN:
      case MiniCLexer.LBRACE:
      case MiniCLexer.RBRACE:
      case MiniCLexer.SEMICOLON:
      case MiniCLexer.COMMA:
        return TokenKind.PUNCTUATION;
      default:
        throw new MCTRuntimeError("Unexpected token type from lexer: "
                                  + tokenType);
    }
  }

  private static class TokenIterator implements Iterator<SourceToken> {
    private final MiniCLexer lexer;
    private SourceToken next = null;
    private boolean finished = false;

    TokenIterator(MiniCLexer lexer) {
      this.lexer = lexer;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !finished) {
        next = lexNext();
      }
      return next != null;
    }

    @Override
    public SourceToken next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      SourceToken result = next;
      next = null;
      return result;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }

    private SourceToken lexNext() {
      Token t = lexer.nextToken();
      while (t.getChannel() == Token.HIDDEN_CHANNEL) {
        t = lexer.nextToken();
      }
      TokenKind kind = classify(t.getType());
      if (kind == TokenKind.END_OF_INPUT) {
        finished = true;
        return new SourceToken(kind, "", t.getLine(),
                               t.getCharPositionInLine() + 1);
      }
      return new SourceToken(kind, t.getText(), t.getLine(),
                             t.getCharPositionInLine() + 1);
    }
  }
}
