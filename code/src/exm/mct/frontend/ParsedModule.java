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

package exm.mct.frontend;

import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.EarlyExitException;
import org.antlr.runtime.MismatchedSetException;
import org.antlr.runtime.MismatchedTokenException;
import org.antlr.runtime.NoViableAltException;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.apache.log4j.Logger;

import exm.mct.ast.MiniAST;
import exm.mct.ast.TokenSequence;
import exm.mct.ast.UnrecognizedInputException;
import exm.mct.ast.antlr.MiniCLexer;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.Logging;
import exm.mct.common.exceptions.LexicalError;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;

/**
 * Represents a Mini-C source text after parsing with ANTLR
 */
public class ParsedModule {

  public ParsedModule(String inputFile, MiniAST ast) {
    this.inputFile = inputFile;
    this.ast = ast;
  }

  /** File name used for positions, may be null */
  public final String inputFile;
  public final MiniAST ast;

  /**
   * Lex and parse the source text
   * @param inputFile name used in error positions, may be null
   * @param source
   * @throws LexicalError if the text has a character that starts no token
   * @throws SyntaxError if the token stream does not match the grammar
   */
  public static ParsedModule parse(String inputFile, String source)
      throws LexicalError, SyntaxError {
    MiniAST tree = runANTLR(inputFile, new ANTLRStringStream(source));
    return new ParsedModule(inputFile, tree);
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static MiniAST runANTLR(String inputFile, ANTLRStringStream input)
      throws LexicalError, SyntaxError {
    Logger logger = Logging.getMCTLogger();

    MiniCLexer lexer = new MiniCLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    try {
      // Lex everything up front so lexical errors are reported as such,
      // ahead of any syntax error
      tokens.fill();
    } catch (UnrecognizedInputException e) {
      throw TokenSequence.lexicalError(inputFile, e);
    }
    logger.debug("Lexed " + tokens.size() + " tokens");

    MiniCParser parser = new MiniCParser(tokens);
    parser.setTreeAdaptor(new MiniTreeAdaptor());

    MiniCParser.program_return program;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      throw syntaxError(inputFile, e);
    } catch (StackOverflowError e) {
      // Generated parser recurses once per level of nesting
      Token at = tokens.LT(1);
      logger.debug("Parser stack overflow at token " + tokens.index());
      throw new SyntaxError(new FilePosition(inputFile, at.getLine(),
                                    at.getCharPositionInLine() + 1),
                            "program nested too deeply to parse");
    }

    if (program == null || program.getTree() == null)
      throw new MCTRuntimeError("Parser returned no tree");

    return (MiniAST) program.getTree();
  }

  static SyntaxError syntaxError(String inputFile, RecognitionException e) {
    Token found = e.token;
    FilePosition pos;
    if (found != null && found.getLine() > 0) {
      pos = new FilePosition(inputFile, found.getLine(),
                             found.getCharPositionInLine() + 1);
    } else {
      pos = new FilePosition(inputFile, e.line, e.charPositionInLine + 1);
    }

    String foundDesc = describeToken(found);
    String msg;
    if (e instanceof MismatchedTokenException) {
      int expecting = ((MismatchedTokenException)e).expecting;
      msg = "expected " + tokenDisplayName(expecting) +
            " but found " + foundDesc;
    } else if (e instanceof NoViableAltException ||
               e instanceof MismatchedSetException ||
               e instanceof EarlyExitException) {
      String expected = expectedConstruct(e);
      if (expected != null) {
        msg = "expected " + expected + " but found " + foundDesc;
      } else {
        msg = "unexpected " + foundDesc;
      }
    } else {
      msg = "unexpected " + foundDesc;
    }
    return new SyntaxError(pos, msg);
  }

  /**
   * Work out which construct the parser was trying to match from the
   * innermost parser rule on the exception's stack
   * @return description, or null if not known
   */
  private static String expectedConstruct(RecognitionException e) {
    List<?> rules = MiniCParser.getRuleInvocationStack(e,
                                      MiniCParser.class.getName());
    if (rules.isEmpty()) {
      return null;
    }
    String rule = rules.get(rules.size() - 1).toString();
    if (rule.equals("program")) {
      return "a function definition";
    } else if (rule.equals("type_name")) {
      return "a type";
    } else if (rule.equals("statement")) {
      return "a statement";
    } else if (rule.endsWith("expr") || rule.equals("expression")) {
      return "an expression";
    } else {
      return null;
    }
  }

  private static String describeToken(Token t) {
    if (t == null || t.getType() == Token.EOF) {
      return "end of input";
    }
    return "'" + t.getText() + "'";
  }

  /**
   * @param tokenType token type number from the generated parser
   * @return user-readable name for a token type
   */
  public static String tokenDisplayName(int tokenType) {
    switch (tokenType) {
      case Token.EOF: return "end of input";
      case MiniCParser.ID: return "an identifier";
      case MiniCParser.NUMBER: return "an integer";
      case MiniCParser.INT_TYPE: return "'int'";
      case MiniCParser.BOOL_TYPE: return "'bool'";
      case MiniCParser.VOID_TYPE: return "'void'";
      case MiniCParser.IF: return "'if'";
      case MiniCParser.ELSE: return "'else'";
      case MiniCParser.WHILE: return "'while'";
      case MiniCParser.RETURN: return "'return'";
      case MiniCParser.PRINT: return "'print'";
      case MiniCParser.TRUE: return "'true'";
      case MiniCParser.FALSE: return "'false'";
      case MiniCParser.LPAREN: return "'('";
      case MiniCParser.RPAREN: return "')'";
      case MiniCParser.LBRACE: return "'{'";
      case MiniCParser.RBRACE: return "'}'";
      case MiniCParser.SEMICOLON: return "';'";
      case MiniCParser.COMMA: return "','";
      case MiniCParser.ASSIGN: return "'='";
      default:
        return LogHelper.tokName(tokenType);
    }
  }

  public static class MiniTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new MiniAST(t);
    }
  }
}
