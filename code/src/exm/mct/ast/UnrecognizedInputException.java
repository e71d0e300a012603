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

import org.antlr.runtime.CharStream;
import org.antlr.runtime.RecognitionException;

/**
 * Thrown by the generated lexer when it cannot match a token.  Unchecked
 * so it can escape the lexer's nextToken(); callers convert it to a
 * LexicalError.
 */
public class UnrecognizedInputException extends RuntimeException {

  private final RecognitionException recognition;
  private final int line;
  private final int column;
  /** Input text from the start of the failed token */
  private final String tokenStart;

  /**
   * @param recognition the lexer's exception
   * @param line line where the failed token started
   * @param charPositionInLine 0-based column where the failed token started
   * @param tokenStart first character of the failed token
   */
  public UnrecognizedInputException(RecognitionException recognition,
          int line, int charPositionInLine, String tokenStart) {
    super("Unrecognized input at " + line + ":" + (charPositionInLine + 1),
          recognition);
    this.recognition = recognition;
    this.line = line;
    this.column = charPositionInLine + 1;
    this.tokenStart = tokenStart == null ? "" : tokenStart;
  }

  public int getLine() {
    return line;
  }

  /**
   * @return 1-based column
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return true if the lexer ran out of input in the middle of a token
   */
  public boolean atEndOfInput() {
    return recognition.c == CharStream.EOF;
  }

  /**
   * @return user-facing description of the problem
   */
  public String describe() {
    if (atEndOfInput()) {
      if (tokenStart.equals("/")) {
        return "unterminated comment";
      }
      return "unexpected end of input";
    }
    if (tokenStart.isEmpty()) {
      return "unrecognized input";
    }
    int c = tokenStart.codePointAt(0);
    if (Character.isISOControl(c) || Character.isWhitespace(c)) {
      return "unrecognized character '\\u" +
             String.format("%04x", c) + "'";
    }
    return "unrecognized character '" + tokenStart + "'";
  }

  private static final long serialVersionUID = 1L;
}
