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

import com.google.common.base.Preconditions;

/**
 * A classified token of Mini-C source text.  Immutable.
 */
public class SourceToken {

  public static enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INT_LITERAL,
    OPERATOR,
    PUNCTUATION,
    END_OF_INPUT,
  }

  private final TokenKind kind;
  private final String text;
  private final int line;
  private final int column;

  /**
   * @param line 1-based line
   * @param column 1-based column
   */
  public SourceToken(TokenKind kind, String text, int line, int column) {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(text);
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + text.hashCode();
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceToken))
      return false;
    SourceToken other = (SourceToken) obj;
    return kind == other.kind && text.equals(other.text) &&
           line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column + " " + kind + " '" + text + "'";
  }
}
