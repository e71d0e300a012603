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

package exm.mct.common;

import com.google.common.base.Preconditions;

import exm.mct.common.exceptions.UserException;

/**
 * A user-facing problem found while compiling a program.
 */
public class Diagnostic {

  /** Which stage of the compiler reported the problem */
  public static enum Severity {
    LEXICAL,
    SYNTAX,
    SEMANTIC,
  }

  public static enum Kind {
    LEXICAL(Severity.LEXICAL),
    SYNTAX(Severity.SYNTAX),
    REDECLARATION(Severity.SEMANTIC),
    UNDECLARED_IDENTIFIER(Severity.SEMANTIC),
    TYPE_MISMATCH(Severity.SEMANTIC),
    ARITY_MISMATCH(Severity.SEMANTIC);

    private final Severity severity;

    private Kind(Severity severity) {
      this.severity = severity;
    }

    public Severity severity() {
      return severity;
    }
  }

  private final Kind kind;
  private final String message;
  /** null if the problem has no source position */
  private final FilePosition position;

  public Diagnostic(Kind kind, String message, FilePosition position) {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(message);
    this.kind = kind;
    this.message = message;
    this.position = position;
  }

  public static Diagnostic fromException(UserException e) {
    return new Diagnostic(e.kind(), e.getRawMessage(), e.getPosition());
  }

  public Severity getSeverity() {
    return kind.severity();
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public FilePosition getPosition() {
    return position;
  }

  public boolean hasPosition() {
    return position != null && position.isKnown();
  }

  @Override
  public String toString() {
    String severity = getSeverity().toString().toLowerCase() + " error";
    if (hasPosition()) {
      return position + ": " + severity + ": " + message;
    } else {
      return severity + ": " + message;
    }
  }
}
