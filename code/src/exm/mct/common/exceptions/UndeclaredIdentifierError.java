package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

public class UndeclaredIdentifierError extends SemanticError {

  public UndeclaredIdentifierError(FilePosition position, String message) {
    super(Diagnostic.Kind.UNDECLARED_IDENTIFIER, position, message);
  }

  private static final long serialVersionUID = 1L;
}
