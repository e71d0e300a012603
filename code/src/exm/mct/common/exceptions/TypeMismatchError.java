package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

public class TypeMismatchError extends SemanticError {

  public TypeMismatchError(FilePosition position, String message) {
    super(Diagnostic.Kind.TYPE_MISMATCH, position, message);
  }

  private static final long serialVersionUID = 1L;
}
