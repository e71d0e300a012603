package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

/** Function called with the wrong number of arguments */
public class ArityMismatchError extends SemanticError {

  public ArityMismatchError(FilePosition position, String message) {
    super(Diagnostic.Kind.ARITY_MISMATCH, position, message);
  }

  private static final long serialVersionUID = 1L;
}
