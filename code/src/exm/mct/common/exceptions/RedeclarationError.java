package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

/** Name declared twice in the same scope */
public class RedeclarationError extends SemanticError {

  public RedeclarationError(FilePosition position, String message) {
    super(Diagnostic.Kind.REDECLARATION, position, message);
  }

  private static final long serialVersionUID = 1L;
}
