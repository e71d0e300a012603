package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

public class SyntaxError extends UserException {

  public SyntaxError(FilePosition position, String message) {
    super(Diagnostic.Kind.SYNTAX, position, message);
  }

  private static final long serialVersionUID = 1L;
}
