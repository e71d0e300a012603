package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

/**
 * Input text that is not a sequence of valid tokens
 */
public class LexicalError extends UserException {

  public LexicalError(FilePosition position, String message) {
    super(Diagnostic.Kind.LEXICAL, position, message);
  }

  private static final long serialVersionUID = 1L;
}
