package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

/**
 * Program is well formed but breaks a scoping or typing rule.  Semantic
 * errors are collected over the whole program rather than thrown one at a
 * time.
 */
public abstract class SemanticError extends UserException {

  protected SemanticError(Diagnostic.Kind kind, FilePosition position,
                          String message) {
    super(kind, position, message);
  }

  private static final long serialVersionUID = 1L;
}
