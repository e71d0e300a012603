package exm.mct.frontend.tree;

import exm.mct.common.FilePosition;

/**
 * A node with a value.  Any expression can also stand as a statement.
 */
public abstract class Expression extends Statement {
  protected Expression(FilePosition position) {
    super(position);
  }
}
