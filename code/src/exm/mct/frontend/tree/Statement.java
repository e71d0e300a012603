package exm.mct.frontend.tree;

import exm.mct.common.FilePosition;

/**
 * A node that may appear in a block
 */
public abstract class Statement extends Node {
  protected Statement(FilePosition position) {
    super(position);
  }
}
