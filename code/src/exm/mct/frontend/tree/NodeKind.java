package exm.mct.frontend.tree;

public enum NodeKind {
  PROGRAM("Program"),
  FUNCTION_DEF("FunctionDef"),
  VAR_DECL("VarDecl"),
  ASSIGNMENT("Assignment"),
  IF("If"),
  WHILE("While"),
  BINARY_OP("BinaryOp"),
  CALL("Call"),
  IDENTIFIER("Identifier"),
  LITERAL("Literal"),
  RETURN("Return"),
  PRINT("Print"),
  BLOCK("Block");

  private final String displayName;

  private NodeKind(String displayName) {
    this.displayName = displayName;
  }

  /**
   * @return name used in the exchange format and the printed tree
   */
  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
