/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.mct.frontend.tree;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.common.lang.Operators.Op;
import exm.mct.frontend.TreeBuilder;

@JsonPropertyOrder({"op", "left", "right"})
public class BinaryOp extends Expression {

  private final Op op;
  private final Expression left;
  private final Expression right;

  public BinaryOp(FilePosition position, Op op, Expression left,
                  Expression right) {
    super(position);
    Preconditions.checkNotNull(op);
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @JsonCreator
  public BinaryOp(@JsonProperty("op") Op op,
                  @JsonProperty("left") Expression left,
                  @JsonProperty("right") Expression right) {
    this(FilePosition.UNKNOWN, op, left, right);
  }

  public Op getOp() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BINARY_OP;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(left, right);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitBinaryOp(this);
  }

  /**
   * @param tree operator token with the two operands as children
   */
  public static BinaryOp fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() != 2) {
      throw new MCTRuntimeError("operator " + tree.getText() +
                   ": expected 2 operands but got " + tree.childCount());
    }
    Op op = Op.fromSymbol(tree.getText());
    return new BinaryOp(builder.position(tree), op,
                        builder.buildExpression(tree.child(0)),
                        builder.buildExpression(tree.child(1)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, left, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof BinaryOp))
      return false;
    BinaryOp other = (BinaryOp) obj;
    return op == other.op && left.equals(other.left) &&
           right.equals(other.right);
  }
}
