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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.frontend.TreeBuilder;

public class Print extends Statement {

  private final Expression value;

  public Print(FilePosition position, Expression value) {
    super(position);
    Preconditions.checkNotNull(value);
    this.value = value;
  }

  @JsonCreator
  public Print(@JsonProperty("value") Expression value) {
    this(FilePosition.UNKNOWN, value);
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PRINT;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(value);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitPrint(this);
  }

  public static Print fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() != 1) {
      throw new MCTRuntimeError("print: expected 1 child but got " +
                                tree.childCount());
    }
    return new Print(builder.position(tree),
                     builder.buildExpression(tree.child(0)));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Print))
      return false;
    return value.equals(((Print) obj).value);
  }
}
