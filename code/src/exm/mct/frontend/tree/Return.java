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
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.frontend.TreeBuilder;

public class Return extends Statement {

  /** null for a bare return */
  private final Expression value;

  public Return(FilePosition position, Expression value) {
    super(position);
    this.value = value;
  }

  @JsonCreator
  public Return(@JsonProperty("value") Expression value) {
    this(FilePosition.UNKNOWN, value);
  }

  public Expression getValue() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.RETURN;
  }

  @Override
  public List<Node> children() {
    if (value == null) {
      return ImmutableList.of();
    }
    return ImmutableList.<Node>of(value);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitReturn(this);
  }

  public static Return fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() > 1) {
      throw new MCTRuntimeError("return: more than one child");
    }
    Expression value = null;
    if (tree.childCount() == 1) {
      value = builder.buildExpression(tree.child(0));
    }
    return new Return(builder.position(tree), value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Return))
      return false;
    return Objects.equals(value, ((Return) obj).value);
  }
}
