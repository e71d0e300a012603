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
import exm.mct.frontend.TreeBuilder;

@JsonPropertyOrder({"target", "value"})
public class Assignment extends Statement {

  private final String target;
  private final Expression value;

  public Assignment(FilePosition position, String target, Expression value) {
    super(position);
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(value);
    this.target = target;
    this.value = value;
  }

  @JsonCreator
  public Assignment(@JsonProperty("target") String target,
                    @JsonProperty("value") Expression value) {
    this(FilePosition.UNKNOWN, target, value);
  }

  public String getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ASSIGNMENT;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(value);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitAssignment(this);
  }

  public static Assignment fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() != 2) {
      throw new MCTRuntimeError("assignment: expected 2 children but got " +
                                tree.childCount());
    }
    return new Assignment(builder.position(tree), tree.child(0).getText(),
                          builder.buildExpression(tree.child(1)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Assignment))
      return false;
    Assignment other = (Assignment) obj;
    return target.equals(other.target) && value.equals(other.value);
  }
}
