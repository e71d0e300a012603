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

@JsonPropertyOrder({"test", "body"})
public class While extends Statement {

  private final Expression test;
  private final Statement body;

  public While(FilePosition position, Expression test, Statement body) {
    super(position);
    Preconditions.checkNotNull(test);
    Preconditions.checkNotNull(body);
    this.test = test;
    this.body = body;
  }

  @JsonCreator
  public While(@JsonProperty("test") Expression test,
               @JsonProperty("body") Statement body) {
    this(FilePosition.UNKNOWN, test, body);
  }

  public Expression getTest() {
    return test;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.WHILE;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(test, body);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitWhile(this);
  }

  public static While fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() != 2) {
      throw new MCTRuntimeError("while: expected 2 children but got " +
                                tree.childCount());
    }
    return new While(builder.position(tree),
                     builder.buildExpression(tree.child(0)),
                     builder.buildStatement(tree.child(1)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(test, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof While))
      return false;
    While other = (While) obj;
    return test.equals(other.test) && body.equals(other.body);
  }
}
