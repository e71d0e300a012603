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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;

import exm.mct.ast.MiniAST;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.frontend.TreeBuilder;

@JsonPropertyOrder({"test", "consequent", "alternate"})
public class If extends Statement {

  private final Expression test;
  private final Statement consequent;
  /** null if there is no else branch */
  private final Statement alternate;

  public If(FilePosition position, Expression test, Statement consequent,
            Statement alternate) {
    super(position);
    Preconditions.checkNotNull(test);
    Preconditions.checkNotNull(consequent);
    this.test = test;
    this.consequent = consequent;
    this.alternate = alternate;
  }

  @JsonCreator
  public If(@JsonProperty("test") Expression test,
            @JsonProperty("consequent") Statement consequent,
            @JsonProperty("alternate") Statement alternate) {
    this(FilePosition.UNKNOWN, test, consequent, alternate);
  }

  public Expression getTest() {
    return test;
  }

  public Statement getConsequent() {
    return consequent;
  }

  public Statement getAlternate() {
    return alternate;
  }

  public boolean hasElse() {
    return alternate != null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IF;
  }

  @Override
  public List<Node> children() {
    List<Node> result = new ArrayList<Node>(3);
    result.add(test);
    result.add(consequent);
    if (alternate != null) {
      result.add(alternate);
    }
    return result;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIf(this);
  }

  public static If fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    int count = tree.getChildCount();
    if (count < 2 || count > 3)
      throw new MCTRuntimeError("if: child count > 3 or < 2");
    Expression test = builder.buildExpression(tree.child(0));
    Statement consequent = builder.buildStatement(tree.child(1));

    boolean hasElse = (count == 3);
    Statement alternate = hasElse ? builder.buildStatement(tree.child(2))
                                  : null;

    return new If(builder.position(tree), test, consequent, alternate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(test, consequent, alternate);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof If))
      return false;
    If other = (If) obj;
    return test.equals(other.test) && consequent.equals(other.consequent) &&
           Objects.equals(alternate, other.alternate);
  }
}
