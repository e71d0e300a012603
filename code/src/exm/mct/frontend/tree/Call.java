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
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.frontend.TreeBuilder;

/**
 * Function call by name
 */
@JsonPropertyOrder({"callee", "args"})
public class Call extends Expression {

  private final String callee;
  private final List<Expression> args;

  public Call(FilePosition position, String callee,
              List<? extends Expression> args) {
    super(position);
    Preconditions.checkNotNull(callee);
    this.callee = callee;
    this.args = ImmutableList.copyOf(args);
  }

  @JsonCreator
  public Call(@JsonProperty("callee") String callee,
              @JsonProperty("args") List<Expression> args) {
    this(FilePosition.UNKNOWN, callee, args);
  }

  public String getCallee() {
    return callee;
  }

  public List<Expression> getArgs() {
    return args;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.CALL;
  }

  @Override
  public List<Node> children() {
    return new ArrayList<Node>(args);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  public static Call fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.childCount() != 2) {
      throw new MCTRuntimeError("call: expected 2 children but got " +
                                tree.childCount());
    }
    String callee = tree.child(0).getText();
    MiniAST argList = tree.child(1);
    if (argList.getType() != MiniCParser.ARGUMENT_LIST) {
      throw new MCTRuntimeError("Expected ARGUMENT_LIST but got " +
                                argList.getText());
    }
    List<Expression> args = new ArrayList<Expression>(argList.childCount());
    for (MiniAST arg: argList.children()) {
      args.add(builder.buildExpression(arg));
    }
    return new Call(builder.position(tree), callee, args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(callee, args);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Call))
      return false;
    Call other = (Call) obj;
    return callee.equals(other.callee) && args.equals(other.args);
  }
}
