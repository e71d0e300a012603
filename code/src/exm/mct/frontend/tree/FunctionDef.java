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
import exm.mct.common.lang.Types.FunctionType;
import exm.mct.common.lang.Types.Type;
import exm.mct.frontend.TreeBuilder;

@JsonPropertyOrder({"returnType", "name", "params", "body"})
public class FunctionDef extends Node {

  private final String name;
  private final Type returnType;
  private final List<Param> params;
  private final Block body;

  public FunctionDef(FilePosition position, String name, Type returnType,
                     List<Param> params, Block body) {
    super(position);
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(returnType);
    Preconditions.checkNotNull(body);
    this.name = name;
    this.returnType = returnType;
    this.params = ImmutableList.copyOf(params);
    this.body = body;
  }

  @JsonCreator
  public FunctionDef(@JsonProperty("name") String name,
                     @JsonProperty("returnType") Type returnType,
                     @JsonProperty("params") List<Param> params,
                     @JsonProperty("body") Block body) {
    this(FilePosition.UNKNOWN, name, returnType, params, body);
  }

  public String getName() {
    return name;
  }

  public Type getReturnType() {
    return returnType;
  }

  public List<Param> getParams() {
    return params;
  }

  public Block getBody() {
    return body;
  }

  /**
   * @return the function's signature
   */
  public FunctionType signature() {
    List<Type> paramTypes = new ArrayList<Type>(params.size());
    for (Param p: params) {
      paramTypes.add(p.getDataType());
    }
    return new FunctionType(returnType, paramTypes);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FUNCTION_DEF;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(body);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitFunctionDef(this);
  }

  public static FunctionDef fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.getType() != MiniCParser.FUNCTION_DEF) {
      throw new MCTRuntimeError("Expected FUNCTION_DEF but got "
                                + tree.getText());
    }
    if (tree.childCount() != 4) {
      throw new MCTRuntimeError("function definition: expected 4 children " +
                                "but got " + tree.childCount());
    }
    String name = tree.child(0).getText();
    Type returnType = builder.buildType(tree.child(1));
    MiniAST formals = tree.child(2);
    if (formals.getType() != MiniCParser.FORMAL_PARAMETERS) {
      throw new MCTRuntimeError("Expected FORMAL_PARAMETERS but got "
                                + formals.getText());
    }
    List<Param> params = new ArrayList<Param>();
    for (MiniAST formal: formals.children()) {
      params.add(Param.fromAST(builder, formal));
    }
    Block body = Block.fromAST(builder, tree.child(3));
    return new FunctionDef(builder.position(tree), name, returnType,
                           params, body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, returnType, params, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FunctionDef))
      return false;
    FunctionDef other = (FunctionDef) obj;
    return name.equals(other.name) && returnType == other.returnType &&
           params.equals(other.params) && body.equals(other.body);
  }
}
