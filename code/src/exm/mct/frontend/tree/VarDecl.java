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
import exm.mct.common.lang.Types.Type;
import exm.mct.frontend.TreeBuilder;

/**
 * Variable declaration with optional initializer
 */
@JsonPropertyOrder({"dataType", "name", "init"})
public class VarDecl extends Statement {

  private final String name;
  private final Type dataType;
  /** null if no initializer */
  private final Expression init;

  public VarDecl(FilePosition position, String name, Type dataType,
                 Expression init) {
    super(position);
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(dataType);
    this.name = name;
    this.dataType = dataType;
    this.init = init;
  }

  @JsonCreator
  public VarDecl(@JsonProperty("name") String name,
                 @JsonProperty("dataType") Type dataType,
                 @JsonProperty("init") Expression init) {
    this(FilePosition.UNKNOWN, name, dataType, init);
  }

  public String getName() {
    return name;
  }

  public Type getDataType() {
    return dataType;
  }

  public Expression getInit() {
    return init;
  }

  public boolean hasInit() {
    return init != null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VAR_DECL;
  }

  @Override
  public List<Node> children() {
    if (init == null) {
      return ImmutableList.of();
    }
    return ImmutableList.<Node>of(init);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitVarDecl(this);
  }

  public static VarDecl fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    int count = tree.childCount();
    if (count < 2 || count > 3)
      throw new MCTRuntimeError("declaration: child count > 3 or < 2");
    String name = tree.child(0).getText();
    Type type = builder.buildType(tree.child(1));
    Expression init = null;
    if (count == 3) {
      init = builder.buildExpression(tree.child(2));
    }
    return new VarDecl(builder.position(tree), name, type, init);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dataType, init);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof VarDecl))
      return false;
    VarDecl other = (VarDecl) obj;
    return name.equals(other.name) && dataType == other.dataType &&
           Objects.equals(init, other.init);
  }
}
