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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;

import exm.mct.ast.MiniAST;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.lang.Types.Type;
import exm.mct.frontend.TreeBuilder;

/**
 * A formal parameter of a function.  Not a node kind of its own.
 */
@JsonPropertyOrder({"name", "dataType"})
public class Param {
  private final FilePosition position;
  private final String name;
  private final Type dataType;

  public Param(FilePosition position, String name, Type dataType) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(dataType);
    this.position = position == null ? FilePosition.UNKNOWN : position;
    this.name = name;
    this.dataType = dataType;
  }

  @JsonCreator
  public Param(@JsonProperty("name") String name,
               @JsonProperty("dataType") Type dataType) {
    this(FilePosition.UNKNOWN, name, dataType);
  }

  @JsonIgnore
  public FilePosition getPosition() {
    return position;
  }

  public String getName() {
    return name;
  }

  public Type getDataType() {
    return dataType;
  }

  public static Param fromAST(TreeBuilder builder, MiniAST tree) {
    if (tree.getType() != MiniCParser.PARAMETER || tree.childCount() != 2) {
      throw new MCTRuntimeError("Malformed parameter: " + tree.toStringTree());
    }
    return new Param(builder.position(tree), tree.child(0).getText(),
                     builder.buildType(tree.child(1)));
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + dataType.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Param))
      return false;
    Param other = (Param) obj;
    return name.equals(other.name) && dataType == other.dataType;
  }

  @Override
  public String toString() {
    return dataType.typeName() + " " + name;
  }
}
