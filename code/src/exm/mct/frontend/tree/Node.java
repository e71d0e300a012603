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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import exm.mct.common.FilePosition;

/**
 * A node of the typed syntax tree.  Nodes are immutable and each is owned
 * by a single parent.  Equality is structural and ignores source
 * positions.
 *
 * The exchange format names the node kind in a "type" field.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME,
              include = JsonTypeInfo.As.PROPERTY,
              property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Program.class, name = "Program"),
  @JsonSubTypes.Type(value = FunctionDef.class, name = "FunctionDef"),
  @JsonSubTypes.Type(value = VarDecl.class, name = "VarDecl"),
  @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
  @JsonSubTypes.Type(value = If.class, name = "If"),
  @JsonSubTypes.Type(value = While.class, name = "While"),
  @JsonSubTypes.Type(value = BinaryOp.class, name = "BinaryOp"),
  @JsonSubTypes.Type(value = Call.class, name = "Call"),
  @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
  @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
  @JsonSubTypes.Type(value = Return.class, name = "Return"),
  @JsonSubTypes.Type(value = Print.class, name = "Print"),
  @JsonSubTypes.Type(value = Block.class, name = "Block"),
})
public abstract class Node {

  private final FilePosition position;

  protected Node(FilePosition position) {
    this.position = position == null ? FilePosition.UNKNOWN : position;
  }

  @JsonIgnore
  public FilePosition getPosition() {
    return position;
  }

  @JsonIgnore
  public abstract NodeKind getKind();

  /**
   * @return child nodes in source order
   */
  public abstract List<Node> children();

  public abstract <R> R accept(NodeVisitor<R> visitor);

  @Override
  public String toString() {
    return getKind().toString() + "@" + position;
  }
}
