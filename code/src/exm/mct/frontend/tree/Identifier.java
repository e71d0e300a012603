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

import exm.mct.common.FilePosition;

/**
 * Reference to a variable by name
 */
public class Identifier extends Expression {

  private final String name;

  public Identifier(FilePosition position, String name) {
    super(position);
    Preconditions.checkNotNull(name);
    this.name = name;
  }

  @JsonCreator
  public Identifier(@JsonProperty("name") String name) {
    this(FilePosition.UNKNOWN, name);
  }

  public String getName() {
    return name;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.IDENTIFIER;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIdentifier(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Identifier))
      return false;
    return name.equals(((Identifier) obj).name);
  }
}
