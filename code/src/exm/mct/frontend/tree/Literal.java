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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.common.lang.Types.Type;
import exm.mct.frontend.TreeBuilder;

/**
 * Integer or boolean constant.  The value is kept as canonical text:
 * a decimal int without leading zeroes, or true/false.
 */
@JsonPropertyOrder({"dataType", "value"})
public class Literal extends Expression {

  private final Type dataType;
  private final String value;

  public Literal(FilePosition position, Type dataType, String value) {
    super(position);
    Preconditions.checkNotNull(dataType);
    Preconditions.checkNotNull(value);
    Preconditions.checkArgument(isCanonical(dataType, value),
        "Not a canonical %s literal: %s", dataType, value);
    this.dataType = dataType;
    this.value = value;
  }

  @JsonCreator
  public Literal(@JsonProperty("dataType") Type dataType,
                 @JsonProperty("value") String value) {
    this(FilePosition.UNKNOWN, dataType, value);
  }

  public static Literal intLiteral(FilePosition position, int value) {
    return new Literal(position, Type.INT, Integer.toString(value));
  }

  public static Literal boolLiteral(FilePosition position, boolean value) {
    return new Literal(position, Type.BOOL, Boolean.toString(value));
  }

  private static boolean isCanonical(Type type, String value) {
    switch (type) {
      case INT:
        try {
          return Integer.toString(Integer.parseInt(value)).equals(value);
        } catch (NumberFormatException e) {
          return false;
        }
      case BOOL:
        return value.equals("true") || value.equals("false");
      default:
        return false;
    }
  }

  public Type getDataType() {
    return dataType;
  }

  public String getValue() {
    return value;
  }

  public boolean boolValue() {
    Preconditions.checkState(dataType == Type.BOOL, "not a bool literal");
    return Boolean.parseBoolean(value);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.LITERAL;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }

  /**
   * @throws SyntaxError if an integer literal does not fit in 32 bits
   */
  public static Literal fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    FilePosition pos = builder.position(tree);
    switch (tree.getType()) {
      case MiniCParser.NUMBER:
        return intLiteral(pos, parseInt(pos, tree.getText()));
      case MiniCParser.TRUE:
        return boolLiteral(pos, true);
      case MiniCParser.FALSE:
        return boolLiteral(pos, false);
      default:
        throw new MCTRuntimeError("Not a literal: " + tree.getText());
    }
  }

  private static int parseInt(FilePosition pos, String text)
      throws SyntaxError {
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new SyntaxError(pos, "integer literal " + text +
                            " is out of range");
    }
  }

  @Override
  public int hashCode() {
    return 31 * dataType.hashCode() + value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Literal))
      return false;
    Literal other = (Literal) obj;
    return dataType == other.dataType && value.equals(other.value);
  }
}
