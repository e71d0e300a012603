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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import exm.mct.ast.MiniAST;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.frontend.TreeBuilder;

/**
 * Root of the tree: the program's functions in source order
 */
public class Program extends Node {

  private final List<FunctionDef> body;

  public Program(FilePosition position, List<FunctionDef> body) {
    super(position);
    this.body = ImmutableList.copyOf(body);
  }

  @JsonCreator
  public Program(@JsonProperty("body") List<FunctionDef> body) {
    this(FilePosition.UNKNOWN, body);
  }

  public List<FunctionDef> getBody() {
    return body;
  }

  /**
   * @return the first function with the name, or null
   */
  public FunctionDef findFunction(String name) {
    for (FunctionDef fn: body) {
      if (fn.getName().equals(name)) {
        return fn;
      }
    }
    return null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PROGRAM;
  }

  @Override
  public List<Node> children() {
    return new ArrayList<Node>(body);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitProgram(this);
  }

  public static Program fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.getType() != MiniCParser.PROGRAM) {
      throw new MCTRuntimeError("Expected PROGRAM at root of tree but got "
                                + tree.getText());
    }
    List<FunctionDef> functions = new ArrayList<FunctionDef>();
    for (MiniAST child: tree.children()) {
      functions.add(FunctionDef.fromAST(builder, child));
    }
    return new Program(builder.position(tree), functions);
  }

  @Override
  public int hashCode() {
    return body.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Program))
      return false;
    return body.equals(((Program) obj).body);
  }
}
