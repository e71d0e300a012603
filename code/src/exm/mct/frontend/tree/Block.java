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
 * Statements in braces, which open a new scope.  An empty statement
 * ";" is an empty block.
 */
public class Block extends Statement {

  private final List<Statement> body;

  public Block(FilePosition position, List<? extends Statement> body) {
    super(position);
    this.body = ImmutableList.copyOf(body);
  }

  @JsonCreator
  public Block(@JsonProperty("body") List<Statement> body) {
    this(FilePosition.UNKNOWN, body);
  }

  public List<Statement> getBody() {
    return body;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.BLOCK;
  }

  @Override
  public List<Node> children() {
    return new ArrayList<Node>(body);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitBlock(this);
  }

  public static Block fromAST(TreeBuilder builder, MiniAST tree)
      throws SyntaxError {
    if (tree.getType() != MiniCParser.BLOCK) {
      throw new MCTRuntimeError("Expected block but got " + tree.getText());
    }
    List<Statement> stmts = new ArrayList<Statement>(tree.childCount());
    for (MiniAST child: tree.children()) {
      stmts.add(builder.buildStatement(child));
    }
    return new Block(builder.position(tree), stmts);
  }

  @Override
  public int hashCode() {
    return body.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Block))
      return false;
    return body.equals(((Block) obj).body);
  }
}
