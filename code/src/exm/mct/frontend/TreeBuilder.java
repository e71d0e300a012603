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

package exm.mct.frontend;

import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.log4j.Logger;

import exm.mct.ast.MiniAST;
import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SyntaxError;
import exm.mct.common.lang.Types.Type;
import exm.mct.common.util.Pair;
import exm.mct.frontend.tree.Assignment;
import exm.mct.frontend.tree.BinaryOp;
import exm.mct.frontend.tree.Block;
import exm.mct.frontend.tree.Call;
import exm.mct.frontend.tree.Expression;
import exm.mct.frontend.tree.Identifier;
import exm.mct.frontend.tree.If;
import exm.mct.frontend.tree.Literal;
import exm.mct.frontend.tree.Print;
import exm.mct.frontend.tree.Program;
import exm.mct.frontend.tree.Return;
import exm.mct.frontend.tree.Statement;
import exm.mct.frontend.tree.VarDecl;
import exm.mct.frontend.tree.While;

/**
 * Converts the ANTLR tree into the typed tree.  Every node is created
 * fresh, so no node is shared between parents.
 */
public class TreeBuilder {

  /** Deepest tree accepted, counting from the program node */
  public static final int MAX_NESTING = 512;

  private final Logger logger;
  private final String inputFile;

  public TreeBuilder(Logger logger, String inputFile) {
    this.logger = logger;
    this.inputFile = inputFile;
  }

  public Program build(ParsedModule module) throws SyntaxError {
    checkNesting(module.ast);
    if (logger.isTraceEnabled()) {
      logger.trace("ANTLR tree:\n" + module.ast.printTree());
    }
    Program program = Program.fromAST(this, module.ast);
    logger.debug("Built tree with " + program.getBody().size() +
                 " functions");
    return program;
  }

  /**
   * Reject trees deeper than MAX_NESTING.  Later stages walk the tree
   * recursively, so this bounds their stack use.  Done without recursion.
   */
  private void checkNesting(MiniAST root) throws SyntaxError {
    Deque<Pair<MiniAST, Integer>> stack =
                            new ArrayDeque<Pair<MiniAST, Integer>>();
    stack.push(Pair.create(root, 0));
    int deepest = 0;
    while (!stack.isEmpty()) {
      Pair<MiniAST, Integer> curr = stack.pop();
      int depth = curr.val2;
      if (depth > MAX_NESTING) {
        throw new SyntaxError(position(curr.val1),
            "program nested too deeply: more than " + MAX_NESTING +
            " levels");
      }
      deepest = Math.max(deepest, depth);
      for (MiniAST child: curr.val1.children()) {
        stack.push(Pair.create(child, depth + 1));
      }
    }
    logger.trace("ANTLR tree depth: " + deepest);
  }

  public FilePosition position(MiniAST tree) {
    return tree.position(inputFile);
  }

  public Type buildType(MiniAST tree) {
    switch (tree.getType()) {
      case MiniCParser.INT_TYPE:
        return Type.INT;
      case MiniCParser.BOOL_TYPE:
        return Type.BOOL;
      case MiniCParser.VOID_TYPE:
        return Type.VOID;
      default:
        throw new MCTRuntimeError("Expected type name but got " +
                                  LogHelper.tokName(tree.getType()));
    }
  }

  public Statement buildStatement(MiniAST tree) throws SyntaxError {
    LogHelper.trace(2, "statement: " + LogHelper.tokName(tree.getType()));
    switch (tree.getType()) {
      case MiniCParser.BLOCK:
        return Block.fromAST(this, tree);
      case MiniCParser.DECLARATION:
        return VarDecl.fromAST(this, tree);
      case MiniCParser.ASSIGN_STATEMENT:
        return Assignment.fromAST(this, tree);
      case MiniCParser.IF_STATEMENT:
        return If.fromAST(this, tree);
      case MiniCParser.WHILE_LOOP:
        return While.fromAST(this, tree);
      case MiniCParser.RETURN_STATEMENT:
        return Return.fromAST(this, tree);
      case MiniCParser.PRINT_STATEMENT:
        return Print.fromAST(this, tree);
      default:
        // Expression statement
        return buildExpression(tree);
    }
  }

  public Expression buildExpression(MiniAST tree) throws SyntaxError {
    switch (tree.getType()) {
      case MiniCParser.NUMBER:
      case MiniCParser.TRUE:
      case MiniCParser.FALSE:
        return Literal.fromAST(this, tree);
      case MiniCParser.ID:
        return new Identifier(position(tree), tree.getText());
      case MiniCParser.CALL_FUNCTION:
        return Call.fromAST(this, tree);
      case MiniCParser.PLUS:
      case MiniCParser.MINUS:
      case MiniCParser.MULT:
      case MiniCParser.DIV:
      case MiniCParser.MOD:
      case MiniCParser.LT:
      case MiniCParser.GT:
      case MiniCParser.LTE:
      case MiniCParser.GTE:
      case MiniCParser.EQUALS:
      case MiniCParser.NEQUALS:
        return BinaryOp.fromAST(this, tree);
      default:
        throw new MCTRuntimeError("Unexpected token in expression: " +
                   LogHelper.tokName(tree.getType()) + " at " +
                   position(tree));
    }
  }
}
