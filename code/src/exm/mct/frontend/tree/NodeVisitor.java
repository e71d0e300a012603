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

/**
 * One method per node kind, so that adding a kind breaks every visitor
 * until it handles the new kind.
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {
  R visitProgram(Program program);
  R visitFunctionDef(FunctionDef function);
  R visitVarDecl(VarDecl decl);
  R visitAssignment(Assignment assignment);
  R visitIf(If ifStmt);
  R visitWhile(While loop);
  R visitBinaryOp(BinaryOp op);
  R visitCall(Call call);
  R visitIdentifier(Identifier id);
  R visitLiteral(Literal literal);
  R visitReturn(Return ret);
  R visitPrint(Print print);
  R visitBlock(Block block);
}
