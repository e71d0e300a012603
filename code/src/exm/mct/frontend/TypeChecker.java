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

import java.util.ArrayList;
import java.util.List;

import exm.mct.common.exceptions.ArityMismatchError;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.SemanticError;
import exm.mct.common.exceptions.TypeMismatchError;
import exm.mct.common.exceptions.UndeclaredIdentifierError;
import exm.mct.common.lang.Operators;
import exm.mct.common.lang.Operators.Op;
import exm.mct.common.lang.Types.FunctionType;
import exm.mct.common.lang.Types.Type;
import exm.mct.common.lang.Var;
import exm.mct.frontend.tree.Assignment;
import exm.mct.frontend.tree.BinaryOp;
import exm.mct.frontend.tree.Block;
import exm.mct.frontend.tree.Call;
import exm.mct.frontend.tree.Expression;
import exm.mct.frontend.tree.FunctionDef;
import exm.mct.frontend.tree.Identifier;
import exm.mct.frontend.tree.If;
import exm.mct.frontend.tree.Literal;
import exm.mct.frontend.tree.Node;
import exm.mct.frontend.tree.NodeVisitor;
import exm.mct.frontend.tree.Print;
import exm.mct.frontend.tree.Program;
import exm.mct.frontend.tree.Return;
import exm.mct.frontend.tree.VarDecl;
import exm.mct.frontend.tree.While;

/**
 * Works out the types of expressions, recording any errors found.  A
 * result of null means the type could not be determined because of an
 * error that has already been recorded; callers skip checks on such
 * values.
 */
public class TypeChecker implements NodeVisitor<Type> {

  private final Context context;
  private final List<SemanticError> errors;

  private TypeChecker(Context context, List<SemanticError> errors) {
    this.context = context;
    this.errors = errors;
  }

  /**
   * @param context scope to resolve names in
   * @param expr
   * @param errors list to append errors to
   * @return type of the expression, or null if unknown due to an error
   */
  public static Type findExprType(Context context, Expression expr,
                                  List<SemanticError> errors) {
    return expr.accept(new TypeChecker(context, errors));
  }

  @Override
  public Type visitLiteral(Literal literal) {
    return literal.getDataType();
  }

  @Override
  public Type visitIdentifier(Identifier id) {
    String name = id.getName();
    Var var = context.lookupVarUnsafe(name);
    if (var == null) {
      if (context.lookupFunction(name) != null) {
        errors.add(new TypeMismatchError(id.getPosition(),
            "function " + name + " cannot be used as a value"));
      } else {
        errors.add(new UndeclaredIdentifierError(id.getPosition(),
            "undeclared identifier " + name));
      }
      return null;
    }
    if (!var.type().isValueType()) {
      // Bad declaration, already reported
      return null;
    }
    return var.type();
  }

  @Override
  public Type visitBinaryOp(BinaryOp op) {
    Type left = op.getLeft().accept(this);
    Type right = op.getRight().accept(this);
    Op operator = op.getOp();
    Type operandType = Operators.operandType(operator);
    if (operandType != null) {
      checkOperand(op, "left", left, operandType);
      checkOperand(op, "right", right, operandType);
    } else if (left != null && right != null) {
      if (left != right) {
        errors.add(new TypeMismatchError(op.getPosition(),
            "operator " + operator + " cannot compare " + left + " with " +
            right));
      } else if (!left.isValueType()) {
        errors.add(new TypeMismatchError(op.getPosition(),
            "operator " + operator + " cannot compare void values"));
      }
    }
    // Result type is fixed by the operator, even if operands were bad
    return Operators.resultType(operator);
  }

  private void checkOperand(BinaryOp op, String side, Type actual,
                            Type expected) {
    if (actual != null && actual != expected) {
      errors.add(new TypeMismatchError(op.getPosition(),
          "operator " + op.getOp() + " expects " + expected +
          " operands but " + side + " operand has type " + actual));
    }
  }

  @Override
  public Type visitCall(Call call) {
    String name = call.getCallee();
    FunctionType fnType = context.lookupFunction(name);
    Var hiding = context.lookupVarUnsafe(name);
    boolean calleeOk = true;
    if (fnType == null) {
      if (hiding != null) {
        errors.add(new TypeMismatchError(call.getPosition(),
            name + " is a variable, not a function"));
      } else {
        errors.add(new UndeclaredIdentifierError(call.getPosition(),
            "undeclared function " + name));
      }
      calleeOk = false;
    } else if (hiding != null) {
      errors.add(new TypeMismatchError(call.getPosition(),
          "function " + name + " is hidden by variable " + name +
          " declared at " + Context.describePosition(hiding.declaredAt())));
      calleeOk = false;
    }

    List<Type> argTypes = new ArrayList<Type>(call.getArgs().size());
    for (Expression arg: call.getArgs()) {
      argTypes.add(arg.accept(this));
    }

    if (!calleeOk) {
      return null;
    }

    List<Type> paramTypes = fnType.getParamTypes();
    if (argTypes.size() != paramTypes.size()) {
      errors.add(new ArityMismatchError(call.getPosition(),
          "function " + name + " expects " + plural(paramTypes.size()) +
          " but was called with " + argTypes.size()));
    } else {
      for (int i = 0; i < argTypes.size(); i++) {
        Type argType = argTypes.get(i);
        if (argType != null && argType != paramTypes.get(i)) {
          errors.add(new TypeMismatchError(
              call.getArgs().get(i).getPosition(),
              "argument " + (i + 1) + " of " + name + " has type " +
              argType + " but the parameter has type " + paramTypes.get(i)));
        }
      }
    }
    return fnType.getReturnType();
  }

  private static String plural(int args) {
    return args + (args == 1 ? " argument" : " arguments");
  }

  private Type notAnExpression(Node node) {
    throw new MCTRuntimeError("Expected an expression but got " +
                              node.getKind() + " at " + node.getPosition());
  }

  @Override
  public Type visitProgram(Program program) {
    return notAnExpression(program);
  }

  @Override
  public Type visitFunctionDef(FunctionDef function) {
    return notAnExpression(function);
  }

  @Override
  public Type visitVarDecl(VarDecl decl) {
    return notAnExpression(decl);
  }

  @Override
  public Type visitAssignment(Assignment assignment) {
    return notAnExpression(assignment);
  }

  @Override
  public Type visitIf(If ifStmt) {
    return notAnExpression(ifStmt);
  }

  @Override
  public Type visitWhile(While loop) {
    return notAnExpression(loop);
  }

  @Override
  public Type visitReturn(Return ret) {
    return notAnExpression(ret);
  }

  @Override
  public Type visitPrint(Print print) {
    return notAnExpression(print);
  }

  @Override
  public Type visitBlock(Block block) {
    return notAnExpression(block);
  }

  /**
   * @return true if a value of the type can be used as a condition
   */
  public static boolean isConditionType(Type t) {
    return t == Type.BOOL || t == Type.INT;
  }
}
