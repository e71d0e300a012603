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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.exceptions.RedeclarationError;
import exm.mct.common.exceptions.SemanticError;
import exm.mct.common.exceptions.TypeMismatchError;
import exm.mct.common.exceptions.UndeclaredIdentifierError;
import exm.mct.common.lang.Types.FunctionType;
import exm.mct.common.lang.Types.Type;
import exm.mct.common.lang.Var;
import exm.mct.common.lang.Var.DefType;
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
import exm.mct.frontend.tree.Param;
import exm.mct.frontend.tree.Print;
import exm.mct.frontend.tree.Program;
import exm.mct.frontend.tree.Return;
import exm.mct.frontend.tree.Statement;
import exm.mct.frontend.tree.VarDecl;
import exm.mct.frontend.tree.While;

/**
 * Checks scoping and typing of a whole program.  Errors are collected
 * rather than thrown, so one run reports every problem.  The tree is not
 * modified.
 */
public class SemanticAnalyzer {

  private final Logger logger;
  private final String inputFile;

  public SemanticAnalyzer(Logger logger, String inputFile) {
    this.logger = logger;
    this.inputFile = inputFile;
  }

  /**
   * @return all errors found, in source order; empty if the program is valid
   */
  public List<SemanticError> analyze(Program program) {
    GlobalContext globals = new GlobalContext(inputFile, logger);
    List<SemanticError> errors = new ArrayList<SemanticError>();

    // Register all signatures first so calls can refer to functions
    // defined later in the file
    defineFunctions(globals, program, errors);

    for (FunctionDef fn: program.getBody()) {
      checkFunction(globals, fn, errors);
    }

    Collections.sort(errors, SOURCE_ORDER);
    logger.debug("Semantic analysis found " + errors.size() + " errors");
    return errors;
  }

  private void defineFunctions(GlobalContext globals, Program program,
                               List<SemanticError> errors) {
    for (FunctionDef fn: program.getBody()) {
      FunctionType type = fn.signature();
      try {
        globals.defineFunction(fn.getName(), type, fn.getPosition());
      } catch (RedeclarationError e) {
        errors.add(e);
      }
    }
  }

  private void checkFunction(GlobalContext globals, FunctionDef fn,
                             List<SemanticError> errors) {
    FunctionContext fc = new FunctionContext(fn.getName(),
                                             fn.getReturnType());
    LocalContext context = LocalContext.fnContext(globals, fc);
    context.syncFilePos(fn);
    LogHelper.debug(context, "function " + fn.getName() + " " +
                    fn.signature());

    for (Param p: fn.getParams()) {
      if (!p.getDataType().isValueType()) {
        errors.add(new TypeMismatchError(p.getPosition(),
            "parameter " + p.getName() + " of function " + fn.getName() +
            " cannot have type " + p.getDataType()));
      }
      declare(context, new Var(p.getName(), p.getDataType(),
                        DefType.PARAMETER, p.getPosition()), errors);
    }

    // Parameters and top-level statements of the body share one scope
    StatementChecker checker = new StatementChecker(context, errors);
    for (Statement stmt: fn.getBody().getBody()) {
      stmt.accept(checker);
    }
  }

  private static void declare(Context context, Var var,
                              List<SemanticError> errors) {
    try {
      context.declareVariable(var);
    } catch (RedeclarationError e) {
      errors.add(e);
    }
  }

  private static final Comparator<SemanticError> SOURCE_ORDER =
      new Comparator<SemanticError>() {
    @Override
    public int compare(SemanticError a, SemanticError b) {
      FilePosition pa = a.getPosition();
      FilePosition pb = b.getPosition();
      if (pa == null || pb == null || !pa.isKnown() || !pb.isKnown()) {
        return 0;
      }
      if (pa.line != pb.line) {
        return Integer.compare(pa.line, pb.line);
      }
      return Integer.compare(pa.column, pb.column);
    }
  };

  /**
   * Checks the statements of one scope.  Nested blocks and the bodies of
   * if and while get a checker for a child scope.
   */
  private static class StatementChecker implements NodeVisitor<Void> {
    private final Context context;
    private final List<SemanticError> errors;

    StatementChecker(Context context, List<SemanticError> errors) {
      this.context = context;
      this.errors = errors;
    }

    private Type typeOf(Expression expr) {
      return TypeChecker.findExprType(context, expr, errors);
    }

    /**
     * Check a statement in a new scope nested in this one
     */
    private void checkNested(Statement stmt) {
      if (stmt instanceof Block) {
        // Block opens its own scope
        stmt.accept(this);
      } else {
        stmt.accept(new StatementChecker(
                          LocalContext.fnSubcontext(context), errors));
      }
    }

    private void checkCondition(String construct, Expression test) {
      Type t = typeOf(test);
      if (t != null && !TypeChecker.isConditionType(t)) {
        errors.add(new TypeMismatchError(test.getPosition(),
            construct + " condition must be of type bool or int, but was " +
            t));
      }
    }

    @Override
    public Void visitBlock(Block block) {
      Context child = LocalContext.fnSubcontext(context);
      child.syncFilePos(block);
      LogHelper.trace(child, "block");
      StatementChecker nested = new StatementChecker(child, errors);
      for (Statement stmt: block.getBody()) {
        stmt.accept(nested);
      }
      return null;
    }

    @Override
    public Void visitVarDecl(VarDecl decl) {
      context.syncFilePos(decl);
      Type declType = decl.getDataType();
      if (!declType.isValueType()) {
        errors.add(new TypeMismatchError(decl.getPosition(),
            "variable " + decl.getName() + " cannot have type " + declType));
      }
      // Initializer is evaluated before the new name is in scope
      if (decl.hasInit()) {
        Type initType = typeOf(decl.getInit());
        if (initType != null && declType.isValueType() &&
            initType != declType) {
          errors.add(new TypeMismatchError(decl.getInit().getPosition(),
              "cannot initialize variable " + decl.getName() + " of type " +
              declType + " with value of type " + initType));
        }
      }
      Var outer = context.lookupVarUnsafe(decl.getName());
      if (outer != null && !context.isDeclaredHere(decl.getName())) {
        LogHelper.uniqueWarn(context, "variable " + decl.getName() +
            " shadows the one declared at " +
            Context.describePosition(outer.declaredAt()));
      }
      declare(context, new Var(decl.getName(), declType, DefType.LOCAL,
                               decl.getPosition()), errors);
      return null;
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
      context.syncFilePos(assignment);
      String target = assignment.getTarget();
      Var var = context.lookupVarUnsafe(target);
      if (var == null) {
        if (context.lookupFunction(target) != null) {
          errors.add(new TypeMismatchError(assignment.getPosition(),
              "cannot assign to function " + target));
        } else {
          errors.add(new UndeclaredIdentifierError(assignment.getPosition(),
              "assignment to undeclared variable " + target));
        }
      }
      Type valueType = typeOf(assignment.getValue());
      if (var != null && var.type().isValueType() && valueType != null &&
          valueType != var.type()) {
        errors.add(new TypeMismatchError(assignment.getValue().getPosition(),
            "cannot assign value of type " + valueType + " to variable " +
            target + " of type " + var.type()));
      }
      return null;
    }

    @Override
    public Void visitIf(If ifStmt) {
      context.syncFilePos(ifStmt);
      checkCondition("if statement", ifStmt.getTest());
      checkNested(ifStmt.getConsequent());
      if (ifStmt.hasElse()) {
        checkNested(ifStmt.getAlternate());
      }
      return null;
    }

    @Override
    public Void visitWhile(While loop) {
      context.syncFilePos(loop);
      checkCondition("while loop", loop.getTest());
      checkNested(loop.getBody());
      return null;
    }

    @Override
    public Void visitReturn(Return ret) {
      context.syncFilePos(ret);
      FunctionContext fc = context.getFunctionContext();
      if (fc == null) {
        throw new MCTRuntimeError("return outside function at " +
                                  ret.getPosition());
      }
      Type expected = fc.getReturnType();
      if (ret.hasValue()) {
        Type actual = typeOf(ret.getValue());
        if (expected == Type.VOID) {
          errors.add(new TypeMismatchError(ret.getPosition(),
              "void function " + fc.getFunctionName() +
              " cannot return a value"));
        } else if (actual != null && actual != expected) {
          errors.add(new TypeMismatchError(ret.getValue().getPosition(),
              "function " + fc.getFunctionName() + " must return " +
              expected + " but value has type " + actual));
        }
      } else if (expected != Type.VOID) {
        errors.add(new TypeMismatchError(ret.getPosition(),
            "function " + fc.getFunctionName() + " must return a value of " +
            "type " + expected));
      }
      return null;
    }

    @Override
    public Void visitPrint(Print print) {
      context.syncFilePos(print);
      Type t = typeOf(print.getValue());
      if (t != null && !t.isValueType()) {
        errors.add(new TypeMismatchError(print.getValue().getPosition(),
            "cannot print a value of type " + t));
      }
      return null;
    }

    // Expression statements: the value is discarded

    @Override
    public Void visitBinaryOp(BinaryOp op) {
      context.syncFilePos(op);
      typeOf(op);
      return null;
    }

    @Override
    public Void visitCall(Call call) {
      context.syncFilePos(call);
      typeOf(call);
      return null;
    }

    @Override
    public Void visitIdentifier(Identifier id) {
      context.syncFilePos(id);
      typeOf(id);
      return null;
    }

    @Override
    public Void visitLiteral(Literal literal) {
      return null;
    }

    private Void notAStatement(Node node) {
      throw new MCTRuntimeError("Unexpected " + node.getKind() +
                                " in statement position");
    }

    @Override
    public Void visitProgram(Program program) {
      return notAStatement(program);
    }

    @Override
    public Void visitFunctionDef(FunctionDef function) {
      return notAStatement(function);
    }
  }
}
