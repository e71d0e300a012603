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

package exm.mct.pybackend;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.lang.Operators.Op;
import exm.mct.common.lang.Types.Type;
import exm.mct.common.util.HierarchicalMap;
import exm.mct.frontend.tree.Assignment;
import exm.mct.frontend.tree.BinaryOp;
import exm.mct.frontend.tree.Block;
import exm.mct.frontend.tree.Call;
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
import exm.mct.pybackend.PyNamer.LocalNames;
import exm.mct.pybackend.tree.BinaryExpr;
import exm.mct.pybackend.tree.CallExpr;
import exm.mct.pybackend.tree.Command;
import exm.mct.pybackend.tree.Comment;
import exm.mct.pybackend.tree.Def;
import exm.mct.pybackend.tree.Expression;
import exm.mct.pybackend.tree.Module;
import exm.mct.pybackend.tree.Sequence;
import exm.mct.pybackend.tree.SetVariable;
import exm.mct.pybackend.tree.Token;
import exm.mct.pybackend.tree.WhileLoop;

/**
 * Translates a checked Mini-C program into Python 3 source.
 *
 * The program must have passed semantic analysis: shapes that analysis
 * rejects cause an MCTRuntimeError here rather than a diagnostic.
 */
public class PythonGenerator {

  public static final String HEADER =
      "Transpiled Python code generated by mct";

  public static final String ENTRY_POINT = "main";

  private final Logger logger;
  private final int indentWidth;
  private final boolean emitHeader;
  private final boolean emitMainGuard;

  public PythonGenerator(Logger logger, int indentWidth, boolean emitHeader,
                         boolean emitMainGuard) {
    Preconditions.checkArgument(indentWidth > 0,
                                "indent width must be positive");
    this.logger = logger;
    this.indentWidth = indentWidth;
    this.emitHeader = emitHeader;
    this.emitMainGuard = emitMainGuard;
  }

  /**
   * @return Python source text, ending in a newline
   */
  public String generate(Program program) {
    Module module = buildModule(program);
    String code = module.render(indentWidth);
    logger.debug("Generated " + code.length() + " characters of Python");
    return code;
  }

  public Module buildModule(Program program) {
    logger.debug("Generating Python for " + program.getBody().size() +
                 " functions");
    PyNamer namer = new PyNamer();
    for (FunctionDef fn: program.getBody()) {
      String pyName = namer.declareFunction(fn.getName());
      if (!pyName.equals(fn.getName())) {
        logger.debug("function " + fn.getName() + " renamed to " + pyName);
      }
    }

    Module module = new Module(emitHeader ? new Comment(HEADER) : null);
    Set<String> usedFunctionNames = new HashSet<String>();
    for (FunctionDef fn: program.getBody()) {
      module.add(generateFunction(namer, fn, usedFunctionNames));
    }

    if (emitMainGuard) {
      FunctionDef main = program.findFunction(ENTRY_POINT);
      if (main != null && main.getParams().isEmpty()) {
        module.setEntryPoint(namer.functionName(ENTRY_POINT));
      }
    }
    return module;
  }

  private Def generateFunction(PyNamer namer, FunctionDef fn,
                               Set<String> usedFunctionNames) {
    logger.trace("Generating function " + fn.getName());
    LocalNames names = namer.functionLocals();
    HierarchicalMap<String, String> scope =
                                  new HierarchicalMap<String, String>();
    List<String> args = new ArrayList<String>(fn.getParams().size());
    for (Param p: fn.getParams()) {
      args.add(names.declare(scope, p.getName()));
    }

    // Parameters share a scope with the top level of the body
    Sequence body = new Sequence();
    StatementGenerator gen = new StatementGenerator(namer, names, scope,
                                                    body);
    for (Statement stmt: fn.getBody().getBody()) {
      stmt.accept(gen);
    }
    return new Def(namer.functionName(fn.getName()), usedFunctionNames,
                   args, body);
  }

  /**
   * @return Python operator for a Mini-C operator.  Integer division
   *        must stay integral, so / becomes //
   */
  public static String pythonOperator(Op op) {
    if (op == Op.DIV) {
      return "//";
    }
    return op.symbol();
  }

  /**
   * @return initial value of a variable declared without initializer
   */
  static Expression defaultValue(Type type) {
    switch (type) {
      case INT:
        return new Token(0);
      case BOOL:
        return Token.FALSE;
      default:
        throw new MCTRuntimeError("No default value for type " + type);
    }
  }

  private static MCTRuntimeError unexpected(Node node, String where) {
    return new MCTRuntimeError("Unexpected " + node.getKind() + " " +
                               where + " at " + node.getPosition());
  }

  /**
   * Emits the statements of one Mini-C scope into a Python suite.
   */
  private static class StatementGenerator implements NodeVisitor<Void> {
    private final PyNamer namer;
    private final LocalNames names;
    private final HierarchicalMap<String, String> scope;
    private final Sequence out;
    private final ExpressionGenerator exprs;

    StatementGenerator(PyNamer namer, LocalNames names,
                       HierarchicalMap<String, String> scope, Sequence out) {
      this.namer = namer;
      this.names = names;
      this.scope = scope;
      this.out = out;
      this.exprs = new ExpressionGenerator(namer, names, scope);
    }

    private Expression expr(exm.mct.frontend.tree.Expression e) {
      return e.accept(exprs);
    }

    /**
     * Generate a statement into a new suite, in a nested scope
     */
    private Sequence suite(Statement stmt) {
      Sequence seq = new Sequence();
      if (stmt instanceof Block) {
        // Block makes its own scope
        stmt.accept(new StatementGenerator(namer, names, scope, seq));
      } else {
        stmt.accept(new StatementGenerator(namer, names,
                                           scope.makeChildMap(), seq));
      }
      return seq;
    }

    @Override
    public Void visitBlock(Block block) {
      // Python has no block scope, so flatten into the enclosing suite
      StatementGenerator inner = new StatementGenerator(namer, names,
                                         scope.makeChildMap(), out);
      for (Statement stmt: block.getBody()) {
        stmt.accept(inner);
      }
      return null;
    }

    @Override
    public Void visitVarDecl(VarDecl decl) {
      // Initializer refers to names visible before the declaration
      Expression init = decl.hasInit() ? expr(decl.getInit())
                                       : defaultValue(decl.getDataType());
      String pyName = names.declare(scope, decl.getName());
      out.add(new SetVariable(pyName, init));
      return null;
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
      String pyName = names.lookup(scope, assignment.getTarget());
      out.add(new SetVariable(pyName, expr(assignment.getValue())));
      return null;
    }

    @Override
    public Void visitIf(If ifStmt) {
      Expression test = expr(ifStmt.getTest());
      Sequence thenBlock = suite(ifStmt.getConsequent());
      Sequence elseBlock = null;
      if (ifStmt.hasElse()) {
        elseBlock = suite(ifStmt.getAlternate());
      }
      out.add(new exm.mct.pybackend.tree.If(test, thenBlock, elseBlock));
      return null;
    }

    @Override
    public Void visitWhile(While loop) {
      Expression test = expr(loop.getTest());
      out.add(new WhileLoop(test, suite(loop.getBody())));
      return null;
    }

    @Override
    public Void visitReturn(Return ret) {
      if (ret.hasValue()) {
        out.add(Command.returnValue(expr(ret.getValue())));
      } else {
        out.add(Command.returnNothing());
      }
      return null;
    }

    @Override
    public Void visitPrint(Print print) {
      out.add(new Command(new CallExpr("print", expr(print.getValue()))));
      return null;
    }

    private Void expressionStatement(exm.mct.frontend.tree.Expression e) {
      out.add(new Command(expr(e)));
      return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp op) {
      return expressionStatement(op);
    }

    @Override
    public Void visitCall(Call call) {
      return expressionStatement(call);
    }

    @Override
    public Void visitIdentifier(Identifier id) {
      return expressionStatement(id);
    }

    @Override
    public Void visitLiteral(Literal literal) {
      return expressionStatement(literal);
    }

    @Override
    public Void visitProgram(Program program) {
      throw unexpected(program, "in statement position");
    }

    @Override
    public Void visitFunctionDef(FunctionDef function) {
      throw unexpected(function, "in statement position");
    }
  }

  private static class ExpressionGenerator implements NodeVisitor<Expression> {
    private final PyNamer namer;
    private final LocalNames names;
    private final HierarchicalMap<String, String> scope;

    ExpressionGenerator(PyNamer namer, LocalNames names,
                        HierarchicalMap<String, String> scope) {
      this.namer = namer;
      this.names = names;
      this.scope = scope;
    }

    @Override
    public Expression visitLiteral(Literal literal) {
      switch (literal.getDataType()) {
        case INT:
          return new Token(literal.getValue());
        case BOOL:
          return literal.boolValue() ? Token.TRUE : Token.FALSE;
        default:
          throw unexpected(literal, "of type " + literal.getDataType());
      }
    }

    @Override
    public Expression visitIdentifier(Identifier id) {
      return new Token(names.lookup(scope, id.getName()));
    }

    @Override
    public Expression visitBinaryOp(BinaryOp op) {
      return new BinaryExpr(op.getLeft().accept(this),
                            pythonOperator(op.getOp()),
                            op.getRight().accept(this));
    }

    @Override
    public Expression visitCall(Call call) {
      List<Expression> args = new ArrayList<Expression>(call.getArgs().size());
      for (exm.mct.frontend.tree.Expression arg: call.getArgs()) {
        args.add(arg.accept(this));
      }
      return new CallExpr(namer.functionName(call.getCallee()), args);
    }

    private Expression notAnExpression(Node node) {
      throw unexpected(node, "in expression position");
    }

    @Override
    public Expression visitProgram(Program program) {
      return notAnExpression(program);
    }

    @Override
    public Expression visitFunctionDef(FunctionDef function) {
      return notAnExpression(function);
    }

    @Override
    public Expression visitBlock(Block block) {
      return notAnExpression(block);
    }

    @Override
    public Expression visitVarDecl(VarDecl decl) {
      return notAnExpression(decl);
    }

    @Override
    public Expression visitAssignment(Assignment assignment) {
      return notAnExpression(assignment);
    }

    @Override
    public Expression visitIf(If ifStmt) {
      return notAnExpression(ifStmt);
    }

    @Override
    public Expression visitWhile(While loop) {
      return notAnExpression(loop);
    }

    @Override
    public Expression visitReturn(Return ret) {
      return notAnExpression(ret);
    }

    @Override
    public Expression visitPrint(Print print) {
      return notAnExpression(print);
    }
  }
}
