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

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.RedeclarationError;
import exm.mct.common.lang.Types.FunctionType;
import exm.mct.common.lang.Var;
import exm.mct.frontend.tree.Node;

/**
 * Abstract interface used to track and access contextual information about the
 * program at different points in the tree.  A new context is created for
 * each function body and each nested block and passed down the traversal.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
     Map from variable name to Variable object, for this scope only
   */
  protected final Map<String,Var> variables = new HashMap<String,Var>();

  /**
   * Current input file
   */
  protected String inputFile;

  /**
     Current line in input file
   */
  protected int line = 0;

  /**
   * Current column in input file.  0 if unknown
   */
  protected int col = 0;

  public Context(Logger logger, int level) {
    this.level = level;
    this.logger = logger;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * @return info about the enclosing function, or null at the top level
   */
  public abstract FunctionContext getFunctionContext();

  /**
   * Lookup variable based on name.  This version will
   * return null if variable undeclared, leaving handling
   * of the problem to the caller
   * @param name
   * @return the variable, or null if not visible here
   */
  public abstract Var lookupVarUnsafe(String name);

  /**
   * @return the function signature, or null if no such function
   */
  public FunctionType lookupFunction(String name) {
    return getGlobals().lookupFunction(name);
  }

  /**
   * Declare a new variable that will be visible in the
   * current scope and all descendant scopes
   * @throws RedeclarationError if the name is already declared in this
   *              scope.  Shadowing a name from an enclosing scope is fine.
   */
  public Var declareVariable(Var variable) throws RedeclarationError {
    String name = variable.name();
    Var existing = variables.get(name);
    if (existing != null) {
      throw new RedeclarationError(variable.declaredAt(),
          "variable " + name + " already declared in this scope at " +
          describePosition(existing.declaredAt()));
    }
    if (logger.isTraceEnabled()) {
      logger.trace("context: declareVariable: " + variable.type() + " " +
                   name + " <" + variable.defType() + "> level " + level);
    }
    variables.put(name, variable);
    return variable;
  }

  /**
   * @return true if the variable is declared in this scope, ignoring
   *        enclosing scopes
   */
  public boolean isDeclaredHere(String name) {
    return variables.containsKey(name);
  }

  public int getLevel() {
    return level;
  }

  /**
   * Update the current position to the node's
   */
  public void syncFilePos(Node node) {
    FilePosition pos = node.getPosition();
    line = pos.line;
    col = pos.column;
  }

  public FilePosition getFilePosition() {
    return new FilePosition(inputFile, line, col);
  }

  /**
   * @return location prefix for log messages
   */
  public String getLocation() {
    return getFilePosition().toString() + ": ";
  }

  static String describePosition(FilePosition pos) {
    if (pos == null || !pos.isKnown()) {
      return "<unknown>";
    }
    return pos.line + ":" + pos.column;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "@" + level + " " + variables.keySet();
  }
}
