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

import exm.mct.common.lang.Var;

/**
 * Context for a function body or a nested block.  Lookups that fail here
 * continue in the parent context.
 */
public class LocalContext extends Context {

  private final Context parent;
  private final GlobalContext globals;
  private final FunctionContext functionContext;

  private LocalContext(Context parent, FunctionContext functionContext) {
    super(parent.logger, parent.level + 1);
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.functionContext = functionContext;
    this.inputFile = parent.inputFile;
    this.line = parent.line;
    this.col = parent.col;
  }

  /**
   * Create the top-level context of a function body.  Parameters are
   * declared here and share it with the body's own declarations.
   */
  public static LocalContext fnContext(GlobalContext globals,
                                       FunctionContext fn) {
    return new LocalContext(globals, fn);
  }

  /**
   * Create a context for a nested block within a function
   */
  public static LocalContext fnSubcontext(Context parent) {
    return new LocalContext(parent, parent.getFunctionContext());
  }

  public Context getParent() {
    return parent;
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public FunctionContext getFunctionContext() {
    return functionContext;
  }

  @Override
  public Var lookupVarUnsafe(String name) {
    Var result = variables.get(name);
    if (result != null) {
      return result;
    }
    return parent.lookupVarUnsafe(name);
  }
}
