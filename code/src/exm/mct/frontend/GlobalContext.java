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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.mct.common.FilePosition;
import exm.mct.common.exceptions.RedeclarationError;
import exm.mct.common.lang.Types.FunctionType;
import exm.mct.common.lang.Var;

/**
 * Global context for the whole program.  Holds the function table; Mini-C
 * has no global variables.
 */
public class GlobalContext extends Context {

  private final Map<String, FunctionType> functions =
                            new LinkedHashMap<String, FunctionType>();
  private final Map<String, FilePosition> functionPositions =
                            new HashMap<String, FilePosition>();

  /** Warnings already emitted while checking this program */
  private final Set<String> warningsEmitted = new HashSet<String>();

  public GlobalContext(String inputFile, Logger logger) {
    super(logger, ROOT_LEVEL);
    this.inputFile = inputFile;
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public FunctionContext getFunctionContext() {
    return null;
  }

  @Override
  public Var lookupVarUnsafe(String name) {
    return variables.get(name);
  }

  /**
   * Register a function signature
   * @throws RedeclarationError if a function with the name already exists
   */
  public void defineFunction(String name, FunctionType type,
                             FilePosition pos) throws RedeclarationError {
    FunctionType existing = functions.get(name);
    if (existing != null) {
      throw new RedeclarationError(pos, "function " + name +
          " already defined at " +
          describePosition(functionPositions.get(name)));
    }
    logger.trace("Defined function " + name + " " + type);
    functions.put(name, type);
    functionPositions.put(name, pos);
  }

  @Override
  public FunctionType lookupFunction(String name) {
    return functions.get(name);
  }

  /**
   * @return true if the warning was not already emitted for this program
   */
  public boolean addEmittedWarning(String msg) {
    return warningsEmitted.add(msg);
  }
}
