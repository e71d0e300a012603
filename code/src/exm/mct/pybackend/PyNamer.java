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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.util.HierarchicalMap;

/**
 * Chooses Python names for Mini-C functions and variables.
 *
 * Python has one scope per function, so a Mini-C variable that shadows
 * another in a nested block must get a distinct name.  Names that are
 * Python keywords or builtins we rely on get a trailing underscore.
 * Renamed variables get a numeric suffix: x, x_1, x_2.  The choice only
 * depends on declaration order, so output is deterministic.
 */
public class PyNamer {

  public static final Set<String> RESERVED = ImmutableSet.of(
      "False", "None", "True", "and", "as", "assert", "async", "await",
      "break", "class", "continue", "def", "del", "elif", "else", "except",
      "finally", "for", "from", "global", "if", "import", "in", "is",
      "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
      "while", "with", "yield", "print", "__name__");

  /** Mini-C function name to Python name */
  private final Map<String, String> functionNames =
                                      new HashMap<String, String>();

  /**
   * Declare a function.  Must be done for all functions before any
   * locals are named.
   * @return python name
   */
  public String declareFunction(String name) {
    if (functionNames.containsKey(name)) {
      throw new MCTRuntimeError("Function " + name + " declared twice");
    }
    String pyName = fresh(escapeReserved(name),
                          new HashSet<String>(functionNames.values()));
    functionNames.put(name, pyName);
    return pyName;
  }

  public String functionName(String name) {
    String pyName = functionNames.get(name);
    if (pyName == null) {
      throw new MCTRuntimeError("No python name for function " + name);
    }
    return pyName;
  }

  /**
   * Start naming the locals of a new function
   */
  public LocalNames functionLocals() {
    return new LocalNames(new HashSet<String>(functionNames.values()));
  }

  /**
   * Names used within one Python function
   */
  public static class LocalNames {
    private final Set<String> used;

    private LocalNames(Set<String> used) {
      this.used = used;
    }

    /**
     * Bind a new Mini-C variable in the given scope
     * @return python name for it
     */
    public String declare(HierarchicalMap<String, String> scope,
                          String name) {
      if (scope.containsKeyLocally(name)) {
        throw new MCTRuntimeError("Variable " + name +
                                  " declared twice in one scope");
      }
      String pyName = fresh(escapeReserved(name), used);
      scope.put(name, pyName);
      return pyName;
    }

    public String lookup(HierarchicalMap<String, String> scope,
                         String name) {
      String pyName = scope.get(name);
      if (pyName == null) {
        throw new MCTRuntimeError("No python name for variable " + name);
      }
      return pyName;
    }
  }

  static String escapeReserved(String name) {
    if (RESERVED.contains(name)) {
      return name + "_";
    }
    return name;
  }

  /**
   * Pick base, or base_N for the smallest N >= 1 not yet used, and mark
   * it as used
   */
  private static String fresh(String base, Set<String> used) {
    String candidate = base;
    int suffix = 1;
    while (used.contains(candidate)) {
      candidate = base + "_" + suffix;
      suffix++;
    }
    used.add(candidate);
    return candidate;
  }
}
