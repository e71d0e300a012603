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

package exm.mct.pybackend.tree;

import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;

import exm.mct.common.exceptions.MCTRuntimeError;

/**
 * Python function definition
 */
public class Def extends PyTree
{
  private final String name;
  private final List<String> args;
  private final Sequence body;

  /**
   * @param name
   * @param usedFunctionNames used to ensure we're not generating duplicate
   *                          functions
   * @param args
   * @param body
   */
  public Def(String name, Set<String> usedFunctionNames,
             List<String> args, Sequence body)
  {
    checkPythonName(name);
    if (!usedFunctionNames.add(name)) {
      throw new MCTRuntimeError("Duplicate python function " + name);
    }
    this.name = name;
    this.args = args;
    this.body = body;
  }

  public String name() {
    return name;
  }

  public Sequence getBody() {
    return body;
  }

  /**
   * Check that there are no invalid characters
   */
  static void checkPythonName(String name) {
    if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
      throw new MCTRuntimeError("Bad python identifier '" + name + "'");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        throw new MCTRuntimeError("Bad character '" + c +
                                  "' in python name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb, Indentation indent)
  {
    indent.appendTo(sb);
    sb.append("def ");
    sb.append(name);
    sb.append('(');
    sb.append(Joiner.on(", ").join(args));
    sb.append(')');
    body.appendToAsSuite(sb, indent);
  }
}
