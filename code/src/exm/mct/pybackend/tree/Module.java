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

import java.util.ArrayList;
import java.util.List;

/**
 * A whole Python source file: optional header comment, function
 * definitions separated by blank lines, then the optional entry point
 * guard.
 */
public class Module extends PyTree
{
  private final Comment header;
  private final List<Def> defs = new ArrayList<Def>();
  private String entryPoint = null;

  /**
   * @param header comment to start the file with, or null for none
   */
  public Module(Comment header)
  {
    this.header = header;
  }

  public void add(Def def)
  {
    defs.add(def);
  }

  /**
   * Call the named function when the file is run as a script
   */
  public void setEntryPoint(String function)
  {
    this.entryPoint = function;
  }

  @Override
  public void appendTo(StringBuilder sb, Indentation indent)
  {
    boolean first = true;
    if (header != null)
    {
      header.appendTo(sb, indent);
      first = false;
    }
    for (Def def: defs)
    {
      if (!first)
        sb.append('\n');
      def.appendTo(sb, indent);
      first = false;
    }
    if (entryPoint != null)
    {
      if (!first)
        sb.append('\n');
      Sequence main = new Sequence();
      main.add(new Command(new CallExpr(entryPoint)));
      If guard = new If(new Token("__name__ == '__main__'"), main);
      guard.appendTo(sb, indent);
    }
  }
}
