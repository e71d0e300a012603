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
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Simple statement on its own line, made of space-separated tokens,
 * e.g. return (a + b)
 */
public class Command extends PyTree
{
  private final List<PyTree> tokens;

  public Command(PyTree... tokens)
  {
    this.tokens = Arrays.asList(tokens);
  }

  public Command(String... strings)
  {
    tokens = new ArrayList<PyTree>(strings.length);
    for (String s : strings)
      tokens.add(new Token(s));
  }

  public static Command returnValue(Expression value)
  {
    return new Command(new Token("return"), value);
  }

  public static Command returnNothing()
  {
    return new Command("return");
  }

  @Override
  public void appendTo(StringBuilder sb, Indentation indent)
  {
    indent.appendTo(sb);
    Iterator<PyTree> it = tokens.iterator();
    while (it.hasNext())
    {
      PyTree tree = it.next();
      tree.appendTo(sb, indent);
      if (it.hasNext())
        sb.append(' ');
    }
    sb.append('\n');
  }
}
