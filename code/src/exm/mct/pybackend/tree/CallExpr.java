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
import java.util.Iterator;
import java.util.List;

/**
 * Function call: name(arg1, arg2)
 */
public class CallExpr extends Expression
{
  private final String function;
  private final List<Expression> args;

  public CallExpr(String function, List<? extends Expression> args)
  {
    this.function = function;
    this.args = new ArrayList<Expression>(args);
  }

  public CallExpr(String function, Expression... args)
  {
    this.function = function;
    this.args = new ArrayList<Expression>(args.length);
    for (Expression arg: args)
      this.args.add(arg);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(function);
    sb.append('(');
    Iterator<Expression> it = args.iterator();
    while (it.hasNext())
    {
      it.next().appendTo(sb);
      if (it.hasNext())
        sb.append(", ");
    }
    sb.append(')');
  }
}
