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

/**
 * If-then-else construct.  An else block holding nothing but another
 * If is written as elif.
 * */
public class If extends PyTree
{
  private final Expression condition;
  private final Sequence thenBlock;
  private final Sequence elseBlock;

  public If(Expression condition, Sequence thenBlock, Sequence elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  public If(Expression condition, Sequence thenBlock)
  {
    this(condition, thenBlock, null);
  }

  public Sequence thenBlock() {
    return thenBlock;
  }

  public Sequence elseBlock() {
    return elseBlock;
  }

  @Override
  public void appendTo(StringBuilder sb, Indentation indent)
  {
    indent.appendTo(sb);
    appendClauses(sb, indent, "if ");
  }

  private void appendClauses(StringBuilder sb, Indentation indent,
                             String keyword)
  {
    sb.append(keyword);
    condition.appendTo(sb);
    thenBlock.appendToAsSuite(sb, indent);
    if (elseBlock == null)
      return;

    indent.appendTo(sb);
    if (elseBlock.members().size() == 1 &&
        elseBlock.members().get(0) instanceof If)
    {
      If elif = (If) elseBlock.members().get(0);
      elif.appendClauses(sb, indent, "elif ");
    }
    else
    {
      sb.append("else");
      elseBlock.appendToAsSuite(sb, indent);
    }
  }
}
