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
 * Binary operation, always parenthesised: (left op right)
 */
public class BinaryExpr extends Expression
{
  private final Expression left;
  private final String operator;
  private final Expression right;

  public BinaryExpr(Expression left, String operator, Expression right)
  {
    this.left = left;
    this.operator = operator;
    this.right = right;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('(');
    left.appendTo(sb);
    sb.append(' ');
    sb.append(operator);
    sb.append(' ');
    right.appendTo(sb);
    sb.append(')');
  }
}
