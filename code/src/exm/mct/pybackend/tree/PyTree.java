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
 * The PyTree class hierarchy represents the Python constructs
 * needed to render a translated Mini-C program.
 *
 * PyTree is the most abstract Python construct.  Nodes hold no layout
 * state: the enclosing construct passes down the indentation to use.
 * */
public abstract class PyTree
{
  public static final int DEFAULT_INDENT_WIDTH = 4;

  /**
   * Append this construct, with statements starting at the given
   * indentation
   */
  public abstract void appendTo(StringBuilder sb, Indentation indent);

  /**
   * @param indentWidth spaces per nesting level
   * @return source text, starting at the outermost level
   */
  public String render(int indentWidth)
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb, Indentation.top(indentWidth));
    return sb.toString();
  }

  @Override
  public String toString()
  {
    return render(DEFAULT_INDENT_WIDTH);
  }
}
