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

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

/**
 * Nesting depth of a Python statement, with the number of spaces per
 * level.  Immutable: a suite is appended with {@link #deeper()}.
 */
public class Indentation
{
  private final int depth;
  private final int width;

  private Indentation(int depth, int width)
  {
    this.depth = depth;
    this.width = width;
  }

  public static Indentation top(int width)
  {
    Preconditions.checkArgument(width > 0, "indent width must be positive");
    return new Indentation(0, width);
  }

  public Indentation deeper()
  {
    return new Indentation(depth + 1, width);
  }

  public void appendTo(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', depth * width));
  }
}
