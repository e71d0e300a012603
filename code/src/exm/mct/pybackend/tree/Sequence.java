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
 * Sequence of statements at the same depth
 */
public class Sequence extends PyTree
{
  private final List<PyTree> members = new ArrayList<PyTree>();

  public void add(PyTree tree)
  {
    members.add(tree);
  }

  /**
   * Append at end of current sequence
   * @param seq
   */
  public void append(Sequence seq)
  {
    members.addAll(seq.members);
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  public List<PyTree> members()
  {
    return members;
  }

  @Override
  public void appendTo(StringBuilder sb, Indentation indent)
  {
    for (PyTree member : members)
    {
      member.appendTo(sb, indent);
    }
  }

  /**
   * Append as the suite of a compound statement whose header
   * has just been written: a colon, then the members one level
   * deeper.  Python requires a non-empty suite, so an empty sequence
   * becomes pass.
   * @param header indentation of the compound statement
   */
  public void appendToAsSuite(StringBuilder sb, Indentation header)
  {
    sb.append(":\n");
    Indentation body = header.deeper();
    if (members.isEmpty())
    {
      body.appendTo(sb);
      sb.append("pass\n");
    }
    else
    {
      appendTo(sb, body);
    }
  }
}
