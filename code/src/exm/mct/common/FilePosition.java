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

package exm.mct.common;

/**
 * A location in a source file.  Lines and columns are 1-based; a line of 0
 * means the position is unknown.
 */
public class FilePosition {
  public static final FilePosition UNKNOWN = new FilePosition(null, 0, 0);

  public final String file;
  public final int line;
  public final int column;

  public FilePosition(String file, int line, int column) {
    this.file = file;
    this.line = line;
    this.column = column;
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FilePosition))
      return false;
    FilePosition other = (FilePosition) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file)) {
      return false;
    }
    return line == other.line && column == other.column;
  }

  /**
   * @return file:line:col, omitting the parts that are unknown
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(file == null ? "<input>" : file);
    if (line > 0) {
      sb.append(':').append(line);
      if (column > 0) {
        sb.append(':').append(column);
      }
    }
    return sb.toString();
  }
}
