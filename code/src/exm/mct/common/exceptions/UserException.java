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

package exm.mct.common.exceptions;

import exm.mct.common.Diagnostic;
import exm.mct.common.FilePosition;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final Diagnostic.Kind kind;
  private final FilePosition position;
  private final String rawMessage;

  public UserException(Diagnostic.Kind kind, FilePosition position,
                       String message)
  {
    super(format(position, message));
    this.kind = kind;
    this.position = position;
    this.rawMessage = message;
  }

  public UserException(Diagnostic.Kind kind, String file, int line, int col,
                       String message) {
    this(kind, new FilePosition(file, line, col), message);
  }

  private static String format(FilePosition position, String message) {
    if (position == null) {
      return message;
    }
    return position + ": " + message;
  }

  public Diagnostic.Kind kind() {
    return kind;
  }

  /**
   * @return the position, or null if unknown
   */
  public FilePosition getPosition() {
    return position;
  }

  /**
   * @return the message without the position prefix
   */
  public String getRawMessage() {
    return rawMessage;
  }

  private static final long serialVersionUID = 1L;
}
