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

package exm.mct.common.lang;

import com.google.common.base.Preconditions;

import exm.mct.common.FilePosition;
import exm.mct.common.lang.Types.Type;

/**
 * A variable binding in a scope
 */
public class Var {

  public static enum DefType {
    /** Function parameter */
    PARAMETER,
    /** Declared in a function body */
    LOCAL,
  }

  private final String name;
  private final Type type;
  private final DefType defType;
  private final FilePosition declaredAt;

  public Var(String name, Type type, DefType defType,
             FilePosition declaredAt) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(type);
    Preconditions.checkNotNull(defType);
    this.name = name;
    this.type = type;
    this.defType = defType;
    this.declaredAt = declaredAt;
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public DefType defType() {
    return defType;
  }

  public FilePosition declaredAt() {
    return declaredAt;
  }

  @Override
  public String toString() {
    return type.typeName() + ":" + name;
  }
}
