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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import exm.mct.common.exceptions.MCTRuntimeError;

/**
 * The types of Mini-C.  The set is closed: two value types and void,
 * which only appears as a function return type.
 */
public class Types {

  public static enum Type {
    INT("int"),
    BOOL("bool"),
    VOID("void");

    private final String typeName;

    private Type(String typeName) {
      this.typeName = typeName;
    }

    @JsonValue
    public String typeName() {
      return typeName;
    }

    /**
     * @return true if values of this type can be stored in variables
     */
    public boolean isValueType() {
      return this != VOID;
    }

    @JsonCreator
    public static Type fromName(String name) {
      for (Type t: values()) {
        if (t.typeName.equals(name)) {
          return t;
        }
      }
      throw new MCTRuntimeError("Unknown type name: " + name);
    }

    @Override
    public String toString() {
      return typeName;
    }
  }

  /**
   * Signature of a function: parameter types and return type
   */
  public static class FunctionType {
    private final Type returnType;
    private final List<Type> paramTypes;

    public FunctionType(Type returnType, List<Type> paramTypes) {
      Preconditions.checkNotNull(returnType);
      Preconditions.checkNotNull(paramTypes);
      this.returnType = returnType;
      this.paramTypes = Collections.unmodifiableList(
                              new ArrayList<Type>(paramTypes));
    }

    public Type getReturnType() {
      return returnType;
    }

    public List<Type> getParamTypes() {
      return paramTypes;
    }

    @Override
    public int hashCode() {
      return 31 * returnType.hashCode() + paramTypes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof FunctionType)) {
        return false;
      }
      FunctionType other = (FunctionType) obj;
      return returnType == other.returnType &&
             paramTypes.equals(other.paramTypes);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("(");
      boolean first = true;
      for (Type t: paramTypes) {
        if (first) {
          first = false;
        } else {
          sb.append(", ");
        }
        sb.append(t.typeName());
      }
      sb.append(") -> ");
      sb.append(returnType.typeName());
      return sb.toString();
    }
  }

  /**
   * @return human-readable name of a possibly unknown type
   */
  public static String typeName(Type t) {
    return t == null ? "<unknown>" : t.typeName();
  }
}
