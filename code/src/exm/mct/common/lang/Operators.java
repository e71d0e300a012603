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

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import exm.mct.common.exceptions.MCTRuntimeError;
import exm.mct.common.lang.Types.Type;

/**
 * Binary operators of Mini-C and their typing rules
 */
public class Operators {

  public static enum OpCategory {
    /** int x int -> int */
    ARITHMETIC,
    /** int x int -> bool */
    RELATIONAL,
    /** t x t -> bool for any value type t */
    EQUALITY,
  }

  public static enum Op {
    PLUS("+", OpCategory.ARITHMETIC),
    MINUS("-", OpCategory.ARITHMETIC),
    MULT("*", OpCategory.ARITHMETIC),
    DIV("/", OpCategory.ARITHMETIC),
    MOD("%", OpCategory.ARITHMETIC),
    LT("<", OpCategory.RELATIONAL),
    GT(">", OpCategory.RELATIONAL),
    LTE("<=", OpCategory.RELATIONAL),
    GTE(">=", OpCategory.RELATIONAL),
    EQ("==", OpCategory.EQUALITY),
    NEQ("!=", OpCategory.EQUALITY);

    private final String symbol;
    private final OpCategory category;

    private Op(String symbol, OpCategory category) {
      this.symbol = symbol;
      this.category = category;
    }

    @JsonValue
    public String symbol() {
      return symbol;
    }

    public OpCategory category() {
      return category;
    }

    @JsonCreator
    public static Op fromSymbol(String symbol) {
      Op op = bySymbol.get(symbol);
      if (op == null) {
        throw new MCTRuntimeError("Unknown operator symbol: " + symbol);
      }
      return op;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private static final Map<String, Op> bySymbol = new HashMap<String, Op>();

  static {
    for (Op op: Op.values()) {
      bySymbol.put(op.symbol(), op);
    }
  }

  /**
   * @return type of the operands the operator requires, or null if any
   *         matching pair of value types is accepted
   */
  public static Type operandType(Op op) {
    switch (op.category()) {
      case ARITHMETIC:
      case RELATIONAL:
        return Type.INT;
      case EQUALITY:
        return null;
      default:
        throw new MCTRuntimeError("Unknown operator category: "
                                  + op.category());
    }
  }

  public static Type resultType(Op op) {
    switch (op.category()) {
      case ARITHMETIC:
        return Type.INT;
      case RELATIONAL:
      case EQUALITY:
        return Type.BOOL;
      default:
        throw new MCTRuntimeError("Unknown operator category: "
                                  + op.category());
    }
  }
}
