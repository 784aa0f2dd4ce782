/*
 * Copyright 2026 The Exprpool Authors
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
 * limitations under the License.
 */

package org.exprpool;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * An integer arithmetic expression: a {@link Constant}, a {@link Variable}, or a {@link BinaryOp}
 * over two subexpressions.
 *
 * <p>Exprs are immutable, so a single node may be shared by any number of trees. Leaf nodes are
 * obtained from an {@link ExprFactory}, which returns the same node for repeated requests with the
 * same key for as long as that node is reachable from somewhere else. Exprs use identity equality;
 * two Constants with the same value are only {@code ==} if they were interned by the same factory
 * while the first was still live.
 *
 * <p>{@link #toString} returns the same text as {@link #render}.
 */
@Immutable
public sealed interface Expr permits Expr.Constant, Expr.Variable, Expr.BinaryOp {

  /**
   * Returns a textual representation of this expression. Constants print their value, Variables
   * their name, and BinaryOps {@code (left symbol right)}. Never evaluates anything.
   */
  default String render() {
    StringBuilder sb = new StringBuilder();
    renderTo(sb);
    return sb.toString();
  }

  /** Appends the result of {@link #render} to {@code sb}. */
  void renderTo(StringBuilder sb);

  /**
   * Evaluates this expression with the given variable bindings, throwing if evaluation fails. See
   * {@link Evaluator#evaluate} for a version that returns an {@link EvalResult} instead.
   */
  default int evaluate(EvalContext context) throws Err.EvalException {
    return Evaluator.evaluateOrThrow(this, context);
  }

  /** An integer constant. */
  @Immutable
  final class Constant implements Expr {
    private final int value;

    Constant(int value) {
      this.value = value;
    }

    public int value() {
      return value;
    }

    @Override
    public void renderTo(StringBuilder sb) {
      sb.append(value);
    }

    @Override
    public String toString() {
      return Integer.toString(value);
    }
  }

  /** A named variable, whose value is looked up in the EvalContext at evaluation time. */
  @Immutable
  final class Variable implements Expr {
    private final String name;

    Variable(String name) {
      this.name = checkNotNull(name);
    }

    public String name() {
      return name;
    }

    @Override
    public void renderTo(StringBuilder sb) {
      sb.append(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * A binary arithmetic operation. Holds strong references to both operands, so a BinaryOp keeps
   * its children alive (and hence interned) for as long as it is itself reachable.
   */
  @Immutable
  final class BinaryOp implements Expr {
    private final Kind kind;
    private final Expr left;
    private final Expr right;

    BinaryOp(Kind kind, Expr left, Expr right) {
      this.kind = checkNotNull(kind);
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    public Kind kind() {
      return kind;
    }

    public Expr left() {
      return left;
    }

    public Expr right() {
      return right;
    }

    @Override
    public void renderTo(StringBuilder sb) {
      sb.append('(');
      left.renderTo(sb);
      sb.append(' ').append(kind.symbol()).append(' ');
      right.renderTo(sb);
      sb.append(')');
    }

    @Override
    public String toString() {
      return render();
    }

    /** The supported operators. */
    public enum Kind {
      ADD("+") {
        @Override
        public int apply(int x, int y) {
          return x + y;
        }
      },
      SUBTRACT("-") {
        @Override
        public int apply(int x, int y) {
          return x - y;
        }
      },
      MULTIPLY("*") {
        @Override
        public int apply(int x, int y) {
          return x * y;
        }
      },
      /** Truncates toward zero. */
      INTEGER_DIVIDE("//") {
        @Override
        public int apply(int x, int y) {
          return x / y;
        }
      };

      private final String symbol;

      Kind(String symbol) {
        this.symbol = symbol;
      }

      /** The operator's symbol as it appears in {@link Expr#render}. */
      public String symbol() {
        return symbol;
      }

      /**
       * Applies this operator with Java {@code int} semantics (overflow wraps). The evaluator
       * checks for a zero divisor before calling {@code INTEGER_DIVIDE.apply}; calling it directly
       * with {@code y == 0} throws ArithmeticException.
       */
      public abstract int apply(int x, int y);
    }
  }
}
