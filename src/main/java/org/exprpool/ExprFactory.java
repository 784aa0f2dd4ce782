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
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.exprpool.impl.InternPool;

/**
 * Creates Exprs, interning leaf nodes: while a Constant or Variable returned by this factory is
 * still reachable, further requests for the same value or name return that same node.
 *
 * <p>Each ExprFactory has its own pools, which live as long as the factory does; nodes from
 * different factories are never shared. The pools only hold weak references, so interning never
 * extends the lifetime of a node beyond that of the trees (or other clients) using it.
 *
 * <p>ExprFactories are not thread-safe.
 */
public class ExprFactory {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final InternPool<Integer, Expr.Constant> constants;
  private final InternPool<String, Expr.Variable> variables;

  private ExprFactory(PruneCadence cadence) {
    this.constants = new InternPool<>("Constant", Expr.Constant::new, cadence);
    this.variables = new InternPool<>("Variable", Expr.Variable::new, cadence);
  }

  /** Returns a new ExprFactory that prunes with {@link PruneCadence#AMORTIZED}. */
  public static ExprFactory create() {
    return create(PruneCadence.AMORTIZED);
  }

  public static ExprFactory create(PruneCadence cadence) {
    return new ExprFactory(checkNotNull(cadence));
  }

  public Expr.Constant makeConstant(int value) {
    return constants.get(value);
  }

  public Expr.Variable makeVariable(String name) {
    return variables.get(checkNotNull(name));
  }

  /** Returns a new BinaryOp; composite nodes are never interned. */
  public Expr.BinaryOp makeBinary(Expr.BinaryOp.Kind kind, Expr left, Expr right) {
    return new Expr.BinaryOp(kind, left, right);
  }

  public Expr.BinaryOp add(Expr left, Expr right) {
    return makeBinary(Expr.BinaryOp.Kind.ADD, left, right);
  }

  public Expr.BinaryOp subtract(Expr left, Expr right) {
    return makeBinary(Expr.BinaryOp.Kind.SUBTRACT, left, right);
  }

  public Expr.BinaryOp multiply(Expr left, Expr right) {
    return makeBinary(Expr.BinaryOp.Kind.MULTIPLY, left, right);
  }

  public Expr.BinaryOp integerDivide(Expr left, Expr right) {
    return makeBinary(Expr.BinaryOp.Kind.INTEGER_DIVIDE, left, right);
  }

  /**
   * Removes stale entries from both pools, returning the number removed. Calling this is never
   * necessary for correctness.
   */
  @CanIgnoreReturnValue
  public int prune() {
    int removed = constants.prune() + variables.prune();
    if (removed != 0) {
      logger.atFine().log(
          "Pruned %s entries: %s, %s",
          removed, lazy(constants::toString), lazy(variables::toString));
    }
    return removed;
  }

  public PoolStats constantStats() {
    return constants.stats();
  }

  public PoolStats variableStats() {
    return variables.stats();
  }
}
