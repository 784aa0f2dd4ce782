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

import com.google.common.flogger.FluentLogger;

/**
 * A static utility class for evaluating and rendering Exprs.
 *
 * <p>Evaluation is a depth-first recursion over the tree. The left operand of a BinaryOp is always
 * evaluated completely before the right operand, and the first error encountered aborts the whole
 * evaluation, so an error in a left subtree takes precedence over any error its sibling would
 * have raised. Very deep trees may exhaust the Java stack; that is not reported as an Err.
 */
public class Evaluator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private Evaluator() {}

  /** Evaluates {@code expr}, returning either its value or the first error encountered. */
  public static EvalResult evaluate(Expr expr, EvalContext context) {
    checkNotNull(expr);
    checkNotNull(context);
    try {
      return EvalResult.success(evaluateOrThrow(expr, context));
    } catch (Err.EvalException e) {
      logger.atFine().log("Evaluating %s with %s failed: %s", expr, context, e.getMessage());
      return EvalResult.failure(e.err(), e.detail());
    }
  }

  /** Evaluates {@code expr}, throwing an EvalException for the first error encountered. */
  public static int evaluateOrThrow(Expr expr, EvalContext context) throws Err.EvalException {
    checkNotNull(expr);
    checkNotNull(context);
    return eval(expr, context);
  }

  private static int eval(Expr expr, EvalContext context) throws Err.EvalException {
    if (expr instanceof Expr.Constant c) {
      return c.value();
    } else if (expr instanceof Expr.Variable v) {
      Integer value = context.lookup(v.name());
      Err.UNDEFINED_VARIABLE.unless(value != null, v.name());
      return value;
    } else if (expr instanceof Expr.BinaryOp op) {
      int left = eval(op.left(), context);
      int right = eval(op.right(), context);
      if (op.kind() == Expr.BinaryOp.Kind.INTEGER_DIVIDE) {
        Err.DIVISION_BY_ZERO.when(right == 0);
      }
      return op.kind().apply(left, right);
    }
    throw new AssertionError("Unexpected Expr: " + expr.getClass());
  }

  /** Equivalent to {@code expr.render()}. */
  public static String render(Expr expr) {
    return checkNotNull(expr).render();
  }
}
