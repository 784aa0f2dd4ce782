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

import org.jspecify.annotations.Nullable;

/**
 * The errors that can be reported by evaluating an {@link Expr}. Errors are only raised during
 * evaluation; constructing or rendering an expression never fails with an Err.
 *
 * <p>While evaluating, an error is signalled by throwing an {@link EvalException}, which aborts the
 * evaluation in progress. {@link Evaluator#evaluate} converts it to an {@link EvalResult.Failure}.
 */
public enum Err {
  /** A Variable's name was not bound in the {@link EvalContext}; the detail is the name. */
  UNDEFINED_VARIABLE("Undefined variable"),

  /** The right operand of an integer division evaluated to zero. */
  DIVISION_BY_ZERO("Division by zero");

  private final String description;

  Err(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /** Returns a human-readable message for this error with the given (optional) detail. */
  public String message(@Nullable String detail) {
    return (detail == null) ? description : description + ": " + detail;
  }

  /** Throws an EvalException for this Err if {@code condition} is true. */
  public void when(boolean condition) throws EvalException {
    when(condition, null);
  }

  /** Throws an EvalException with the given detail if {@code condition} is true. */
  public void when(boolean condition, @Nullable String detail) throws EvalException {
    if (condition) {
      throw new EvalException(this, detail);
    }
  }

  /** Throws an EvalException for this Err if {@code condition} is false. */
  public void unless(boolean condition) throws EvalException {
    when(!condition, null);
  }

  /** Throws an EvalException with the given detail if {@code condition} is false. */
  public void unless(boolean condition, @Nullable String detail) throws EvalException {
    when(!condition, detail);
  }

  /** Thrown to abort an evaluation; carries the Err and its detail. */
  public static class EvalException extends Exception {
    private final Err err;
    private final @Nullable String detail;

    public EvalException(Err err, @Nullable String detail) {
      super(checkNotNull(err).message(detail));
      this.err = err;
      this.detail = detail;
    }

    public Err err() {
      return err;
    }

    public @Nullable String detail() {
      return detail;
    }
  }
}
