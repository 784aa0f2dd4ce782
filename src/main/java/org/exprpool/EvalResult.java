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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** The outcome of {@link Evaluator#evaluate}: either a value or the first error encountered. */
public sealed interface EvalResult permits EvalResult.Success, EvalResult.Failure {

  static EvalResult success(int value) {
    return new Success(value);
  }

  static EvalResult failure(Err err, @Nullable String detail) {
    return new Failure(err, detail);
  }

  boolean isSuccess();

  /** Returns the value if this is a Success, otherwise throws the corresponding EvalException. */
  @CanIgnoreReturnValue
  int getOrThrow() throws Err.EvalException;

  record Success(int value) implements EvalResult {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public int getOrThrow() {
      return value;
    }

    @Override
    public String toString() {
      return Integer.toString(value);
    }
  }

  /** {@code detail} is the variable name for UNDEFINED_VARIABLE, and null for DIVISION_BY_ZERO. */
  record Failure(Err err, @Nullable String detail) implements EvalResult {
    public Failure {
      checkNotNull(err);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public int getOrThrow() throws Err.EvalException {
      throw new Err.EvalException(err, detail);
    }

    public String message() {
      return err.message(detail);
    }

    @Override
    public String toString() {
      return "error: " + message();
    }
  }
}
