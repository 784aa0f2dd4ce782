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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The variable bindings used by a single evaluation. An EvalContext is supplied by the caller of
 * {@link Evaluator#evaluate} and is never retained by the expression being evaluated.
 *
 * <p>A context need not bind every variable that appears in an expression; only a lookup of an
 * unbound name that is actually reached during evaluation is an error.
 */
@Immutable
public final class EvalContext {

  private static final EvalContext EMPTY = new EvalContext(ImmutableMap.of());

  private final ImmutableMap<String, Integer> values;

  private EvalContext(ImmutableMap<String, Integer> values) {
    this.values = values;
  }

  /** Returns a context with no bindings. */
  public static EvalContext of() {
    return EMPTY;
  }

  public static EvalContext of(String name, int value) {
    return new EvalContext(ImmutableMap.of(name, value));
  }

  public static EvalContext of(String name1, int value1, String name2, int value2) {
    return new EvalContext(ImmutableMap.of(name1, value1, name2, value2));
  }

  /** Returns a context with the bindings in {@code values}; null names or values are rejected. */
  public static EvalContext copyOf(Map<String, Integer> values) {
    return values.isEmpty() ? EMPTY : new EvalContext(ImmutableMap.copyOf(values));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value bound to {@code name}, or null if there is none. */
  public @Nullable Integer lookup(String name) {
    return values.get(name);
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  public int size() {
    return values.size();
  }

  public ImmutableSet<String> names() {
    return values.keySet();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /** Accumulates bindings for a new EvalContext. Each name may only be bound once. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, Integer> values = ImmutableMap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder put(String name, int value) {
      values.put(name, value);
      return this;
    }

    /** Throws IllegalArgumentException if the same name was bound more than once. */
    public EvalContext build() {
      ImmutableMap<String, Integer> map = values.buildOrThrow();
      return map.isEmpty() ? EMPTY : new EvalContext(map);
    }
  }
}
