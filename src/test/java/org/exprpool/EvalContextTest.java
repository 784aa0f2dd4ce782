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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvalContextTest {

  @Test
  public void empty() {
    EvalContext context = EvalContext.of();

    assertThat(context.size()).isEqualTo(0);
    assertThat(context.lookup("x")).isNull();
    assertThat(context.contains("x")).isFalse();
    assertThat(EvalContext.builder().build()).isSameInstanceAs(context);
  }

  @Test
  public void lookup() {
    EvalContext context = EvalContext.of("x", 3, "y", -8);

    assertThat(context.lookup("x")).isEqualTo(3);
    assertThat(context.lookup("y")).isEqualTo(-8);
    assertThat(context.lookup("z")).isNull();
    assertThat(context.names()).containsExactly("x", "y").inOrder();
    assertThat(context.toString()).isEqualTo("{x=3, y=-8}");
  }

  @Test
  public void copyOfIsIndependent() {
    Map<String, Integer> values = new HashMap<>();
    values.put("a", 1);
    EvalContext context = EvalContext.copyOf(values);
    values.put("a", 2);
    values.put("b", 3);

    assertThat(context.lookup("a")).isEqualTo(1);
    assertThat(context.contains("b")).isFalse();
  }

  @Test
  public void builder() {
    EvalContext context = EvalContext.builder().put("p", 0).put("q", 1).build();

    assertThat(context.size()).isEqualTo(2);
    assertThat(context.lookup("p")).isEqualTo(0);
  }

  @Test
  public void duplicateNamesRejected() {
    EvalContext.Builder builder = EvalContext.builder().put("p", 0).put("p", 1);

    assertThrows(IllegalArgumentException.class, builder::build);
    assertThrows(IllegalArgumentException.class, () -> EvalContext.of("p", 0, "p", 1));
  }

  @Test
  public void nullsRejected() {
    Map<String, Integer> values = new HashMap<>();
    values.put("a", null);

    assertThrows(NullPointerException.class, () -> EvalContext.copyOf(values));
    assertThrows(NullPointerException.class, () -> EvalContext.of(null, 1));
  }
}
