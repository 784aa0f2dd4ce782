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

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.exprpool.Expr.BinaryOp.Kind;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ExprTest {

  private final ExprFactory factory = ExprFactory.create();

  @Test
  public void renderConstant(@TestParameter({"0", "42", "-17", "2147483647"}) int value) {
    Expr.Constant c = factory.makeConstant(value);

    assertThat(c.value()).isEqualTo(value);
    assertThat(c.render()).isEqualTo(Integer.toString(value));
    assertThat(c.toString()).isEqualTo(Integer.toString(value));
  }

  @Test
  public void renderVariable() {
    Expr.Variable v = factory.makeVariable("total_1");

    assertThat(v.name()).isEqualTo("total_1");
    assertThat(v.render()).isEqualTo("total_1");
  }

  @Test
  public void renderBinaryOp(@TestParameter Kind kind) {
    Expr.BinaryOp op = factory.makeBinary(kind, factory.makeVariable("a"), factory.makeConstant(1));

    assertThat(op.kind()).isEqualTo(kind);
    assertThat(op.render()).isEqualTo("(a " + kind.symbol() + " 1)");
    assertThat(op.toString()).isEqualTo(op.render());
  }

  @Test
  public void symbols() {
    assertThat(Kind.ADD.symbol()).isEqualTo("+");
    assertThat(Kind.SUBTRACT.symbol()).isEqualTo("-");
    assertThat(Kind.MULTIPLY.symbol()).isEqualTo("*");
    assertThat(Kind.INTEGER_DIVIDE.symbol()).isEqualTo("//");
  }

  @Test
  public void renderNested() {
    Expr expr =
        factory.integerDivide(
            factory.subtract(factory.makeVariable("x"), factory.makeConstant(-3)),
            factory.multiply(factory.makeConstant(0), factory.makeVariable("y")));

    assertThat(expr.render()).isEqualTo("((x - -3) // (0 * y))");
  }

  @Test
  public void renderDoesNotEvaluate() {
    // Would fail with both errors if evaluated.
    Expr expr = factory.integerDivide(factory.makeVariable("missing"), factory.makeConstant(0));

    assertThat(expr.render()).isEqualTo("(missing // 0)");
  }

  @Test
  public void childrenAreSharedNotCopied() {
    Expr.Variable x = factory.makeVariable("x");
    Expr.BinaryOp sum = factory.add(x, x);
    Expr.BinaryOp product = factory.multiply(sum, x);

    assertThat(sum.left()).isSameInstanceAs(x);
    assertThat(sum.right()).isSameInstanceAs(x);
    assertThat(product.left()).isSameInstanceAs(sum);
    assertThat(product.right()).isSameInstanceAs(x);
  }

  @Test
  public void binaryOpsAreNotInterned() {
    Expr.Constant one = factory.makeConstant(1);

    assertThat(factory.add(one, one)).isNotSameInstanceAs(factory.add(one, one));
  }

  @Test
  public void nullOperandsRejected() {
    Expr.Constant one = factory.makeConstant(1);

    assertThrows(NullPointerException.class, () -> factory.add(one, null));
    assertThrows(NullPointerException.class, () -> factory.add(null, one));
    assertThrows(NullPointerException.class, () -> factory.makeBinary(null, one, one));
  }
}
