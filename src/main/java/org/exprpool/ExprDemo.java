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

import java.io.PrintStream;

/** Builds and evaluates a couple of sample expressions. */
public class ExprDemo {

  private ExprDemo() {}

  public static void main(String[] args) {
    run(System.out);
  }

  static void run(PrintStream out) {
    ExprFactory factory = ExprFactory.create();
    EvalContext context = EvalContext.of("x", 3);

    Expr sum = factory.add(factory.makeConstant(2), factory.makeVariable("x"));
    Expr product = factory.multiply(sum, factory.makeConstant(5));
    out.println(product + " = " + Evaluator.evaluate(product, context));

    // xx isn't bound in context
    Expr other = factory.add(factory.makeConstant(3), factory.makeVariable("xx"));
    out.println(other + " = " + Evaluator.evaluate(other, context));
  }
}
