/*
 * Copyright 2026 The Ledger Authors
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

package org.ledgerlang.analysis;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.jspecify.annotations.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.ledgerlang.ast.BinaryOperation;
import org.ledgerlang.ast.Expression;
import org.ledgerlang.ast.Identifier;
import org.ledgerlang.ast.Literal;
import org.ledgerlang.ast.SourceLocation;
import org.ledgerlang.ast.Token;
import org.ledgerlang.ast.TupleExpression;
import org.ledgerlang.ast.UnaryOperation;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.diagnostics.Diagnostic;
import org.ledgerlang.diagnostics.ErrorReporter;
import org.ledgerlang.diagnostics.Severity;
import org.ledgerlang.types.IntegerType;
import org.ledgerlang.types.Type;
import org.ledgerlang.types.TypeProvider;
import org.ledgerlang.util.Rational;

@RunWith(JUnitParamsRunner.class)
public class ConstantEvaluatorTest {
  private static final IntegerType UINT8 = TypeProvider.integer(8, false);
  private static final IntegerType INT8 = TypeProvider.integer(8, true);

  ErrorReporter reporter;

  /** Each node gets a distinct location, so that we can tell where diagnostics were reported. */
  int nextPosition;

  @Before
  public void setup() {
    reporter = new ErrorReporter();
    nextPosition = 0;
  }

  private SourceLocation loc() {
    int start = nextPosition;
    nextPosition += 2;
    return SourceLocation.of("c.sol", start, start + 1);
  }

  private Literal number(String text) {
    return Literal.number(loc(), text);
  }

  private BinaryOperation binary(Expression left, Token op, Expression right) {
    return new BinaryOperation(loc(), left, op, right);
  }

  private Identifier ref(VariableDeclaration declaration) {
    Identifier id = new Identifier(loc(), declaration.name());
    id.resolve(declaration);
    return id;
  }

  private VariableDeclaration constant(String name, Type type, Expression value) {
    return VariableDeclaration.constant(loc(), name, type, value);
  }

  /** Parses "n", "n/d" or "2^n". */
  private static Rational r(String s) {
    if (s.startsWith("2^")) {
      return Rational.of(BigInteger.ONE.shiftLeft(Integer.parseInt(s.substring(2))));
    }
    List<String> parts = Splitter.on('/').splitToList(s);
    if (parts.size() == 1) {
      return Rational.of(new BigInteger(s));
    }
    return Rational.of(new BigInteger(parts.get(0)), new BigInteger(parts.get(1)));
  }

  /** Each case is {@code operator, left, right, expected result or "none"}; see {@link #r}. */
  private static Object[] binaryOperators() {
    return new Object[] {
      new Object[] {Token.ADD, "1/2", "1/3", "5/6"},
      new Object[] {Token.SUB, "1/2", "1/3", "1/6"},
      new Object[] {Token.MUL, "-2/3", "3/4", "-1/2"},
      new Object[] {Token.DIV, "7", "2", "7/2"},
      new Object[] {Token.DIV, "7", "0", "none"},
      new Object[] {Token.DIV, "0", "0", "none"},
      new Object[] {Token.MOD, "7", "3", "1"},
      new Object[] {Token.MOD, "-7", "3", "-1"},
      new Object[] {Token.MOD, "7/2", "3/2", "1/2"},
      new Object[] {Token.MOD, "7", "0", "none"},
      new Object[] {Token.MOD, "7/2", "0", "none"},
      new Object[] {Token.BIT_OR, "12", "10", "14"},
      new Object[] {Token.BIT_XOR, "12", "10", "6"},
      new Object[] {Token.BIT_AND, "12", "10", "8"},
      new Object[] {Token.BIT_AND, "-1", "255", "255"},
      new Object[] {Token.BIT_OR, "1/2", "1", "none"},
      new Object[] {Token.BIT_AND, "1", "1/2", "none"},
      new Object[] {Token.EXP, "2", "10", "1024"},
      new Object[] {Token.EXP, "2/3", "2", "4/9"},
      new Object[] {Token.EXP, "2", "-2", "1/4"},
      new Object[] {Token.EXP, "-3", "3", "-27"},
      new Object[] {Token.EXP, "5", "0", "1"},
      new Object[] {Token.EXP, "0", "0", "1"},
      new Object[] {Token.EXP, "0", "99999999999999", "0"},
      new Object[] {Token.EXP, "1", "99999999999999", "1"},
      new Object[] {Token.EXP, "-1", "99999999999998", "1"},
      new Object[] {Token.EXP, "-1", "99999999999999", "-1"},
      new Object[] {Token.EXP, "0", "-1", "0"},
      new Object[] {Token.EXP, "4", "1/2", "none"},
      new Object[] {Token.EXP, "2", "4097", "none"},
      new Object[] {Token.EXP, "2", "4294967296", "none"},
      new Object[] {Token.EXP, "3/2", "3000", "none"},
      new Object[] {Token.SHL, "3", "4", "48"},
      new Object[] {Token.SHL, "-3", "1", "-6"},
      new Object[] {Token.SHL, "0", "4294967295", "0"},
      new Object[] {Token.SHL, "1", "4095", "2^4095"},
      new Object[] {Token.SHL, "1", "4096", "none"},
      new Object[] {Token.SHL, "1", "4294967296", "none"},
      new Object[] {Token.SHL, "1", "-1", "none"},
      new Object[] {Token.SHL, "1/2", "1", "none"},
      new Object[] {Token.SAR, "48", "4", "3"},
      new Object[] {Token.SAR, "-7", "1", "-4"},
      new Object[] {Token.SAR, "5", "3", "0"},
      new Object[] {Token.SAR, "-5", "4294967295", "-1"},
      new Object[] {Token.SAR, "0", "7", "0"},
      new Object[] {Token.SAR, "5", "-1", "none"},
      new Object[] {Token.SAR, "5", "1/2", "none"},
      new Object[] {Token.SHR, "8", "1", "none"},
      new Object[] {Token.LESS_THAN, "1", "2", "none"},
      new Object[] {Token.AND, "1", "1", "none"},
    };
  }

  @Test
  @Parameters(method = "binaryOperators")
  @TestCaseName("{0}({1}, {2})")
  public void evaluateBinaryOperator(Token op, String left, String right, String expected) {
    Rational result = ConstantEvaluator.evaluateBinaryOperator(op, r(left), r(right));
    if (expected.equals("none")) {
      assertThat(result).isNull();
    } else {
      assertThat(result).isEqualTo(r(expected));
    }
  }

  @Test
  public void evaluateUnaryOperator() {
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.SUB, r("3/4"))).isEqualTo(r("-3/4"));
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.BIT_NOT, r("5"))).isEqualTo(r("-6"));
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.BIT_NOT, r("-1"))).isEqualTo(r("0"));
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.BIT_NOT, r("1/2"))).isNull();
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.NOT, r("1"))).isNull();
    assertThat(ConstantEvaluator.evaluateUnaryOperator(Token.INC, r("1"))).isNull();
  }

  private static Object[] shifts() {
    return new Object[] {
      new Object[] {"0", 5},
      new Object[] {"1", 0},
      new Object[] {"1", 4000},
      new Object[] {"12345678901234567890", 100},
      new Object[] {"255", 8},
    };
  }

  @Test
  @Parameters(method = "shifts")
  public void shiftRightUndoesShiftLeft(String value, int shift) {
    Rational x = r(value);
    Rational s = Rational.of(shift);
    Rational shifted = ConstantEvaluator.evaluateBinaryOperator(Token.SHL, x, s);
    assertThat(shifted).isNotNull();
    assertThat(ConstantEvaluator.evaluateBinaryOperator(Token.SAR, shifted, s)).isEqualTo(x);
  }

  @Test
  public void convertType() {
    assertThat(ConstantEvaluator.convertType(r("255"), UINT8))
        .isEqualTo(new TypedRational(UINT8, r("255")));
    assertThat(ConstantEvaluator.convertType(r("256"), UINT8)).isNull();
    assertThat(ConstantEvaluator.convertType(r("-1"), UINT8)).isNull();
    assertThat(ConstantEvaluator.convertType(r("-128"), INT8))
        .isEqualTo(new TypedRational(INT8, r("-128")));
    assertThat(ConstantEvaluator.convertType(r("-129"), INT8)).isNull();
    // In-range fractions are truncated toward zero.
    assertThat(ConstantEvaluator.convertType(r("-7/2"), INT8))
        .isEqualTo(new TypedRational(INT8, r("-3")));
    TypedRational asRational =
        ConstantEvaluator.convertType(r("1/3"), TypeProvider.rationalNumber(r("5")));
    assertThat(asRational.type).isEqualTo(TypeProvider.rationalNumber(r("1/3")));
    assertThat(asRational.value).isEqualTo(r("1/3"));
    assertThat(ConstantEvaluator.convertType(r("1"), TypeProvider.bool())).isNull();
  }

  private static Object[] integerBounds() {
    return new Object[] {
      new Object[] {8, false}, new Object[] {8, true}, new Object[] {64, true},
      new Object[] {256, false}, new Object[] {256, true},
    };
  }

  @Test
  @Parameters(method = "integerBounds")
  public void convertTypeAtBounds(int bits, boolean signed) {
    IntegerType type = TypeProvider.integer(bits, signed);
    assertThat(ConstantEvaluator.convertType(type.maxValue(), type).value)
        .isEqualTo(type.maxValue());
    assertThat(ConstantEvaluator.convertType(type.minValue(), type).value)
        .isEqualTo(type.minValue());
    assertThat(ConstantEvaluator.convertType(type.maxValue().add(Rational.ONE), type)).isNull();
    assertThat(ConstantEvaluator.convertType(type.minValue().subtract(Rational.ONE), type))
        .isNull();
  }

  @Test
  public void literalArithmetic() {
    Expression expr = binary(binary(number("2"), Token.EXP, number("10")), Token.ADD, number("1"));
    TypedRational result = ConstantEvaluator.evaluate(reporter, expr);
    assertThat(result)
        .isEqualTo(new TypedRational(TypeProvider.rationalNumber(r("1025")), r("1025")));
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void fractionsStayExact() {
    Expression expr = binary(number("1"), Token.DIV, number("3"));
    expr = binary(expr, Token.MUL, number("3"));
    assertThat(ConstantEvaluator.evaluate(reporter, expr).value).isEqualTo(Rational.ONE);
  }

  @Test
  public void undefinedOperatorsAreSilent() {
    assertThat(ConstantEvaluator.evaluate(reporter, binary(number("1"), Token.DIV, number("0"))))
        .isNull();
    assertThat(ConstantEvaluator.evaluate(reporter, binary(number("4"), Token.EXP, number("0.5"))))
        .isNull();
    assertThat(ConstantEvaluator.evaluate(reporter, binary(number("1"), Token.SHL, number("5000"))))
        .isNull();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void comparisonsHaveNoValue() {
    Expression expr = binary(number("1"), Token.LESS_THAN, number("2"));
    assertThat(ConstantEvaluator.evaluate(reporter, expr)).isNull();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void nonNumericLiterals() {
    assertThat(ConstantEvaluator.evaluate(reporter, Literal.bool(loc(), true))).isNull();
    Literal string = new Literal(loc(), Literal.Kind.STRING, "abc", null);
    assertThat(ConstantEvaluator.evaluate(reporter, string)).isNull();
    assertThat(ConstantEvaluator.evaluate(reporter, number("1e5000"))).isNull();
  }

  @Test
  public void sizedConstants() {
    VariableDeclaration c = constant("c", UINT8, number("200"));
    TypedRational sum =
        ConstantEvaluator.evaluate(reporter, binary(ref(c), Token.ADD, number("55")));
    assertThat(sum).isEqualTo(new TypedRational(UINT8, r("255")));
    // A constant whose initializer doesn't fit its type has no value.
    VariableDeclaration big = constant("big", UINT8, number("256"));
    assertThat(ConstantEvaluator.evaluate(reporter, ref(big))).isNull();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void identifierAliasesDeclaration() {
    VariableDeclaration c = constant("c", INT8, number("5"));
    ConstantEvaluator evaluator = new ConstantEvaluator(reporter);
    TypedRational viaIdentifier = evaluator.evaluate(ref(c));
    assertThat(viaIdentifier).isEqualTo(new TypedRational(INT8, r("5")));
    assertThat(evaluator.evaluate(c)).isSameInstanceAs(viaIdentifier);
  }

  @Test
  public void negativeConstant() {
    VariableDeclaration c =
        constant("c", INT8, new UnaryOperation(loc(), Token.SUB, number("5")));
    assertThat(ConstantEvaluator.evaluate(reporter, ref(c)))
        .isEqualTo(new TypedRational(INT8, r("-5")));
  }

  @Test
  public void nonConstantReferences() {
    VariableDeclaration v = VariableDeclaration.variable(loc(), "v", UINT8);
    assertThat(ConstantEvaluator.evaluate(reporter, ref(v))).isNull();
    VariableDeclaration untyped = VariableDeclaration.constant(loc(), "u", null, number("1"));
    assertThat(ConstantEvaluator.evaluate(reporter, ref(untyped))).isNull();
    VariableDeclaration uninitialized = VariableDeclaration.constant(loc(), "w", UINT8, null);
    assertThat(ConstantEvaluator.evaluate(reporter, ref(uninitialized))).isNull();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void evaluatingNonConstantDeclarationFails() {
    VariableDeclaration v = VariableDeclaration.variable(loc(), "v", UINT8);
    ConstantEvaluator evaluator = new ConstantEvaluator(reporter);
    assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(v));
  }

  @Test
  public void tuples() {
    Expression paren = TupleExpression.paren(loc(), binary(number("6"), Token.MUL, number("7")));
    assertThat(ConstantEvaluator.evaluate(reporter, paren).value).isEqualTo(r("42"));
    TupleExpression pair =
        new TupleExpression(loc(), ImmutableList.of(number("1"), number("2")), false);
    assertThat(ConstantEvaluator.evaluate(reporter, pair)).isNull();
    TupleExpression array = new TupleExpression(loc(), ImmutableList.of(number("1")), true);
    assertThat(ConstantEvaluator.evaluate(reporter, array)).isNull();
  }

  private Diagnostic onlyDiagnostic() {
    assertThat(reporter.diagnostics()).hasSize(1);
    return reporter.diagnostics().get(0);
  }

  @Test
  public void binaryOverflowIsFatal() {
    VariableDeclaration c = constant("c", UINT8, number("200"));
    BinaryOperation sum = binary(ref(c), Token.ADD, number("56"));
    assertThat(ConstantEvaluator.evaluate(reporter, sum)).isNull();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ConstantEvaluator.BINARY_ARITHMETIC_ERROR);
    assertThat(diagnostic.severity).isEqualTo(Severity.FATAL_ERROR);
    assertThat(diagnostic.location).isEqualTo(sum.location());
    assertThat(diagnostic.message).isEqualTo("Arithmetic error when computing constant value.");
  }

  @Test
  public void unaryOverflowIsFatal() {
    VariableDeclaration min =
        constant("min", INT8, new UnaryOperation(loc(), Token.SUB, number("128")));
    UnaryOperation negated = new UnaryOperation(loc(), Token.SUB, ref(min));
    assertThat(ConstantEvaluator.evaluate(reporter, negated)).isNull();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ConstantEvaluator.UNARY_ARITHMETIC_ERROR);
    assertThat(diagnostic.location).isEqualTo(negated.location());
    assertThat(reporter.hasFatalErrors()).isTrue();
  }

  @Test
  public void unsignedNegationHasNoValue() {
    VariableDeclaration c = constant("c", UINT8, number("1"));
    assertThat(ConstantEvaluator.evaluate(reporter, new UnaryOperation(loc(), Token.SUB, ref(c))))
        .isNull();
    assertThat(reporter.diagnostics()).isEmpty();
  }

  @Test
  public void incompatibleOperandsAreFatal() {
    VariableDeclaration a = constant("a", UINT8, number("1"));
    VariableDeclaration b = constant("b", INT8, number("1"));
    BinaryOperation sum = binary(ref(a), Token.ADD, ref(b));
    assertThat(ConstantEvaluator.evaluate(reporter, sum)).isNull();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ConstantEvaluator.INCOMPATIBLE_OPERATOR);
    assertThat(diagnostic.message)
        .isEqualTo("Operator + not compatible with types uint8 and int8");
  }

  @Test
  public void cyclicConstants() {
    Identifier refB = new Identifier(loc(), "b");
    VariableDeclaration a = constant("a", TypeProvider.uint256(), refB);
    VariableDeclaration b = constant("b", TypeProvider.uint256(), ref(a));
    refB.resolve(b);
    ConstantEvaluator evaluator = new ConstantEvaluator(reporter);
    assertThat(evaluator.evaluate(a)).isNull();
    assertThat(evaluator.aborted()).isTrue();
    Diagnostic diagnostic = onlyDiagnostic();
    assertThat(diagnostic.errorId).isEqualTo(ConstantEvaluator.CYCLIC_DEFINITION);
    assertThat(diagnostic.severity).isEqualTo(Severity.FATAL_ERROR);
    // Once aborted, nothing more is evaluated.
    assertThat(evaluator.evaluate(number("1"))).isNull();
    assertThat(evaluator.evaluate(b)).isNull();
    assertThat(reporter.diagnostics()).hasSize(1);
  }

  /**
   * Returns the first of a chain of {@code length} constants, each initialized to the next, the
   * last initialized to 7.
   */
  private VariableDeclaration chain(int length) {
    VariableDeclaration next = constant("c" + length, UINT8, number("7"));
    for (int i = length - 1; i > 0; i--) {
      next = constant("c" + i, UINT8, ref(next));
    }
    return next;
  }

  @Test
  public void deepChains() {
    ConstantEvaluator evaluator = new ConstantEvaluator(reporter);
    assertThat(evaluator.evaluate(chain(ConstantEvaluator.MAX_DEPTH)))
        .isEqualTo(new TypedRational(UINT8, r("7")));
    assertThat(reporter.diagnostics()).isEmpty();
    // Acyclic chains beyond the limit are rejected too.
    assertThat(evaluator.evaluate(chain(ConstantEvaluator.MAX_DEPTH + 1))).isNull();
    assertThat(onlyDiagnostic().errorId).isEqualTo(ConstantEvaluator.CYCLIC_DEFINITION);
  }

  @Test
  public void resultsAreCached() {
    VariableDeclaration c = constant("c", UINT8, binary(number("3"), Token.MUL, number("4")));
    Expression expr = binary(ref(c), Token.SHL, number("2"));
    ConstantEvaluator evaluator = new ConstantEvaluator(reporter);
    @Nullable TypedRational first = evaluator.evaluate(expr);
    assertThat(first).isEqualTo(new TypedRational(UINT8, r("48")));
    assertThat(evaluator.evaluate(expr)).isSameInstanceAs(first);
    // A fresh evaluator computes an equal value.
    assertThat(new ConstantEvaluator(reporter).evaluate(expr)).isEqualTo(first);
    assertThat(reporter.diagnostics()).isEmpty();
  }
}
