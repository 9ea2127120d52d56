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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.ledgerlang.ast.AstNode;
import org.ledgerlang.ast.AstVisitor;
import org.ledgerlang.ast.BinaryOperation;
import org.ledgerlang.ast.ContractDefinition;
import org.ledgerlang.ast.Expression;
import org.ledgerlang.ast.FunctionDefinition;
import org.ledgerlang.ast.Identifier;
import org.ledgerlang.ast.Literal;
import org.ledgerlang.ast.Token;
import org.ledgerlang.ast.TupleExpression;
import org.ledgerlang.ast.UnaryOperation;
import org.ledgerlang.ast.VariableDeclaration;
import org.ledgerlang.diagnostics.ErrorReporter;
import org.ledgerlang.types.IntegerType;
import org.ledgerlang.types.RationalNumberType;
import org.ledgerlang.types.Type;
import org.ledgerlang.types.TypeProvider;
import org.ledgerlang.util.Precision;
import org.ledgerlang.util.Rational;

/**
 * Evaluates constant expressions (literals, references to constants, and arithmetic on them) to
 * exact values, e.g. for array lengths.
 *
 * <p>Arithmetic is exact and "checked": an operator that is undefined for its operands (division by
 * zero, a bit operation on a fraction, an exponent or shift too large to compute within {@link
 * Precision#MAX_BITS} bits, ...) simply has no value, while a value that was computed but doesn't
 * fit the operation's result type is a fatal error.
 *
 * <p>Results are cached per node, so each node is evaluated at most once per evaluator. Constants
 * that refer to each other cyclically are detected by bounding the nesting depth of constant
 * initializers at {@link #MAX_DEPTH}; this also rejects acyclic chains that are too deep.
 *
 * <p>After reporting a fatal error an evaluator returns null for every node it has not already
 * evaluated, and the caller should stop analyzing the current unit.
 */
public final class ConstantEvaluator {

  /** The maximum nesting of constant initializers. */
  public static final int MAX_DEPTH = 32;

  static final int CYCLIC_DEFINITION = 5210;
  static final int INCOMPATIBLE_OPERATOR = 6020;
  static final int BINARY_ARITHMETIC_ERROR = 2643;
  static final int UNARY_ARITHMETIC_ERROR = 3667;

  private static final BigInteger BIG_UINT32_MAX = BigInteger.valueOf(Precision.UINT32_MAX);

  private final ErrorReporter errorReporter;

  /**
   * The result for each node we have evaluated; a null value means that the node has no constant
   * value, while a missing key means we haven't evaluated it yet.
   */
  private final Map<AstNode, @Nullable TypedRational> values = new IdentityHashMap<>();

  private final Visitor visitor = new Visitor();

  /** Set once this evaluator has reported a fatal error. */
  private boolean aborted;

  public ConstantEvaluator(ErrorReporter errorReporter) {
    this.errorReporter = errorReporter;
  }

  /** Evaluates a single expression with a new evaluator. */
  public static @Nullable TypedRational evaluate(ErrorReporter errorReporter, Expression expr) {
    return new ConstantEvaluator(errorReporter).evaluate(expr);
  }

  /**
   * Returns the value of the given expression or constant declaration, or null if it does not
   * have a constant value.
   */
  public @Nullable TypedRational evaluate(AstNode node) {
    return evaluate(node, 0);
  }

  /** True if this evaluator has reported a fatal error. */
  public boolean aborted() {
    return aborted;
  }

  /**
   * Evaluates {@code node}, which is nested inside {@code depth} constant initializers, caching
   * the result.
   */
  private @Nullable TypedRational evaluate(AstNode node, int depth) {
    if (values.containsKey(node)) {
      return values.get(node);
    } else if (aborted) {
      return null;
    }
    TypedRational result = node.accept(visitor, depth);
    values.put(node, result);
    return result;
  }

  @FormatMethod
  private void fatal(int errorId, AstNode node, String fmt, Object... fmtArgs) {
    errorReporter.fatalTypeError(errorId, node.location(), fmt, fmtArgs);
    aborted = true;
  }

  /** Each visit method returns the (uncached) value of the node it is passed. */
  private class Visitor implements AstVisitor<Integer, @Nullable TypedRational> {

    @Override
    public @Nullable TypedRational visitVariableDeclaration(
        VariableDeclaration declaration, Integer depth) {
      Preconditions.checkArgument(declaration.isConstant(), "%s is not constant", declaration);
      Expression value = declaration.value();
      Type type = declaration.type();
      if (value == null || type == null) {
        return null;
      }
      int nestedDepth = depth + 1;
      if (nestedDepth > MAX_DEPTH) {
        fatal(
            CYCLIC_DEFINITION,
            declaration,
            "Cyclic constant definition (or maximum recursion depth exhausted).");
        return null;
      }
      TypedRational initial = evaluate(value, nestedDepth);
      return (initial == null) ? null : convertType(initial.value, type);
    }

    @Override
    public @Nullable TypedRational visitBinaryOperation(BinaryOperation operation, Integer depth) {
      TypedRational left = evaluate(operation.left(), depth);
      TypedRational right = evaluate(operation.right(), depth);
      if (left == null || right == null) {
        return null;
      }
      Token op = operation.operator();
      if (op.isCompareOp()) {
        // Comparisons produce a bool, which is left to the type checker.
        return null;
      }
      Type resultType = left.type.binaryOperatorResult(op, right.type);
      if (resultType == null) {
        fatal(
            INCOMPATIBLE_OPERATOR,
            operation,
            "Operator %s not compatible with types %s and %s",
            op,
            left.type,
            right.type);
        return null;
      }
      left = convertType(left.value, resultType);
      right = convertType(right.value, resultType);
      if (left == null || right == null) {
        return null;
      }
      Rational result = evaluateBinaryOperator(op, left.value, right.value);
      if (result == null) {
        return null;
      }
      TypedRational converted = convertType(result, resultType);
      if (converted == null) {
        fatal(
            BINARY_ARITHMETIC_ERROR, operation, "Arithmetic error when computing constant value.");
      }
      return converted;
    }

    @Override
    public @Nullable TypedRational visitUnaryOperation(UnaryOperation operation, Integer depth) {
      TypedRational value = evaluate(operation.subExpression(), depth);
      if (value == null) {
        return null;
      }
      Token op = operation.operator();
      Type resultType = value.type.unaryOperatorResult(op);
      if (resultType == null) {
        return null;
      }
      value = convertType(value.value, resultType);
      if (value == null) {
        return null;
      }
      Rational result = evaluateUnaryOperator(op, value.value);
      if (result == null) {
        return null;
      }
      TypedRational converted = convertType(result, resultType);
      if (converted == null) {
        fatal(UNARY_ARITHMETIC_ERROR, operation, "Arithmetic error when computing constant value.");
      }
      return converted;
    }

    @Override
    public @Nullable TypedRational visitLiteral(Literal literal, Integer depth) {
      Type type = TypeProvider.forLiteral(literal);
      if (type instanceof RationalNumberType rational) {
        return new TypedRational(rational, rational.value());
      }
      return null;
    }

    @Override
    public @Nullable TypedRational visitIdentifier(Identifier identifier, Integer depth) {
      if (identifier.referencedDeclaration() instanceof VariableDeclaration declaration
          && declaration.isConstant()) {
        return evaluate(declaration, depth);
      }
      return null;
    }

    @Override
    public @Nullable TypedRational visitTuple(TupleExpression tuple, Integer depth) {
      if (!tuple.isInlineArray() && tuple.components().size() == 1) {
        return evaluate(tuple.components().get(0), depth);
      }
      return null;
    }

    @Override
    public @Nullable TypedRational visitContract(ContractDefinition contract, Integer depth) {
      return null;
    }

    @Override
    public @Nullable TypedRational visitFunction(FunctionDefinition function, Integer depth) {
      return null;
    }
  }

  /**
   * Converts {@code value} to {@code type}. Any value can be converted to a rational number type;
   * a value in range of an integer type is converted by truncating it toward zero. Returns null if
   * the value is out of range or the type is of any other category.
   */
  public static @Nullable TypedRational convertType(Rational value, Type type) {
    if (type.category() == Type.Category.RATIONAL_NUMBER) {
      return new TypedRational(TypeProvider.rationalNumber(value), value);
    } else if (type instanceof IntegerType intType) {
      if (!intType.contains(value)) {
        return null;
      }
      return new TypedRational(intType, Rational.of(value.truncate()));
    }
    return null;
  }

  /**
   * Applies a binary operator to two exact values. Returns null if the operator is not supported
   * (comparisons, logical operators, {@code >>>}) or is undefined for the given operands.
   */
  public static @Nullable Rational evaluateBinaryOperator(
      Token operator, Rational left, Rational right) {
    boolean fractional = !left.isIntegral() || !right.isIntegral();
    switch (operator) {
      case BIT_OR:
        return fractional ? null : Rational.of(left.numerator().or(right.numerator()));
      case BIT_XOR:
        return fractional ? null : Rational.of(left.numerator().xor(right.numerator()));
      case BIT_AND:
        return fractional ? null : Rational.of(left.numerator().and(right.numerator()));
      case ADD:
        return left.add(right);
      case SUB:
        return left.subtract(right);
      case MUL:
        return left.multiply(right);
      case DIV:
        return left.divide(right);
      case MOD:
        return left.remainder(right);
      case EXP:
        return power(left, right);
      case SHL:
        if (fractional || !isValidShiftAmount(right)) {
          return null;
        } else if (left.isZero()) {
          return Rational.ZERO;
        }
        long shift = right.numerator().longValueExact();
        if (!Precision.fitsPrecisionBase2(left.numerator().abs(), shift)) {
          return null;
        }
        return left.shiftLeft((int) shift);
      case SAR:
        if (fractional || !isValidShiftAmount(right)) {
          return null;
        }
        return left.shiftRight(right.numerator().longValueExact());
      default:
        return null;
    }
  }

  /** Shift amounts must be non-negative and fit in a uint32. */
  private static boolean isValidShiftAmount(Rational amount) {
    return amount.signum() >= 0 && amount.numerator().compareTo(BIG_UINT32_MAX) <= 0;
  }

  /** Returns {@code base ** exp}, or null if it is undefined or too large to compute. */
  private static @Nullable Rational power(Rational base, Rational exp) {
    if (!exp.isIntegral()) {
      return null;
    }
    BigInteger e = exp.numerator();
    if (e.signum() == 0) {
      return Rational.ONE;
    } else if (base.isZero() || base.equals(Rational.ONE)) {
      // The size of the exponent doesn't matter for 0, 1 and -1.
      return base;
    } else if (base.equals(Rational.MINUS_ONE)) {
      return e.testBit(0) ? Rational.MINUS_ONE : Rational.ONE;
    }
    BigInteger absExp = e.abs();
    if (absExp.compareTo(BIG_UINT32_MAX) > 0
        || !Precision.fitsPrecisionExp(base.numerator().abs(), absExp)
        || !Precision.fitsPrecisionExp(base.denominator(), absExp)) {
      return null;
    }
    // The guards limit the exponent to MAX_BITS, so it fits in an int.
    return base.pow(e.intValueExact());
  }

  /**
   * Applies a unary operator to an exact value. Returns null for operators other than {@code -}
   * and {@code ~}, and for {@code ~} applied to a fraction.
   */
  public static @Nullable Rational evaluateUnaryOperator(Token operator, Rational value) {
    switch (operator) {
      case BIT_NOT:
        return value.isIntegral() ? Rational.of(value.numerator().not()) : null;
      case SUB:
        return value.negate();
      default:
        return null;
    }
  }
}
