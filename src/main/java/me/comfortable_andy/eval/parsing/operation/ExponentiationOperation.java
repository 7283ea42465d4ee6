package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

import static me.comfortable_andy.eval.parsing.operation.Numerics.*;

/**
 * Exponentiation. Besides folding literals it drops trivial exponents and collapses a power
 * raised to a literal exponent, {@code (x^a)^b}, into {@code x^(a*b)}.
 *
 * @author AndyNoob
 */
public class ExponentiationOperation implements MathOperation {

    private final MultiplicationOperation multiplication = new MultiplicationOperation();

    @Override
    public Node makeNode(Node left, Node right) {
        return simplify(left, right).orElseGet(() -> new InfixExpressionNode(InfixOperator.EXPONENTIATION, left, right));
    }

    private Optional<Node> simplify(Node left, Node right) {
        if (!isNumeric(right)) return Optional.empty();
        if (isZero(left) && isZero(right)) throw MathParserException.zeroToZero();
        if (bothNumeric(left, right)) return fold((NumericNode) left, (NumericNode) right);
        if (isZero(right)) return Optional.of(new IntegerNode(1));
        if (isOne(right)) return Optional.of(left);
        if (left instanceof InfixExpressionNode && ((InfixExpressionNode) left).operator() == InfixOperator.EXPONENTIATION)
            return Optional.of(doubleExponentiation((InfixExpressionNode) left, right));
        return Optional.empty();
    }

    private Node doubleExponentiation(InfixExpressionNode power, Node exponent) {
        if (power.operator() != InfixOperator.EXPONENTIATION)
            throw MathParserException.unexpectedOperator(power.symbol(), InfixOperator.EXPONENTIATION.getSymbol());
        if (power.left() == null || power.right() == null) throw MathParserException.nullOperand();
        return makeNode(power.left(), this.multiplication.makeNode(power.right(), exponent));
    }

    private Optional<Node> fold(NumericNode left, NumericNode right) {
        switch (resultingType(left, right)) {
            case INTEGER:
                return Optional.of(integerPower(((IntegerNode) left).value(), ((IntegerNode) right).value()));
            case RATIONAL:
                final double result = Math.pow(left.doubleValue(), right.doubleValue());
                if (!Double.isFinite(result)) return Optional.of(new FloatNode(result));
                try {
                    return Optional.of(new RationalNode(Rational.fromDouble(result)));
                } catch (MathParserException e) {
                    // no fraction with long terms is close enough
                    if (e.reason() != MathParserException.Reason.UNEXPECTED_VALUE) throw e;
                    return Optional.of(new FloatNode(result));
                }
            default:
                return Optional.of(new FloatNode(Math.pow(left.doubleValue(), right.doubleValue())));
        }
    }

    // negative exponents stay exact as 1/(b^n), overflow degrades to a float
    private NumericNode integerPower(long base, long exponent) {
        try {
            long result = 1;
            long square = base;
            // square and multiply
            for (long n = Math.abs(exponent); n > 0; n >>= 1) {
                if ((n & 1) == 1) result = Math.multiplyExact(result, square);
                if (n > 1) square = Math.multiplyExact(square, square);
            }
            if (exponent >= 0) return new IntegerNode(result);
            if (result == 0) throw MathParserException.divisionByZero();
            return new RationalNode(1, result);
        } catch (ArithmeticException e) {
            return new FloatNode(Math.pow(base, exponent));
        }
    }

}
