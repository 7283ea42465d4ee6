package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.MathFunctions;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates a tree exactly, as a fraction. Anything that leaves the rationals (floats,
 * constants, transcendental functions, irrational roots) is rejected.
 * <p>
 * Variable values may be {@link Rational}s, whole {@link Number}s or {@code "p/q"} strings.
 *
 * @author AndyNoob
 */
public class RationalEvaluator implements Visitor<Rational> {

    private static final String NOT_RATIONAL = "Expecting rational number";
    // trial division covers every factor of a number below 2^31
    private static final int SIEVE_LIMIT = 46341;

    private final Map<String, Rational> variables;
    // composite flags, filled on first factorization
    private BitSet sieve;

    public RationalEvaluator() {
        this(Collections.emptyMap());
    }

    public RationalEvaluator(Map<String, ?> variables) {
        this.variables = new HashMap<>();
        variables.forEach((name, value) -> this.variables.put(name, toRational(value)));
    }

    private static Rational toRational(Object value) {
        if (value instanceof Rational) return (Rational) value;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
            return Rational.of(((Number) value).longValue());
        if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            if (Math.rint(number) != number || Double.isInfinite(number))
                throw MathParserException.unexpectedValue(NOT_RATIONAL);
            return Rational.of((long) number);
        }
        if (value instanceof String) return Rational.parse((String) value);
        throw MathParserException.unexpectedValue(NOT_RATIONAL);
    }

    @Override
    public Rational visit(IntegerNode node) {
        return Rational.of(node.value());
    }

    @Override
    public Rational visit(RationalNode node) {
        return node.value();
    }

    @Override
    public Rational visit(FloatNode node) {
        throw MathParserException.unexpectedValue(NOT_RATIONAL);
    }

    @Override
    public Rational visit(BooleanNode node) {
        throw MathParserException.unexpectedValue(NOT_RATIONAL);
    }

    @Override
    public Rational visit(VariableNode node) {
        final Rational value = this.variables.get(node.name());
        if (value == null) throw MathParserException.unknownVariable(node.name());
        return value;
    }

    @Override
    public Rational visit(ConstantNode node) {
        switch (node.name()) {
            case "pi":
            case "e":
            case "i":
            case "NAN":
            case "INF":
                throw MathParserException.unexpectedValue(NOT_RATIONAL);
            default:
                throw MathParserException.unknownConstant(node.name());
        }
    }

    @Override
    public Rational visit(StringNode node) {
        throw MathParserException.unexpectedValue(NOT_RATIONAL);
    }

    @Override
    public Rational visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = node.operator() == InfixOperator.SUBTRACTION || node.operator() == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();

        final Rational a = left.accept(this);
        final Rational b = right == null ? null : right.accept(this);

        try {
            if (b == null) return a.negate();
            switch (node.operator()) {
                case ADDITION:
                    return Rational.add(a, b);
                case SUBTRACTION:
                    return Rational.sub(a, b);
                case MULTIPLICATION:
                    return Rational.mul(a, b);
                case DIVISION:
                    return Rational.div(a, b);
                case EXPONENTIATION:
                    return pow(a, b);
                default:
                    throw MathParserException.unknownOperator(node.operator().getSymbol());
            }
        } catch (ArithmeticException e) {
            throw overflow(e);
        }
    }

    @Override
    public Rational visit(TernaryExpressionNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Rational visit(FunctionNode node) {
        if (node.operand() == null) throw MathParserException.nullOperand();
        final Rational inner = node.operand().accept(this);

        switch (node.name()) {
            case "sin":
            case "cos":
            case "tan":
            case "cot":
            case "sind":
            case "cosd":
            case "tand":
            case "cotd":
            case "arcsin":
            case "arccos":
            case "arctan":
            case "arccot":
            case "exp":
            case "log":
            case "ln":
            case "lg":
            case "sinh":
            case "cosh":
            case "tanh":
            case "coth":
            case "arsinh":
            case "arcosh":
            case "artanh":
            case "arcoth":
                throw MathParserException.unexpectedValue(NOT_RATIONAL);
            case "abs":
                return new Rational(Math.abs(inner.numerator()), inner.denominator());
            case "sgn":
                return Rational.of(inner.numerator() >= 0 ? 1 : -1);
            case "sqrt":
                return pow(inner, new Rational(1, 2));
            case "!":
                if (!inner.isInteger() || inner.numerator() < 0)
                    throw MathParserException.unexpectedValue("Expecting positive integer (factorial)");
                try {
                    return Rational.of(MathFunctions.factorial(inner.numerator()));
                } catch (ArithmeticException e) {
                    throw overflow(e);
                }
            case "!!":
                if (!inner.isInteger() || inner.numerator() < 0)
                    throw MathParserException.unexpectedValue("Expecting positive integer (semi-factorial)");
                try {
                    return Rational.of(MathFunctions.semiFactorial(inner.numerator()));
                } catch (ArithmeticException e) {
                    throw overflow(e);
                }
            default:
                throw MathParserException.unknownFunction(node.name());
        }
    }

    /**
     * Factors {@code n} by trial division.
     *
     * @return prime to exponent, in increasing prime order
     */
    public Map<Long, Integer> factor(long n) {
        if (n < 1) throw MathParserException.unexpectedValue("Expecting positive integer, got " + n);
        final BitSet composite = sieve();
        final Map<Long, Integer> factors = new LinkedHashMap<>();
        for (int d = 2; d <= SIEVE_LIMIT && (long) d * d <= n; d++) {
            if (composite.get(d)) continue;
            while (n % d == 0) {
                factors.merge((long) d, 1, Integer::sum);
                n /= d;
            }
        }
        if (n > 1) {
            // the remainder has no factor below the limit, so it is prime only if small enough
            if (n > (long) SIEVE_LIMIT * SIEVE_LIMIT)
                throw MathParserException.unexpectedValue("Cannot factor " + n);
            factors.merge(n, 1, Integer::sum);
        }
        return factors;
    }

    /**
     * Splits {@code n} into {@code root^d * rest}, with {@code rest} free of d-th powers.
     *
     * @return {@code {root, rest}}
     */
    public long[] powerFreeFactorization(long n, int d) {
        long root = 1;
        long rest = 1;
        for (Map.Entry<Long, Integer> entry : factor(n).entrySet()) {
            final long prime = entry.getKey();
            final int exponent = entry.getValue();
            root = Math.multiplyExact(root, power(prime, exponent / d));
            rest = Math.multiplyExact(rest, power(prime, exponent % d));
        }
        return new long[]{root, rest};
    }

    private Rational pow(Rational base, Rational exponent) {
        if (exponent.isInteger()) {
            final long n = exponent.numerator();
            if (n >= 0) return new Rational(power(base.numerator(), n), power(base.denominator(), n));
            if (base.isZero()) throw MathParserException.divisionByZero();
            return new Rational(power(base.denominator(), -n), power(base.numerator(), -n));
        }
        if (base.numerator() < 0) throw MathParserException.unexpectedValue(NOT_RATIONAL);

        long p = base.numerator();
        long q = base.denominator();
        long alpha = exponent.numerator();
        final long beta = exponent.denominator();
        if (beta > Integer.MAX_VALUE) throw MathParserException.unexpectedValue(NOT_RATIONAL);

        if (alpha < 0) {
            if (p == 0) throw MathParserException.divisionByZero();
            final long swap = p;
            p = q;
            q = swap;
            alpha = -alpha;
        }
        if (p == 0) return Rational.of(0);

        final long[] top = powerFreeFactorization(power(p, alpha), (int) beta);
        final long[] bottom = powerFreeFactorization(power(q, alpha), (int) beta);
        if (top[1] == 1 && bottom[1] == 1) return new Rational(top[0], bottom[0]);
        throw MathParserException.unexpectedValue(NOT_RATIONAL);
    }

    private static long power(long base, long exponent) {
        long result = 1;
        while (exponent > 0) {
            if ((exponent & 1) == 1) result = Math.multiplyExact(result, base);
            exponent >>= 1;
            if (exponent > 0) base = Math.multiplyExact(base, base);
        }
        return result;
    }

    private BitSet sieve() {
        if (this.sieve == null) {
            final BitSet composite = new BitSet(SIEVE_LIMIT + 1);
            for (int i = 2; (long) i * i <= SIEVE_LIMIT; i++) {
                if (composite.get(i)) continue;
                for (int j = i * i; j <= SIEVE_LIMIT; j += i)
                    composite.set(j);
            }
            this.sieve = composite;
        }
        return this.sieve;
    }

    private static MathParserException overflow(ArithmeticException cause) {
        final MathParserException exception = MathParserException.unexpectedValue("Rational overflow");
        exception.initCause(cause);
        return exception;
    }

}
