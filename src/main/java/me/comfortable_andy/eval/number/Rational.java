package me.comfortable_andy.eval.number;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.exception.MathParserException;

import java.util.regex.Pattern;

/**
 * An exact fraction p/q. Normalized instances keep q positive and p, q coprime.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Rational {

    public static final double DEFAULT_TOLERANCE = 1e-7;

    private static final Pattern SIGNED_INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("^\\d+$");

    private final long numerator;
    private final long denominator;

    public Rational(long numerator, long denominator) {
        this(numerator, denominator, true);
    }

    public Rational(long numerator, long denominator, boolean normalize) {
        if (denominator == 0) throw MathParserException.divisionByZero();
        if (normalize) {
            final long gcd = MathFunctions.gcd(numerator, denominator);
            numerator /= gcd;
            denominator /= gcd;
            if (denominator < 0) {
                numerator = Math.negateExact(numerator);
                denominator = Math.negateExact(denominator);
            }
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(long value) {
        return new Rational(value, 1);
    }

    /**
     * Approximates a double by a continued fraction, stopping once the approximation is within
     * {@code x * tolerance} of {@code x}.
     *
     * @throws MathParserException {@code UNEXPECTED_VALUE} if {@code x} is not finite, or the
     *                             fraction needs a numerator or denominator outside the long range
     */
    public static Rational fromDouble(double x, double tolerance) {
        if (!Double.isFinite(x)) throw MathParserException.unexpectedValue("Cannot approximate " + x + " by a fraction");
        if (x == 0.0) return new Rational(0, 1);
        final boolean negative = x < 0;
        if (negative) x = Math.abs(x);

        double num1 = 1;
        double num2 = 0;
        double den1 = 0;
        double den2 = 1;
        double oneOver = 1 / x;
        do {
            oneOver = 1 / oneOver;
            final double floor = Math.floor(oneOver);
            double aux = num1;
            num1 = floor * num1 + num2;
            num2 = aux;
            aux = den1;
            den1 = floor * den1 + den2;
            den2 = aux;
            oneOver -= floor;
        } while (Math.abs(x - num1 / den1) > x * tolerance);

        if (!(num1 < 0x1p63) || !(den1 >= 1 && den1 < 0x1p63))
            throw MathParserException.unexpectedValue("Cannot approximate " + (negative ? -x : x) + " by a fraction");
        if (negative) num1 = -num1;
        return new Rational((long) num1, (long) den1);
    }

    public static Rational fromDouble(double x) {
        return fromDouble(x, DEFAULT_TOLERANCE);
    }

    public static Rational parse(Rational value) {
        return value;
    }

    public static Rational parse(String value) {
        return parse(value, true);
    }

    /**
     * Parses {@code "p"} or {@code "p/q"}, with an optional minus sign on {@code p} only.
     */
    public static Rational parse(String value, boolean normalize) {
        if (value == null || value.isEmpty()) throw MathParserException.syntaxError();
        final String[] parts = value.split("/", -1);
        if (parts.length > 2) throw MathParserException.syntaxError();
        if (!SIGNED_INTEGER.matcher(parts[0]).matches()) throw MathParserException.syntaxError();
        if (parts.length == 2 && !UNSIGNED_INTEGER.matcher(parts[1]).matches())
            throw MathParserException.syntaxError();
        try {
            final long p = Long.parseLong(parts[0]);
            final long q = parts.length == 2 ? Long.parseLong(parts[1]) : 1;
            return new Rational(p, q, normalize);
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            throw MathParserException.syntaxError();
        }
    }

    /**
     * @throws ArithmeticException if the sum does not fit in longs
     */
    public static Rational add(Rational x, Rational y) {
        final long gcd = MathFunctions.gcd(x.denominator, y.denominator);
        return new Rational(
                Math.addExact(Math.multiplyExact(x.numerator, y.denominator / gcd), Math.multiplyExact(y.numerator, x.denominator / gcd)),
                Math.multiplyExact(x.denominator, y.denominator / gcd)
        );
    }

    /**
     * @throws ArithmeticException if the difference does not fit in longs
     */
    public static Rational sub(Rational x, Rational y) {
        final long gcd = MathFunctions.gcd(x.denominator, y.denominator);
        return new Rational(
                Math.subtractExact(Math.multiplyExact(x.numerator, y.denominator / gcd), Math.multiplyExact(y.numerator, x.denominator / gcd)),
                Math.multiplyExact(x.denominator, y.denominator / gcd)
        );
    }

    /**
     * Cross-reduces before multiplying, so only a product that really exceeds the long range fails.
     *
     * @throws ArithmeticException if the product does not fit in longs
     */
    public static Rational mul(Rational x, Rational y) {
        final long first = Math.abs(MathFunctions.gcd(x.numerator, y.denominator));
        final long second = Math.abs(MathFunctions.gcd(y.numerator, x.denominator));
        return new Rational(
                Math.multiplyExact(x.numerator / first, y.numerator / second),
                Math.multiplyExact(x.denominator / second, y.denominator / first)
        );
    }

    /**
     * @throws ArithmeticException if the quotient does not fit in longs
     */
    public static Rational div(Rational x, Rational y) {
        if (y.numerator == 0) throw MathParserException.divisionByZero();
        return mul(x, new Rational(y.denominator, y.numerator));
    }

    public Rational negate() {
        return new Rational(Math.negateExact(this.numerator), this.denominator, false);
    }

    public boolean isInteger() {
        return this.denominator == 1;
    }

    public boolean isZero() {
        return this.numerator == 0;
    }

    public int signum() {
        return Long.signum(this.numerator) * Long.signum(this.denominator);
    }

    public double doubleValue() {
        return (double) this.numerator / this.denominator;
    }

    /**
     * @return {@code +p} or {@code +p/q}, the sign always written out
     */
    public String signed() {
        final String sign = this.numerator < 0 ? "" : "+";
        if (this.denominator == 1) return sign + this.numerator;
        return sign + this.numerator + "/" + this.denominator;
    }

    @Override
    public String toString() {
        if (this.denominator == 1) return String.valueOf(this.numerator);
        return this.numerator + "/" + this.denominator;
    }

}
