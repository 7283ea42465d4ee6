package me.comfortable_andy.eval.number;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.exception.MathParserException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable complex number. Multi-valued functions return the principal branch.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor
public final class Complex {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    private static final Pattern COMPLEX = Pattern.compile("^([-,+])?([0-9/,.]*?)([-,+]?)([0-9/,.]*?)i$");
    private static final Pattern SIGNED_REAL = Pattern.compile("^-?\\d+([,|.]\\d+)?$");

    private final double real;
    private final double imaginary;

    public static Complex parse(double value) {
        return new Complex(value, 0);
    }

    public static Complex parse(Rational value) {
        return new Complex(value.doubleValue(), 0);
    }

    /**
     * Accepts {@code a+bi}, {@code a-bi}, {@code bi}, {@code i}, {@code -i}, where each part may be a
     * fraction or a decimal, or a bare rational or real with no imaginary part.
     */
    public static Complex parse(String value) {
        final String trimmed = value.trim();
        final Matcher matcher = COMPLEX.matcher(trimmed);
        if (!matcher.matches()) {
            try {
                return parse(Rational.parse(trimmed));
            } catch (MathParserException e) {
                if (e.reason() != MathParserException.Reason.SYNTAX_ERROR) throw e;
                return new Complex(parseReal(trimmed), 0);
            }
        }

        final String leadingSign = group(matcher, 1);
        String middleSign = group(matcher, 3);
        String real = group(matcher, 2);
        if (real.isEmpty()) {
            // a pure imaginary, the leading sign belongs to the imaginary part
            middleSign = leadingSign;
            real = "0";
        }
        String imaginary = group(matcher, 4);
        if (imaginary.isEmpty()) imaginary = "1";
        if (leadingSign.equals("-")) real = "-" + real;
        if (middleSign.equals("-")) imaginary = "-" + imaginary;

        return new Complex(parsePart(real), parsePart(imaginary));
    }

    private static String group(Matcher matcher, int group) {
        final String found = matcher.group(group);
        return found == null ? "" : found;
    }

    private static double parsePart(String part) {
        try {
            return Rational.parse(part).doubleValue();
        } catch (MathParserException e) {
            if (e.reason() != MathParserException.Reason.SYNTAX_ERROR) throw e;
            return parseReal(part);
        }
    }

    private static double parseReal(String value) {
        if (value.isEmpty()) return 0;
        final String normalized = value.replace(',', '.');
        if (!SIGNED_REAL.matcher(normalized).matches()) throw MathParserException.syntaxError();
        return Double.parseDouble(normalized);
    }

    public double abs() {
        return Math.hypot(this.real, this.imaginary);
    }

    public double arg() {
        return Math.atan2(this.imaginary, this.real);
    }

    public boolean isReal() {
        return this.imaginary == 0.0;
    }

    public Complex conjugate() {
        return new Complex(this.real, -this.imaginary);
    }

    public Complex negate() {
        return new Complex(-this.real, -this.imaginary);
    }

    public static Complex add(Complex z, Complex w) {
        return new Complex(z.real + w.real, z.imaginary + w.imaginary);
    }

    public static Complex sub(Complex z, Complex w) {
        return new Complex(z.real - w.real, z.imaginary - w.imaginary);
    }

    public static Complex mul(Complex z, Complex w) {
        return new Complex(
                z.real * w.real - z.imaginary * w.imaginary,
                z.real * w.imaginary + z.imaginary * w.real
        );
    }

    public static Complex div(Complex z, Complex w) {
        final double d = w.real * w.real + w.imaginary * w.imaginary;
        if (d == 0.0) throw MathParserException.divisionByZero();
        return new Complex(
                (z.real * w.real + z.imaginary * w.imaginary) / d,
                (-z.real * w.imaginary + z.imaginary * w.real) / d
        );
    }

    public static Complex pow(Complex z, Complex w) {
        if (w.isReal() && w.real == Math.rint(w.real) && Math.abs(w.real) <= Integer.MAX_VALUE)
            return powi(z, (int) w.real);
        // principal branch, z^w = exp(w log z)
        return exp(mul(w, log(z)));
    }

    public static Complex pow(Complex z, int n) {
        return powi(z, n);
    }

    private static Complex powi(Complex z, int n) {
        if (n < 0) return div(ONE, powi(z, -n));
        if (n == 0) return ONE;
        Complex y = ONE;
        while (n > 1) {
            if (n % 2 == 0) {
                n /= 2;
            } else {
                y = mul(z, y);
                n = (n - 1) / 2;
            }
            z = mul(z, z);
        }
        return mul(z, y);
    }

    public static Complex sqrt(Complex z) {
        final double r = Math.sqrt(z.abs());
        final double theta = z.arg() / 2;
        return new Complex(r * Math.cos(theta), r * Math.sin(theta));
    }

    public static Complex exp(Complex z) {
        final double r = Math.exp(z.real);
        return new Complex(r * Math.cos(z.imaginary), r * Math.sin(z.imaginary));
    }

    public static Complex log(Complex z) {
        final double modulus = z.abs();
        if (modulus == 0.0) throw MathParserException.logarithmOfZero();
        return new Complex(Math.log(modulus), z.arg());
    }

    public static Complex sin(Complex z) {
        return new Complex(Math.sin(z.real) * Math.cosh(z.imaginary), Math.cos(z.real) * Math.sinh(z.imaginary));
    }

    public static Complex cos(Complex z) {
        return new Complex(Math.cos(z.real) * Math.cosh(z.imaginary), -Math.sin(z.real) * Math.sinh(z.imaginary));
    }

    public static Complex tan(Complex z) {
        final double d = Math.cos(z.real) * Math.cos(z.real) + Math.sinh(z.imaginary) * Math.sinh(z.imaginary);
        return new Complex(Math.sin(z.real) * Math.cos(z.real) / d, Math.sinh(z.imaginary) * Math.cosh(z.imaginary) / d);
    }

    public static Complex cot(Complex z) {
        final double d = Math.sin(z.real) * Math.sin(z.real) + Math.sinh(z.imaginary) * Math.sinh(z.imaginary);
        return new Complex(Math.sin(z.real) * Math.cos(z.real) / d, -Math.sinh(z.imaginary) * Math.cosh(z.imaginary) / d);
    }

    public static Complex arcsin(Complex z) {
        final Complex iz = mul(z, I);
        final Complex root = sqrt(sub(ONE, mul(z, z)));
        return div(log(add(iz, root)), I);
    }

    public static Complex arccos(Complex z) {
        final Complex root = mul(sqrt(sub(ONE, mul(z, z))), I);
        return div(log(add(z, root)), I);
    }

    public static Complex arctan(Complex z) {
        final Complex iz = mul(z, I);
        final Complex w = div(add(ONE, iz), sub(ONE, iz));
        return div(log(w), new Complex(0, 2));
    }

    public static Complex arccot(Complex z) {
        return sub(new Complex(Math.PI / 2, 0), arctan(z));
    }

    public static Complex sinh(Complex z) {
        return new Complex(Math.sinh(z.real) * Math.cos(z.imaginary), Math.cosh(z.real) * Math.sin(z.imaginary));
    }

    public static Complex cosh(Complex z) {
        return new Complex(Math.cosh(z.real) * Math.cos(z.imaginary), Math.sinh(z.real) * Math.sin(z.imaginary));
    }

    public static Complex tanh(Complex z) {
        final double d = Math.sinh(z.real) * Math.sinh(z.real) + Math.cos(z.imaginary) * Math.cos(z.imaginary);
        return new Complex(Math.sinh(z.real) * Math.cosh(z.real) / d, Math.sin(z.imaginary) * Math.cos(z.imaginary) / d);
    }

    public static Complex arsinh(Complex z) {
        return log(add(z, sqrt(add(ONE, mul(z, z)))));
    }

    public static Complex arcosh(Complex z) {
        return log(add(z, sqrt(add(new Complex(-1, 0), mul(z, z)))));
    }

    public static Complex artanh(Complex z) {
        return div(log(div(add(ONE, z), sub(ONE, z))), new Complex(2, 0));
    }

    public String signed() {
        final String str = toString();
        return str.startsWith("-") ? str : "+" + str;
    }

    @Override
    public String toString() {
        final String real = format(this.real, false);
        String imaginary = format(this.imaginary, true);

        if (this.imaginary == 0.0) return real;
        if (this.real == 0.0) {
            if (this.imaginary == 1.0) return "i";
            if (this.imaginary == -1.0) return "-i";
            if (imaginary.startsWith("+")) imaginary = imaginary.substring(1);
            return imaginary + "i";
        }
        if (this.imaginary == 1.0) imaginary = "+";
        if (this.imaginary == -1.0) imaginary = "-";
        return real + imaginary + "i";
    }

    // small denominators read better as fractions, anything else is printed as a fixed decimal
    private static String format(double part, boolean signed) {
        if (Double.isFinite(part) && Math.abs(part) < 0x1p63) {
            try {
                final Rational approximation = Rational.fromDouble(part);
                if (approximation.denominator() <= 100)
                    return signed ? approximation.signed() : approximation.toString();
            } catch (MathParserException e) {
                // too small for a long denominator
                if (e.reason() != MathParserException.Reason.UNEXPECTED_VALUE) throw e;
            }
        }
        return String.format(Locale.ROOT, signed ? "%+f" : "%f", part);
    }

}
