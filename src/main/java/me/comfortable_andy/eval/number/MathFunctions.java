package me.comfortable_andy.eval.number;

/**
 * Integer and gamma helpers shared by the numeric tower and the evaluators.
 *
 * @author AndyNoob
 */
public final class MathFunctions {

    private static final double[] LANCZOS = {
            0.99999999999980993,
            676.5203681218851,
            -1259.1392167224028,
            771.32342877765313,
            -176.61502916214059,
            12.507343278686905,
            -0.13857109526572012,
            9.9843695780195716e-6,
            1.5056327351493116e-7
    };
    private static final int LANCZOS_G = 7;

    private MathFunctions() {
    }

    /**
     * Greatest common divisor carrying the product of the operands' signs, so that dividing a
     * fraction by it never flips the sign of the numerator-denominator pair as a whole.
     */
    public static long gcd(long a, long b) {
        int sign = 1;
        if (a < 0) sign = -sign;
        if (b < 0) sign = -sign;
        while (b != 0) {
            final long m = a % b;
            a = b;
            b = m;
        }
        return sign * Math.abs(a);
    }

    public static double logGamma(double a) {
        if (a < 0) throw new IllegalArgumentException("Log gamma calls should be > 0.");
        // lanczos is accurate to 15 digits below 171
        if (a >= 171) return logStirlingApproximation(a);
        return Math.log(lanczosApproximation(a));
    }

    private static double logStirlingApproximation(double x) {
        final double t = 0.5 * Math.log(2 * Math.PI) - 0.5 * Math.log(x) + x * Math.log(x) - x;
        final double x2 = x * x;
        final double x3 = x2 * x;
        final double x4 = x3 * x;
        final double error = Math.log(1 + (1.0 / (12 * x)) + (1.0 / (288 * x2)) - (139.0 / (51840 * x3)) - (571.0 / (2488320 * x4)));
        return t + error;
    }

    private static double lanczosApproximation(double x) {
        if (Math.abs(x - Math.floor(x)) < 1e-16) {
            final long n = (long) x;
            return n >= 1 ? factorialAsDouble(n - 1) : Double.POSITIVE_INFINITY;
        }
        x--;
        double y = LANCZOS[0];
        for (int i = 1; i < LANCZOS_G + 2; i++)
            y += LANCZOS[i] / (x + i);
        final double t = x + LANCZOS_G + 0.5;
        return Math.sqrt(2 * Math.PI) * Math.exp((x + 0.5) * Math.log(t) - t) * y;
    }

    private static double factorialAsDouble(long n) {
        double result = 1;
        for (long i = 2; i <= n; i++)
            result *= i;
        return result;
    }

    public static long factorial(long n) {
        if (n < 0) throw new IllegalArgumentException("Factorial calls should be > 0.");
        long result = 1;
        for (long i = 2; i <= n; i++)
            result = Math.multiplyExact(result, i);
        return result;
    }

    public static long semiFactorial(long n) {
        if (n < 0) throw new IllegalArgumentException("Semi-factorial calls should be > 0.");
        long result = 1;
        while (n >= 2) {
            result = Math.multiplyExact(result, n);
            n -= 2;
        }
        return result;
    }

}
