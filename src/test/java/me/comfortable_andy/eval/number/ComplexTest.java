package me.comfortable_andy.eval.number;

import me.comfortable_andy.eval.exception.MathParserException;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ComplexTest {

    private static final double EPSILON = 1e-9;

    private static void assertComplex(double real, double imaginary, Complex actual) {
        assertEquals(real, actual.real(), EPSILON, "real part of " + actual);
        assertEquals(imaginary, actual.imaginary(), EPSILON, "imaginary part of " + actual);
    }

    @Test
    public void testParse() {
        assertComplex(1, 2, Complex.parse("1+2i"));
        assertComplex(0, -1, Complex.parse("-i"));
        assertComplex(0, 1, Complex.parse("i"));
        assertComplex(-3, -4, Complex.parse("-3-4i"));
        assertComplex(2.0 / 3, 0, Complex.parse("2/3"));
        assertComplex(2.5, 0, Complex.parse("2.5"));
        assertComplex(0.5, 0, Complex.parse(new Rational(1, 2)));
        assertThrows(MathParserException.class, () -> Complex.parse("abc"));
    }

    @Test
    public void testArithmetic() {
        final Complex z = new Complex(1, 2);
        final Complex w = new Complex(3, -1);
        assertComplex(4, 1, Complex.add(z, w));
        assertComplex(-2, 3, Complex.sub(z, w));
        assertComplex(5, 5, Complex.mul(z, w));
        assertComplex(0.1, 0.7, Complex.div(z, w));
        assertThrows(MathParserException.class, () -> Complex.div(z, Complex.ZERO));
        assertComplex(-1, 0, Complex.mul(Complex.I, Complex.I));
    }

    @Test
    public void testPowers() {
        assertComplex(-1, 0, Complex.pow(Complex.I, new Complex(2, 0)));
        assertComplex(0, -1, Complex.pow(Complex.I, 3));
        assertComplex(0, 1, Complex.sqrt(new Complex(-1, 0)));
        // e^(i pi) = -1
        assertComplex(-1, 0, Complex.exp(new Complex(0, Math.PI)));
        // principal branch of i^i is e^(-pi/2)
        assertComplex(Math.exp(-Math.PI / 2), 0, Complex.pow(Complex.I, Complex.I));
    }

    @Test
    public void testLogarithm() {
        assertComplex(0, Math.PI, Complex.log(new Complex(-1, 0)));
        final MathParserException exception = assertThrows(MathParserException.class, () -> Complex.log(Complex.ZERO));
        assertEquals(MathParserException.Reason.LOGARITHM_OF_ZERO, exception.reason());
    }

    @Test
    public void testTrigonometry() {
        final Complex z = new Complex(0.3, 0.4);
        assertComplex(z.real(), z.imaginary(), Complex.arcsin(Complex.sin(z)));
        assertComplex(z.real(), z.imaginary(), Complex.arctan(Complex.tan(z)));
        assertComplex(z.real(), z.imaginary(), Complex.arsinh(Complex.sinh(z)));
        assertComplex(Math.cosh(1), 0, Complex.cos(new Complex(0, 1)));
    }

    @Test
    public void testAccessors() {
        final Complex z = new Complex(3, 4);
        assertEquals(5, z.abs(), EPSILON);
        assertEquals(Math.atan2(4, 3), z.arg(), EPSILON);
        assertEquals(new Complex(3, -4), z.conjugate());
        assertFalse(z.isReal());
    }

    @Test
    public void testToString() {
        assertEquals("1+2i", new Complex(1, 2).toString());
        assertEquals("-i", new Complex(0, -1).toString());
        assertEquals("i", Complex.I.toString());
        assertEquals("1/2", new Complex(0.5, 0).toString());
        assertEquals("1-i", new Complex(1, -1).toString());
        assertEquals("2/3i", new Complex(0, 2.0 / 3).toString());
    }

    @Test
    public void testToStringOutsideLongRange() {
        assertEquals(String.format(Locale.ROOT, "%f", 1e20), new Complex(1e20, 0).toString());
        assertNotEquals("9223372036854775807", new Complex(1e20, 0).toString());
        assertEquals(String.format(Locale.ROOT, "%f", -1e30), new Complex(-1e30, 0).toString());
        assertEquals(String.format(Locale.ROOT, "%f", 1e-30), new Complex(1e-30, 0).toString());
    }

}
