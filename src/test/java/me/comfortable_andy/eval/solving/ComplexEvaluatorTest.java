package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.lexing.ComplexMathLexer;
import me.comfortable_andy.eval.number.Complex;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.Parser;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ComplexEvaluatorTest {

    private static final double EPSILON = 0.000001;

    private static Complex evaluate(String expression, Map<String, ?> variables) {
        return new Parser().parse(new ComplexMathLexer().tokenize(expression)).accept(new ComplexEvaluator(variables));
    }

    private static Complex evaluate(String expression) {
        return evaluate(expression, new HashMap<>());
    }

    private static void assertComplex(double real, double imaginary, Complex actual) {
        assertEquals(real, actual.real(), EPSILON, actual.toString());
        assertEquals(imaginary, actual.imaginary(), EPSILON, actual.toString());
    }

    @Test
    public void testArithmetic() {
        assertComplex(-1, 0, evaluate("i^2"));
        assertComplex(0, 1, evaluate("sqrt(-1)"));
        assertComplex(5, 5, evaluate("(1+2i)*(3-i)"));
        assertComplex(0, -1, evaluate("1/i"));
        assertComplex(-1, 0, evaluate("e^(i*pi)"));
        assertComplex(0.5, 0, evaluate("1/2"));
    }

    @Test
    public void testFunctions() {
        assertComplex(3, -4, evaluate("conj(3+4i)"));
        assertComplex(5, 0, evaluate("abs(3+4i)"));
        assertComplex(3, 0, evaluate("re(3+4i)"));
        assertComplex(4, 0, evaluate("im(3+4i)"));
        assertComplex(Math.PI / 2, 0, evaluate("arg(i)"));
        assertComplex(0, Math.PI, evaluate("log(-1)"));
        assertComplex(2, 0, evaluate("lg(100)"));
        assertComplex(Math.sinh(1), 0, evaluate("-i*sin(i)"));

        MathParserException exception = assertThrows(MathParserException.class, () -> evaluate("ln(-1)"));
        assertEquals(MathParserException.Reason.UNEXPECTED_VALUE, exception.reason());
        exception = assertThrows(MathParserException.class, () -> evaluate("ln(i)"));
        assertEquals(MathParserException.Reason.UNEXPECTED_VALUE, exception.reason());
        exception = assertThrows(MathParserException.class, () -> evaluate("log(0)"));
        assertEquals(MathParserException.Reason.LOGARITHM_OF_ZERO, exception.reason());
    }

    @Test
    public void testVariables() {
        final Map<String, Object> variables = new HashMap<>();
        variables.put("z", "1+2i");
        variables.put("w", new Rational(1, 2));
        variables.put("n", 2);
        assertComplex(2.5, 1, evaluate("z*w + n", variables));
        assertComplex(-3, 4, evaluate("z^2", variables));

        MathParserException exception = assertThrows(MathParserException.class, () -> evaluate("z!", variables));
        assertEquals(MathParserException.Reason.UNKNOWN_FUNCTION, exception.reason());
        exception = assertThrows(MathParserException.class, () -> evaluate("u"));
        assertEquals(MathParserException.Reason.UNKNOWN_VARIABLE, exception.reason());

        variables.put("b", Boolean.TRUE);
        assertThrows(MathParserException.class, () -> new ComplexEvaluator(variables));
    }

}
