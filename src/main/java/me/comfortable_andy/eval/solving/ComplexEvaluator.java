package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.Complex;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates a tree over the complex numbers. Variable values may be {@link Complex}es,
 * {@link Rational}s, {@link Number}s or strings such as {@code "1+2i"}.
 *
 * @author AndyNoob
 */
public class ComplexEvaluator implements Visitor<Complex> {

    private static final double LN10 = Math.log(10);

    private final Map<String, Complex> variables;

    public ComplexEvaluator() {
        this(Collections.emptyMap());
    }

    public ComplexEvaluator(Map<String, ?> variables) {
        this.variables = new HashMap<>();
        variables.forEach((name, value) -> this.variables.put(name, toComplex(value)));
    }

    private static Complex toComplex(Object value) {
        if (value instanceof Complex) return (Complex) value;
        if (value instanceof Rational) return Complex.parse((Rational) value);
        if (value instanceof Number) return Complex.parse(((Number) value).doubleValue());
        if (value instanceof String) return Complex.parse((String) value);
        throw MathParserException.unexpectedValue("Expecting complex number, got " + value);
    }

    @Override
    public Complex visit(IntegerNode node) {
        return new Complex(node.value(), 0);
    }

    @Override
    public Complex visit(RationalNode node) {
        return Complex.parse(node.value());
    }

    @Override
    public Complex visit(FloatNode node) {
        return new Complex(node.value(), 0);
    }

    @Override
    public Complex visit(BooleanNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Complex visit(VariableNode node) {
        final Complex value = this.variables.get(node.name());
        if (value == null) throw MathParserException.unknownVariable(node.name());
        return value;
    }

    @Override
    public Complex visit(ConstantNode node) {
        switch (node.name()) {
            case "pi":
                return new Complex(Math.PI, 0);
            case "e":
                return new Complex(Math.E, 0);
            case "i":
                return Complex.I;
            default:
                throw MathParserException.unknownConstant(node.name());
        }
    }

    @Override
    public Complex visit(StringNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Complex visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = node.operator() == InfixOperator.SUBTRACTION || node.operator() == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();
        if (right == null) return left.accept(this).negate();

        final Complex a = left.accept(this);
        final Complex b = right.accept(this);
        switch (node.operator()) {
            case ADDITION:
                return Complex.add(a, b);
            case SUBTRACTION:
                return Complex.sub(a, b);
            case MULTIPLICATION:
                return Complex.mul(a, b);
            case DIVISION:
                return Complex.div(a, b);
            case EXPONENTIATION:
                return Complex.pow(a, b);
            default:
                throw MathParserException.unknownOperator(node.operator().getSymbol());
        }
    }

    @Override
    public Complex visit(TernaryExpressionNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Complex visit(FunctionNode node) {
        if (node.operand() == null) throw MathParserException.nullOperand();
        final Complex z = node.operand().accept(this);

        switch (node.name()) {
            case "sin":
                return Complex.sin(z);
            case "cos":
                return Complex.cos(z);
            case "tan":
                return Complex.tan(z);
            case "cot":
                return Complex.cot(z);
            case "arcsin":
                return Complex.arcsin(z);
            case "arccos":
                return Complex.arccos(z);
            case "arctan":
                return Complex.arctan(z);
            case "arccot":
                return Complex.arccot(z);
            case "sinh":
                return Complex.sinh(z);
            case "cosh":
                return Complex.cosh(z);
            case "tanh":
                return Complex.tanh(z);
            case "coth":
                return Complex.div(Complex.ONE, Complex.tanh(z));
            case "arsinh":
                return Complex.arsinh(z);
            case "arcosh":
                return Complex.arcosh(z);
            case "artanh":
                return Complex.artanh(z);
            case "arcoth":
                return Complex.div(Complex.ONE, Complex.artanh(z));
            case "exp":
                return Complex.exp(z);
            case "ln":
                if (!z.isReal() || z.real() <= 0)
                    throw MathParserException.unexpectedValue("Expecting positive real number (ln)");
                return Complex.log(z);
            case "log":
                return Complex.log(z);
            case "lg":
                return Complex.div(Complex.log(z), new Complex(LN10, 0));
            case "sqrt":
                return Complex.sqrt(z);
            case "abs":
                return new Complex(z.abs(), 0);
            case "arg":
                return new Complex(z.arg(), 0);
            case "re":
                return new Complex(z.real(), 0);
            case "im":
                return new Complex(z.imaginary(), 0);
            case "conj":
                return z.conjugate();
            default:
                throw MathParserException.unknownFunction(node.name());
        }
    }

}
