package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.MathFunctions;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates a tree over doubles.
 *
 * @author AndyNoob
 */
public class StdMathEvaluator implements Visitor<Double> {

    private final Map<String, Double> variables;

    public StdMathEvaluator() {
        this(Collections.emptyMap());
    }

    public StdMathEvaluator(Map<String, ?> variables) {
        this.variables = new HashMap<>();
        variables.forEach((name, value) -> {
            if (!(value instanceof Number))
                throw MathParserException.unexpectedValue("Expecting a number for " + name + ", got " + value);
            this.variables.put(name, ((Number) value).doubleValue());
        });
    }

    @Override
    public Double visit(IntegerNode node) {
        return (double) node.value();
    }

    @Override
    public Double visit(RationalNode node) {
        return node.doubleValue();
    }

    @Override
    public Double visit(FloatNode node) {
        return node.value();
    }

    @Override
    public Double visit(BooleanNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Double visit(VariableNode node) {
        final Double value = this.variables.get(node.name());
        if (value == null) throw MathParserException.unknownVariable(node.name());
        return value;
    }

    @Override
    public Double visit(ConstantNode node) {
        return constant(node.name());
    }

    @Override
    public Double visit(StringNode node) {
        throw MathParserException.unexpectedValue("Expecting a number, got " + node.value());
    }

    @Override
    public Double visit(InfixExpressionNode node) {
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = node.operator() == InfixOperator.SUBTRACTION || node.operator() == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();
        if (right == null) return -left.accept(this);
        return operate(node.operator(), left.accept(this), right.accept(this));
    }

    @Override
    public Double visit(TernaryExpressionNode node) {
        throw MathParserException.syntaxError();
    }

    @Override
    public Double visit(FunctionNode node) {
        return function(node.name(), node.operand().accept(this));
    }

    public double constant(String name) {
        switch (name) {
            case "pi":
                return Math.PI;
            case "e":
                return Math.E;
            case "NAN":
                return Double.NaN;
            case "INF":
                return Double.POSITIVE_INFINITY;
            default:
                throw MathParserException.unknownConstant(name);
        }
    }

    public double operate(InfixOperator operator, double left, double right) {
        switch (operator) {
            case ADDITION:
                return left + right;
            case SUBTRACTION:
                return left - right;
            case MULTIPLICATION:
                return left * right;
            case DIVISION:
                if (right == 0.0) throw MathParserException.divisionByZero();
                return left / right;
            case EXPONENTIATION:
                if (left == 0.0 && right == 0.0) throw MathParserException.zeroToZero();
                if (left == Math.E) return Math.exp(right);
                return Math.pow(left, right);
            default:
                throw MathParserException.unknownOperator(operator.getSymbol());
        }
    }

    public double function(String name, double inner) {
        switch (name) {
            case "sin":
                return Math.sin(inner);
            case "cos":
                return Math.cos(inner);
            case "tan":
                return Math.tan(inner);
            case "cot":
                return cot(inner);
            case "sind":
                return Math.sin(Math.toRadians(inner));
            case "cosd":
                return Math.cos(Math.toRadians(inner));
            case "tand":
                return Math.tan(Math.toRadians(inner));
            case "cotd":
                return cot(Math.toRadians(inner));
            case "arcsin":
                return Math.asin(inner);
            case "arccos":
                return Math.acos(inner);
            case "arctan":
                return Math.atan(inner);
            case "arccot":
                return Math.PI / 2 - Math.atan(inner);
            case "exp":
                return Math.exp(inner);
            case "log":
            case "ln":
                return Math.log(inner);
            case "lg":
                return Math.log10(inner);
            case "sqrt":
                return Math.sqrt(inner);
            case "sinh":
                return Math.sinh(inner);
            case "cosh":
                return Math.cosh(inner);
            case "tanh":
                return Math.tanh(inner);
            case "coth":
                final double tanh = Math.tanh(inner);
                return tanh == 0.0 ? Double.NaN : 1 / tanh;
            case "arsinh":
                return Math.log(inner + Math.sqrt(inner * inner + 1));
            case "arcosh":
                return Math.log(inner + Math.sqrt(inner * inner - 1));
            case "artanh":
                return artanh(inner);
            case "arcoth":
                return artanh(1 / inner);
            case "abs":
                return Math.abs(inner);
            case "sgn":
                return inner >= 0 ? 1 : -1;
            case "!":
                return Math.exp(MathFunctions.logGamma(1 + inner));
            case "!!":
                if (Math.rint(inner) != inner || inner < 0)
                    throw MathParserException.unexpectedValue("Expecting positive integer (semi-factorial)");
                return MathFunctions.semiFactorial((long) inner);
            case "round":
                // half away from zero
                return Math.signum(inner) * Math.floor(Math.abs(inner) + 0.5);
            case "floor":
                return Math.floor(inner);
            case "ceil":
                return Math.ceil(inner);
            default:
                throw MathParserException.unknownFunction(name);
        }
    }

    private static double cot(double x) {
        final double tan = Math.tan(x);
        return tan == 0.0 ? Double.NaN : 1 / tan;
    }

    private static double artanh(double x) {
        return 0.5 * Math.log((1 + x) / (1 - x));
    }

}
