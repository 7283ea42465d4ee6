package me.comfortable_andy.eval.solving;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates trees that mix arithmetic with comparisons, logical connectives and
 * {@code if ... then ... else}. Results are {@link Boolean}s, {@link Double}s or, for string
 * literals and string variables, {@link String}s. Arithmetic and functions are delegated to a
 * {@link StdMathEvaluator}.
 *
 * @author AndyNoob
 */
public class LogicEvaluator implements Visitor<Object> {

    private final Map<String, Object> variables;
    private final StdMathEvaluator math = new StdMathEvaluator();

    public LogicEvaluator() {
        this(Collections.emptyMap());
    }

    public LogicEvaluator(Map<String, ?> variables) {
        this.variables = new HashMap<>();
        variables.forEach((name, value) -> this.variables.put(name, normalize(value)));
    }

    private static Object normalize(Object value) {
        if (value instanceof Boolean || value instanceof String) return value;
        if (value instanceof Number) return ((Number) value).doubleValue();
        throw MathParserException.unexpectedValue("Unsupported variable value " + value);
    }

    @Override
    public Object visit(IntegerNode node) {
        return (double) node.value();
    }

    @Override
    public Object visit(RationalNode node) {
        return node.doubleValue();
    }

    @Override
    public Object visit(FloatNode node) {
        return node.value();
    }

    @Override
    public Object visit(BooleanNode node) {
        return node.value();
    }

    @Override
    public Object visit(VariableNode node) {
        final Object value = this.variables.get(node.name());
        if (value == null) throw MathParserException.unknownVariable(node.name());
        return value;
    }

    @Override
    public Object visit(ConstantNode node) {
        return this.math.constant(node.name());
    }

    @Override
    public Object visit(StringNode node) {
        return node.value();
    }

    @Override
    public Object visit(InfixExpressionNode node) {
        final InfixOperator operator = node.operator();
        final Node left = node.left();
        final Node right = node.right();
        final boolean prefix = operator == InfixOperator.SUBTRACTION || operator == InfixOperator.UNARY_MINUS;
        if (left == null || (right == null && !prefix)) throw MathParserException.nullOperand();
        if (right == null) return -number(left.accept(this));

        if (operator.isLogical()) {
            final boolean a = bool(left.accept(this));
            // short circuit, the right side may be undefined when it does not matter
            if (operator.isConjunction()) return a && bool(right.accept(this));
            return a || bool(right.accept(this));
        }

        final Object a = left.accept(this);
        final Object b = right.accept(this);
        if (operator.isRelational()) return compare(operator, a, b);
        return this.math.operate(operator, number(a), number(b));
    }

    @Override
    public Object visit(TernaryExpressionNode node) {
        if (node.condition() == null || node.left() == null || node.right() == null)
            throw MathParserException.nullOperand();
        final Object condition = node.condition().accept(this);
        final boolean chosen = condition instanceof Double ? (Double) condition != 0.0 : bool(condition);
        return chosen ? node.left().accept(this) : node.right().accept(this);
    }

    @Override
    public Object visit(FunctionNode node) {
        return this.math.function(node.name(), number(node.operand().accept(this)));
    }

    private static boolean compare(InfixOperator operator, Object a, Object b) {
        if (a instanceof Double && b instanceof Double) {
            final int comparison = Double.compare((Double) a, (Double) b);
            switch (operator) {
                case EQUAL_TO:
                    return comparison == 0;
                case DIFFERENT_THAN:
                    return comparison != 0;
                case GREATER_THAN:
                    return comparison > 0;
                case LESS_THAN:
                    return comparison < 0;
                case GREATER_OR_EQUAL_THAN:
                    return comparison >= 0;
                case LESS_OR_EQUAL_THAN:
                    return comparison <= 0;
                default:
                    throw MathParserException.unknownOperator(operator.getSymbol());
            }
        }
        // booleans and strings only compare for equality
        if (operator == InfixOperator.EQUAL_TO) return a.equals(b);
        if (operator == InfixOperator.DIFFERENT_THAN) return !a.equals(b);
        throw MathParserException.unexpectedValue("Cannot order " + a + " and " + b);
    }

    private static double number(Object value) {
        if (value instanceof Double) return (Double) value;
        throw MathParserException.unexpectedValue("Expecting a number, got " + value);
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        throw MathParserException.unexpectedValue("Expecting a boolean, got " + value);
    }

}
