package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

/**
 * Comparisons. A comparison folds to a {@link BooleanNode} when both sides are literals of a
 * comparable kind, or when both sides are the same expression.
 *
 * @author AndyNoob
 */
public class RelationalOperation {

    public Node makeNode(Node left, Node right, InfixOperator operator) {
        return evaluate(left, right, operator)
                .<Node>map(BooleanNode::of)
                .orElseGet(() -> new InfixExpressionNode(operator, left, right));
    }

    public Node makeNode(Node left, Node right, String operator) {
        return makeNode(left, right, InfixOperator.valueOfSymbol(operator));
    }

    /**
     * @return the truth value if it is known without binding any variable
     */
    public Optional<Boolean> evaluate(Node left, Node right, InfixOperator operator) {
        if (!operator.isRelational()) throw MathParserException.unknownOperator(operator.getSymbol());
        return compare(left, right).map(comparison -> holds(comparison, operator));
    }

    private Optional<Integer> compare(Node left, Node right) {
        if (left instanceof NumericNode && right instanceof NumericNode) {
            final NumericNode a = (NumericNode) left;
            final NumericNode b = (NumericNode) right;
            if (a.tower() == NumericNode.Tower.FLOAT || b.tower() == NumericNode.Tower.FLOAT)
                return Optional.of(Double.compare(a.doubleValue(), b.doubleValue()));
            try {
                return Optional.of(Rational.sub(a.rationalValue(), b.rationalValue()).signum());
            } catch (ArithmeticException e) {
                return Optional.of(Double.compare(a.doubleValue(), b.doubleValue()));
            }
        }
        if (left instanceof BooleanNode && right instanceof BooleanNode)
            return Optional.of(Boolean.compare(((BooleanNode) left).value(), ((BooleanNode) right).value()));
        if (left instanceof StringNode && right instanceof StringNode)
            return Optional.of(Integer.signum(((StringNode) left).value().compareTo(((StringNode) right).value())));
        if (left.sameAs(right)) return Optional.of(0);
        return Optional.empty();
    }

    private static boolean holds(int comparison, InfixOperator operator) {
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

}
