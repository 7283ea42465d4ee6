package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

import static me.comfortable_andy.eval.parsing.operation.Numerics.*;

/**
 * Binary subtraction, and negation when the right operand is absent.
 *
 * @author AndyNoob
 */
public class SubtractionOperation implements MathOperation {

    @Override
    public Node makeNode(Node left, /* nullable */ Node right) {
        if (right == null) return createUnaryMinusNode(left);
        return simplify(left, right).orElseGet(() -> new InfixExpressionNode(InfixOperator.SUBTRACTION, left, right));
    }

    public Node createUnaryMinusNode(Node operand) {
        if (operand instanceof NumericNode) return ((NumericNode) operand).negate();
        // -(-x) is x
        if (operand instanceof InfixExpressionNode && ((InfixExpressionNode) operand).isNegation())
            return ((InfixExpressionNode) operand).left();
        return InfixExpressionNode.negation(operand);
    }

    private Optional<Node> simplify(Node left, Node right) {
        if (bothNumeric(left, right)) return Optional.of(fold((NumericNode) left, (NumericNode) right));
        if (left.sameAs(right)) return Optional.of(new IntegerNode(0));
        return Optional.empty();
    }

    // overflow degrades to a float
    private NumericNode fold(NumericNode left, NumericNode right) {
        try {
            switch (resultingType(left, right)) {
                case INTEGER:
                    return new IntegerNode(Math.subtractExact(((IntegerNode) left).value(), ((IntegerNode) right).value()));
                case RATIONAL:
                    return new RationalNode(Rational.sub(left.rationalValue(), right.rationalValue()));
                default:
                    return new FloatNode(left.doubleValue() - right.doubleValue());
            }
        } catch (ArithmeticException e) {
            return new FloatNode(left.doubleValue() - right.doubleValue());
        }
    }

}
