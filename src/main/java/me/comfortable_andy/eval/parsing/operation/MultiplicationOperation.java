package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

import static me.comfortable_andy.eval.parsing.operation.Numerics.*;

public class MultiplicationOperation implements MathOperation {

    @Override
    public Node makeNode(Node left, Node right) {
        return simplify(left, right).orElseGet(() -> new InfixExpressionNode(InfixOperator.MULTIPLICATION, left, right));
    }

    private Optional<Node> simplify(Node left, Node right) {
        if (bothNumeric(left, right)) return Optional.of(fold((NumericNode) left, (NumericNode) right));
        if (isZero(left) || isZero(right)) return Optional.of(new IntegerNode(0));
        if (isOne(left)) return Optional.of(right);
        if (isOne(right)) return Optional.of(left);
        return Optional.empty();
    }

    // overflow degrades to a float
    private NumericNode fold(NumericNode left, NumericNode right) {
        try {
            switch (resultingType(left, right)) {
                case INTEGER:
                    return new IntegerNode(Math.multiplyExact(((IntegerNode) left).value(), ((IntegerNode) right).value()));
                case RATIONAL:
                    return new RationalNode(Rational.mul(left.rationalValue(), right.rationalValue()));
                default:
                    return new FloatNode(left.doubleValue() * right.doubleValue());
            }
        } catch (ArithmeticException e) {
            return new FloatNode(left.doubleValue() * right.doubleValue());
        }
    }

}
