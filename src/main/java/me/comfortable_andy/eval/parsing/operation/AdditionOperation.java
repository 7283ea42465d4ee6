package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

import static me.comfortable_andy.eval.parsing.operation.Numerics.*;

public class AdditionOperation implements MathOperation {

    @Override
    public Node makeNode(Node left, Node right) {
        return simplify(left, right).orElseGet(() -> new InfixExpressionNode(InfixOperator.ADDITION, left, right));
    }

    private Optional<Node> simplify(Node left, Node right) {
        if (bothNumeric(left, right)) return Optional.of(fold((NumericNode) left, (NumericNode) right));
        if (isZero(left)) return Optional.of(right);
        if (isZero(right)) return Optional.of(left);
        return Optional.empty();
    }

    // overflow degrades to a float
    private NumericNode fold(NumericNode left, NumericNode right) {
        try {
            switch (resultingType(left, right)) {
                case INTEGER:
                    return new IntegerNode(Math.addExact(((IntegerNode) left).value(), ((IntegerNode) right).value()));
                case RATIONAL:
                    return new RationalNode(Rational.add(left.rationalValue(), right.rationalValue()));
                default:
                    return new FloatNode(left.doubleValue() + right.doubleValue());
            }
        } catch (ArithmeticException e) {
            return new FloatNode(left.doubleValue() + right.doubleValue());
        }
    }

}
