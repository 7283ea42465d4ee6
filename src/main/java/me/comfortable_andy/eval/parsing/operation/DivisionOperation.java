package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.number.Rational;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

import static me.comfortable_andy.eval.parsing.operation.Numerics.*;

/**
 * Division. Two exact operands always give a {@link RationalNode}, even when it divides evenly.
 *
 * @author AndyNoob
 */
public class DivisionOperation implements MathOperation {

    @Override
    public Node makeNode(Node left, Node right) {
        if (isZero(right)) throw MathParserException.divisionByZero();
        return simplify(left, right).orElseGet(() -> new InfixExpressionNode(InfixOperator.DIVISION, left, right));
    }

    private Optional<Node> simplify(Node left, Node right) {
        if (bothNumeric(left, right)) return Optional.of(fold((NumericNode) left, (NumericNode) right));
        if (isZero(left)) return Optional.of(new IntegerNode(0));
        if (isOne(right)) return Optional.of(left);
        if (left.sameAs(right)) return Optional.of(new IntegerNode(1));
        return Optional.empty();
    }

    private NumericNode fold(NumericNode left, NumericNode right) {
        if (resultingType(left, right) == NumericNode.Tower.FLOAT)
            return new FloatNode(left.doubleValue() / right.doubleValue());
        try {
            return new RationalNode(Rational.div(left.rationalValue(), right.rationalValue()));
        } catch (ArithmeticException e) {
            return new FloatNode(left.doubleValue() / right.doubleValue());
        }
    }

}
