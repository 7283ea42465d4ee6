package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.*;

import java.util.Optional;

/**
 * {@code if (condition) {then} else {otherwise}}. When the condition is already known the
 * matching branch replaces the whole conditional; both branches are kept otherwise.
 *
 * @author AndyNoob
 */
public class ConditionOperation {

    private final RelationalOperation relational = new RelationalOperation();

    public Node makeNode(Node condition, Node then, Node otherwise) {
        return decide(condition)
                .map(holds -> holds ? then : otherwise)
                .orElseGet(() -> new TernaryExpressionNode(condition, then, otherwise));
    }

    private Optional<Boolean> decide(Node condition) {
        if (condition instanceof BooleanNode) return Optional.of(((BooleanNode) condition).value());
        // numbers behave like C, anything but zero holds
        if (condition instanceof NumericNode) return Optional.of(!((NumericNode) condition).isZero());
        if (condition instanceof InfixExpressionNode) {
            final InfixExpressionNode infix = (InfixExpressionNode) condition;
            if (infix.left() == null || infix.right() == null) throw MathParserException.syntaxError();
            if (infix.operator().isRelational())
                return this.relational.evaluate(infix.left(), infix.right(), infix.operator());
        }
        return Optional.empty();
    }

}
