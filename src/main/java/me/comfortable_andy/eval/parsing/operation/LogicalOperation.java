package me.comfortable_andy.eval.parsing.operation;

import me.comfortable_andy.eval.exception.MathParserException;
import me.comfortable_andy.eval.parsing.node.BooleanNode;
import me.comfortable_andy.eval.parsing.node.InfixExpressionNode;
import me.comfortable_andy.eval.parsing.node.InfixOperator;
import me.comfortable_andy.eval.parsing.node.Node;

/**
 * A boolean connective. Operands that are themselves comparisons or connectives are reduced
 * first, so {@code 1 <> 0 && 0 <> 1} folds all the way to {@code true}.
 *
 * @author AndyNoob
 */
public abstract class LogicalOperation {

    public Node makeNode(Node left, Node right) {
        return makeNode(left, right, defaultOperator());
    }

    /**
     * @param operator the spelling to keep if the node cannot be folded, e.g. {@code AND} or {@code &&}
     */
    public Node makeNode(Node left, Node right, InfixOperator operator) {
        if (!accepts(operator)) throw MathParserException.unexpectedOperator(operator.getSymbol(), defaultOperator().getSymbol());
        final Node reducedLeft = reduce(left);
        final Node reducedRight = reduce(right);
        if (reducedLeft instanceof BooleanNode && reducedRight instanceof BooleanNode)
            return BooleanNode.of(combine(((BooleanNode) reducedLeft).value(), ((BooleanNode) reducedRight).value()));
        return new InfixExpressionNode(operator, reducedLeft, reducedRight);
    }

    protected abstract boolean combine(boolean left, boolean right);

    protected abstract InfixOperator defaultOperator();

    protected abstract boolean accepts(InfixOperator operator);

    private static Node reduce(Node operand) {
        if (!(operand instanceof InfixExpressionNode)) return operand;
        final InfixExpressionNode infix = (InfixExpressionNode) operand;
        if (infix.left() == null || infix.right() == null) return operand;
        final InfixOperator operator = infix.operator();
        if (operator.isRelational()) return new RelationalOperation().makeNode(infix.left(), infix.right(), operator);
        if (operator.isConjunction()) return new ConjunctionOperation().makeNode(infix.left(), infix.right(), operator);
        if (operator.isLogical()) return new DisjunctionOperation().makeNode(infix.left(), infix.right(), operator);
        return operand;
    }

}
