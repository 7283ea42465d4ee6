package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * {@code if (condition) {left} else {right}}. The parts are null only while the node waits on
 * the parser's operator stack.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class TernaryExpressionNode extends Node {

    public static final String OPERATOR = "if";

    private final /* nullable */ Node condition;
    private final /* nullable */ Node left;
    private final /* nullable */ Node right;

    public TernaryExpressionNode(Node condition, Node left, Node right) {
        this.condition = condition;
        this.left = left;
        this.right = right;
    }

    public TernaryExpressionNode withOperands(Node condition, Node left, Node right) {
        return new TernaryExpressionNode(condition, left, right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TERNARY;
    }

    @Override
    public int complexity() {
        return 1000;
    }

    @Override
    public boolean sameAs(Node other) {
        if (!(other instanceof TernaryExpressionNode)) return false;
        final TernaryExpressionNode ternary = (TernaryExpressionNode) other;
        return sameAs(this.condition, ternary.condition) && sameAs(this.left, ternary.left) && sameAs(this.right, ternary.right);
    }

    @Override
    public String toString() {
        return "(" + this.condition + "; " + this.left + "; " + this.right + ")";
    }

}
