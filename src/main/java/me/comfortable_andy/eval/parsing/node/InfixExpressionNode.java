package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A binary operation, or a negation when {@code right} is absent. Operands are null only while
 * the node waits on the parser's operator stack.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class InfixExpressionNode extends Node {

    private final InfixOperator operator;
    private final /* nullable */ Node left;
    private final /* nullable */ Node right;

    public InfixExpressionNode(InfixOperator operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public InfixExpressionNode(String symbol, Node left, Node right) {
        this(InfixOperator.valueOfSymbol(symbol), left, right);
    }

    public static InfixExpressionNode negation(Node operand) {
        return new InfixExpressionNode(InfixOperator.SUBTRACTION, operand, null);
    }

    public InfixExpressionNode withOperands(Node left, Node right) {
        return new InfixExpressionNode(this.operator, left, right);
    }

    public String symbol() {
        return this.operator.getSymbol();
    }

    public boolean isNegation() {
        return this.operator == InfixOperator.SUBTRACTION && this.right == null;
    }

    public int precedence() {
        return this.operator.getPrecedence();
    }

    /**
     * Whether an operator sitting on the stack has to be reduced before this one is pushed:
     * strictly higher precedence always, equal precedence only for left associative operators.
     */
    public boolean lowerPrecedenceThan(/* nullable */ Node other) {
        if (!(other instanceof InfixExpressionNode)) return false;
        final InfixExpressionNode infix = (InfixExpressionNode) other;
        if (precedence() < infix.precedence()) return true;
        if (precedence() > infix.precedence()) return false;
        return this.operator.getAssociativity() == InfixOperator.Associativity.LEFT;
    }

    public boolean strictlyLowerPrecedenceThan(/* nullable */ Node other) {
        return other instanceof InfixExpressionNode && precedence() < ((InfixExpressionNode) other).precedence();
    }

    public boolean canBeUnary() {
        return this.operator.canBeUnary();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INFIX;
    }

    @Override
    public int complexity() {
        int complexity = this.operator.getWeight();
        if (this.left != null) complexity += this.left.complexity();
        if (this.right != null) complexity += this.right.complexity();
        return complexity;
    }

    @Override
    public boolean sameAs(Node other) {
        if (!(other instanceof InfixExpressionNode)) return false;
        final InfixExpressionNode infix = (InfixExpressionNode) other;
        return infix.operator == this.operator && sameAs(this.left, infix.left) && sameAs(this.right, infix.right);
    }

    @Override
    public String toString() {
        if (this.right == null) return "(" + symbol() + ", " + this.left + ")";
        return "(" + symbol() + ", " + this.left + ", " + this.right + ")";
    }

}
