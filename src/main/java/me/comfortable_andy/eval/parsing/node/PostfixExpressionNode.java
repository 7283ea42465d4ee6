package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.exception.MathParserException;

/**
 * A factorial ({@code !}) or semi-factorial ({@code !!}) token. The parser turns it into a
 * {@link FunctionNode} as soon as it is read, so it never appears in a finished tree.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class PostfixExpressionNode extends Node {

    private final String operator;

    public PostfixExpressionNode(String operator) {
        if (!operator.equals("!") && !operator.equals("!!")) throw MathParserException.unknownOperator(operator);
        this.operator = operator;
    }

    public FunctionNode apply(Node operand) {
        return new FunctionNode(this.operator, operand);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        throw MathParserException.syntaxError();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.POSTFIX;
    }

    @Override
    public int complexity() {
        return 1000;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof PostfixExpressionNode && ((PostfixExpressionNode) other).operator.equals(this.operator);
    }

    @Override
    public String toString() {
        return this.operator;
    }

}
