package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A function applied to its argument. Factorials are functions named {@code !} and {@code !!}.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class FunctionNode extends Node {

    private final String name;
    private final Node operand;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public int complexity() {
        return 5 + this.operand.complexity();
    }

    @Override
    public boolean sameAs(Node other) {
        if (!(other instanceof FunctionNode)) return false;
        final FunctionNode function = (FunctionNode) other;
        return function.name.equals(this.name) && this.operand.sameAs(function.operand);
    }

    @Override
    public String toString() {
        return this.name + "(" + this.operand + ")";
    }

}
