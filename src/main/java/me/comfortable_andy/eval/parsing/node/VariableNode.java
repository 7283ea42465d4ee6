package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A free variable, bound by name when a tree is evaluated.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class VariableNode extends OperandNode {

    private final String name;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public int complexity() {
        return 1;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof VariableNode && ((VariableNode) other).name.equals(this.name);
    }

    @Override
    public String toString() {
        return this.name;
    }

}
