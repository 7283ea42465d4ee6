package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A named constant such as {@code pi}, {@code e}, {@code i}, {@code NAN} or {@code INF}. Each evaluator
 * decides which names it knows.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class ConstantNode extends OperandNode {

    private final String name;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public int complexity() {
        return 1;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof ConstantNode && ((ConstantNode) other).name.equals(this.name);
    }

    @Override
    public String toString() {
        return this.name;
    }

}
