package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A short decimal such as {@code .25}. The arithmetic evaluators reject it.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class StringNode extends OperandNode {

    private final String value;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }

    @Override
    public int complexity() {
        return 1000;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof StringNode && ((StringNode) other).value.equals(this.value);
    }

    @Override
    public String toString() {
        return this.value;
    }

}
