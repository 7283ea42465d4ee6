package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.number.Rational;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class FloatNode extends NumericNode {

    private final double value;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FLOAT;
    }

    @Override
    public int complexity() {
        return 2;
    }

    @Override
    public boolean sameAs(Node other) {
        // never equal to an integer or rational, even with the same value
        return other instanceof FloatNode && ((FloatNode) other).value == this.value;
    }

    @Override
    public Tower tower() {
        return Tower.FLOAT;
    }

    @Override
    public double doubleValue() {
        return this.value;
    }

    @Override
    public Rational rationalValue() {
        return null;
    }

    @Override
    public FloatNode negate() {
        return new FloatNode(-this.value);
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }

}
