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
public final class IntegerNode extends NumericNode {

    private final long value;

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INTEGER;
    }

    @Override
    public int complexity() {
        return 1;
    }

    @Override
    public boolean sameAs(Node other) {
        if (other instanceof IntegerNode) return ((IntegerNode) other).value == this.value;
        if (other instanceof RationalNode) {
            final RationalNode rational = (RationalNode) other;
            return rational.denominator() == 1 && rational.numerator() == this.value;
        }
        return false;
    }

    @Override
    public Tower tower() {
        return Tower.INTEGER;
    }

    @Override
    public double doubleValue() {
        return this.value;
    }

    @Override
    public Rational rationalValue() {
        return Rational.of(this.value);
    }

    @Override
    public NumericNode negate() {
        // -Long.MIN_VALUE is not a long
        if (this.value == Long.MIN_VALUE) return new FloatNode(-(double) this.value);
        return new IntegerNode(-this.value);
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }

}
