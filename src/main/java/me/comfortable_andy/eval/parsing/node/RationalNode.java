package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.number.Rational;

/**
 * An exact fraction. It stays a rational even when the denominator reduces to 1, but then
 * prints like an integer.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class RationalNode extends NumericNode {

    private final Rational value;

    public RationalNode(long numerator, long denominator) {
        this(new Rational(numerator, denominator));
    }

    public RationalNode(long numerator, long denominator, boolean normalize) {
        this(new Rational(numerator, denominator, normalize));
    }

    public long numerator() {
        return this.value.numerator();
    }

    public long denominator() {
        return this.value.denominator();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RATIONAL;
    }

    @Override
    public int complexity() {
        return 2;
    }

    @Override
    public boolean sameAs(Node other) {
        if (other instanceof IntegerNode) return other.sameAs(this);
        if (other instanceof RationalNode) {
            final RationalNode rational = (RationalNode) other;
            return rational.numerator() == numerator() && rational.denominator() == denominator();
        }
        return false;
    }

    @Override
    public Tower tower() {
        return Tower.RATIONAL;
    }

    @Override
    public double doubleValue() {
        return this.value.doubleValue();
    }

    @Override
    public Rational rationalValue() {
        return this.value;
    }

    @Override
    public NumericNode negate() {
        if (this.value.numerator() == Long.MIN_VALUE) return new FloatNode(-this.value.doubleValue());
        return new RationalNode(this.value.negate());
    }

    @Override
    public String toString() {
        return this.value.toString();
    }

}
