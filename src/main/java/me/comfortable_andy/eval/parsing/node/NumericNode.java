package me.comfortable_andy.eval.parsing.node;

import me.comfortable_andy.eval.number.Rational;

/**
 * A numeric literal. Literals of different kinds combine at the higher of their two
 * {@link Tower} levels.
 *
 * @author AndyNoob
 */
public abstract class NumericNode extends OperandNode {

    public abstract Tower tower();

    public abstract double doubleValue();

    /**
     * @return the exact value; floats have none
     */
    public abstract /* nullable */ Rational rationalValue();

    public abstract NumericNode negate();

    public boolean isZero() {
        return doubleValue() == 0.0;
    }

    public boolean isOne() {
        return doubleValue() == 1.0;
    }

    public enum Tower {
        INTEGER,
        RATIONAL,
        FLOAT;

        public static Tower max(Tower a, Tower b) {
            return a.compareTo(b) >= 0 ? a : b;
        }
    }

}
