package me.comfortable_andy.eval.parsing.node;

/**
 * The closed set of node variants.
 *
 * @author AndyNoob
 */
public enum NodeKind {
    INTEGER,
    RATIONAL,
    FLOAT,
    BOOLEAN,
    VARIABLE,
    CONSTANT,
    STRING,
    INFIX,
    POSTFIX,
    TERNARY,
    FUNCTION,
    // structural, never part of a finished tree
    PENDING_FUNCTION,
    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,
    OPEN_BRACE,
    CLOSE_BRACE,
    TERMINATOR,
    UNMAPPED;

    public boolean isStructural() {
        return this.ordinal() >= PENDING_FUNCTION.ordinal();
    }

    public boolean isNumeric() {
        return this == INTEGER || this == RATIONAL || this == FLOAT;
    }

    public boolean isOperand() {
        return this.ordinal() <= STRING.ordinal();
    }
}
