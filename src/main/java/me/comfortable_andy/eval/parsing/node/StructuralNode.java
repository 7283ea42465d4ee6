package me.comfortable_andy.eval.parsing.node;

import me.comfortable_andy.eval.exception.MathParserException;

/**
 * A delimiter or marker the parser consumes. None of these survive into a finished tree, so
 * visiting one means the tree was built by hand and is malformed.
 *
 * @author AndyNoob
 */
public abstract class StructuralNode extends Node {

    @Override
    public final <T> T accept(Visitor<T> visitor) {
        throw MathParserException.syntaxError();
    }

    @Override
    public int complexity() {
        return 1000;
    }

    @Override
    public boolean sameAs(Node other) {
        return other != null && other.getClass() == getClass();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Node && sameAs((Node) other);
    }

    @Override
    public int hashCode() {
        return kind().hashCode();
    }

}
