package me.comfortable_andy.eval.parsing.node;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import me.comfortable_andy.eval.exception.MathParserException;

@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class BooleanNode extends OperandNode {

    public static final BooleanNode TRUE = new BooleanNode(true);
    public static final BooleanNode FALSE = new BooleanNode(false);

    private final boolean value;

    public static BooleanNode of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @param text {@code true} or {@code false}, in any case
     */
    public static BooleanNode parse(String text) {
        if (text.equalsIgnoreCase("true")) return TRUE;
        if (text.equalsIgnoreCase("false")) return FALSE;
        throw MathParserException.syntaxError();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOLEAN;
    }

    @Override
    public int complexity() {
        return 1000;
    }

    @Override
    public boolean sameAs(Node other) {
        return other instanceof BooleanNode && ((BooleanNode) other).value == this.value;
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }

}
