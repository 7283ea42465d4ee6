package me.comfortable_andy.eval.parsing.node;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * A token the parser ignores, e.g. {@code else} or a stray newline.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class UnmappedNode extends StructuralNode {

    private final String text;

    @Override
    public NodeKind kind() {
        return NodeKind.UNMAPPED;
    }

    @Override
    public String toString() {
        return this.text;
    }

}
