package me.comfortable_andy.eval.parsing.node;

public final class OpenBraceNode extends StructuralNode {

    @Override
    public NodeKind kind() {
        return NodeKind.OPEN_BRACE;
    }

    @Override
    public String toString() {
        return "{";
    }

}
