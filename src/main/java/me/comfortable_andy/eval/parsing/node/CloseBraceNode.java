package me.comfortable_andy.eval.parsing.node;

public final class CloseBraceNode extends StructuralNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CLOSE_BRACE;
    }

    @Override
    public String toString() {
        return "}";
    }

}
