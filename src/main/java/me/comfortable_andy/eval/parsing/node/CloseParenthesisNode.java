package me.comfortable_andy.eval.parsing.node;

public final class CloseParenthesisNode extends StructuralNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CLOSE_PARENTHESIS;
    }

    @Override
    public String toString() {
        return ")";
    }

}
