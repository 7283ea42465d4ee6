package me.comfortable_andy.eval.parsing.node;

public final class OpenParenthesisNode extends StructuralNode {

    @Override
    public NodeKind kind() {
        return NodeKind.OPEN_PARENTHESIS;
    }

    @Override
    public String toString() {
        return "(";
    }

}
