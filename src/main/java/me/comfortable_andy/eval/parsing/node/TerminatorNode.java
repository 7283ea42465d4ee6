package me.comfortable_andy.eval.parsing.node;

public final class TerminatorNode extends StructuralNode {

    @Override
    public NodeKind kind() {
        return NodeKind.TERMINATOR;
    }

    @Override
    public String toString() {
        return ";";
    }

}
